package com.typegraph.schema.metadata.reflection;

import static org.assertj.core.api.Assertions.*;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;

import com.typegraph.schema.fixtures.User;
import com.typegraph.schema.fixtures.UserInput;
import com.typegraph.schema.metadata.ClassTypeValue;
import com.typegraph.schema.metadata.ParamKind;
import com.typegraph.schema.metadata.ScalarTypeValue;
import com.typegraph.schema.metadata.TypeMetadata;
import com.typegraph.schema.metadata.TypeModifiers;
import com.typegraph.schema.metadata.exception.CannotDetermineTypeException;
import com.typegraph.schema.metadata.raw.RawFieldMetadata;
import com.typegraph.schema.metadata.raw.RawTypeOptions;
import com.typegraph.schema.testutil.RawMetadataFixtures;

import graphql.Scalars;

/**
 * Unit tests for DefaultTypeReflection.
 */
class DefaultTypeReflectionTest {

    @SuppressWarnings({ "unused", "rawtypes" })
    private static class Signatures<T> {
        private long primitiveLong;
        private double score;
        private UUID id;
        private List<List<String>> tags;
        private String[] aliases;
        private Set<User> friends;
        private List<? extends UserInput> filters;
        private T unbound;
        private List rawList;
        private Map<String, Integer> lookup;
        private Object anything;
        private CompletableFuture<List<User>> pending;
        private CompletableFuture<CompletableFuture<User>> nestedPending;
    }

    private final DefaultTypeReflection reflection = new DefaultTypeReflection();

    private static Type typeOf(String member) throws NoSuchFieldException {
        return Signatures.class.getDeclaredField(member).getGenericType();
    }

    private static RawFieldMetadata field(String member) throws NoSuchFieldException {
        return RawMetadataFixtures.field(Signatures.class, member, typeOf(member));
    }

    private static RawFieldMetadata field(String member, RawTypeOptions.RawTypeOptionsBuilder options)
            throws NoSuchFieldException {
        return RawMetadataFixtures.field(Signatures.class, member, options.reflectedType(typeOf(member)).build());
    }

    @Test
    void testScalarMapping() throws Exception {
        assertThat(reflection.resolveFieldType(field("score"), false))
                .isEqualTo(TypeMetadata.of(new ScalarTypeValue(Scalars.GraphQLFloat), TypeModifiers.of(false, 0)));
        assertThat(reflection.resolveFieldType(field("id"), false).getValue())
                .isEqualTo(new ScalarTypeValue(Scalars.GraphQLID));
    }

    @Test
    void testNestedListsArePeeledOneLevelEach() throws Exception {
        TypeMetadata type = reflection.resolveFieldType(field("tags"), false);

        assertThat(type.getValue()).isEqualTo(new ScalarTypeValue(Scalars.GraphQLString));
        assertThat(type.getModifiers().getListDepth()).isEqualTo(2);
        assertThat(type.toTypeString()).isEqualTo("[[String!]!]!");
    }

    @Test
    void testArraysAndSetsCountAsLists() throws Exception {
        assertThat(reflection.resolveFieldType(field("aliases"), false).toTypeString()).isEqualTo("[String!]!");

        TypeMetadata friends = reflection.resolveFieldType(field("friends"), true);
        assertThat(friends.getValue()).isEqualTo(new ClassTypeValue(User.class));
        assertThat(friends.getModifiers()).isEqualTo(TypeModifiers.of(true, 1));
        assertThat(friends.toTypeString()).isEqualTo("[User!]");
    }

    @Test
    void testWildcardUsesUpperBound() throws Exception {
        TypeMetadata type = reflection.resolveFieldType(field("filters"), false);

        assertThat(type.getValue()).isEqualTo(new ClassTypeValue(UserInput.class));
        assertThat(type.getModifiers().getListDepth()).isEqualTo(1);
    }

    @Test
    void testExplicitTypeOverridesDerivedBaseClass() throws Exception {
        TypeMetadata type = reflection.resolveFieldType(
                field("anything", RawTypeOptions.builder().explicitType(User.class)), false);

        assertThat(type.getValue()).isEqualTo(new ClassTypeValue(User.class));
        assertThat(type.getModifiers().getListDepth()).isZero();
    }

    @Test
    void testExplicitListDepthOverridesDerivedDepth() throws Exception {
        TypeMetadata type = reflection.resolveFieldType(
                field("tags", RawTypeOptions.builder().listDepth(0)), false);

        assertThat(type.getModifiers().getListDepth()).isZero();
        assertThat(type.getValue()).isEqualTo(new ScalarTypeValue(Scalars.GraphQLString));
    }

    @Test
    void testNegativeListDepthIsRejected() throws Exception {
        RawFieldMetadata negative = field("score", RawTypeOptions.builder().listDepth(-2));

        assertThatThrownBy(() -> reflection.resolveFieldType(negative, false))
                .isInstanceOf(CannotDetermineTypeException.class)
                .hasMessageContaining("negative");
    }

    @Test
    void testNullabilityOverrideBeatsDefault() throws Exception {
        RawFieldMetadata nonNull = field("score", RawTypeOptions.builder().nullable(false));
        RawFieldMetadata nullable = field("score", RawTypeOptions.builder().nullable(true));

        assertThat(reflection.resolveFieldType(nonNull, true).getModifiers().isNullable()).isFalse();
        assertThat(reflection.resolveFieldType(nullable, false).getModifiers().isNullable()).isTrue();
        assertThat(reflection.resolveFieldType(field("score"), true).getModifiers().isNullable()).isTrue();
    }

    @Test
    void testUnboundTypeVariableIsRejected() throws Exception {
        RawFieldMetadata unbound = field("unbound");

        assertThatThrownBy(() -> reflection.resolveFieldType(unbound, false))
                .isInstanceOfSatisfying(CannotDetermineTypeException.class,
                        e -> assertThat(e.getDeclarationName()).isEqualTo("Signatures.unbound"))
                .hasMessageContaining("T");
    }

    @Test
    void testRawCollectionIsRejected() throws Exception {
        RawFieldMetadata rawList = field("rawList");

        assertThatThrownBy(() -> reflection.resolveFieldType(rawList, false))
                .isInstanceOf(CannotDetermineTypeException.class)
                .hasMessageContaining("List");
    }

    @Test
    void testJdkTypesWithoutScalarAreRejected() throws Exception {
        for (String member : List.of("primitiveLong", "lookup", "anything", "pending")) {
            RawFieldMetadata rejected = field(member);
            assertThatThrownBy(() -> reflection.resolveFieldType(rejected, false))
                    .as(member)
                    .isInstanceOf(CannotDetermineTypeException.class);
        }
    }

    @Test
    void testQueryReturnTypeUnwrapsCompletionStages() throws Exception {
        TypeMetadata pending = reflection.resolveQueryReturnType(
                RawMetadataFixtures.query(Signatures.class, "pending", typeOf("pending")), false);
        TypeMetadata nested = reflection.resolveQueryReturnType(
                RawMetadataFixtures.query(Signatures.class, "nestedPending", typeOf("nestedPending")), false);

        assertThat(pending).isEqualTo(TypeMetadata.of(new ClassTypeValue(User.class), TypeModifiers.of(false, 1)));
        assertThat(nested).isEqualTo(TypeMetadata.of(new ClassTypeValue(User.class), TypeModifiers.of(false, 0)));
    }

    @Test
    void testParameterTypeIsResolvedLikeAField() throws Exception {
        TypeMetadata type = reflection.resolveParameterType(
                RawMetadataFixtures.parameter(Signatures.class, "find", 0, ParamKind.SINGLE_ARG, typeOf("aliases")),
                false);

        assertThat(type.toTypeString()).isEqualTo("[String!]!");
    }

    @Test
    void testScalarTypeMapperLookups() {
        ScalarTypeMapper mapper = new ScalarTypeMapper();

        assertThat(mapper.findScalar(boolean.class)).contains(Scalars.GraphQLBoolean);
        assertThat(mapper.findScalar(Character.class)).contains(Scalars.GraphQLString);
        assertThat(mapper.findScalar(Long.class)).isEmpty();
        assertThat(mapper.isPlatformType(long.class)).isTrue();
        assertThat(mapper.isPlatformType(Map.class)).isTrue();
        assertThat(mapper.isPlatformType(User.class)).isFalse();
    }
}
