package com.typegraph.schema.cli.output;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import com.typegraph.schema.build.SchemaBuildResult;
import com.typegraph.schema.cli.exception.ReportRenderingException;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a schema build result as an SDL-like text report using the
 * {@code templates/schema-report.ftl} template.
 */
public class SchemaReportRenderer {

    private static final String REPORT_TEMPLATE = "schema-report.ftl";

    private final Configuration freemarkerConfig;

    public SchemaReportRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(SchemaBuildResult result) {
        try {
            Template template = freemarkerConfig.getTemplate(REPORT_TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(Map.of("result", result), out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ReportRenderingException("Failed to render " + REPORT_TEMPLATE, e);
        }
    }
}
