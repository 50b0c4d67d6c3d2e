package com.isobolt.generator.codegen.generator;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.isobolt.generator.codegen.model.output.GeneratedFileType;
import com.isobolt.generator.model.GeometryTable;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Dumps the geometry parameters to an HTML table for the family documentation.
 */
public class GeometryParameterHtmlGenerator implements CatalogFileGenerator {

    public static final String FILE_NAME = "GIMBA MGeo.html";

    static final String TEMPLATE = "geometry-parameters.ftl";

    private final GeometryTable table;
    private final Configuration freemarkerConfig;

    public GeometryParameterHtmlGenerator(GeometryTable table) {
        this.table = table;
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

    @Override
    public String getFileName() {
        return FILE_NAME;
    }

    @Override
    public GeneratedFileType getType() {
        return GeneratedFileType.HTML;
    }

    @Override
    public String render() throws IOException {
        List<GeometryParameterRow> rows = table.getBoltGeometries().stream()
                .map(GeometryParameterRow::of)
                .collect(Collectors.toList());
        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        StringWriter out = new StringWriter();
        try {
            template.process(Map.of("rows", rows), out);
        } catch (TemplateException e) {
            throw new IOException("Cannot render " + TEMPLATE + ": " + e.getMessage(), e);
        }
        return out.toString();
    }
}
