package com.isobolt.generator.codegen.generator;

import java.util.List;
import java.util.stream.Collectors;

import com.isobolt.generator.codegen.model.output.GeneratedFileType;
import com.isobolt.generator.codegen.util.DelimitedTextBuilder;
import com.isobolt.generator.codegen.util.DelimitedTextBuilder.Column;
import com.isobolt.generator.model.BoltGeometry;
import com.isobolt.generator.model.GeometryTable;

/**
 * Generates the lookup table of all geometry parameters, one row per nominal diameter.
 */
public class GeometryParameterTableGenerator implements CatalogFileGenerator {

    public static final String FILE_NAME = "GIMBA MGeo.csv";

    static final List<String> PARAMETERS = List.of(
            "D", "P", "H", "d2", "s", "k", "a", "b2", "b3", "b4", "du1", "du2", "u", "dh1", "dh2", "dh3");

    private final GeometryTable table;

    public GeometryParameterTableGenerator(GeometryTable table) {
        this.table = table;
    }

    @Override
    public String getFileName() {
        return FILE_NAME;
    }

    @Override
    public GeneratedFileType getType() {
        return GeneratedFileType.LOOKUP_TABLE;
    }

    @Override
    public String render() {
        List<Column> columns = PARAMETERS.stream().map(Column::length).collect(Collectors.toList());
        DelimitedTextBuilder text = DelimitedTextBuilder.withHeader(columns);
        for (BoltGeometry geometry : table.getBoltGeometries()) {
            GeometryParameterRow row = GeometryParameterRow.of(geometry);
            text.row(row.getName(), row.values().toArray());
        }
        return text.build();
    }
}
