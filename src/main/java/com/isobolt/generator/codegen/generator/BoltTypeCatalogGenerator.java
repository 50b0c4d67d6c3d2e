package com.isobolt.generator.codegen.generator;

import java.util.List;

import com.isobolt.generator.codegen.model.output.GeneratedFileType;
import com.isobolt.generator.codegen.util.DelimitedTextBuilder;
import com.isobolt.generator.codegen.util.DelimitedTextBuilder.Column;
import com.isobolt.generator.model.BoltGeometry;
import com.isobolt.generator.model.GeometryTable;
import com.isobolt.generator.naming.NameCodec;

/**
 * Generates the type catalog of the bolt family.
 *
 * One type per diameter, customary length and material. Bolts longer than
 * {@value #SHANK_THRESHOLD} mm get an additional type with shank.
 */
public class BoltTypeCatalogGenerator implements CatalogFileGenerator {

    public static final String FILE_NAME = "Generic ISO Metric Bolt.txt";

    static final int SHANK_THRESHOLD = 50;

    private static final List<Column> COLUMNS = List.of(
            Column.length("Nominal Diameter"),
            Column.length("Length"),
            Column.other("Shank"),
            Column.other("Material"),
            Column.other("Thread Material"));

    private final GeometryTable table;
    private final List<String> materials;
    private final NameCodec nameCodec;

    public BoltTypeCatalogGenerator(GeometryTable table, List<String> materials, NameCodec nameCodec) {
        this.table = table;
        this.materials = List.copyOf(materials);
        this.nameCodec = nameCodec;
    }

    @Override
    public String getFileName() {
        return FILE_NAME;
    }

    @Override
    public GeneratedFileType getType() {
        return GeneratedFileType.TYPE_CATALOG;
    }

    @Override
    public String render() {
        DelimitedTextBuilder text = DelimitedTextBuilder.withHeader(COLUMNS);
        for (BoltGeometry geometry : table.getBoltGeometries()) {
            for (int length : geometry.getCls()) {
                for (boolean shank : new boolean[] {false, true}) {
                    if (shank && length <= SHANK_THRESHOLD) {
                        continue;
                    }
                    for (String material : materials) {
                        text.row(typeName(geometry.getD(), length, shank, material),
                                geometry.getD(),
                                length,
                                shank ? 1 : 0,
                                nameCodec.encodePlain(material),
                                nameCodec.encode(material, geometry.getD()));
                    }
                }
            }
        }
        return text.build();
    }

    static String typeName(int diameter, int length, boolean shank, String material) {
        return "M" + diameter + " x " + length + (shank ? " w/shank" : "") + " " + material;
    }
}
