package com.isobolt.generator.codegen.generator;

import java.util.List;
import java.util.OptionalInt;

import com.isobolt.generator.codegen.model.output.GeneratedFileType;
import com.isobolt.generator.codegen.util.DelimitedTextBuilder;
import com.isobolt.generator.codegen.util.DelimitedTextBuilder.Column;
import com.isobolt.generator.model.BoltGeometry;
import com.isobolt.generator.model.GeometryTable;

/**
 * Generates the lookup table that maps a grip length {@code LG} to the customary bolt length
 * {@code l} of an assembly.
 *
 * The bolt must pass the clamped parts, two washers and the nut:
 * {@code l > LG + 2k + 2u}. The shortest customary length satisfying this is chosen. Grip
 * lengths are sampled in steps of 2 mm below 23 mm, 5 mm below 100 mm and 10 mm above.
 */
public class GripToLengthTableGenerator implements CatalogFileGenerator {

    public static final String FILE_NAME = "GIMBA G2L.csv";

    static final int MAX_GRIP_LENGTH = 600;

    private static final List<Column> COLUMNS = List.of(
            Column.length("D"),
            Column.length("LG"),
            Column.length("l"));

    private final GeometryTable table;

    public GripToLengthTableGenerator(GeometryTable table) {
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
        DelimitedTextBuilder text = DelimitedTextBuilder.withHeader(COLUMNS);
        for (BoltGeometry geometry : table.getBoltGeometries()) {
            for (int gripLength = 0; gripLength <= MAX_GRIP_LENGTH; gripLength++) {
                if (gripLength % samplingStep(gripLength) != 0) {
                    continue;
                }
                OptionalInt length = selectLength(geometry, gripLength);
                if (length.isPresent()) {
                    text.row("M" + geometry.getD() + " x ]" + gripLength + "[",
                            geometry.getD(), gripLength, length.getAsInt());
                }
            }
        }
        return text.build();
    }

    static int samplingStep(int gripLength) {
        if (gripLength < 23) {
            return 2;
        }
        if (gripLength < 100) {
            return 5;
        }
        return 10;
    }

    /**
     * Shortest customary length strictly longer than {@code LG + 2k + 2u}, if any.
     */
    public static OptionalInt selectLength(BoltGeometry geometry, int gripLength) {
        double minLength = gripLength + 2 * geometry.getK() + 2 * geometry.getU();
        return geometry.getCls().stream()
                .mapToInt(Integer::intValue)
                .filter(l -> l > minLength)
                .findFirst();
    }
}
