package com.isobolt.generator.codegen.generator;

import java.util.List;

import com.isobolt.generator.codegen.model.output.GeneratedFileType;
import com.isobolt.generator.codegen.util.DelimitedTextBuilder;
import com.isobolt.generator.codegen.util.DelimitedTextBuilder.Column;
import com.isobolt.generator.model.GeometryTable;

/**
 * Generates the lookup table that snaps any integer diameter to a supported nominal diameter.
 */
public class DiameterBandingTableGenerator implements CatalogFileGenerator {

    public static final String FILE_NAME = "GIMBA D2D.csv";

    private static final List<Column> COLUMNS = List.of(
            Column.length("ND"),
            Column.length("D"));

    private final GeometryTable table;

    public DiameterBandingTableGenerator(GeometryTable table) {
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
        List<Integer> nominals = table.getNominalDiameters();
        DelimitedTextBuilder text = DelimitedTextBuilder.withHeader(COLUMNS);
        if (nominals.isEmpty()) {
            return text.build();
        }
        int first = nominals.get(0);
        int last = nominals.get(nominals.size() - 1);
        for (int diameter = first; diameter <= last; diameter++) {
            text.row("D=" + diameter, diameter, nearestNominal(nominals, diameter));
        }
        return text.build();
    }

    /**
     * Nearest entry of the ascending list; on a tie the smaller neighbour wins.
     */
    public static int nearestNominal(List<Integer> nominals, int diameter) {
        if (nominals.isEmpty()) {
            throw new IllegalArgumentException("No nominal diameters");
        }
        int best = nominals.get(0);
        for (int nominal : nominals) {
            if (Math.abs(nominal - diameter) < Math.abs(best - diameter)) {
                best = nominal;
            }
        }
        return best;
    }
}
