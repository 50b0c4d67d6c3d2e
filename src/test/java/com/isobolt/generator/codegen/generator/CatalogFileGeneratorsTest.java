package com.isobolt.generator.codegen.generator;

import java.io.IOException;
import java.util.List;
import java.util.OptionalInt;

import org.junit.jupiter.api.Test;

import com.isobolt.generator.model.BoltGeometry;
import com.isobolt.generator.model.GeometryTable;
import com.isobolt.generator.naming.NameCodec;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the type catalog, lookup table and HTML generators.
 */
class CatalogFileGeneratorsTest {

    private final GeometryTable table = GeometryTable.defaultTable();
    private final NameCodec nameCodec = new NameCodec();

    @Test
    void testBoltCatalogHeaderAndRows() {
        String text = new BoltTypeCatalogGenerator(table, List.of("Steel galvanized"), nameCodec).render();
        List<String> lines = text.lines().toList();

        assertThat(lines.get(0)).isEqualTo(",Nominal Diameter##LENGTH##MILLIMETERS,Length##LENGTH##MILLIMETERS"
                + ",Shank##OTHER##,Material##OTHER##,Thread Material##OTHER##");
        assertThat(lines).contains(
                "M3 x 3 Steel galvanized,3,3,0,GIMBA - Steel galvanized,GIMBA - Steel galvanized - M3 thread",
                "M12 x 60 w/shank Steel galvanized,12,60,1,GIMBA - Steel galvanized,"
                        + "GIMBA - Steel galvanized - M12 thread");
        assertThat(lines).noneMatch(line -> line.startsWith("M12 x 50 w/shank"));
    }

    @Test
    void testBoltCatalogRowCount() {
        int expected = 0;
        for (BoltGeometry geometry : table.getBoltGeometries()) {
            for (int length : geometry.getCls()) {
                expected += length > BoltTypeCatalogGenerator.SHANK_THRESHOLD ? 2 : 1;
            }
        }

        String text = new BoltTypeCatalogGenerator(table, List.of("Steel", "Brass"), nameCodec).render();

        assertThat(text.lines().count()).isEqualTo(1 + 2L * expected);
    }

    @Test
    void testPrefixWithDelimiterCannotShiftColumns() {
        BoltTypeCatalogGenerator generator =
                new BoltTypeCatalogGenerator(table, List.of("Steel"), new NameCodec("GIM,BA"));

        assertThatThrownBy(generator::render)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("GIM,BA - Steel");
    }

    @Test
    void testAssemblyCatalogUsesDefaultGripLength() {
        String text = new AssemblyTypeCatalogGenerator(table, List.of("Steel galvanized"), nameCodec).render();
        List<String> lines = text.lines().toList();

        assertThat(lines.get(0)).startsWith(",Nominal Diameter##LENGTH##MILLIMETERS,Grip Length##LENGTH##MILLIMETERS");
        assertThat(lines).contains(
                "M12 Steel galvanized,12,100,0,GIMBA - Steel galvanized,GIMBA - Steel galvanized - M12 thread",
                "M12 w/shank Steel galvanized,12,100,1,GIMBA - Steel galvanized,"
                        + "GIMBA - Steel galvanized - M12 thread");
        // M3 has a default grip length of 10 mm, too short for a shank
        assertThat(lines).noneMatch(line -> line.startsWith("M3 w/shank"));
    }

    @Test
    void testSelectLengthPicksShortestFittingBolt() {
        BoltGeometry m6 = table.get(6);

        // LG + 2k + 2u = 0 + 8 + 3.2
        assertThat(GripToLengthTableGenerator.selectLength(m6, 0)).isEqualTo(OptionalInt.of(12));
        assertThat(GripToLengthTableGenerator.selectLength(m6, 100)).isEqualTo(OptionalInt.of(120));
        assertThat(GripToLengthTableGenerator.selectLength(m6, 600)).isEmpty();
    }

    @Test
    void testSelectLengthRequiresStrictlyLongerBolt() {
        BoltGeometry geometry = BoltGeometry.builder().d(4).p(0.7).k(2).u(1).cls(List.of(10, 12)).build();

        // 4 + 2*2 + 2*1 = 10 does not fit a 10 mm bolt
        assertThat(GripToLengthTableGenerator.selectLength(geometry, 4)).isEqualTo(OptionalInt.of(12));
    }

    @Test
    void testGripToLengthSampling() {
        assertThat(GripToLengthTableGenerator.samplingStep(0)).isEqualTo(2);
        assertThat(GripToLengthTableGenerator.samplingStep(22)).isEqualTo(2);
        assertThat(GripToLengthTableGenerator.samplingStep(23)).isEqualTo(5);
        assertThat(GripToLengthTableGenerator.samplingStep(100)).isEqualTo(10);

        List<String> lines = new GripToLengthTableGenerator(table).render().lines().toList();

        assertThat(lines.get(0)).isEqualTo(",D##LENGTH##MILLIMETERS,LG##LENGTH##MILLIMETERS,l##LENGTH##MILLIMETERS");
        assertThat(lines).contains("M6 x ]0[,6,0,12");
        assertThat(lines).noneMatch(line -> line.startsWith("M6 x ]1["));
        assertThat(lines).contains("M6 x ]25[,6,25,40");
        assertThat(lines).noneMatch(line -> line.startsWith("M6 x ]24["));
    }

    @Test
    void testNearestNominalPrefersSmallerOnTie() {
        List<Integer> nominals = table.getNominalDiameters();

        assertThat(DiameterBandingTableGenerator.nearestNominal(nominals, 7)).isEqualTo(6);
        assertThat(DiameterBandingTableGenerator.nearestNominal(nominals, 9)).isEqualTo(8);
        assertThat(DiameterBandingTableGenerator.nearestNominal(nominals, 12)).isEqualTo(12);
        assertThat(DiameterBandingTableGenerator.nearestNominal(nominals, 61)).isEqualTo(64);
        assertThat(DiameterBandingTableGenerator.nearestNominal(nominals, 1)).isEqualTo(3);
    }

    @Test
    void testDiameterBandingTable() {
        List<String> lines = new DiameterBandingTableGenerator(table).render().lines().toList();

        assertThat(lines.get(0)).isEqualTo(",ND##LENGTH##MILLIMETERS,D##LENGTH##MILLIMETERS");
        assertThat(lines.get(1)).isEqualTo("D=3,3,3");
        assertThat(lines).contains("D=7,7,6", "D=60,60,56");
        assertThat(lines).hasSize(1 + 64 - 3 + 1);
    }

    @Test
    void testGeometryParameterTableRoundsThreadValues() {
        List<String> lines = new GeometryParameterTableGenerator(table).render().lines().toList();

        assertThat(lines.get(0)).startsWith(",D##LENGTH##MILLIMETERS,P##LENGTH##MILLIMETERS,H##LENGTH##MILLIMETERS");
        assertThat(lines).hasSize(25);
        assertThat(lines).contains("M12,12,1.75,1.52,10.86,19,8,5.5,30,36,49,13,24,2.5,13,13.5,14.5");
    }

    @Test
    void testGeometryParameterHtml() throws IOException {
        String html = new GeometryParameterHtmlGenerator(table).render();

        assertThat(html).contains("</th>");
        assertThat(html).contains("<td>M12</td>");
        assertThat(html).contains("<td>10.86</td>");
    }
}
