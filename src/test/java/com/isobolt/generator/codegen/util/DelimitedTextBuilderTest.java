package com.isobolt.generator.codegen.util;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.isobolt.generator.codegen.util.DelimitedTextBuilder.Column;

import static org.assertj.core.api.Assertions.*;

class DelimitedTextBuilderTest {

    @Test
    void testHeaderAndRows() {
        String text = DelimitedTextBuilder.withHeader(List.of(Column.length("D"), Column.other("Shank")))
                .row("M8", 8, 0)
                .build();

        assertThat(text).isEqualTo(",D##LENGTH##MILLIMETERS,Shank##OTHER##\nM8,8,0\n");
    }

    @Test
    void testCellsWithDelimiterOrLineBreakAreRejected() {
        DelimitedTextBuilder builder = DelimitedTextBuilder.withHeader(List.of(Column.other("Material")));

        assertThatThrownBy(() -> builder.row("M8", "GIM,BA - Steel"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("GIM,BA - Steel");
        assertThatThrownBy(() -> builder.row("M8\nM10", "Steel")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.row("M8", "Steel\r")).isInstanceOf(IllegalArgumentException.class);
        assertThat(builder.build()).isEqualTo(",Material##OTHER##\n");
    }

    @Test
    void testPlainCell() {
        assertThat(DelimitedTextBuilder.isPlainCell("GIMBA - Steel galvanized")).isTrue();
        assertThat(DelimitedTextBuilder.isPlainCell("a,b")).isFalse();
        assertThat(DelimitedTextBuilder.isPlainCell("a\nb")).isFalse();
        assertThat(DelimitedTextBuilder.isPlainCell(null)).isFalse();
    }
}
