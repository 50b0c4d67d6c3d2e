package com.isobolt.generator.codegen.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for count messages and number rendering.
 */
class MessageFormattingTest {

    @Test
    void testCountMessages() {
        assertThat(CountMessageUtil.format(0, "Found {0} file{1}")).isEqualTo("Found no files");
        assertThat(CountMessageUtil.format(1, "Found {0} file{1}")).isEqualTo("Found 1 file");
        assertThat(CountMessageUtil.format(24, "Found {0} geometr{1}", "ies", "y")).isEqualTo("Found 24 geometries");
        assertThat(CountMessageUtil.formatVerdict(0, false, "Found {0} template{1}", "s", ""))
                .isEqualTo("Found no templates --> NOT OK");
    }

    @Test
    void testNumberFormatting() {
        assertThat(NumberFormatUtil.format(10.0)).isEqualTo("10");
        assertThat(NumberFormatUtil.format(1.25)).isEqualTo("1.25");
        assertThat(NumberFormatUtil.format(0.0)).isEqualTo("0");
        assertThat(NumberFormatUtil.fixed2(1.5156)).isEqualTo("1.52");
        assertThat(NumberFormatUtil.fixed2(3)).isEqualTo("3.00");
    }
}
