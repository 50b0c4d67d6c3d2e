package com.isobolt.generator.store;

import org.junit.jupiter.api.Test;

import com.isobolt.generator.model.asset.Asset;
import com.isobolt.generator.model.asset.BooleanProperty;
import com.isobolt.generator.model.asset.BumpGradientMaps;
import com.isobolt.generator.model.asset.DoubleProperty;
import com.isobolt.generator.model.asset.Material;
import com.isobolt.generator.model.asset.TestMaterials;

import static org.assertj.core.api.Assertions.*;

class BumpPatternEditTest {

    private final BumpPatternEdit edit = BumpPatternEdit.builder()
            .scaleX(0.05)
            .scaleY(1.5)
            .angle(88)
            .scaleLock(false)
            .uRepeat(true)
            .vRepeat(true)
            .description("M12 thread")
            .keywordSuffix(":M12")
            .manufacturer("Bolt Works")
            .build();

    @Test
    void testApplyEditsBumpMapAndFields() {
        Material result = edit.applyTo(TestMaterials.template("T"), "T - M12 thread");

        assertThat(result.getName()).isEqualTo("T - M12 thread");
        assertThat(result.getManufacturer()).isEqualTo("Bolt Works");
        assertThat(result.getDescription()).isEqualTo("M12 thread");
        assertThat(result.getAppearance().getName()).isEqualTo("T - M12 thread");
        assertThat(result.getAppearance().findString("keyword")).contains("steel:M12");

        Asset map = BumpGradientMaps.find(result.getAppearance()).orElseThrow();
        assertThat(map.find(BumpPatternEdit.ANGLE)).contains(new DoubleProperty(BumpPatternEdit.ANGLE, 88));
        assertThat(map.find(BumpPatternEdit.SCALE_LOCK)).contains(new BooleanProperty(BumpPatternEdit.SCALE_LOCK, false));
        assertThat(map.find(BumpPatternEdit.U_REPEAT)).contains(new BooleanProperty(BumpPatternEdit.U_REPEAT, true));
        assertThat(map.find("gradient_Type")).isPresent();
    }

    @Test
    void testMissingUrlKeepsTemplateValue() {
        Material template = TestMaterials.template("T").toBuilder().url("https://example.org").build();

        assertThat(edit.applyTo(template, "X").getUrl()).isEqualTo("https://example.org");
    }

    @Test
    void testTemplateWithoutBumpMapIsRejected() {
        assertThatThrownBy(() -> edit.applyTo(TestMaterials.templateWithoutBumpMap("T"), "X"))
                .isInstanceOf(StoreOperationException.class)
                .hasMessageContaining("no bump gradient map");
        assertThatThrownBy(() -> edit.applyTo(TestMaterials.plain("T"), "X"))
                .isInstanceOf(StoreOperationException.class)
                .hasMessageContaining("no appearance asset");
    }
}
