package com.isobolt.generator.model.asset;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BumpGradientMapsTest {

    @Test
    void testFindsGenericBumpMap() {
        Asset appearance = TestMaterials.template("T").getAppearance();

        assertThat(BumpGradientMaps.findHolder(appearance)).map(AssetProperty::getName).contains("generic_bump_map");
        assertThat(BumpGradientMaps.find(appearance)).map(Asset::getName).contains("Gradient");
    }

    @Test
    void testFindsMetalPatternShader() {
        Asset appearance = new Asset("Metal", List.of(
                new ReferenceProperty("generic_bump_map", null),
                new ReferenceProperty("metal_pattern_shader", TestMaterials.gradientMap())));

        assertThat(BumpGradientMaps.findHolder(appearance)).map(AssetProperty::getName)
                .contains("metal_pattern_shader");
    }

    @Test
    void testIgnoresOtherSchemas() {
        Asset checker = new Asset("Checker", List.of(new StringProperty("BaseSchema", "CheckerSchema")));
        Asset appearance = new Asset("Generic", List.of(new ReferenceProperty("generic_bump_map", checker)));

        assertThat(BumpGradientMaps.find(appearance)).isEmpty();
        assertThat(BumpGradientMaps.find(null)).isEmpty();
    }

    @Test
    void testWithPropertyReplacesOrAppends() {
        Asset asset = new Asset("A", List.of(new StringProperty("keyword", "old")));

        Asset replaced = asset.withProperty(new StringProperty("keyword", "new"));
        Asset appended = asset.withProperty(new BooleanProperty("flag", true));

        assertThat(replaced.getProperties()).hasSize(1);
        assertThat(replaced.findString("keyword")).contains("new");
        assertThat(appended.getProperties()).extracting(AssetProperty::getName).containsExactly("keyword", "flag");
        assertThat(asset.findString("keyword")).contains("old");
    }
}
