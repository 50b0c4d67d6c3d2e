package com.isobolt.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import com.isobolt.generator.naming.NameCodec;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the catalog generator.
 */
@Data
@Builder
public class GeneratorConfig {

    public static final String DEFAULT_MATERIAL = "Steel galvanized";

    private Path outputDir;

    @Builder.Default
    private List<String> materials = List.of(DEFAULT_MATERIAL);

    @Builder.Default
    private String namePrefix = NameCodec.DEFAULT_PREFIX;
}
