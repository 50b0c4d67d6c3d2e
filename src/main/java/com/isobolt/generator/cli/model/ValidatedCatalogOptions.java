package com.isobolt.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps CatalogsCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedCatalogOptions {
    Path normalizedOutputDir;
    List<String> materials;
}
