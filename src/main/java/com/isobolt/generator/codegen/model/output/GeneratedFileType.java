package com.isobolt.generator.codegen.model.output;

/**
 * High-level file categories for generated artifacts.
 */
public enum GeneratedFileType {
    TYPE_CATALOG,
    LOOKUP_TABLE,
    HTML
}
