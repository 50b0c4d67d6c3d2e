package com.isobolt.generator.codegen;

import java.util.EnumSet;
import java.util.Set;

import com.isobolt.generator.codegen.model.output.GeneratedFileType;

/**
 * Groups of files that are generated together.
 */
public enum CatalogSet {
    TYPE_CATALOGS("type catalog files", EnumSet.of(GeneratedFileType.TYPE_CATALOG)),
    LOOKUP_TABLES("lookup table files", EnumSet.of(GeneratedFileType.LOOKUP_TABLE)),
    HTML("geometry parameter HTML table", EnumSet.of(GeneratedFileType.HTML)),
    ALL("all catalog and table files", EnumSet.allOf(GeneratedFileType.class));

    private final String description;
    private final Set<GeneratedFileType> types;

    CatalogSet(String description, Set<GeneratedFileType> types) {
        this.description = description;
        this.types = types;
    }

    public String getDescription() {
        return description;
    }

    public boolean includes(GeneratedFileType type) {
        return types.contains(type);
    }
}
