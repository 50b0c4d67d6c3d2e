package com.isobolt.generator.codegen;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import lombok.Value;

/**
 * Target files of a catalog set and whether each already exists.
 */
@Value
public class CatalogPreCheck {

    CatalogSet catalogSet;

    /** Target paths in generation order, mapped to their existence. */
    Map<Path, Boolean> targets;

    public List<Path> getExistingFiles() {
        return targets.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .toList();
    }

    public int getFileCount() {
        return targets.size();
    }

    /**
     * With no target file in place there is nothing to protect, so overwriting is implied.
     */
    public boolean isOverwriteImplied() {
        return getExistingFiles().isEmpty();
    }
}
