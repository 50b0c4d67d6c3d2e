package com.isobolt.generator.codegen;

import java.util.List;

import com.isobolt.generator.codegen.model.output.GeneratedFileReport;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a catalog generation run.
 */
@Data
@Builder
public class CatalogResult {
    private CatalogSet catalogSet;
    private boolean overwrite;

    private int created;
    private int overwritten;
    private int skipped;
    private int errors;

    private List<GeneratedFileReport> files;

    public boolean isSuccess() {
        return errors == 0;
    }
}
