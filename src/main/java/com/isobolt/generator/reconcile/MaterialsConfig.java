package com.isobolt.generator.reconcile;

import java.nio.file.Path;

import com.isobolt.generator.naming.NameCodec;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for a thread material pass.
 */
@Data
@Builder
public class MaterialsConfig {

    private Path library;

    /** Null means the user is asked after the pre-check. */
    private ReconciliationMode mode;

    private boolean overwrite;

    @Builder.Default
    private String namePrefix = NameCodec.DEFAULT_PREFIX;
}
