package com.isobolt.generator.reconcile;

import java.util.List;

import com.isobolt.generator.codegen.util.CountMessageUtil;

import lombok.Value;

/**
 * Counts gathered before any change is made, and whether an operation is possible at all.
 */
@Value
public class PreCheckSummary {

    String storeTitle;
    int geometriesFound;
    int existingArtifacts;
    int validTemplates;
    int invalidTemplates;

    /**
     * Operations need at least one geometry and one valid template.
     */
    public boolean isReady() {
        return geometriesFound > 0 && validTemplates > 0;
    }

    /** Number of thread materials a create pass produces. */
    public int getPlannedCreations() {
        return geometriesFound * validTemplates;
    }

    public List<String> describe() {
        return List.of(
                CountMessageUtil.formatVerdict(geometriesFound, geometriesFound > 0,
                        "* Found {0} thread geometr{1}", "ies", "y"),
                CountMessageUtil.formatVerdict(existingArtifacts, true,
                        "* Found {0} existing thread material{1}", "s", ""),
                CountMessageUtil.formatVerdict(validTemplates, validTemplates > 0,
                        "* Found {0} valid template material{1}", "s", ""),
                CountMessageUtil.format(invalidTemplates, "* Found {0} invalid template material{1}")
                        + (invalidTemplates > 0 ? " --> ignore" : " --> ok"));
    }
}
