package com.isobolt.generator.reconcile;

import lombok.Getter;
import lombok.ToString;

/**
 * Tallies of one reconciliation pass. The discovery counts are fixed at construction, the
 * operation counts grow while the pass executes.
 */
@Getter
@ToString
public class OutcomeCounters {

    private final int geometriesFound;
    private final int validTemplates;
    private final int invalidTemplates;
    private final int existingArtifacts;

    private int skipped;
    private int deleted;
    private int overwritten;
    private int created;
    private int deleteFailed;
    private int overwriteFailed;
    private int createFailed;

    public OutcomeCounters(int geometriesFound, int validTemplates, int invalidTemplates, int existingArtifacts) {
        this.geometriesFound = geometriesFound;
        this.validTemplates = validTemplates;
        this.invalidTemplates = invalidTemplates;
        this.existingArtifacts = existingArtifacts;
    }

    void skip() {
        skipped++;
    }

    void delete() {
        deleted++;
    }

    void overwrite() {
        overwritten++;
    }

    void create() {
        created++;
    }

    void deleteFailure() {
        deleteFailed++;
    }

    void overwriteFailure() {
        overwriteFailed++;
    }

    void createFailure() {
        createFailed++;
    }

    public boolean hasFailures() {
        return deleteFailed > 0 || overwriteFailed > 0 || createFailed > 0;
    }
}
