package com.isobolt.generator.reconcile;

/**
 * Thrown before any change is made when there are no geometries or no valid templates to work
 * with.
 */
public class PreconditionFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient PreCheckSummary summary;

    public PreconditionFailureException(PreCheckSummary summary) {
        super("Pre-check failed on \"" + summary.getStoreTitle() + "\": "
                + summary.getGeometriesFound() + " geometries, "
                + summary.getValidTemplates() + " valid templates");
        this.summary = summary;
    }

    public PreCheckSummary getSummary() {
        return summary;
    }
}
