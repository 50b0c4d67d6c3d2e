package com.isobolt.generator.reconcile;

import java.util.ArrayList;
import java.util.List;

import com.isobolt.generator.codegen.util.CountMessageUtil;

import lombok.Value;

/**
 * Wrap-up of a reconciliation pass.
 */
@Value
public class ReconciliationReport {

    public enum Status {
        /** Something was changed or attempted. */
        COMPLETED,
        /** Every desired material already existed, or there was nothing to delete. */
        NOTHING_TO_DO,
        /** The user cancelled after the pre-check; nothing was changed. */
        CANCELLED
    }

    /** Null for cancelled passes. */
    ReconciliationMode mode;

    Status status;

    OutcomeCounters counters;

    static ReconciliationReport cancelled(OutcomeCounters counters) {
        return new ReconciliationReport(null, Status.CANCELLED, counters);
    }

    static ReconciliationReport of(ReconciliationMode mode, OutcomeCounters counters) {
        boolean idle = mode == ReconciliationMode.CREATE
                ? counters.getCreated() == 0 && counters.getOverwritten() == 0
                : counters.getDeleted() == 0;
        Status status = !counters.hasFailures() && idle ? Status.NOTHING_TO_DO : Status.COMPLETED;
        return new ReconciliationReport(mode, status, counters);
    }

    public boolean hasWarnings() {
        return counters.hasFailures();
    }

    public String getTitle() {
        if (status == Status.CANCELLED) {
            return "Operation Cancelled";
        }
        return "Operation Completed" + (hasWarnings() ? " with Errors" : "");
    }

    public String getHeadline() {
        if (status == Status.CANCELLED) {
            return "Cancelled by user. No materials were changed.";
        }
        if (mode == ReconciliationMode.CREATE) {
            if (status == Status.NOTHING_TO_DO) {
                return "All thread materials were already present. Did not create new materials.";
            }
            return CountMessageUtil.format(counters.getCreated() + counters.getOverwritten(),
                    "Created {0} thread material{1}.");
        }
        if (status == Status.NOTHING_TO_DO) {
            return "No thread materials were found. Did not delete any materials.";
        }
        return CountMessageUtil.format(counters.getDeleted(), "Deleted {0} thread material{1}.");
    }

    public List<String> getDetails() {
        List<String> details = new ArrayList<>();
        if (mode == ReconciliationMode.CREATE) {
            details.add(CountMessageUtil.format(counters.getCreated(), "* Created {0} new material{1}"));
            details.add(CountMessageUtil.format(counters.getOverwritten(), "* Overwrote {0} material{1}"));
            if (counters.getSkipped() > 0) {
                details.add(CountMessageUtil.format(counters.getSkipped(), "* Skipped {0} existing material{1}"));
            }
            if (counters.getCreateFailed() > 0) {
                details.add(CountMessageUtil.format(counters.getCreateFailed(), "* Failed to create {0} material{1}"));
            }
            if (counters.getOverwriteFailed() > 0) {
                details.add(CountMessageUtil.format(counters.getOverwriteFailed(),
                        "* Failed to overwrite {0} material{1}"));
            }
        } else if (mode == ReconciliationMode.DELETE) {
            details.add(CountMessageUtil.format(counters.getDeleted(), "* Deleted {0} material{1}"));
            if (counters.getDeleteFailed() > 0) {
                details.add(CountMessageUtil.format(counters.getDeleteFailed(), "* Failed to delete {0} material{1}"));
            }
        }
        return details;
    }
}
