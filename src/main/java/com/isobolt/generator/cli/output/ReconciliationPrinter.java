package com.isobolt.generator.cli.output;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.isobolt.generator.reconcile.MaterialsConfig;
import com.isobolt.generator.reconcile.PreCheckSummary;
import com.isobolt.generator.reconcile.ReconciliationReport;

/**
 * Responsible only for printing CLI output for the "materials" command.
 */
public class ReconciliationPrinter {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationPrinter.class);

    public void printBanner(MaterialsConfig config) {
        log.info("=================================================");
        log.info("ISO Metric Screw Thread Materials");
        log.info("=================================================");
        log.info("Material Library: {}", config.getLibrary());
        log.info("Name Prefix: {}", config.getNamePrefix());
        log.info("Mode: {}", config.getMode() != null ? config.getMode() : "interactive");
        if (config.isOverwrite()) {
            log.info("Overwrite: yes");
        }
        log.info("=================================================");
    }

    public void printPreCheckFailure(PreCheckSummary summary) {
        log.error("Pre-checks failed. No operation is possible on \"{}\".", summary.getStoreTitle());
        summary.describe().forEach(line -> log.error("  {}", line));
        log.error("Issues marked with \"NOT OK\" obstruct operation.");
    }

    public void printReport(ReconciliationReport report) {
        log.info("");
        log.info("=================================================");
        log.info(report.getTitle().toUpperCase(Locale.ROOT));
        log.info("=================================================");
        log.info(report.getHeadline());
        if (report.hasWarnings()) {
            report.getDetails().forEach(line -> log.warn("  {}", line));
        } else {
            report.getDetails().forEach(line -> log.info("  {}", line));
        }
        log.info("=================================================");
    }
}
