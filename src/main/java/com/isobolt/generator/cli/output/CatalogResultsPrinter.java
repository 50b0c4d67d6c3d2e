package com.isobolt.generator.cli.output;

import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.isobolt.generator.cli.model.CatalogOptions;
import com.isobolt.generator.cli.model.ValidatedCatalogOptions;
import com.isobolt.generator.codegen.CatalogPreCheck;
import com.isobolt.generator.codegen.CatalogResult;
import com.isobolt.generator.codegen.model.output.GeneratedFileReport;
import com.isobolt.generator.codegen.util.CountMessageUtil;

/**
 * Responsible only for printing CLI output for the "catalogs" command.
 * No validation, no execution, no prompting.
 */
public class CatalogResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CatalogResultsPrinter.class);

    public void printBanner(CatalogOptions o, ValidatedCatalogOptions v) {
        log.info("=================================================");
        log.info("ISO Metric Bolt Catalogs and Tables");
        log.info("=================================================");
        log.info("Files: {}", o.getCatalogSet().getDescription());
        log.info("Materials: {}", String.join(", ", v.getMaterials()));
        log.info("Name Prefix: {}", o.getNamePrefix());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("=================================================");
    }

    public void printPreCheck(CatalogPreCheck preCheck, boolean overwrite) {
        log.info("Status of type catalog and lookup table files:");
        for (Map.Entry<Path, Boolean> target : preCheck.getTargets().entrySet()) {
            log.info("* {} ({})", target.getKey().getFileName(), target.getValue() ? "exists" : "does not exist");
        }
        int existing = preCheck.getExistingFiles().size();
        if (existing > 0) {
            log.info(CountMessageUtil.format(existing, overwrite
                    ? "Will overwrite {0} existing file{1}."
                    : "Will keep {0} existing file{1}. Use --overwrite to replace them."));
        }
    }

    public void printResult(CatalogResult result) {
        log.info("");
        log.info("=================================================");
        log.info(result.isSuccess() ? "GENERATION SUCCESSFUL" : "GENERATION COMPLETED WITH ERRORS");
        log.info("=================================================");
        for (GeneratedFileReport file : result.getFiles()) {
            if (file.isError()) {
                log.error("  {}: {} ({})", file.getPath().getFileName(), file.getStatus(), file.getError());
            } else {
                log.info("  {}: {}", file.getPath().getFileName(), file.getStatus());
            }
        }
        log.info("");
        log.info(CountMessageUtil.format(result.getCreated(), "Created {0} file{1}"));
        log.info(CountMessageUtil.format(result.getOverwritten(), "Overwrote {0} file{1}"));
        log.info(CountMessageUtil.format(result.getSkipped(), "Skipped {0} file{1}"));
        if (result.getErrors() > 0) {
            log.warn(CountMessageUtil.format(result.getErrors(), "Failed to write {0} file{1}"));
        }
        log.info("=================================================");
    }
}
