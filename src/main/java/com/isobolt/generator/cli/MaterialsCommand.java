package com.isobolt.generator.cli;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.isobolt.generator.cli.exception.OptionsValidationException;
import com.isobolt.generator.cli.model.MaterialsOptions;
import com.isobolt.generator.cli.output.ReconciliationPrinter;
import com.isobolt.generator.cli.prompt.ConsoleInteractionPrompt;
import com.isobolt.generator.cli.prompt.FixedChoicePrompt;
import com.isobolt.generator.cli.validation.MaterialsOptionsValidator;
import com.isobolt.generator.model.GeometryTable;
import com.isobolt.generator.naming.NameCodec;
import com.isobolt.generator.reconcile.InteractionPrompt;
import com.isobolt.generator.reconcile.MaterialsConfig;
import com.isobolt.generator.reconcile.PreconditionFailureException;
import com.isobolt.generator.reconcile.PromptChoice;
import com.isobolt.generator.reconcile.ReconciliationEngine;
import com.isobolt.generator.reconcile.ReconciliationMode;
import com.isobolt.generator.reconcile.ReconciliationReport;
import com.isobolt.generator.reconcile.ThreadMaterialEditFactory;
import com.isobolt.generator.store.library.MaterialLibrary;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for creating or deleting the screw thread materials of a material library.
 */
@Command(
        name = "materials",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = 1,
        description = "Creates one thread material per thread template and nominal diameter, or deletes all thread materials."
)
public class MaterialsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MaterialsCommand.class);

    static final int EXIT_PRECHECK_FAILED = 2;

    @Mixin
    private MaterialsOptions options;

    private final MaterialsOptionsValidator validator = new MaterialsOptionsValidator();
    private final ReconciliationPrinter printer = new ReconciliationPrinter();

    @Override
    public Integer call() {
        try {
            MaterialsConfig config = validator.validate(options);
            printer.printBanner(config);

            MaterialLibrary library = MaterialLibrary.open(config.getLibrary());
            ReconciliationEngine engine = new ReconciliationEngine(library, library, GeometryTable.defaultTable(),
                    new NameCodec(config.getNamePrefix()), new ThreadMaterialEditFactory());

            ReconciliationReport report = engine.run(createPrompt(config));
            printer.printReport(report);
            return report.hasWarnings() ? 1 : 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (PreconditionFailureException e) {
            printer.printPreCheckFailure(e.getSummary());
            return EXIT_PRECHECK_FAILED;
        } catch (Exception e) {
            log.error("Thread material operation failed with exception", e);
            return 1;
        }
    }

    private InteractionPrompt createPrompt(MaterialsConfig config) {
        if (config.getMode() == ReconciliationMode.CREATE) {
            return new FixedChoicePrompt(PromptChoice.create(config.isOverwrite()));
        }
        if (config.getMode() == ReconciliationMode.DELETE) {
            return new FixedChoicePrompt(PromptChoice.delete());
        }
        return new ConsoleInteractionPrompt(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }
}
