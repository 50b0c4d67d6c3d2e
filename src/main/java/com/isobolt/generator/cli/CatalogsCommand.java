package com.isobolt.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.isobolt.generator.cli.exception.OptionsValidationException;
import com.isobolt.generator.cli.model.CatalogOptions;
import com.isobolt.generator.cli.model.ValidatedCatalogOptions;
import com.isobolt.generator.cli.output.CatalogResultsPrinter;
import com.isobolt.generator.cli.validation.CatalogOptionsValidator;
import com.isobolt.generator.codegen.CatalogGenerator;
import com.isobolt.generator.codegen.CatalogPreCheck;
import com.isobolt.generator.codegen.CatalogResult;
import com.isobolt.generator.codegen.GeneratorConfig;
import com.isobolt.generator.codegen.output.FileSystemTextFileSink;
import com.isobolt.generator.model.GeometryTable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for writing the type catalogs and lookup tables of the bolt families.
 */
@Command(
        name = "catalogs",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = 1,
        description = "Writes type catalog, lookup table and HTML parameter files for the generic ISO metric bolt families."
)
public class CatalogsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CatalogsCommand.class);

    @Mixin
    private CatalogOptions options;

    private final CatalogOptionsValidator validator = new CatalogOptionsValidator();
    private final CatalogResultsPrinter printer = new CatalogResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedCatalogOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            GeneratorConfig config = GeneratorConfig.builder()
                    .outputDir(validated.getNormalizedOutputDir())
                    .materials(validated.getMaterials())
                    .namePrefix(options.getNamePrefix())
                    .build();
            CatalogGenerator generator = new CatalogGenerator(config, GeometryTable.defaultTable(),
                    new FileSystemTextFileSink());

            CatalogPreCheck preCheck = generator.preCheck(options.getCatalogSet());
            boolean overwrite = options.isOverwrite() || preCheck.isOverwriteImplied();
            printer.printPreCheck(preCheck, overwrite);

            CatalogResult result = generator.generate(options.getCatalogSet(), overwrite);
            printer.printResult(result);
            return result.isSuccess() ? 0 : 1;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (Exception e) {
            log.error("Catalog generation failed with exception", e);
            return 1;
        }
    }
}
