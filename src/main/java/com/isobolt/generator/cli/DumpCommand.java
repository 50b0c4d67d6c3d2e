package com.isobolt.generator.cli;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.isobolt.generator.cli.exception.OptionsValidationException;
import com.isobolt.generator.cli.model.DumpOptions;
import com.isobolt.generator.cli.validation.DumpOptionsValidator;
import com.isobolt.generator.codegen.util.FileWriteUtil;
import com.isobolt.generator.dump.AssetDumper;
import com.isobolt.generator.model.asset.Material;
import com.isobolt.generator.store.library.MaterialLibrary;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for dumping materials and their appearance assets as text.
 */
@Command(
        name = "dump",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = 1,
        description = "Dumps the materials of a material library, including all appearance asset properties."
)
public class DumpCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DumpCommand.class);

    @Mixin
    private DumpOptions options;

    private final DumpOptionsValidator validator = new DumpOptionsValidator();

    @Override
    public Integer call() {
        try {
            Pattern pattern = validator.validate(options);
            MaterialLibrary library = MaterialLibrary.open(options.getLibrary());
            List<Material> materials = library.find(pattern);
            String dump = new AssetDumper().dump(materials);

            if (options.getOutput() != null) {
                FileWriteUtil.safeWriteString(options.getOutput(), dump);
                log.info("Dumped {} material(s) to {}", materials.size(), options.getOutput().toAbsolutePath());
            } else {
                dump.lines().forEach(log::info);
                log.info("Dumped {} material(s)", materials.size());
            }
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (Exception e) {
            log.error("Material dump failed with exception", e);
            return 1;
        }
    }
}
