package com.isobolt.generator.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command. Does nothing by itself but list the subcommands.
 */
@Command(
        name = "bolt-gen",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = 1,
        version = "iso-bolt-generator 1.0.0",
        description = "Generates catalogs, lookup tables and thread materials for generic ISO metric bolt families.",
        subcommands = { CatalogsCommand.class, MaterialsCommand.class, DumpCommand.class }
)
public class BoltGenCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return 1;
    }
}
