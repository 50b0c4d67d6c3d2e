package com.isobolt.generator;

import com.isobolt.generator.cli.BoltGenCommand;
import picocli.CommandLine;

/**
 * Main entry point for the ISO metric bolt generator.
 * This CLI tool writes type catalogs and lookup tables for generic ISO metric bolt families
 * and manages the screw thread materials of a material library.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new BoltGenCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
