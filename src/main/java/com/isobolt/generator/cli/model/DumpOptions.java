package com.isobolt.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "dump" command.
 */
@Getter
public class DumpOptions {

	@Option(names = { "--library", "-l" }, required = true, description = "Material library file (JSON)")
	private Path library;

	@Option(names = { "--name-pattern", "-p" }, defaultValue = ".*",
			description = "Regular expression a material name must match (default: all materials)")
	private String namePattern;

	@Option(names = { "--output", "-o" }, description = "Write the dump to this file instead of the log")
	private Path output;
}
