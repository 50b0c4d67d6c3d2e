package com.isobolt.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.isobolt.generator.codegen.CatalogSet;
import com.isobolt.generator.codegen.GeneratorConfig;
import com.isobolt.generator.naming.NameCodec;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "catalogs" command. No validation, no execution logic, no
 * printing.
 */
@Getter
public class CatalogOptions {

	@Option(names = { "--output-dir", "-o" }, description = "Directory to write the files to (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--set", "-s" }, defaultValue = "ALL",
			description = "Files to generate: TYPE_CATALOGS, LOOKUP_TABLES, HTML or ALL (default: ${DEFAULT-VALUE})")
	private CatalogSet catalogSet;

	@Option(names = { "--material", "-m" }, split = ",",
			description = "Plain material names to generate catalog types for (default: " + GeneratorConfig.DEFAULT_MATERIAL + ")")
	private List<String> materials;

	@Option(names = { "--prefix" }, defaultValue = NameCodec.DEFAULT_PREFIX,
			description = "Material name prefix (default: ${DEFAULT-VALUE})")
	private String namePrefix;

	@Option(names = { "--overwrite", "-f" }, description = "Overwrite existing files")
	private boolean overwrite;
}
