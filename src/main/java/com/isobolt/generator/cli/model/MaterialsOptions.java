package com.isobolt.generator.cli.model;

import java.nio.file.Path;

import com.isobolt.generator.naming.NameCodec;
import com.isobolt.generator.reconcile.ReconciliationMode;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "materials" command.
 */
@Getter
public class MaterialsOptions {

	@Option(names = { "--library", "-l" }, required = true, description = "Material library file (JSON)")
	private Path library;

	@Option(names = { "--mode" },
			description = "CREATE or DELETE thread materials without asking. Prompts interactively when omitted.")
	private ReconciliationMode mode;

	@Option(names = { "--overwrite", "-f" }, description = "Overwrite existing thread materials when creating")
	private boolean overwrite;

	@Option(names = { "--prefix" }, defaultValue = NameCodec.DEFAULT_PREFIX,
			description = "Material name prefix (default: ${DEFAULT-VALUE})")
	private String namePrefix;
}
