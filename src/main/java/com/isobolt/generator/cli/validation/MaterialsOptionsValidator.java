package com.isobolt.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.isobolt.generator.cli.exception.OptionsValidationException;
import com.isobolt.generator.cli.model.MaterialsOptions;
import com.isobolt.generator.codegen.util.DelimitedTextBuilder;
import com.isobolt.generator.reconcile.MaterialsConfig;
import com.isobolt.generator.reconcile.ReconciliationMode;

public class MaterialsOptionsValidator {

	public MaterialsConfig validate(MaterialsOptions o) {
		List<String> errors = new ArrayList<>();

		checkLibrary(o.getLibrary(), errors);

		if (o.getNamePrefix() == null || o.getNamePrefix().isBlank()) {
			errors.add("Material name prefix must not be blank (--prefix).");
		} else if (!DelimitedTextBuilder.isPlainCell(o.getNamePrefix())) {
			errors.add("Material name prefix must not contain \"" + DelimitedTextBuilder.DELIMITER
					+ "\" or line breaks (--prefix): " + o.getNamePrefix());
		}
		if (o.isOverwrite() && o.getMode() == ReconciliationMode.DELETE) {
			errors.add("--overwrite only applies to --mode CREATE.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
		return MaterialsConfig.builder()
				.library(o.getLibrary().toAbsolutePath().normalize())
				.mode(o.getMode())
				.overwrite(o.isOverwrite())
				.namePrefix(o.getNamePrefix())
				.build();
	}

	static void checkLibrary(Path library, List<String> errors) {
		if (library == null) {
			errors.add("Material library is required (--library / -l).");
		} else if (!Files.isRegularFile(library)) {
			errors.add("Material library does not exist or is not a file: " + library);
		}
	}
}
