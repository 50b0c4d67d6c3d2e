package com.isobolt.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.isobolt.generator.cli.exception.OptionsValidationException;
import com.isobolt.generator.cli.model.CatalogOptions;
import com.isobolt.generator.cli.model.ValidatedCatalogOptions;
import com.isobolt.generator.codegen.GeneratorConfig;
import com.isobolt.generator.codegen.util.DelimitedTextBuilder;
import com.isobolt.generator.naming.NameCodec;

public class CatalogOptionsValidator {

	public ValidatedCatalogOptions validate(CatalogOptions o) {
		List<String> errors = new ArrayList<>();

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();
		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists but is not a directory: " + normalizedOutputDir);
		}

		if (o.getCatalogSet() == null) {
			errors.add("Catalog set is required (--set / -s).");
		}

		if (isBlank(o.getNamePrefix())) {
			errors.add("Material name prefix must not be blank (--prefix).");
		} else if (!DelimitedTextBuilder.isPlainCell(o.getNamePrefix())) {
			errors.add("Material name prefix must not contain \"" + DelimitedTextBuilder.DELIMITER
					+ "\" or line breaks (--prefix): " + o.getNamePrefix());
		}

		List<String> materials = new ArrayList<>();
		if (o.getMaterials() == null || o.getMaterials().isEmpty()) {
			materials.add(GeneratorConfig.DEFAULT_MATERIAL);
		} else {
			for (String material : o.getMaterials()) {
				String trimmed = material.trim();
				if (trimmed.isEmpty()) {
					errors.add("Material names must not be blank (--material / -m).");
				} else if (!DelimitedTextBuilder.isPlainCell(trimmed)) {
					errors.add("Material name must not contain \"" + DelimitedTextBuilder.DELIMITER
							+ "\" or line breaks: " + trimmed);
				} else if (trimmed.contains(NameCodec.DELIMITER)) {
					errors.add("Material name must not contain \"" + NameCodec.DELIMITER + "\": " + trimmed);
				} else if (materials.contains(trimmed)) {
					errors.add("Duplicate material name: " + trimmed);
				} else {
					materials.add(trimmed);
				}
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
		return new ValidatedCatalogOptions(normalizedOutputDir, materials);
	}

	private static boolean isBlank(String s) {
		return s == null || s.isBlank();
	}
}
