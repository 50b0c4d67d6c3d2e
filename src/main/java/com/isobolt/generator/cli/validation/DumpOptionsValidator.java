package com.isobolt.generator.cli.validation;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.isobolt.generator.cli.exception.OptionsValidationException;
import com.isobolt.generator.cli.model.DumpOptions;

public class DumpOptionsValidator {

	/**
	 * Validates the options and returns the compiled name filter.
	 */
	public Pattern validate(DumpOptions o) {
		List<String> errors = new ArrayList<>();

		MaterialsOptionsValidator.checkLibrary(o.getLibrary(), errors);

		Pattern pattern = null;
		try {
			pattern = Pattern.compile(o.getNamePattern() == null ? ".*" : o.getNamePattern());
		} catch (PatternSyntaxException e) {
			errors.add("Invalid name pattern: " + e.getDescription() + " in \"" + o.getNamePattern() + "\"");
		}

		if (o.getOutput() != null && Files.isDirectory(o.getOutput())) {
			errors.add("Dump output must be a file, not a directory: " + o.getOutput());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
		return pattern;
	}
}
