package com.isobolt.generator.codegen.model.output;

import java.nio.file.Path;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Represents a rendered catalog or table file (path + contents).
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedFile {

    @NonNull
    Path path;

    @NonNull
    String contents;

    @NonNull
    GeneratedFileType type;
}
