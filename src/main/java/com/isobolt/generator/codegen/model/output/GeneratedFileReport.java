package com.isobolt.generator.codegen.model.output;

import java.nio.file.Path;

import com.isobolt.generator.codegen.output.WriteOutcome;

import lombok.NonNull;
import lombok.Value;

/**
 * What happened to one target file. {@code outcome} is null when rendering or writing failed.
 */
@Value
public class GeneratedFileReport {

    @NonNull
    Path path;

    @NonNull
    GeneratedFileType type;

    WriteOutcome outcome;

    String error;

    public static GeneratedFileReport written(Path path, GeneratedFileType type, WriteOutcome outcome) {
        return new GeneratedFileReport(path, type, outcome, null);
    }

    public static GeneratedFileReport failed(Path path, GeneratedFileType type, String error) {
        return new GeneratedFileReport(path, type, null, error);
    }

    public boolean isError() {
        return outcome == null;
    }

    /**
     * Status label for reports: the outcome name or {@code ERROR}.
     */
    public String getStatus() {
        return outcome != null ? outcome.name() : "ERROR";
    }
}
