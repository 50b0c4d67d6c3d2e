package com.isobolt.generator.validation;

import java.util.List;

import lombok.Value;

/**
 * Outcome of checking a thread template material, with the diagnostic trace of every check
 * performed.
 */
@Value
public class TemplateValidation {

    boolean valid;

    /** Why the template was rejected; null for valid templates. */
    String reason;

    List<String> trace;

    public static TemplateValidation ok(List<String> trace) {
        return new TemplateValidation(true, null, List.copyOf(trace));
    }

    public static TemplateValidation failure(String reason, List<String> trace) {
        return new TemplateValidation(false, reason, List.copyOf(trace));
    }
}
