package com.isobolt.generator.codegen.output;

/**
 * What a {@link TextFileSink} did with a write request.
 */
public enum WriteOutcome {
    CREATED,
    OVERWRITTEN,
    SKIPPED
}
