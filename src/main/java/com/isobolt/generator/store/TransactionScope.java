package com.isobolt.generator.store;

import java.util.function.Supplier;

/**
 * Runs a unit of work atomically against an {@link ArtifactStore}.
 *
 * The body's changes are committed when it returns normally and rolled back when it
 * throws.
 */
public interface TransactionScope {

    <T> T run(String name, Supplier<T> body);
}
