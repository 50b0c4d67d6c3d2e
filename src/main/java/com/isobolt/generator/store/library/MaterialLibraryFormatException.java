package com.isobolt.generator.store.library;

import com.isobolt.generator.store.StoreOperationException;

/**
 * Thrown when a material library file is not well formed.
 */
public class MaterialLibraryFormatException extends StoreOperationException {

    private static final long serialVersionUID = 1L;

    public MaterialLibraryFormatException(String message) {
        super(message);
    }
}
