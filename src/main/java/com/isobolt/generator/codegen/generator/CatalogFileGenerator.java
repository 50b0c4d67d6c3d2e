package com.isobolt.generator.codegen.generator;

import java.io.IOException;

import com.isobolt.generator.codegen.model.output.GeneratedFileType;

/**
 * Renders one catalog or lookup table file from the geometry table.
 *
 * Rendering is pure; writing is left to the caller.
 */
public interface CatalogFileGenerator {

    String getFileName();

    GeneratedFileType getType();

    String render() throws IOException;
}
