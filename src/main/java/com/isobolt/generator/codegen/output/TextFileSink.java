package com.isobolt.generator.codegen.output;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Destination for rendered catalog and table text.
 */
public interface TextFileSink {

    boolean exists(Path path);

    /**
     * Writes the content in one go. An existing file is replaced only when {@code overwrite}
     * is set, otherwise it is left untouched.
     */
    WriteOutcome write(Path path, String content, boolean overwrite) throws IOException;
}
