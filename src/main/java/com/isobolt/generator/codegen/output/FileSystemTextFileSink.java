package com.isobolt.generator.codegen.output;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.isobolt.generator.codegen.util.FileWriteUtil;

public class FileSystemTextFileSink implements TextFileSink {

    private static final Logger log = LoggerFactory.getLogger(FileSystemTextFileSink.class);

    @Override
    public boolean exists(Path path) {
        return Files.exists(path);
    }

    @Override
    public WriteOutcome write(Path path, String content, boolean overwrite) throws IOException {
        boolean existed = Files.exists(path);
        if (existed && !overwrite) {
            log.debug("Keeping existing file {}", path);
            return WriteOutcome.SKIPPED;
        }
        FileWriteUtil.safeWriteString(path, content);
        return existed ? WriteOutcome.OVERWRITTEN : WriteOutcome.CREATED;
    }
}
