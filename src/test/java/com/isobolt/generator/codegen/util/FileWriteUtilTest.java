package com.isobolt.generator.codegen.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class FileWriteUtilTest {

    @TempDir
    Path tempDir;

    @Test
    void testSafeWriteCreatesParentDirectories() throws IOException {
        Path target = tempDir.resolve("a/b/c.txt");

        FileWriteUtil.safeWriteString(target, "M12 Ø");

        assertThat(Files.readString(target)).isEqualTo("M12 Ø");
    }

    @Test
    void testReplaceLeavesNoTemporaryFile() throws IOException {
        Path target = tempDir.resolve("library.json");
        Files.writeString(target, "old");

        FileWriteUtil.replaceString(target, "new");

        assertThat(Files.readString(target)).isEqualTo("new");
        assertThat(tempDir.resolve("library.json.tmp")).doesNotExist();
    }
}
