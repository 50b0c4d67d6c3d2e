package com.isobolt.generator.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.isobolt.generator.codegen.generator.AssemblyTypeCatalogGenerator;
import com.isobolt.generator.codegen.generator.BoltTypeCatalogGenerator;
import com.isobolt.generator.codegen.generator.GeometryParameterHtmlGenerator;
import com.isobolt.generator.codegen.generator.GripToLengthTableGenerator;
import com.isobolt.generator.store.library.MaterialLibrary;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests of the command line.
 */
class BoltGenCommandTest {

    @TempDir
    Path tempDir;

    private Path library;

    @BeforeEach
    void setUp() throws IOException, URISyntaxException {
        Path fixture = Path.of(getClass().getResource("/libraries/thread-templates.json").toURI());
        library = tempDir.resolve("library.json");
        Files.copy(fixture, library);
    }

    @Test
    void testCatalogsWritesAllFiles() {
        Path out = tempDir.resolve("out");

        int exitCode = execute("catalogs", "-o", out.toString());

        assertThat(exitCode).isZero();
        assertThat(out.resolve(BoltTypeCatalogGenerator.FILE_NAME)).exists();
        assertThat(out.resolve(AssemblyTypeCatalogGenerator.FILE_NAME)).exists();
        assertThat(out.resolve(GripToLengthTableGenerator.FILE_NAME)).exists();
        assertThat(out.resolve(GeometryParameterHtmlGenerator.FILE_NAME)).exists();
    }

    @Test
    void testCatalogsSetAndMaterials() throws IOException {
        int exitCode = execute("catalogs", "-o", tempDir.toString(), "--set", "type_catalogs",
                "-m", "Brass,Stainless steel");

        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve(GripToLengthTableGenerator.FILE_NAME)).doesNotExist();
        assertThat(Files.readString(tempDir.resolve(BoltTypeCatalogGenerator.FILE_NAME)))
                .contains("GIMBA - Brass - M3 thread", "GIMBA - Stainless steel - M3 thread");
    }

    @Test
    void testCatalogsRejectsDelimiterInMaterial() {
        assertThat(execute("catalogs", "-o", tempDir.toString(), "-m", "Steel - galvanized")).isEqualTo(1);
        assertThat(tempDir.resolve(BoltTypeCatalogGenerator.FILE_NAME)).doesNotExist();
    }

    @Test
    void testMaterialsCreateUpdatesLibraryFile() throws IOException {
        int exitCode = execute("materials", "-l", library.toString(), "--mode", "create");

        assertThat(exitCode).isZero();
        MaterialLibrary reloaded = MaterialLibrary.open(library);
        assertThat(reloaded.findByName("GIMBA - Steel galvanized - M12 thread")).isPresent();
        assertThat(reloaded.getMaterials()).hasSize(3 + 24);
    }

    @Test
    void testMaterialsDeleteAfterCreate() throws IOException {
        execute("materials", "-l", library.toString(), "--mode", "CREATE");

        int exitCode = execute("materials", "-l", library.toString(), "--mode", "DELETE");

        assertThat(exitCode).isZero();
        assertThat(MaterialLibrary.open(library).getMaterials()).hasSize(3);
    }

    @Test
    void testMaterialsGateFailure() throws IOException, URISyntaxException {
        Path empty = Path.of(getClass().getResource("/libraries/empty.json").toURI());

        assertThat(execute("materials", "-l", empty.toString(), "--mode", "CREATE")).isEqualTo(2);
    }

    @Test
    void testMaterialsOptionErrors() {
        assertThat(execute("materials", "-l", tempDir.resolve("missing.json").toString())).isEqualTo(1);
        assertThat(execute("materials", "-l", library.toString(), "--mode", "DELETE", "--overwrite")).isEqualTo(1);
        assertThat(execute("materials", "--mode", "CREATE")).isEqualTo(1);
    }

    @Test
    void testDumpToFile() throws IOException {
        Path dump = tempDir.resolve("dump/materials.txt");

        int exitCode = execute("dump", "-l", library.toString(), "-p", ".*Thread template", "-o", dump.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(dump))
                .contains("Material \"GIMBA - Steel galvanized - Thread template\"")
                .contains("Material \"GIMBA - Brass - Thread template\"")
                .doesNotContain("Material \"GIMBA - Steel galvanized\"\n");
    }

    @Test
    void testDumpRejectsInvalidPattern() {
        assertThat(execute("dump", "-l", library.toString(), "-p", "[")).isEqualTo(1);
    }

    @Test
    void testRootCommandPrintsUsage() {
        StringWriter err = new StringWriter();
        CommandLine commandLine = newCommandLine();
        commandLine.setErr(new PrintWriter(err));

        int exitCode = commandLine.execute();

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("catalogs", "materials", "dump");
    }

    private int execute(String... args) {
        return newCommandLine().execute(args);
    }

    private static CommandLine newCommandLine() {
        return new CommandLine(new BoltGenCommand()).setCaseInsensitiveEnumValuesAllowed(true);
    }
}
