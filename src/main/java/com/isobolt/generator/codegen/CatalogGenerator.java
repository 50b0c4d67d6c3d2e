package com.isobolt.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.isobolt.generator.codegen.generator.AssemblyTypeCatalogGenerator;
import com.isobolt.generator.codegen.generator.BoltTypeCatalogGenerator;
import com.isobolt.generator.codegen.generator.CatalogFileGenerator;
import com.isobolt.generator.codegen.generator.DiameterBandingTableGenerator;
import com.isobolt.generator.codegen.generator.GeometryParameterHtmlGenerator;
import com.isobolt.generator.codegen.generator.GeometryParameterTableGenerator;
import com.isobolt.generator.codegen.generator.GripToLengthTableGenerator;
import com.isobolt.generator.codegen.model.output.GeneratedFile;
import com.isobolt.generator.codegen.model.output.GeneratedFileReport;
import com.isobolt.generator.codegen.output.TextFileSink;
import com.isobolt.generator.codegen.output.WriteOutcome;
import com.isobolt.generator.model.GeometryTable;
import com.isobolt.generator.naming.NameCodec;

/**
 * Writes the type catalogs and lookup tables of the bolt families.
 *
 * Each file is rendered completely before it is handed to the sink. A file that fails to
 * render or write is reported as an error; the remaining files are still processed.
 */
public class CatalogGenerator {

    private static final Logger log = LoggerFactory.getLogger(CatalogGenerator.class);

    private final GeneratorConfig config;
    private final TextFileSink sink;
    private final List<CatalogFileGenerator> generators;

    public CatalogGenerator(GeneratorConfig config, GeometryTable table, TextFileSink sink) {
        this.config = config;
        this.sink = sink;
        NameCodec nameCodec = new NameCodec(config.getNamePrefix());
        this.generators = List.of(
                new BoltTypeCatalogGenerator(table, config.getMaterials(), nameCodec),
                new AssemblyTypeCatalogGenerator(table, config.getMaterials(), nameCodec),
                new GripToLengthTableGenerator(table),
                new GeometryParameterTableGenerator(table),
                new DiameterBandingTableGenerator(table),
                new GeometryParameterHtmlGenerator(table));
    }

    /**
     * Lists the target files of a set and whether they already exist.
     */
    public CatalogPreCheck preCheck(CatalogSet catalogSet) {
        Map<Path, Boolean> targets = new LinkedHashMap<>();
        for (CatalogFileGenerator generator : generatorsFor(catalogSet)) {
            Path path = targetPath(generator);
            targets.put(path, sink.exists(path));
        }
        return new CatalogPreCheck(catalogSet, targets);
    }

    /**
     * Renders and writes all files of a set.
     */
    public CatalogResult generate(CatalogSet catalogSet, boolean overwrite) {
        log.info("Generating {} in {}", catalogSet.getDescription(), config.getOutputDir());

        List<GeneratedFileReport> reports = new ArrayList<>();
        for (CatalogFileGenerator generator : generatorsFor(catalogSet)) {
            reports.add(write(generator, overwrite));
        }

        return CatalogResult.builder()
                .catalogSet(catalogSet)
                .overwrite(overwrite)
                .created(count(reports, WriteOutcome.CREATED))
                .overwritten(count(reports, WriteOutcome.OVERWRITTEN))
                .skipped(count(reports, WriteOutcome.SKIPPED))
                .errors((int) reports.stream().filter(GeneratedFileReport::isError).count())
                .files(reports)
                .build();
    }

    private GeneratedFileReport write(CatalogFileGenerator generator, boolean overwrite) {
        Path path = targetPath(generator);
        log.info("{}", path);
        try {
            GeneratedFile file = GeneratedFile.builder()
                    .path(path)
                    .contents(generator.render())
                    .type(generator.getType())
                    .build();
            WriteOutcome outcome = sink.write(file.getPath(), file.getContents(), overwrite);
            log.info("- {}", outcome.name().toLowerCase(Locale.ROOT));
            return GeneratedFileReport.written(path, file.getType(), outcome);
        } catch (IOException | RuntimeException e) {
            log.error("- failed: {}", e.getMessage(), e);
            return GeneratedFileReport.failed(path, generator.getType(), String.valueOf(e.getMessage()));
        }
    }

    private List<CatalogFileGenerator> generatorsFor(CatalogSet catalogSet) {
        return generators.stream()
                .filter(g -> catalogSet.includes(g.getType()))
                .collect(Collectors.toList());
    }

    private Path targetPath(CatalogFileGenerator generator) {
        Path outputDir = config.getOutputDir() != null ? config.getOutputDir() : Path.of(".");
        return outputDir.resolve(generator.getFileName());
    }

    private static int count(List<GeneratedFileReport> reports, WriteOutcome outcome) {
        return (int) reports.stream().filter(r -> r.getOutcome() == outcome).count();
    }
}
