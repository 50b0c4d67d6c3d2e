package com.isobolt.generator.reconcile;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.isobolt.generator.model.BoltGeometry;
import com.isobolt.generator.model.GeometryTable;
import com.isobolt.generator.model.asset.Material;
import com.isobolt.generator.model.asset.TestMaterials;
import com.isobolt.generator.naming.NameCodec;
import com.isobolt.generator.store.ArtifactStore;
import com.isobolt.generator.store.library.MaterialLibrary;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for creating and deleting thread materials.
 */
class ReconciliationEngineTest {

    private static final String STEEL = "GIMBA - Steel - Thread template";
    private static final String BRASS = "GIMBA - Brass - Thread template";

    private final NameCodec nameCodec = new NameCodec();
    private final GeometryTable table = GeometryTable.defaultTable();

    private MaterialLibrary library;

    @BeforeEach
    void setUp() {
        library = MaterialLibrary.inMemory("Test Library")
                .add(TestMaterials.plain("GIMBA - Steel"))
                .add(TestMaterials.template(STEEL))
                .add(TestMaterials.templateWithoutBumpMap(BRASS));
    }

    @Test
    void testDiscoverCountsEverything() {
        Discovery discovery = engine(library, table).discover();
        PreCheckSummary summary = discovery.summary();

        assertThat(summary.getStoreTitle()).isEqualTo("Test Library");
        assertThat(summary.getGeometriesFound()).isEqualTo(24);
        assertThat(summary.getValidTemplates()).isEqualTo(1);
        assertThat(summary.getInvalidTemplates()).isEqualTo(1);
        assertThat(summary.getExistingArtifacts()).isZero();
        assertThat(summary.getPlannedCreations()).isEqualTo(24);
        assertThat(summary.isReady()).isTrue();
        assertThat(summary.describe()).contains(
                "* Found 24 thread geometries --> ok",
                "* Found 1 valid template material --> ok",
                "* Found 1 invalid template material --> ignore");
    }

    @Test
    void testCreateMakesOneMaterialPerTemplateAndGeometry() {
        ReconciliationReport report = engine(library, table).run(new FixedPrompt(PromptChoice.create(false)));

        assertThat(report.getStatus()).isEqualTo(ReconciliationReport.Status.COMPLETED);
        assertThat(report.getCounters().getCreated()).isEqualTo(24);
        assertThat(report.hasWarnings()).isFalse();
        assertThat(report.getHeadline()).isEqualTo("Created 24 thread materials.");
        assertThat(library.find(nameCodec.derivedPattern())).hasSize(24);
        assertThat(library.findByName("GIMBA - Steel - M64 thread")).isPresent();
        assertThat(library.findByName("GIMBA - Brass - M64 thread")).isEmpty();
    }

    @Test
    void testSecondCreateSkipsEverything() {
        ReconciliationEngine engine = engine(library, table);
        engine.run(new FixedPrompt(PromptChoice.create(false)));

        ReconciliationReport report = engine.run(new FixedPrompt(PromptChoice.create(false)));

        assertThat(report.getStatus()).isEqualTo(ReconciliationReport.Status.NOTHING_TO_DO);
        assertThat(report.getCounters().getSkipped()).isEqualTo(24);
        assertThat(report.getCounters().getExistingArtifacts()).isEqualTo(24);
        assertThat(report.getCounters().getCreated()).isZero();
    }

    @Test
    void testOverwriteIsIdempotent() {
        ReconciliationEngine engine = engine(library, table);
        engine.run(new FixedPrompt(PromptChoice.create(true)));
        List<Material> first = library.find(nameCodec.derivedPattern());

        ReconciliationReport report = engine.run(new FixedPrompt(PromptChoice.create(true)));

        assertThat(report.getCounters().getOverwritten()).isEqualTo(24);
        assertThat(report.getCounters().getCreated()).isZero();
        assertThat(library.find(nameCodec.derivedPattern())).containsExactlyInAnyOrderElementsOf(first);
    }

    @Test
    void testSkippedEqualsTemplatesTimesGeometries() {
        library.add(TestMaterials.template("GIMBA - Zinc - Thread template"));
        ReconciliationEngine engine = engine(library, table);
        engine.run(new FixedPrompt(PromptChoice.create(false)));

        ReconciliationReport report = engine.run(new FixedPrompt(PromptChoice.create(false)));

        assertThat(report.getCounters().getValidTemplates()).isEqualTo(2);
        assertThat(report.getCounters().getSkipped()).isEqualTo(2 * 24);
    }

    @Test
    void testSingleFailureDoesNotStopThePass() {
        GeometryTable.Builder builder = GeometryTable.builder();
        for (int d = 1; d <= 20; d++) {
            builder.boltWithThread(BoltGeometry.builder().d(d).p(0.5).k(1).u(1).dgl(10).cls(List.of(10, 20)).build());
        }
        FaultyArtifactStore store = new FaultyArtifactStore(library).failCreate("GIMBA - Steel - M7 thread");

        ReconciliationReport report = engine(store, builder.build()).run(new FixedPrompt(PromptChoice.create(false)));

        assertThat(report.getStatus()).isEqualTo(ReconciliationReport.Status.COMPLETED);
        assertThat(report.hasWarnings()).isTrue();
        assertThat(report.getTitle()).isEqualTo("Operation Completed with Errors");
        assertThat(report.getCounters().getCreated()).isEqualTo(19);
        assertThat(report.getCounters().getCreateFailed()).isEqualTo(1);
        assertThat(library.find(nameCodec.derivedPattern())).hasSize(19);
    }

    @Test
    void testFailedOverwriteKeepsExistingMaterial() {
        engine(library, table).run(new FixedPrompt(PromptChoice.create(false)));
        FaultyArtifactStore store = new FaultyArtifactStore(library).failDelete("GIMBA - Steel - M12 thread");

        ReconciliationReport report = engine(store, table).run(new FixedPrompt(PromptChoice.create(true)));

        assertThat(report.getCounters().getOverwritten()).isEqualTo(23);
        assertThat(report.getCounters().getOverwriteFailed()).isEqualTo(1);
        assertThat(library.findByName("GIMBA - Steel - M12 thread")).isPresent();
    }

    @Test
    void testFailedCreateAfterDeleteCountsAsOverwriteFailure() {
        engine(library, table).run(new FixedPrompt(PromptChoice.create(false)));
        FaultyArtifactStore store = new FaultyArtifactStore(library).failCreate("GIMBA - Steel - M12 thread");

        ReconciliationReport report = engine(store, table).run(new FixedPrompt(PromptChoice.create(true)));

        assertThat(report.getCounters().getOverwritten()).isEqualTo(23);
        assertThat(report.getCounters().getOverwriteFailed()).isEqualTo(1);
        assertThat(report.getCounters().getCreateFailed()).isZero();
    }

    @Test
    void testDeleteRemovesOnlyThreadMaterials() {
        ReconciliationEngine engine = engine(library, table);
        engine.run(new FixedPrompt(PromptChoice.create(false)));

        ReconciliationReport report = engine.run(new FixedPrompt(PromptChoice.delete()));

        assertThat(report.getMode()).isEqualTo(ReconciliationMode.DELETE);
        assertThat(report.getCounters().getDeleted()).isEqualTo(24);
        assertThat(report.getHeadline()).isEqualTo("Deleted 24 thread materials.");
        assertThat(library.getMaterials()).extracting(Material::getName)
                .containsExactly("GIMBA - Steel", STEEL, BRASS);
    }

    @Test
    void testDeleteWithNothingToDelete() {
        ReconciliationReport report = engine(library, table).run(new FixedPrompt(PromptChoice.delete()));

        assertThat(report.getStatus()).isEqualTo(ReconciliationReport.Status.NOTHING_TO_DO);
        assertThat(report.getHeadline()).isEqualTo("No thread materials were found. Did not delete any materials.");
    }

    @Test
    void testDeleteFailureIsCounted() {
        engine(library, table).run(new FixedPrompt(PromptChoice.create(false)));
        FaultyArtifactStore store = new FaultyArtifactStore(library).failDelete("GIMBA - Steel - M3 thread");

        ReconciliationReport report = engine(store, table).run(new FixedPrompt(PromptChoice.delete()));

        assertThat(report.getCounters().getDeleted()).isEqualTo(23);
        assertThat(report.getCounters().getDeleteFailed()).isEqualTo(1);
        assertThat(library.find(nameCodec.derivedPattern())).extracting(Material::getName)
                .containsExactly("GIMBA - Steel - M3 thread");
    }

    @Test
    void testCancelChangesNothing() {
        ReconciliationReport report = engine(library, table).run(new FixedPrompt(PromptChoice.cancel()));

        assertThat(report.getStatus()).isEqualTo(ReconciliationReport.Status.CANCELLED);
        assertThat(report.getMode()).isNull();
        assertThat(library.getMaterials()).hasSize(3);
    }

    @Test
    void testGateFailsWithoutValidTemplate() {
        MaterialLibrary noTemplates = MaterialLibrary.inMemory("Empty")
                .add(TestMaterials.templateWithoutBumpMap(BRASS));
        FixedPrompt prompt = new FixedPrompt(PromptChoice.create(true));

        assertThatThrownBy(() -> engine(noTemplates, table).run(prompt))
                .isInstanceOfSatisfying(PreconditionFailureException.class, e -> {
                    assertThat(e.getSummary().getValidTemplates()).isZero();
                    assertThat(e.getSummary().getInvalidTemplates()).isEqualTo(1);
                });
        assertThat(prompt.asked).isEmpty();
        assertThat(noTemplates.getMaterials()).hasSize(1);
    }

    @Test
    void testGateFailsWithoutGeometries() {
        ReconciliationEngine engine = engine(library, GeometryTable.builder().build());
        Discovery discovery = engine.discover();

        assertThatThrownBy(() -> engine.execute(discovery, ReconciliationMode.DELETE, false))
                .isInstanceOf(PreconditionFailureException.class);
        assertThat(library.getMaterials()).hasSize(3);
    }

    @Test
    void testExistingMaterialsOfOtherPrefixAreIgnored() {
        library.add(TestMaterials.plain("OTHER - Steel - M12 thread"));

        Discovery discovery = engine(library, table).discover();

        assertThat(discovery.getExistingArtifacts()).isEmpty();
        assertThat(library.find(Pattern.compile(".*M12 thread"))).hasSize(1);
    }

    private ReconciliationEngine engine(ArtifactStore store, GeometryTable geometryTable) {
        return new ReconciliationEngine(store, library, geometryTable, nameCodec, new ThreadMaterialEditFactory());
    }

    private static final class FixedPrompt implements InteractionPrompt {

        private final PromptChoice choice;
        private final List<PreCheckSummary> asked = new ArrayList<>();

        private FixedPrompt(PromptChoice choice) {
            this.choice = choice;
        }

        @Override
        public PromptChoice choose(PreCheckSummary summary) {
            asked.add(summary);
            return choice;
        }
    }
}
