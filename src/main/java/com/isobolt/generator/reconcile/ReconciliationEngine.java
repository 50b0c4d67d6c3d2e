package com.isobolt.generator.reconcile;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.isobolt.generator.model.BoltGeometry;
import com.isobolt.generator.model.GeometryTable;
import com.isobolt.generator.model.asset.Material;
import com.isobolt.generator.naming.NameCodec;
import com.isobolt.generator.store.ArtifactStore;
import com.isobolt.generator.store.TransactionScope;
import com.isobolt.generator.validation.TemplateValidation;
import com.isobolt.generator.validation.TemplateValidator;

/**
 * Brings the thread materials of a store in line with its templates and the geometry table.
 *
 * A pass discovers geometries, existing thread materials and templates, refuses to continue
 * without at least one geometry and one valid template, and then creates one thread material
 * per template and geometry or deletes all existing thread materials. Execution runs inside a
 * single transaction. A failing item is logged and counted and does not stop the pass.
 */
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final ArtifactStore store;
    private final TransactionScope transactions;
    private final GeometryTable geometryTable;
    private final NameCodec nameCodec;
    private final TemplateValidator templateValidator;
    private final ThreadMaterialEditFactory editFactory;

    public ReconciliationEngine(ArtifactStore store, TransactionScope transactions, GeometryTable geometryTable,
                                NameCodec nameCodec, ThreadMaterialEditFactory editFactory) {
        this.store = store;
        this.transactions = transactions;
        this.geometryTable = geometryTable;
        this.nameCodec = nameCodec;
        this.templateValidator = new TemplateValidator(nameCodec);
        this.editFactory = editFactory;
    }

    /**
     * Runs the pre-check. Reads only.
     */
    public Discovery discover() {
        log.info("");
        log.info("Pre-Checks");

        log.info("- Searching thread geometries");
        List<BoltGeometry> geometries = geometryTable.getBoltGeometries();
        geometries.forEach(g -> log.info("   - {}", g));

        log.info("- Searching existing thread materials");
        List<Material> existing = store.find(nameCodec.derivedPattern());
        existing.forEach(m -> log.info("   - Material \"{}\"", m.getName()));

        log.info("- Searching and checking thread template materials");
        List<Material> valid = new ArrayList<>();
        List<Material> invalid = new ArrayList<>();
        for (Material template : store.find(nameCodec.templatePattern())) {
            TemplateValidation validation = templateValidator.validate(template);
            validation.getTrace().forEach(line -> log.info("  - {}", line));
            if (validation.isValid()) {
                valid.add(template);
            } else {
                log.warn("Check failed on template material \"{}\": {}", template.getName(), validation.getReason());
                invalid.add(template);
            }
        }

        Discovery discovery = new Discovery(store.getTitle(), geometries, existing, valid, invalid);
        PreCheckSummary summary = discovery.summary();
        log.info(summary.isReady() ? "- PRE-CHECK OK" : "- PRE-CHECK FAILED");
        summary.describe().forEach(line -> log.info("  {}", line));
        return discovery;
    }

    /**
     * Performs the chosen operation on a discovered store.
     *
     * @throws PreconditionFailureException if there are no geometries or no valid templates;
     *         nothing is changed in that case
     */
    public ReconciliationReport execute(Discovery discovery, ReconciliationMode mode, boolean overwrite) {
        if (!discovery.isReady()) {
            throw new PreconditionFailureException(discovery.summary());
        }
        OutcomeCounters counters = discovery.newCounters();
        String transactionName = mode.getTransactionName();
        log.info("");
        log.info("Starting transaction \"{}\"", transactionName);
        transactions.run(transactionName, () -> {
            if (mode == ReconciliationMode.CREATE) {
                createAll(discovery, overwrite, counters);
            } else {
                deleteAll(discovery, counters);
            }
            return counters;
        });
        log.info("Committed transaction \"{}\"", transactionName);
        ReconciliationReport report = ReconciliationReport.of(mode, counters);
        log.info("Reconciliation finished: {}", counters);
        return report;
    }

    /**
     * Full pass: pre-check, ask, execute.
     *
     * @throws PreconditionFailureException if the pre-check fails; the prompt is not consulted
     */
    public ReconciliationReport run(InteractionPrompt prompt) {
        Discovery discovery = discover();
        PreCheckSummary summary = discovery.summary();
        if (!summary.isReady()) {
            throw new PreconditionFailureException(summary);
        }
        PromptChoice choice = prompt.choose(summary);
        switch (choice.getAction()) {
            case CREATE:
                log.info("- Create thread materials operation selected by user");
                return execute(discovery, ReconciliationMode.CREATE, choice.isOverwrite());
            case DELETE:
                log.info("- Delete thread materials operation selected by user");
                return execute(discovery, ReconciliationMode.DELETE, false);
            default:
                log.info("- Cancelled by user");
                return ReconciliationReport.cancelled(discovery.newCounters());
        }
    }

    private void createAll(Discovery discovery, boolean overwrite, OutcomeCounters counters) {
        log.info("");
        log.info("Creating thread materials");
        for (Material template : discovery.getValidTemplates()) {
            String category = nameCodec.decodeCategory(template.getName());
            for (BoltGeometry geometry : discovery.getGeometries()) {
                reconcileOne(template, category, geometry, overwrite, counters);
            }
        }
    }

    private void reconcileOne(Material template, String category, BoltGeometry geometry, boolean overwrite,
                              OutcomeCounters counters) {
        String name = nameCodec.encode(category, geometry.getD());

        Optional<Material> existing;
        try {
            existing = store.findByName(name);
        } catch (RuntimeException e) {
            log.warn("  Failed to look up \"{}\"", name, e);
            counters.createFailure();
            return;
        }

        if (existing.isPresent() && !overwrite) {
            log.info("- Skip existing material \"{}\"", name);
            counters.skip();
            return;
        }

        if (existing.isPresent()) {
            try {
                log.info("- Deleting thread material \"{}\"", name);
                store.delete(existing.get());
            } catch (RuntimeException e) {
                log.warn("  Failed to remove \"{}\"", name, e);
                counters.overwriteFailure();
                return;
            }
        }

        try {
            log.info("- Creating {} thread material from template \"{}\"", geometry.getDesignation(),
                    template.getName());
            store.create(template, name, editFactory.create(category, geometry));
        } catch (RuntimeException e) {
            log.warn("  Failed to create \"{}\"", name, e);
            if (existing.isPresent()) {
                counters.overwriteFailure();
            } else {
                counters.createFailure();
            }
            return;
        }

        if (existing.isPresent()) {
            counters.overwrite();
        } else {
            counters.create();
        }
    }

    private void deleteAll(Discovery discovery, OutcomeCounters counters) {
        log.info("");
        log.info("Deleting thread materials");
        for (Material material : discovery.getExistingArtifacts()) {
            try {
                log.info("- Deleting thread material \"{}\"", material.getName());
                store.delete(material);
                counters.delete();
            } catch (RuntimeException e) {
                log.warn("  Failed to delete thread material \"{}\"", material.getName(), e);
                counters.deleteFailure();
            }
        }
    }
}
