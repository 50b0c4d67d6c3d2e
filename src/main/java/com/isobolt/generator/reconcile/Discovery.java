package com.isobolt.generator.reconcile;

import java.util.List;

import com.isobolt.generator.model.BoltGeometry;
import com.isobolt.generator.model.asset.Material;

import lombok.Value;

/**
 * Snapshot of the store taken by the pre-check: what exists and what can be derived from it.
 */
@Value
public class Discovery {

    String storeTitle;
    List<BoltGeometry> geometries;
    List<Material> existingArtifacts;
    List<Material> validTemplates;
    List<Material> invalidTemplates;

    public PreCheckSummary summary() {
        return new PreCheckSummary(storeTitle, geometries.size(), existingArtifacts.size(),
                validTemplates.size(), invalidTemplates.size());
    }

    public boolean isReady() {
        return summary().isReady();
    }

    OutcomeCounters newCounters() {
        return new OutcomeCounters(geometries.size(), validTemplates.size(), invalidTemplates.size(),
                existingArtifacts.size());
    }
}
