package com.isobolt.generator.reconcile;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.isobolt.generator.model.asset.Material;
import com.isobolt.generator.store.ArtifactStore;
import com.isobolt.generator.store.BumpPatternEdit;
import com.isobolt.generator.store.StoreOperationException;

/**
 * Store decorator that fails create or delete for selected material names.
 */
class FaultyArtifactStore implements ArtifactStore {

    private final ArtifactStore delegate;
    private final Set<String> failingCreates = new HashSet<>();
    private final Set<String> failingDeletes = new HashSet<>();

    FaultyArtifactStore(ArtifactStore delegate) {
        this.delegate = delegate;
    }

    FaultyArtifactStore failCreate(String name) {
        failingCreates.add(name);
        return this;
    }

    FaultyArtifactStore failDelete(String name) {
        failingDeletes.add(name);
        return this;
    }

    @Override
    public String getTitle() {
        return delegate.getTitle();
    }

    @Override
    public List<Material> find(Pattern namePattern) {
        return delegate.find(namePattern);
    }

    @Override
    public Optional<Material> findByName(String name) {
        return delegate.findByName(name);
    }

    @Override
    public Material create(Material template, String name, BumpPatternEdit edit) {
        if (failingCreates.contains(name)) {
            throw new StoreOperationException("Injected failure creating \"" + name + "\"");
        }
        return delegate.create(template, name, edit);
    }

    @Override
    public void delete(Material material) {
        if (failingDeletes.contains(material.getName())) {
            throw new StoreOperationException("Injected failure deleting \"" + material.getName() + "\"");
        }
        delegate.delete(material);
    }
}
