package com.isobolt.generator.store;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.isobolt.generator.model.asset.Material;

/**
 * Mutable store of named materials, e.g. the materials of a CAD document.
 *
 * Mutating calls fail with {@link StoreOperationException}; callers are expected to run
 * them inside a {@link TransactionScope}.
 */
public interface ArtifactStore {

    /**
     * Human readable name of the store, used in logs and prompts.
     */
    String getTitle();

    /**
     * Returns all materials whose whole name matches the pattern, in store order.
     */
    List<Material> find(Pattern namePattern);

    Optional<Material> findByName(String name);

    /**
     * Duplicates a template material under a new name and applies the edit to the copy.
     *
     * @return the created material
     */
    Material create(Material template, String name, BumpPatternEdit edit);

    /**
     * Deletes a material together with its appearance asset.
     */
    void delete(Material material);
}
