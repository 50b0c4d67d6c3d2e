package com.isobolt.generator.model.asset;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A rendering material as held by an artifact store.
 *
 * {@code documentId} identifies the owning store; a material without one is detached
 * and cannot serve as a thread template.
 */
@Value
@Builder(toBuilder = true)
public class Material {

    @NonNull
    String name;

    String documentId;

    String manufacturer;

    String description;

    String comments;

    String url;

    Asset appearance;

    public boolean hasAppearance() {
        return appearance != null;
    }
}
