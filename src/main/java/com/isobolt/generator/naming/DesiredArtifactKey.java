package com.isobolt.generator.naming;

import lombok.NonNull;
import lombok.Value;

/**
 * Identity of a derived thread material: the template category and the nominal diameter.
 */
@Value
public class DesiredArtifactKey {

    @NonNull
    String category;

    int diameter;
}
