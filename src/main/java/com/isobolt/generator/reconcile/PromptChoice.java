package com.isobolt.generator.reconcile;

import lombok.NonNull;
import lombok.Value;

/**
 * The operation picked after the pre-check, with the overwrite toggle for creation.
 */
@Value
public class PromptChoice {

    @NonNull
    PromptAction action;

    boolean overwrite;

    public static PromptChoice create(boolean overwrite) {
        return new PromptChoice(PromptAction.CREATE, overwrite);
    }

    public static PromptChoice delete() {
        return new PromptChoice(PromptAction.DELETE, false);
    }

    public static PromptChoice cancel() {
        return new PromptChoice(PromptAction.CANCEL, false);
    }
}
