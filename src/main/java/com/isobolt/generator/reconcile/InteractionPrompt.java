package com.isobolt.generator.reconcile;

/**
 * Asks the user which operation to perform once the pre-check is done.
 */
public interface InteractionPrompt {

    PromptChoice choose(PreCheckSummary summary);
}
