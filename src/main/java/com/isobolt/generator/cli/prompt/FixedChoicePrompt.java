package com.isobolt.generator.cli.prompt;

import com.isobolt.generator.reconcile.InteractionPrompt;
import com.isobolt.generator.reconcile.PreCheckSummary;
import com.isobolt.generator.reconcile.PromptChoice;

/**
 * Answers with a choice made up front, e.g. from command line options.
 */
public class FixedChoicePrompt implements InteractionPrompt {

    private final PromptChoice choice;

    public FixedChoicePrompt(PromptChoice choice) {
        this.choice = choice;
    }

    @Override
    public PromptChoice choose(PreCheckSummary summary) {
        return choice;
    }
}
