package com.isobolt.generator.reconcile;

public enum PromptAction {
    CREATE,
    DELETE,
    CANCEL
}
