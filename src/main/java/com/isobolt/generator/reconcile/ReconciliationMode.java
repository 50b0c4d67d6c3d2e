package com.isobolt.generator.reconcile;

public enum ReconciliationMode {
    CREATE("Create Thread Materials"),
    DELETE("Delete Thread Materials");

    private final String transactionName;

    ReconciliationMode(String transactionName) {
        this.transactionName = transactionName;
    }

    public String getTransactionName() {
        return transactionName;
    }
}
