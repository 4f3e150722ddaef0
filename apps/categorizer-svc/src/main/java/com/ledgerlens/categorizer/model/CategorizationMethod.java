package com.ledgerlens.categorizer.model;

public enum CategorizationMethod {
    RULE(0.9d),
    ML(0.0d),
    MANUAL(1.0d),
    SIMILARITY(0.8d);

    private final double defaultConfidence;

    CategorizationMethod(double defaultConfidence) {
        this.defaultConfidence = defaultConfidence;
    }

    /**
     * Confidence recorded for transactions categorized this way. ML predictions carry their own score.
     */
    public double defaultConfidence() {
        return defaultConfidence;
    }
}
