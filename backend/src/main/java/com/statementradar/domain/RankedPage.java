package com.statementradar.domain;

/**
 * A page together with its winning classification.
 */
public record RankedPage(Page page, ClassificationScore classification) {

    public int pageNum() {
        return page.pageNum();
    }

    public boolean classified() {
        return classification.classified();
    }

    public StatementType statementType() {
        return classification.statementType();
    }

    public double score() {
        return classification.score();
    }

    public double confidence() {
        return classification.confidence();
    }
}
