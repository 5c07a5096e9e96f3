package uk.gegc.reelstudio.features.billing.domain.model;

public enum TokenTransactionType {
    PURCHASE,
    BONUS,
    RESERVE,
    CONSUME,
    RELEASE;

    public boolean isFunding() {
        return this == PURCHASE || this == BONUS;
    }
}
