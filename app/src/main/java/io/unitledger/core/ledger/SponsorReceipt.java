package io.unitledger.core.ledger;

/**
 * Result of a successful sponsorship.
 *
 * @param receivedUnits units credited, equal to what the sink actually gained
 * @param newBalance    beneficiary's balance of the asset after crediting
 * @param cumulativeSponsored asset's lifetime sponsored total after crediting
 */
public record SponsorReceipt(String sponsor,
                             String beneficiary,
                             String asset,
                             long requestedUnits,
                             long receivedUnits,
                             long newBalance,
                             long cumulativeSponsored,
                             boolean sponsorAssigned) {
}
