package io.unitledger.core.audit;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Append-only audit records. They describe what happened; they are never queried
 * as state, except when an in-memory ledger is rebuilt from its log.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LedgerEvent.EngineConfigured.class, name = "engine_configured"),
        @JsonSubTypes.Type(value = LedgerEvent.Sponsored.class, name = "sponsored"),
        @JsonSubTypes.Type(value = LedgerEvent.SponsoredReceived.class, name = "sponsored_received"),
        @JsonSubTypes.Type(value = LedgerEvent.Consumed.class, name = "consumed"),
        @JsonSubTypes.Type(value = LedgerEvent.Forfeited.class, name = "forfeited"),
        @JsonSubTypes.Type(value = LedgerEvent.SponsorCleared.class, name = "sponsor_cleared"),
        @JsonSubTypes.Type(value = LedgerEvent.SponsorClearedWithForfeit.class, name = "sponsor_cleared_with_forfeit"),
        @JsonSubTypes.Type(value = LedgerEvent.OwnershipTransferStarted.class, name = "ownership_transfer_started"),
        @JsonSubTypes.Type(value = LedgerEvent.OwnershipTransferred.class, name = "ownership_transferred")
})
public interface LedgerEvent {

    /** Address the event is about, used for filtering; may be null for configuration events. */
    String subject();

    record EngineConfigured(String previousEngine, String engine) implements LedgerEvent {
        @Override public String subject() { return engine; }
    }

    record Sponsored(String sponsor, String beneficiary, String asset, long requestedUnits, long newBalance) implements LedgerEvent {
        @Override public String subject() { return beneficiary; }
    }

    record SponsoredReceived(String sponsor, String beneficiary, String asset, long requestedUnits, long receivedUnits) implements LedgerEvent {
        @Override public String subject() { return beneficiary; }
    }

    record Consumed(String engine, String beneficiary, String asset, long units, long remaining) implements LedgerEvent {
        @Override public String subject() { return beneficiary; }
    }

    record Forfeited(String beneficiary, String asset, long units) implements LedgerEvent {
        @Override public String subject() { return beneficiary; }
    }

    record SponsorCleared(String beneficiary, String previousSponsor) implements LedgerEvent {
        @Override public String subject() { return beneficiary; }
    }

    record SponsorClearedWithForfeit(String beneficiary, int assetsCleared, long totalForfeited, boolean sponsorCleared) implements LedgerEvent {
        @Override public String subject() { return beneficiary; }
    }

    record OwnershipTransferStarted(String owner, String pendingOwner) implements LedgerEvent {
        @Override public String subject() { return pendingOwner; }
    }

    record OwnershipTransferred(String previousOwner, String newOwner) implements LedgerEvent {
        @Override public String subject() { return newOwner; }
    }
}
