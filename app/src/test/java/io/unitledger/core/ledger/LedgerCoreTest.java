package io.unitledger.core.ledger;

import io.unitledger.core.audit.AuditEntry;
import io.unitledger.core.audit.InMemoryAuditLog;
import io.unitledger.core.audit.LedgerEvent;
import io.unitledger.core.protocol.LedgerError;
import io.unitledger.core.protocol.LedgerException;
import io.unitledger.core.registry.AssetListing;
import io.unitledger.core.registry.InMemoryEligibilityRegistry;
import io.unitledger.core.sink.SimulatedAssetBank;
import io.unitledger.core.sink.SinkBalanceMeasurer;
import io.unitledger.core.state.InMemoryStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class LedgerCoreTest {
    private static final String OWNER = "owner-1";
    private static final String ENGINE = "engine-1";
    private static final String SINK = "sink:dead";
    private static final String S = "sponsor-1";
    private static final String S2 = "sponsor-2";
    private static final String B = "user-b";
    private static final String A = "asset:a1";
    private static final String A2 = "asset:a2";
    private static final String CAPPED = "asset:capped";
    private static final String FEE = "asset:fee";
    private static final String DISABLED = "asset:off";

    private InMemoryStateStore state;
    private InMemoryEligibilityRegistry registry;
    private SimulatedAssetBank bank;
    private InMemoryAuditLog audit;
    private LedgerCore ledger;

    @BeforeEach
    void setUp() {
        state = new InMemoryStateStore();
        registry = new InMemoryEligibilityRegistry()
                .put(A, AssetListing.enabled(6, 1_000_000L))
                .put(A2, AssetListing.enabled(18, 1L))
                .put(CAPPED, AssetListing.enabled(0, 1L).withCap(1_000L))
                .put(FEE, AssetListing.enabled(0, 1L))
                .put(DISABLED, AssetListing.enabled(0, 1L).withEnabled(false));
        bank = new SimulatedAssetBank(SINK);
        bank.setTransferFeeBps(FEE, 100);
        audit = new InMemoryAuditLog();
        ledger = new LedgerCore(state, registry, new SinkBalanceMeasurer(bank, bank), audit);
        ledger.bootstrapOwner(OWNER);
        ledger.setConsumingEngine(OWNER, ENGINE);
        for (String asset : List.of(A, A2, CAPPED, FEE, DISABLED)) {
            bank.mint(S, asset, 10_000L);
            bank.mint(S2, asset, 10_000L);
        }
    }

    @Test
    void firstSponsorshipCreditsAndAssignsSponsor() {
        SponsorReceipt receipt = ledger.sponsor(S, B, A, 100L);

        assertEquals(100L, receipt.receivedUnits());
        assertEquals(100L, receipt.newBalance());
        assertTrue(receipt.sponsorAssigned());
        assertEquals(100L, ledger.balanceOf(B, A));
        assertEquals(1L, ledger.activeAssetCount(B));
        assertEquals(S, ledger.sponsorOf(B).orElseThrow());
        assertEquals(100L, ledger.lifetimeAllocatedUnits(B));
        assertEquals(9_900L, bank.holdingOf(S, A));
        assertInvariants(B);
    }

    @Test
    void secondSponsorIsLockedOut() {
        ledger.sponsor(S, B, A, 100L);
        long auditBefore = audit.nextSequence();

        assertLedgerError(LedgerError.SPONSOR_LOCKED, () -> ledger.sponsor(S2, B, A, 10L));

        assertEquals(100L, ledger.balanceOf(B, A));
        assertEquals(S, ledger.sponsorOf(B).orElseThrow());
        assertEquals(10_000L, bank.holdingOf(S2, A));
        assertEquals(auditBefore, audit.nextSequence());
        assertInvariants(B);
    }

    @Test
    void sameSponsorCanTopUpAnotherAsset() {
        ledger.sponsor(S, B, A, 100L);
        SponsorReceipt receipt = ledger.sponsor(S, B, A2, 40L);

        assertFalse(receipt.sponsorAssigned());
        assertEquals(2L, ledger.activeAssetCount(B));
        assertEquals(Map.of(A, 100L, A2, 40L), ledger.balancesOf(B));
        assertInvariants(B);
    }

    @Test
    void engineConsumesDownToZero() {
        ledger.sponsor(S, B, A, 100L);

        assertEquals(0L, ledger.consume(ENGINE, B, A, 100L));
        assertEquals(0L, ledger.balanceOf(B, A));
        assertEquals(0L, ledger.activeAssetCount(B));

        assertLedgerError(LedgerError.INSUFFICIENT_BALANCE, () -> ledger.consume(ENGINE, B, A, 1L));
        assertInvariants(B);
    }

    @Test
    void partialConsumeKeepsAssetActive() {
        ledger.sponsor(S, B, A, 100L);

        assertEquals(60L, ledger.consume(ENGINE, B, A, 40L));
        assertEquals(1L, ledger.activeAssetCount(B));
        assertInvariants(B);
    }

    @Test
    void emptyBeneficiaryCanReleaseSponsor() {
        ledger.sponsor(S, B, A, 100L);
        ledger.consume(ENGINE, B, A, 100L);

        assertEquals(S, ledger.clearSponsorIfEmpty(B));
        assertTrue(ledger.sponsorOf(B).isEmpty());
        assertInvariants(B);
    }

    @Test
    void partialForfeitKeepsSponsor() {
        ledger.sponsor(S, B, A, 50L);
        ledger.sponsor(S, B, A2, 30L);

        ForfeitSummary summary = ledger.clearSponsorAndForfeit(B, List.of(A));

        assertEquals(0L, ledger.balanceOf(B, A));
        assertEquals(30L, ledger.balanceOf(B, A2));
        assertEquals(1L, ledger.activeAssetCount(B));
        assertEquals(S, ledger.sponsorOf(B).orElseThrow());
        assertEquals(1, summary.assetsCleared());
        assertEquals(50L, summary.totalForfeited());
        assertFalse(summary.sponsorCleared());
        assertInvariants(B);

        ForfeitSummary second = ledger.clearSponsorAndForfeit(B, List.of(A2));

        assertEquals(0L, ledger.balanceOf(B, A2));
        assertEquals(0L, ledger.activeAssetCount(B));
        assertTrue(ledger.sponsorOf(B).isEmpty());
        assertTrue(second.sponsorCleared());
        assertEquals(30L, second.totalForfeited());
        assertInvariants(B);
    }

    @Test
    void forfeitSkipsZeroAndRepeatedAssets() {
        ledger.sponsor(S, B, A, 50L);

        ForfeitSummary summary = ledger.clearSponsorAndForfeit(B, Arrays.asList(A2, A, A, CAPPED));

        assertEquals(Map.of(A, 50L), summary.forfeited());
        assertEquals(50L, summary.totalForfeited());
        assertTrue(summary.sponsorCleared());
        assertInvariants(B);
    }

    @Test
    void forfeitEmitsEventsInOrder() {
        ledger.sponsor(S, B, A, 50L);
        long from = audit.nextSequence();

        ledger.clearSponsorAndForfeit(B, List.of(A));

        List<AuditEntry> entries = audit.entriesSince(from);
        assertEquals(3, entries.size());
        assertInstanceOf(LedgerEvent.Forfeited.class, entries.get(0).event());
        assertInstanceOf(LedgerEvent.SponsorCleared.class, entries.get(1).event());
        LedgerEvent.SponsorClearedWithForfeit last = assertInstanceOf(LedgerEvent.SponsorClearedWithForfeit.class, entries.get(2).event());
        assertEquals(1, last.assetsCleared());
        assertTrue(last.sponsorCleared());
    }

    @Test
    void forfeitWithNothingPositiveIsRejected() {
        ledger.sponsor(S, B, A, 50L);

        assertLedgerError(LedgerError.NOTHING_TO_FORFEIT, () -> ledger.clearSponsorAndForfeit(B, List.of(A2)));
        assertLedgerError(LedgerError.NOTHING_TO_FORFEIT, () -> ledger.clearSponsorAndForfeit(B, List.of()));
        assertLedgerError(LedgerError.INVALID_ADDRESS, () -> ledger.clearSponsorAndForfeit(B, List.of(A, "bad address")));
        assertEquals(50L, ledger.balanceOf(B, A));
    }

    @Test
    void clearIfEmptyRejectsHeldBalancesAndMissingSponsor() {
        assertLedgerError(LedgerError.NOTHING_TO_FORFEIT, () -> ledger.clearSponsorIfEmpty(B));

        ledger.sponsor(S, B, A, 50L);
        assertLedgerError(LedgerError.NOT_EMPTY, () -> ledger.clearSponsorIfEmpty(B));
        assertEquals(S, ledger.sponsorOf(B).orElseThrow());
    }

    @Test
    void lockLiftsOnceBalancesReachZero() {
        ledger.sponsor(S, B, A, 100L);
        ledger.consume(ENGINE, B, A, 100L);

        SponsorReceipt receipt = ledger.sponsor(S2, B, A, 10L);

        assertTrue(receipt.sponsorAssigned());
        assertEquals(S2, ledger.sponsorOf(B).orElseThrow());
        assertInvariants(B);
    }

    @Test
    void feeOnTransferCreditsOnlyWhatArrived() {
        SponsorReceipt receipt = ledger.sponsor(S, B, FEE, 10_000L);

        assertEquals(10_000L, receipt.requestedUnits());
        assertEquals(9_900L, receipt.receivedUnits());
        assertEquals(9_900L, ledger.balanceOf(B, FEE));
        assertEquals(9_900L, ledger.cumulativeSponsoredUnits(FEE));
        assertEquals(9_900L, bank.balanceOf(FEE));
        assertInvariants(B);
    }

    @Test
    void zeroReceiptIsRejectedAndTransferReverted() {
        bank.setTransferFeeBps(FEE, 10_000);

        assertLedgerError(LedgerError.ZERO_RECEIVED, () -> ledger.sponsor(S, B, FEE, 500L));

        assertEquals(10_000L, bank.holdingOf(S, FEE));
        assertEquals(0L, ledger.balanceOf(B, FEE));
        assertTrue(ledger.sponsorOf(B).isEmpty());
    }

    @Test
    void zeroReceiptAtFullCapReportsZeroReceived() {
        registry.put(FEE, AssetListing.enabled(0, 1L).withCap(495L));
        ledger.sponsor(S, B, FEE, 500L);
        assertEquals(495L, ledger.cumulativeSponsoredUnits(FEE));
        bank.setTransferFeeBps(FEE, 10_000);

        assertLedgerError(LedgerError.ZERO_RECEIVED, () -> ledger.sponsor(S, B, FEE, 10L));

        assertEquals(495L, ledger.cumulativeSponsoredUnits(FEE));
        assertEquals(9_500L, bank.holdingOf(S, FEE));
        assertInvariants(B);
    }

    @Test
    void capBoundaryIsInclusive() {
        ledger.sponsor(S, B, CAPPED, 600L);
        ledger.sponsor(S, B, CAPPED, 400L);
        assertEquals(1_000L, ledger.cumulativeSponsoredUnits(CAPPED));

        assertLedgerError(LedgerError.CAP_EXCEEDED, () -> ledger.sponsor(S, "user-c", CAPPED, 1L));
        assertEquals(1_000L, ledger.cumulativeSponsoredUnits(CAPPED));
    }

    @Test
    void capOverflowRevertsTransfer() {
        ledger.sponsor(S, B, CAPPED, 600L);

        assertLedgerError(LedgerError.CAP_EXCEEDED, () -> ledger.sponsor(S, B, CAPPED, 401L));

        assertEquals(600L, ledger.cumulativeSponsoredUnits(CAPPED));
        assertEquals(600L, ledger.balanceOf(B, CAPPED));
        assertEquals(9_400L, bank.holdingOf(S, CAPPED));
        assertEquals(600L, bank.balanceOf(CAPPED));
    }

    @Test
    void rejectsSelfSponsorshipAndBadInputs() {
        assertLedgerError(LedgerError.SELF_SPONSORSHIP_FORBIDDEN, () -> ledger.sponsor(S, S, A, 10L));
        assertLedgerError(LedgerError.INVALID_AMOUNT, () -> ledger.sponsor(S, B, A, 0L));
        assertLedgerError(LedgerError.INVALID_AMOUNT, () -> ledger.sponsor(S, B, A, -5L));
        assertLedgerError(LedgerError.INVALID_ADDRESS, () -> ledger.sponsor(S, "", A, 10L));
        assertLedgerError(LedgerError.INVALID_ADDRESS, () -> ledger.sponsor(null, B, A, 10L));
        assertLedgerError(LedgerError.ASSET_NOT_ELIGIBLE, () -> ledger.sponsor(S, B, "asset:unknown", 10L));
        assertLedgerError(LedgerError.ASSET_NOT_ELIGIBLE, () -> ledger.sponsor(S, B, DISABLED, 10L));
        assertTrue(ledger.sponsorOf(B).isEmpty());
        assertEquals(0L, bank.balanceOf(A));
    }

    @Test
    void underfundedSponsorFailsTransfer() {
        assertLedgerError(LedgerError.TRANSFER_FAILED, () -> ledger.sponsor(S, B, A, 10_001L));
        assertEquals(10_000L, bank.holdingOf(S, A));
        assertTrue(ledger.sponsorOf(B).isEmpty());
    }

    @Test
    void onlyEngineMayConsume() {
        ledger.sponsor(S, B, A, 100L);

        assertLedgerError(LedgerError.UNAUTHORIZED_CALLER, () -> ledger.consume(S, B, A, 10L));
        assertLedgerError(LedgerError.UNAUTHORIZED_CALLER, () -> ledger.consume(null, B, A, 10L));
        assertLedgerError(LedgerError.INVALID_AMOUNT, () -> ledger.consume(ENGINE, B, A, 0L));
        assertEquals(100L, ledger.balanceOf(B, A));
    }

    @Test
    void consumeWithoutConfiguredEngineIsUnauthorized() {
        LedgerCore bare = new LedgerCore(new InMemoryStateStore(), registry, new SinkBalanceMeasurer(bank, bank), new InMemoryAuditLog());
        assertLedgerError(LedgerError.UNAUTHORIZED_CALLER, () -> bare.consume(ENGINE, B, A, 1L));
    }

    @Test
    void nestedSponsorForSameBeneficiaryIsRejected() {
        AtomicBoolean fired = new AtomicBoolean();
        bank.setHook((from, to, asset, amount) -> {
            if (fired.compareAndSet(false, true)) {
                ledger.sponsor(S, B, A2, 5L);
            }
        });

        assertLedgerError(LedgerError.REENTRANT_CALL, () -> ledger.sponsor(S, B, A, 100L));

        assertEquals(10_000L, bank.holdingOf(S, A));
        assertEquals(10_000L, bank.holdingOf(S, A2));
        assertTrue(ledger.balancesOf(B).isEmpty());
        assertTrue(ledger.sponsorOf(B).isEmpty());
    }

    @Test
    void nestedSponsorOfSameAssetIsRejected() {
        AtomicBoolean fired = new AtomicBoolean();
        bank.setHook((from, to, asset, amount) -> {
            if (fired.compareAndSet(false, true)) {
                ledger.sponsor(S2, "user-c", A, 5L);
            }
        });

        assertLedgerError(LedgerError.REENTRANT_CALL, () -> ledger.sponsor(S, B, A, 100L));
        assertEquals(0L, bank.balanceOf(A));
        assertEquals(0L, ledger.cumulativeSponsoredUnits(A));
    }

    @Test
    void guardIsReleasedAfterFailure() {
        assertLedgerError(LedgerError.TRANSFER_FAILED, () -> ledger.sponsor(S, B, A, 50_000L));

        assertEquals(100L, ledger.sponsor(S, B, A, 100L).newBalance());
    }

    @Test
    void ownershipMovesInTwoSteps() {
        String next = "owner-2";
        ledger.transferOwnership(OWNER, next);
        assertEquals(next, ledger.pendingOwner().orElseThrow());
        assertEquals(OWNER, ledger.owner().orElseThrow());

        assertLedgerError(LedgerError.UNAUTHORIZED_CALLER, () -> ledger.setConsumingEngine(next, "engine-2"));
        assertLedgerError(LedgerError.UNAUTHORIZED_CALLER, () -> ledger.acceptOwnership("stranger"));

        ledger.acceptOwnership(next);
        assertEquals(next, ledger.owner().orElseThrow());
        assertTrue(ledger.pendingOwner().isEmpty());

        assertLedgerError(LedgerError.UNAUTHORIZED_CALLER, () -> ledger.setConsumingEngine(OWNER, "engine-2"));
        ledger.setConsumingEngine(next, "engine-2");
        assertEquals("engine-2", ledger.consumingEngine().orElseThrow());
    }

    @Test
    void engineChangesAreOwnerOnly() {
        assertLedgerError(LedgerError.UNAUTHORIZED_CALLER, () -> ledger.setConsumingEngine(S, "engine-x"));
        assertLedgerError(LedgerError.INVALID_ADDRESS, () -> ledger.setConsumingEngine(OWNER, "bad engine"));
        assertEquals(ENGINE, ledger.consumingEngine().orElseThrow());

        ledger.sponsor(S, B, A, 10L);
        ledger.setConsumingEngine(OWNER, "engine-2");
        assertLedgerError(LedgerError.UNAUTHORIZED_CALLER, () -> ledger.consume(ENGINE, B, A, 1L));
        assertEquals(9L, ledger.consume("engine-2", B, A, 1L));
    }

    @Test
    void bootstrapOwnerIsOneShot() {
        ledger.bootstrapOwner("someone-else");
        assertEquals(OWNER, ledger.owner().orElseThrow());
    }

    @Test
    void failedAuditAppendLeavesSponsorUntouched() {
        FailingAuditLog failing = new FailingAuditLog();
        ledger = new LedgerCore(state, registry, new SinkBalanceMeasurer(bank, bank), failing);
        failing.fail.set(true);

        assertThrows(UncheckedIOException.class, () -> ledger.sponsor(S, B, A, 100L));

        assertEquals(0L, ledger.balanceOf(B, A));
        assertEquals(0L, ledger.cumulativeSponsoredUnits(A));
        assertEquals(0L, ledger.activeAssetCount(B));
        assertEquals(0L, ledger.lifetimeAllocatedUnits(B));
        assertTrue(ledger.sponsorOf(B).isEmpty());
        assertEquals(0L, bank.balanceOf(A));
        assertEquals(10_000L, bank.holdingOf(S, A));
        assertEquals(0L, failing.nextSequence());
        assertInvariants(B);
    }

    @Test
    void failedAuditAppendLeavesConsumeAndForfeitUntouched() {
        FailingAuditLog failing = new FailingAuditLog();
        ledger = new LedgerCore(state, registry, new SinkBalanceMeasurer(bank, bank), failing);
        ledger.sponsor(S, B, A, 100L);
        long appended = failing.nextSequence();
        failing.fail.set(true);

        assertThrows(UncheckedIOException.class, () -> ledger.consume(ENGINE, B, A, 100L));
        assertThrows(UncheckedIOException.class, () -> ledger.clearSponsorAndForfeit(B, List.of(A)));

        assertEquals(100L, ledger.balanceOf(B, A));
        assertEquals(1L, ledger.activeAssetCount(B));
        assertEquals(S, ledger.sponsorOf(B).orElseThrow());
        assertEquals(appended, failing.nextSequence());
        assertInvariants(B);
    }

    private static final class FailingAuditLog extends InMemoryAuditLog {
        final AtomicBoolean fail = new AtomicBoolean();

        @Override
        protected void persist(List<AuditEntry> appended) {
            if (fail.get()) {
                throw new UncheckedIOException(new IOException("disk full"));
            }
        }
    }

    private void assertInvariants(String beneficiary) {
        Map<String, Long> balances = ledger.balancesOf(beneficiary);
        assertEquals(balances.size(), ledger.activeAssetCount(beneficiary), "active count matches positive balances");
        if (ledger.activeAssetCount(beneficiary) > 0) {
            assertTrue(ledger.sponsorOf(beneficiary).isPresent(), "holder of a positive balance has a sponsor");
        }
        for (String asset : List.of(A, A2, CAPPED, FEE)) {
            assertEquals(bank.balanceOf(asset), ledger.cumulativeSponsoredUnits(asset), "sink holds everything credited for " + asset);
        }
    }

    private static void assertLedgerError(LedgerError expected, Executable action) {
        LedgerException ex = assertThrows(LedgerException.class, action);
        assertEquals(expected, ex.error());
    }
}
