package io.unitledger.core.ledger;

import io.unitledger.core.audit.LedgerEvent;
import io.unitledger.core.protocol.Address;
import io.unitledger.core.protocol.LedgerError;
import io.unitledger.core.protocol.LedgerException;
import io.unitledger.core.state.StateBatch;
import io.unitledger.core.state.StateStore;

import java.util.Optional;

/**
 * Two-step ownership: the owner nominates a successor, the successor accepts.
 * Owner and pending owner live in the state store's meta entries so they survive restarts.
 *
 * Staging methods only validate and write into the supplied batch; {@link LedgerCore}
 * commits them.
 */
public final class AdminControl {
    private final StateStore state;

    public AdminControl(StateStore state) {
        this.state = state;
    }

    public Optional<String> owner() {
        return state.getMeta(StateStore.META_OWNER);
    }

    public Optional<String> pendingOwner() {
        return state.getMeta(StateStore.META_PENDING_OWNER);
    }

    public void requireOwner(String caller) {
        Optional<String> owner = owner();
        if (caller == null || owner.isEmpty() || !owner.get().equals(caller)) {
            throw new LedgerException(LedgerError.UNAUTHORIZED_CALLER, "Caller " + caller + " is not the owner");
        }
    }

    /** Seed the first owner; a no-op when one is already recorded. */
    Optional<LedgerEvent> stageBootstrap(String initialOwner, StateBatch batch) {
        if (owner().isPresent()) {
            return Optional.empty();
        }
        Address.require(initialOwner, "owner");
        batch.putMeta(StateStore.META_OWNER, initialOwner);
        return Optional.of(new LedgerEvent.OwnershipTransferred(null, initialOwner));
    }

    LedgerEvent stageTransfer(String caller, String newOwner, StateBatch batch) {
        requireOwner(caller);
        Address.require(newOwner, "new owner");
        batch.putMeta(StateStore.META_PENDING_OWNER, newOwner);
        return new LedgerEvent.OwnershipTransferStarted(caller, newOwner);
    }

    LedgerEvent stageAccept(String caller, StateBatch batch) {
        Optional<String> pending = pendingOwner();
        if (caller == null || pending.isEmpty() || !pending.get().equals(caller)) {
            throw new LedgerException(LedgerError.UNAUTHORIZED_CALLER, "Caller " + caller + " is not the pending owner");
        }
        String previous = owner().orElse(null);
        batch.putMeta(StateStore.META_OWNER, caller);
        batch.deleteMeta(StateStore.META_PENDING_OWNER);
        return new LedgerEvent.OwnershipTransferred(previous, caller);
    }
}
