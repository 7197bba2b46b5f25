package io.unitledger.core.sink;

/**
 * Undo token for one asset movement that has not been settled yet.
 * Reverting plays the role of a host-level revert of the enclosing call.
 */
@FunctionalInterface
public interface TransferHandle {
    TransferHandle NONE = () -> {};

    void revert();
}
