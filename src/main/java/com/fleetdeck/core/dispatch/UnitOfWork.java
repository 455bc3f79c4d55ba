package com.fleetdeck.core.dispatch;

/**
 * What the dispatcher runs against each reachable node.
 *
 * <p>Implementations should throw {@link ConnectionException} for transport
 * problems and {@link CommandException} when the node answered but the work
 * failed. They should honour thread interruption; the dispatcher interrupts
 * work that exceeds its timeout.
 *
 * @param <T> per-node result type
 */
@FunctionalInterface
public interface UnitOfWork<T> {
    T execute(WorkContext context);
}
