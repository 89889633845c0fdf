package com.eyelevel.batchorchestrator.model;

/**
 * Contract for the finite state machine of a {@link WorkItem}.
 *
 * @param <S> the concrete status enum
 */
public interface ItemStatus<S extends Enum<S> & ItemStatus<S>> {

    /**
     * @return {@code true} once no further transition is allowed within a batch run.
     */
    boolean isTerminal();

    /**
     * @return {@code true} if this status is the failure terminal of the machine.
     */
    boolean isFailure();

    /**
     * Forward-only transition check. Nothing ever goes back to the initial status.
     */
    boolean canTransitionTo(S next);

    /**
     * @return the lowercase wire value shown to clients.
     */
    String getValue();
}
