package com.eyelevel.batchorchestrator.exception;

import java.io.Serial;
import java.util.UUID;

/**
 * The bulk-anchor decision refers to a gate ticket that was never issued, was already answered,
 * or was replaced by a newer evaluation.
 */
public class GateTicketNotFoundException extends BatchProcessingException {
    @Serial
    private static final long serialVersionUID = 6034721165909237001L;

    public GateTicketNotFoundException(UUID ticketId) {
        super("Bulk anchor decision ticket '" + ticketId + "' is unknown or has already been answered.");
    }
}
