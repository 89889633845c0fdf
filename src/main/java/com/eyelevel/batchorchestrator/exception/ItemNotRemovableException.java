package com.eyelevel.batchorchestrator.exception;

import java.io.Serial;

/**
 * Only pending items of an idle embedding queue can be removed.
 */
public class ItemNotRemovableException extends BatchProcessingException {
    @Serial
    private static final long serialVersionUID = -6120574471820953315L;

    public ItemNotRemovableException(String itemId) {
        super(String.format("Item '%s' is not pending and cannot be removed.", itemId));
    }
}
