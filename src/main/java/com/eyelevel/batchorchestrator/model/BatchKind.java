package com.eyelevel.batchorchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The workflows that run through the batch scheduler. A session runs at most one batch per kind.
 */
@Getter
@AllArgsConstructor
public enum BatchKind {
    EMBEDDING("embedding"),
    ANCHORING("anchoring"),
    EXPORT("export");

    private final String value;
}
