package com.xammer.tagops.domain;

/**
 * Workflow lifecycle. PENDING is the only initial state; REJECTED, COMPLETED and CANCELLED are terminal.
 * APPROVED is kept for compatibility with stored data but is never written: approval and tag
 * application happen in one step that lands directly on COMPLETED.
 */
public enum WorkflowStatus {
    PENDING,
    APPROVED,
    REJECTED,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == REJECTED || this == COMPLETED || this == CANCELLED;
    }
}
