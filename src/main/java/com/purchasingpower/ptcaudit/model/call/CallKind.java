package com.purchasingpower.ptcaudit.model.call;

/**
 * Position of a tool call in the execution hierarchy.
 */
public enum CallKind {

    /**
     * Top-level tool invocation issued by the orchestrating agent.
     */
    AGENT,

    /**
     * Pass-through call issued from inside a sandboxed code-execution context,
     * logically a child of an agent call.
     */
    PTC
}
