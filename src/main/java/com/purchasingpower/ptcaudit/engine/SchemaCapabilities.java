package com.purchasingpower.ptcaudit.engine;

/**
 * Optional tool-call columns available in the store.
 *
 * <p>Both flags are false on databases created before the pass-through
 * migration; that is a supported state, not an error.
 *
 * @param hasTypeTag   {@code tool_call_results.type} exists
 * @param hasParentRef {@code tool_call_results.ptc_call_id} exists
 */
public record SchemaCapabilities(boolean hasTypeTag, boolean hasParentRef) {

    public static SchemaCapabilities legacy() {
        return new SchemaCapabilities(false, false);
    }

    public static SchemaCapabilities current() {
        return new SchemaCapabilities(true, true);
    }

    /**
     * @return true when both optional columns can be selected
     */
    public boolean isComplete() {
        return hasTypeTag && hasParentRef;
    }
}
