package com.purchasingpower.ptcaudit.engine;

import com.purchasingpower.ptcaudit.model.call.CallKind;
import com.purchasingpower.ptcaudit.model.call.CallRecord;

/**
 * Strategy deciding whether a call record is an agent call or a pass-through call.
 *
 * <p>Two implementations exist, one per schema generation:
 * <ul>
 *   <li>{@link TypeTagClassifier}: trusts {@code tool_call_results.type}</li>
 *   <li>{@link CallIdPrefixClassifier}: inspects the call-id prefix</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>
 * CallClassifier classifier = CallClassifier.forCapabilities(capabilities, "ptc:");
 * CallKind kind = classifier.classify(record);
 * </pre>
 */
public interface CallClassifier {

    /**
     * @param record raw call record
     * @return derived kind, never null
     */
    CallKind classify(CallRecord record);

    /**
     * Select the classifier for the given schema generation.
     *
     * @param capabilities probed schema capabilities
     * @param ptcPrefix    call-id prefix of pass-through calls
     */
    static CallClassifier forCapabilities(SchemaCapabilities capabilities, String ptcPrefix) {
        CallIdPrefixClassifier prefixClassifier = new CallIdPrefixClassifier(ptcPrefix);
        return capabilities.hasTypeTag()
                ? new TypeTagClassifier(prefixClassifier)
                : prefixClassifier;
    }
}
