package com.purchasingpower.ptcaudit.engine;

import com.purchasingpower.ptcaudit.model.call.CallKind;
import com.purchasingpower.ptcaudit.model.call.CallRecord;
import lombok.RequiredArgsConstructor;

/**
 * Classifier for stores with the {@code type} column. A row whose tag is
 * blank was written before the column was populated and goes through the
 * prefix rule instead.
 */
@RequiredArgsConstructor
public class TypeTagClassifier implements CallClassifier {

    static final String PTC_TAG = "ptc";

    private final CallClassifier untaggedFallback;

    @Override
    public CallKind classify(CallRecord record) {
        String tag = record.getTypeTag();
        if (tag == null || tag.isBlank()) {
            return untaggedFallback.classify(record);
        }
        return PTC_TAG.equals(tag) ? CallKind.PTC : CallKind.AGENT;
    }
}
