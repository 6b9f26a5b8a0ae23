package com.purchasingpower.ptcaudit.engine;

import com.purchasingpower.ptcaudit.model.call.CallKind;
import com.purchasingpower.ptcaudit.model.call.CallRecord;
import lombok.RequiredArgsConstructor;

/**
 * Classifier for data written before the {@code type} column existed:
 * pass-through call ids carry a reserved prefix.
 */
@RequiredArgsConstructor
public class CallIdPrefixClassifier implements CallClassifier {

    private final String ptcPrefix;

    @Override
    public CallKind classify(CallRecord record) {
        String callId = record.getCallId();
        return callId != null && callId.startsWith(ptcPrefix) ? CallKind.PTC : CallKind.AGENT;
    }
}
