package com.purchasingpower.ptcaudit.model.call;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * A {@link CallRecord} together with the kind the classifier derived for it.
 */
@Value
public class ClassifiedCall {

    CallRecord record;
    CallKind kind;

    public String getCallId() {
        return record.getCallId();
    }

    public LocalDateTime getCreatedAt() {
        return record.getCreatedAt();
    }

    public boolean isPtc() {
        return kind == CallKind.PTC;
    }
}
