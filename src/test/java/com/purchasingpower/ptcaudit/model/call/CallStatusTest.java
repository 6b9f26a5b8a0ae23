package com.purchasingpower.ptcaudit.model.call;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Call Status Tests")
class CallStatusTest {

    @Test
    @DisplayName("Strict parse accepts only the exact stored values")
    void fromValue_exactOnly() {
        assertEquals(CallStatus.PENDING, CallStatus.fromValue("pending"));
        assertEquals(CallStatus.EXECUTING, CallStatus.fromValue("executing"));
        assertEquals(CallStatus.COMPLETED, CallStatus.fromValue("completed"));
        assertEquals(CallStatus.FAILED, CallStatus.fromValue("failed"));

        assertEquals(CallStatus.UNKNOWN, CallStatus.fromValue("success"));
        assertEquals(CallStatus.UNKNOWN, CallStatus.fromValue("finish"));
        assertEquals(CallStatus.UNKNOWN, CallStatus.fromValue("COMPLETED"));
        assertEquals(CallStatus.UNKNOWN, CallStatus.fromValue("error"));
        assertEquals(CallStatus.UNKNOWN, CallStatus.fromValue(null));
    }

    @Test
    @DisplayName("Display parse recognises aliases from older rows")
    void forDisplay_parsesAliases() {
        assertEquals(CallStatus.COMPLETED, CallStatus.forDisplay("finish"));
        assertEquals(CallStatus.COMPLETED, CallStatus.forDisplay("success"));
        assertEquals(CallStatus.EXECUTING, CallStatus.forDisplay("running"));
        assertEquals(CallStatus.EXECUTING, CallStatus.forDisplay("in_progress"));
        assertEquals(CallStatus.FAILED, CallStatus.forDisplay("error"));
        assertEquals(CallStatus.UNKNOWN, CallStatus.forDisplay("paused"));
        assertEquals(CallStatus.UNKNOWN, CallStatus.forDisplay(null));
    }

    @Test
    @DisplayName("Call record exposes the raw value and its strict parse")
    void callRecord_keepsRawStatus() {
        CallRecord record = CallRecordFixtures.agent("a1", 0).status("success").build();

        assertEquals("success", record.getStatus());
        assertEquals(CallStatus.UNKNOWN, record.getCallStatus());
    }
}
