package com.purchasingpower.ptcaudit.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@DisplayName("Payload Text Tests")
class PayloadTextTest {

    @Test
    @DisplayName("Code is taken from a nested input object first, then from code or input fields")
    void codeOf_prefersNestedCode() {
        assertEquals("print(2)", PayloadText.codeOf("{\"input\":\"{\\\"code\\\":\\\"print(2)\\\"}\",\"code\":\"ignored\"}"));
        assertEquals("print(1)", PayloadText.codeOf("{\"code\":\"print(1)\"}"));
        assertEquals("ls -la", PayloadText.codeOf("{\"input\":\"ls -la\"}"));
        assertEquals("{\"script\":\"x\"}", PayloadText.codeOf("{\"script\":\"x\"}"));
        assertEquals("plain text", PayloadText.codeOf("plain text"));
        assertEquals("", PayloadText.codeOf(null));
    }

    @Test
    @DisplayName("Language is read only from a JSON input")
    void languageOf() {
        assertEquals("python", PayloadText.languageOf("{\"code\":\"x\",\"language\":\"python\"}"));
        assertNull(PayloadText.languageOf("{\"code\":\"x\"}"));
        assertNull(PayloadText.languageOf("python"));
    }

    @Test
    @DisplayName("Summary prefers well-known keys, then any short string value")
    void ptcSummary() {
        assertEquals("(AAPL)", PayloadText.ptcSummary("{\"name\":\"Apple\",\"ticker\":\"AAPL\"}"));
        assertEquals("(rust async)", PayloadText.ptcSummary("{\"input\":{\"keywords\":\"rust async\"}}"));
        assertEquals("(en)", PayloadText.ptcSummary("{\"limit\":5,\"lang\":\"en\"}"));
        assertEquals("", PayloadText.ptcSummary("{\"limit\":5,\"body\":\"" + "x".repeat(60) + "\"}"));
        assertEquals("", PayloadText.ptcSummary("not json"));
        assertEquals("", PayloadText.ptcSummary(null));
    }

    @Test
    @DisplayName("Sandbox output shows stdout and a non-zero exit code")
    void outputSummary() {
        assertEquals("hello", PayloadText.outputSummary("{\"data\":{\"output\":\"hello\\n\",\"exitCode\":0}}"));
        assertEquals("[exit=1]", PayloadText.outputSummary("{\"exit_code\":1}"));
        assertEquals("{\"data\":{\"price\":42}}", PayloadText.outputSummary("{\"data\":{\"price\":42}}"));
        assertEquals("{\"status\":\"ok\"}", PayloadText.outputSummary("{\"status\":\"ok\"}"));
        assertEquals("raw text", PayloadText.outputSummary("raw text"));
        assertEquals("(empty output)", PayloadText.outputSummary(null));
    }

    @Test
    @DisplayName("Tool call meta needs a tool name")
    void toolCallMeta() {
        PayloadText.ToolCallMeta meta = PayloadText.toolCallMeta("{\"toolName\":\"web_search\",\"status\":\"failed\"}");

        assertEquals("web_search", meta.toolName());
        assertEquals("failed", meta.status());
        assertNull(PayloadText.toolCallMeta("{\"status\":\"failed\"}"));
        assertNull(PayloadText.toolCallMeta(null));
    }
}
