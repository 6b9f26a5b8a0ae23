package com.purchasingpower.ptcaudit.model.call;

import lombok.Value;

import java.util.List;

/**
 * An agent call with the pass-through calls attributed to it, in ascending
 * creation-time order.
 */
@Value
public class AttributedCall {

    ClassifiedCall agentCall;
    List<ClassifiedCall> children;

    public AttributedCall(ClassifiedCall agentCall, List<ClassifiedCall> children) {
        this.agentCall = agentCall;
        this.children = List.copyOf(children);
    }

    public String getCallId() {
        return agentCall.getCallId();
    }
}
