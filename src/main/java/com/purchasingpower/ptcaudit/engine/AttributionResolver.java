package com.purchasingpower.ptcaudit.engine;

import com.purchasingpower.ptcaudit.model.call.AttributedCall;
import com.purchasingpower.ptcaudit.model.call.CallTree;
import com.purchasingpower.ptcaudit.model.call.ChildCallIndex;
import com.purchasingpower.ptcaudit.model.call.ClassifiedCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the call hierarchy of a run from its flat, classified call log.
 *
 * <p>Attribution rules for a pass-through call:
 * <ol>
 *   <li>explicit parent that is one of the run's agent calls: child of that call</li>
 *   <li>explicit parent that does not resolve: orphan, never guessed</li>
 *   <li>no parent reference (null or blank): child of the last agent call created at
 *       or before it, or of the first agent call when none precedes it</li>
 *   <li>no parent reference and no agent call in the run: unattributed</li>
 * </ol>
 *
 * <p>Input is stably sorted by {@code createdAt}; calls sharing a timestamp keep
 * their input order, and children are listed in that order.
 */
@Slf4j
@Component
public class AttributionResolver {

    static final Comparator<ClassifiedCall> BY_CREATED_AT =
            Comparator.comparing(ClassifiedCall::getCreatedAt,
                    Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * @param calls classified call log of one run, any order
     * @return attributed tree with orphan and unattributed sets
     */
    public CallTree resolve(List<ClassifiedCall> calls) {
        List<ClassifiedCall> ordered = sortByCreation(calls);

        List<ClassifiedCall> agentCalls = new ArrayList<>();
        List<ClassifiedCall> ptcCalls = new ArrayList<>();
        for (ClassifiedCall call : ordered) {
            (call.isPtc() ? ptcCalls : agentCalls).add(call);
        }

        Set<String> agentIds = new LinkedHashSet<>();
        agentCalls.forEach(a -> agentIds.add(a.getCallId()));

        ChildCallIndex children = new ChildCallIndex();
        CallTree.CallTreeBuilder tree = CallTree.builder()
                .agentCount(agentCalls.size())
                .ptcCount(ptcCalls.size());

        for (ClassifiedCall ptc : ptcCalls) {
            if (ptc.getRecord().hasExplicitParent()) {
                String parentId = ptc.getRecord().getExplicitParentId();
                if (agentIds.contains(parentId)) {
                    children.append(parentId, ptc);
                } else {
                    log.warn("Orphan pass-through call {} references missing parent {}",
                            ptc.getCallId(), parentId);
                    tree.orphan(ptc);
                }
            } else if (agentCalls.isEmpty()) {
                tree.unattributedCall(ptc);
            } else {
                children.append(nearestPrecedingAgent(agentCalls, ptc.getCreatedAt()).getCallId(), ptc);
            }
        }

        for (ClassifiedCall agent : agentCalls) {
            tree.agentCall(new AttributedCall(agent, children.childrenOf(agent.getCallId())));
        }

        CallTree result = tree.build();
        if (result.getUnattributedCount() > 0) {
            log.warn("{} pass-through call(s) have no agent call to attach to", result.getUnattributedCount());
        }
        log.debug("Attributed {} agent + {} ptc calls ({} linked, {} orphan, {} unattributed)",
                result.getAgentCount(), result.getPtcCount(), children.size(),
                result.getOrphanCount(), result.getUnattributedCount());
        return result;
    }

    /**
     * Stable sort: {@link List#sort} keeps equal elements in input order.
     */
    static List<ClassifiedCall> sortByCreation(List<ClassifiedCall> calls) {
        List<ClassifiedCall> ordered = new ArrayList<>(calls);
        ordered.sort(BY_CREATED_AT);
        return ordered;
    }

    /**
     * Last agent call created at or before {@code createdAt}; the first agent call
     * when all of them are later. {@code agentCalls} is non-empty and ascending.
     */
    private ClassifiedCall nearestPrecedingAgent(List<ClassifiedCall> agentCalls, LocalDateTime createdAt) {
        ClassifiedCall parent = null;
        for (ClassifiedCall agent : agentCalls) {
            if (createdAt != null && agent.getCreatedAt() != null && !agent.getCreatedAt().isAfter(createdAt)) {
                parent = agent;
            } else {
                break;
            }
        }
        return parent != null ? parent : agentCalls.get(0);
    }
}
