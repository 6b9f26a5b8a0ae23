package com.purchasingpower.ptcaudit.model.call;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Stream;

/**
 * Attribution result for one run.
 *
 * <p>Every pass-through call appears exactly once: in the children of one
 * agent call, in {@code orphans} (explicit parent reference that does not
 * resolve), or in {@code unattributedCalls} (no parent reference and no agent call
 * in the run).
 */
@Value
@Builder
public class CallTree {

    @Singular
    List<AttributedCall> agentCalls;

    @Singular
    List<ClassifiedCall> orphans;

    @Singular
    List<ClassifiedCall> unattributedCalls;

    int agentCount;
    int ptcCount;

    public int getOrphanCount() {
        return orphans.size();
    }

    public int getUnattributedCount() {
        return unattributedCalls.size();
    }

    /**
     * @return pass-through calls attached to a valid parent
     */
    public int getLinkedPtcCount() {
        return ptcCount - orphans.size() - unattributedCalls.size();
    }

    /**
     * All pass-through calls in tree order: children of each agent call, then
     * orphans, then unattributed calls.
     */
    public Stream<ClassifiedCall> allPtcCalls() {
        return Stream.of(
                        agentCalls.stream().flatMap(a -> a.getChildren().stream()),
                        orphans.stream(),
                        unattributedCalls.stream())
                .flatMap(s -> s);
    }
}
