package com.purchasingpower.ptcaudit.engine;

import com.purchasingpower.ptcaudit.model.call.AttributedCall;
import com.purchasingpower.ptcaudit.model.call.CallTree;
import com.purchasingpower.ptcaudit.model.call.ClassifiedCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static com.purchasingpower.ptcaudit.model.call.CallRecordFixtures.agent;
import static com.purchasingpower.ptcaudit.model.call.CallRecordFixtures.classified;
import static com.purchasingpower.ptcaudit.model.call.CallRecordFixtures.ptc;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Attribution Resolver Tests")
class AttributionResolverTest {

    private AttributionResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new AttributionResolver();
    }

    @Test
    @DisplayName("Implicit pass-through call attaches to the preceding agent call")
    void implicitPtc_attachesToPrecedingAgent() {
        // Given: agent at t=0, ptc at t=5 without parent reference
        List<ClassifiedCall> calls = List.of(
                classified(agent("a1", 0)),
                classified(ptc("p1", 5)));

        // When
        CallTree tree = resolver.resolve(calls);

        // Then
        assertEquals(1, tree.getAgentCount());
        assertEquals(1, tree.getPtcCount());
        assertThat(childIds(tree.getAgentCalls().get(0))).containsExactly("p1");
        assertThat(tree.getOrphans()).isEmpty();
        assertThat(tree.getUnattributedCalls()).isEmpty();
    }

    @Test
    @DisplayName("Explicit parent that does not resolve becomes an orphan")
    void unresolvedExplicitParent_becomesOrphan() {
        // Given
        List<ClassifiedCall> calls = List.of(
                classified(agent("a1", 0)),
                classified(ptc("p1", 5).explicitParentId("X")));

        // When
        CallTree tree = resolver.resolve(calls);

        // Then: never guessed onto a1
        assertThat(tree.getOrphans()).extracting(ClassifiedCall::getCallId).containsExactly("p1");
        assertThat(tree.getAgentCalls().get(0).getChildren()).isEmpty();
        assertEquals(0, tree.getLinkedPtcCount());
    }

    @Test
    @DisplayName("Explicit parent wins over time proximity")
    void explicitParent_overridesNearestAgent() {
        // Given: p1 is closer to a2 in time but points at a1
        List<ClassifiedCall> calls = List.of(
                classified(agent("a1", 0)),
                classified(agent("a2", 10)),
                classified(ptc("p1", 12).explicitParentId("a1")));

        // When
        CallTree tree = resolver.resolve(calls);

        // Then
        assertThat(childIds(tree.getAgentCalls().get(0))).containsExactly("p1");
        assertThat(tree.getAgentCalls().get(1).getChildren()).isEmpty();
    }

    @Test
    @DisplayName("Nearest preceding agent call is used, not the nearest overall")
    void implicitPtcs_useNearestPrecedingAgent() {
        // Given: agents at 0 and 15, ptcs at 10 and 20
        List<ClassifiedCall> calls = List.of(
                classified(ptc("p10", 10)),
                classified(agent("a0", 0)),
                classified(ptc("p20", 20)),
                classified(agent("a15", 15)));

        // When
        CallTree tree = resolver.resolve(calls);

        // Then: p10 is nearer to a15 in absolute terms but a15 came later
        assertThat(tree.getAgentCalls()).extracting(AttributedCall::getCallId).containsExactly("a0", "a15");
        assertThat(childIds(tree.getAgentCalls().get(0))).containsExactly("p10");
        assertThat(childIds(tree.getAgentCalls().get(1))).containsExactly("p20");
    }

    @Test
    @DisplayName("Pass-through call before every agent call goes to the first agent call")
    void ptcBeforeAllAgents_attachesToFirstAgent() {
        // Given
        List<ClassifiedCall> calls = List.of(
                classified(ptc("p1", 0)),
                classified(agent("a1", 5)),
                classified(agent("a2", 9)));

        // When
        CallTree tree = resolver.resolve(calls);

        // Then
        assertThat(childIds(tree.getAgentCalls().get(0))).containsExactly("p1");
    }

    @Test
    @DisplayName("Equal timestamps attach to the agent call listed last among them")
    void sameTimestamp_tieBreakFollowsInputOrder() {
        // Given: two agents and a ptc sharing t=5
        List<ClassifiedCall> calls = List.of(
                classified(agent("a1", 5)),
                classified(agent("a2", 5)),
                classified(ptc("p1", 5)));

        // When
        CallTree first = resolver.resolve(calls);
        CallTree second = resolver.resolve(calls);

        // Then: deterministic, a2 is the last agent created at or before p1
        assertThat(childIds(first.getAgentCalls().get(1))).containsExactly("p1");
        assertThat(childIds(second.getAgentCalls().get(1))).containsExactly("p1");
        assertThat(first.getAgentCalls().get(0).getChildren()).isEmpty();
    }

    @Test
    @DisplayName("Pass-through calls sharing a timestamp keep input order under their parent")
    void sameTimestampPtcs_keepInputOrder() {
        // Given: p2 listed before p1, both at t=5, once implicit and once with explicit parent
        List<ClassifiedCall> implicit = List.of(
                classified(agent("a1", 0)),
                classified(ptc("p2", 5)),
                classified(ptc("p1", 5)));
        List<ClassifiedCall> explicit = List.of(
                classified(agent("a1", 0)),
                classified(agent("a2", 9)),
                classified(ptc("p2", 5).explicitParentId("a2")),
                classified(ptc("p1", 5).explicitParentId("a2")));

        // When
        CallTree implicitTree = resolver.resolve(implicit);
        CallTree explicitTree = resolver.resolve(explicit);

        // Then
        assertThat(childIds(implicitTree.getAgentCalls().get(0))).containsExactly("p2", "p1");
        assertThat(childIds(explicitTree.getAgentCalls().get(1))).containsExactly("p2", "p1");
        assertThat(explicitTree.getAgentCalls().get(0).getChildren()).isEmpty();
    }

    @Test
    @DisplayName("Blank parent reference is treated like a missing one")
    void blankExplicitParent_followsImplicitPath() {
        // Given
        List<ClassifiedCall> calls = List.of(
                classified(agent("a1", 0)),
                classified(ptc("p1", 3).explicitParentId("")),
                classified(ptc("p2", 4).explicitParentId("   ")));

        // When
        CallTree tree = resolver.resolve(calls);

        // Then
        assertThat(tree.getOrphans()).isEmpty();
        assertThat(childIds(tree.getAgentCalls().get(0))).containsExactly("p1", "p2");
    }

    @Test
    @DisplayName("Implicit pass-through calls without any agent call are unattributed")
    void noAgentCalls_ptcsAreUnattributed() {
        // Given
        List<ClassifiedCall> calls = List.of(
                classified(ptc("p1", 1)),
                classified(ptc("p2", 2).explicitParentId("gone")));

        // When
        CallTree tree = resolver.resolve(calls);

        // Then: the explicit one is still an orphan
        assertThat(tree.getAgentCalls()).isEmpty();
        assertThat(tree.getUnattributedCalls()).extracting(ClassifiedCall::getCallId).containsExactly("p1");
        assertThat(tree.getOrphans()).extracting(ClassifiedCall::getCallId).containsExactly("p2");
    }

    @Test
    @DisplayName("Every pass-through call lands in exactly one place")
    void everyPtc_appearsExactlyOnce() {
        // Given: a mix of linked, orphan and implicit calls
        List<ClassifiedCall> calls = List.of(
                classified(ptc("p0", 0)),
                classified(agent("a1", 1)),
                classified(ptc("p1", 2).explicitParentId("a1")),
                classified(ptc("p2", 3).explicitParentId("missing")),
                classified(agent("a2", 4)),
                classified(ptc("p3", 5)),
                classified(ptc("p4", 6).explicitParentId("a2")));

        // When
        CallTree tree = resolver.resolve(calls);

        // Then
        List<String> placed = tree.allPtcCalls().map(ClassifiedCall::getCallId).collect(Collectors.toList());
        assertThat(placed).containsExactlyInAnyOrder("p0", "p1", "p2", "p3", "p4");
        assertEquals(tree.getPtcCount(), placed.size());
        assertEquals(4, tree.getLinkedPtcCount());
    }

    @Test
    @DisplayName("Input order does not change the result")
    void shuffledInput_yieldsSameTree() {
        // Given
        List<ClassifiedCall> ordered = List.of(
                classified(agent("a1", 0)),
                classified(ptc("p1", 2)),
                classified(agent("a2", 4)),
                classified(ptc("p2", 6)));
        List<ClassifiedCall> reversed = new ArrayList<>(ordered);
        Collections.reverse(reversed);

        // When
        CallTree fromOrdered = resolver.resolve(ordered);
        CallTree fromReversed = resolver.resolve(reversed);

        // Then
        assertEquals(fromOrdered, fromReversed);
    }

    private static List<String> childIds(AttributedCall agentCall) {
        return agentCall.getChildren().stream().map(ClassifiedCall::getCallId).collect(Collectors.toList());
    }
}
