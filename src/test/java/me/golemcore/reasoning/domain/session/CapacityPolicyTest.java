package me.golemcore.reasoning.domain.session;

import me.golemcore.reasoning.domain.model.ArtifactKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapacityPolicyTest {

    @Test
    void shouldTakeThoughtLimitFromMaxThoughts() {
        CapacityPolicy policy = CapacityPolicy.of(100, Map.of(ArtifactKind.THOUGHT, 5, ArtifactKind.DECISION, 3));

        assertEquals(100, policy.limitFor(ArtifactKind.THOUGHT));
        assertEquals(3, policy.limitFor(ArtifactKind.DECISION));
        assertEquals(1, policy.remaining(ArtifactKind.DECISION, 2));
        assertEquals(0, policy.remaining(ArtifactKind.DECISION, 7));
    }

    @Test
    void shouldTreatMissingOrNonPositiveLimitsAsUnbounded() {
        CapacityPolicy policy = CapacityPolicy.of(0, null).withLimit(ArtifactKind.VISUAL, -1);

        assertFalse(policy.isBounded(ArtifactKind.THOUGHT));
        assertFalse(policy.isBounded(ArtifactKind.VISUAL));
        assertFalse(policy.isBounded(ArtifactKind.ARGUMENT));
        assertEquals(Integer.MAX_VALUE, policy.remaining(ArtifactKind.ARGUMENT, 1_000));
    }

    @Test
    void shouldNotMutateOriginalOnWithLimit() {
        CapacityPolicy base = CapacityPolicy.unbounded();
        CapacityPolicy bounded = base.withLimit(ArtifactKind.CREATIVE, 2);

        assertTrue(bounded.isBounded(ArtifactKind.CREATIVE));
        assertFalse(base.isBounded(ArtifactKind.CREATIVE));
    }
}
