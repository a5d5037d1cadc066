package com.qqsuccubus.egress.core.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static com.qqsuccubus.egress.core.model.EgressStatus.ABORTED;
import static com.qqsuccubus.egress.core.model.EgressStatus.ACTIVE;
import static com.qqsuccubus.egress.core.model.EgressStatus.COMPLETE;
import static com.qqsuccubus.egress.core.model.EgressStatus.ENDING;
import static com.qqsuccubus.egress.core.model.EgressStatus.STARTING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EgressStatusTest {

    @Test
    void testAllowedTransitions() {
        assertAllowed(STARTING, EnumSet.of(ACTIVE, ENDING, ABORTED));
        assertAllowed(ACTIVE, EnumSet.of(ENDING, ABORTED));
        assertAllowed(ENDING, EnumSet.of(COMPLETE, ABORTED));
        assertAllowed(COMPLETE, EnumSet.noneOf(EgressStatus.class));
        assertAllowed(ABORTED, EnumSet.noneOf(EgressStatus.class));
    }

    @Test
    void testNoStateIsRevisited() {
        for (EgressStatus status : EgressStatus.values()) {
            assertFalse(status.canTransitionTo(status), status + " -> itself");
        }
        assertFalse(ACTIVE.canTransitionTo(STARTING));
        assertFalse(ENDING.canTransitionTo(ACTIVE));
    }

    @Test
    void testNullTargetRejected() {
        assertFalse(STARTING.canTransitionTo(null));
    }

    @Test
    void testTerminalAndStoppable() {
        assertEquals(EnumSet.of(COMPLETE, ABORTED), statesMatching(true));
        assertTrue(STARTING.isStoppable());
        assertTrue(ACTIVE.isStoppable());
        assertFalse(ENDING.isStoppable());
        assertFalse(COMPLETE.isStoppable());
        assertFalse(ABORTED.isStoppable());
    }

    private static Set<EgressStatus> statesMatching(boolean terminal) {
        Set<EgressStatus> result = EnumSet.noneOf(EgressStatus.class);
        for (EgressStatus status : EgressStatus.values()) {
            if (status.isTerminal() == terminal) {
                result.add(status);
            }
        }
        return result;
    }

    private static void assertAllowed(EgressStatus from, Set<EgressStatus> allowed) {
        for (EgressStatus to : EgressStatus.values()) {
            assertEquals(allowed.contains(to), from.canTransitionTo(to), from + " -> " + to);
        }
    }
}
