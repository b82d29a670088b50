package com.customer.identity.merge;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the compensating merge transaction used by the in-memory store.
 */
class MergeTransactionTest {

    @Test
    void committedTransaction_keepsEveryStep() {
        List<String> log = new ArrayList<>();

        try (MergeTransaction tx = new MergeTransaction()) {
            tx.execute("repoint orders", () -> log.add("repoint"), () -> log.add("restore"));
            tx.execute("delete losers", () -> log.add("delete"), () -> log.add("reinsert"));
            tx.markSuccess();
        }

        assertEquals(List.of("repoint", "delete"), log);
    }

    @Test
    void failedStep_undoesEarlierStepsInReverse() {
        List<String> log = new ArrayList<>();

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> {
            try (MergeTransaction tx = new MergeTransaction()) {
                tx.execute("repoint identities", () -> log.add("identities"), () -> log.add("undo identities"));
                tx.execute("repoint orders", () -> log.add("orders"), () -> log.add("undo orders"));
                tx.execute("delete losers", () -> {
                    throw new IllegalStateException("customer vanished");
                }, () -> log.add("undo delete"));
            }
        });

        assertEquals("customer vanished", thrown.getMessage());
        assertEquals(List.of("identities", "orders", "undo orders", "undo identities"), log);
    }

    @Test
    void closedWithoutSuccess_rollsBack() {
        List<String> log = new ArrayList<>();

        MergeTransaction tx = new MergeTransaction();
        tx.execute("step1", () -> log.add("op1"), () -> log.add("comp1"));
        tx.execute("step2", () -> log.add("op2"), () -> log.add("comp2"));
        assertEquals(2, tx.pendingCompensations());
        tx.close();

        assertEquals(List.of("op1", "op2", "comp2", "comp1"), log);
        assertEquals(0, tx.pendingCompensations());
    }

    @Test
    void failingCompensation_doesNotStopTheRest() {
        List<String> log = new ArrayList<>();

        MergeTransaction tx = new MergeTransaction();
        tx.execute("step1", () -> log.add("op1"), () -> log.add("comp1"));
        tx.execute("step2", () -> log.add("op2"), () -> {
            throw new RuntimeException("compensation failed");
        });
        tx.execute("step3", () -> log.add("op3"), () -> log.add("comp3"));
        tx.close();

        assertEquals(List.of("op1", "op2", "op3", "comp3", "comp1"), log);
        assertEquals(List.of("step2"), tx.failedCompensations());
    }

    @Test
    void isSuccess_reflectsState() {
        MergeTransaction tx = new MergeTransaction();
        assertFalse(tx.isSuccess());
        tx.markSuccess();
        assertTrue(tx.isSuccess());
        tx.close();
    }

    @Test
    void executeAfterClose_throwsIllegalState() {
        MergeTransaction tx = new MergeTransaction("merge 1 <- [2]");
        tx.markSuccess();
        tx.close();

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> tx.execute("step", () -> {}, () -> {}));
        assertEquals("Transaction 'merge 1 <- [2]' is already closed", thrown.getMessage());
        assertTrue(tx.failedCompensations().isEmpty());
    }

    @Test
    void closeTwice_compensatesOnce() {
        List<String> log = new ArrayList<>();

        MergeTransaction tx = new MergeTransaction();
        tx.execute("step1", () -> log.add("op1"), () -> log.add("comp1"));
        tx.close();
        tx.close();

        assertEquals(List.of("op1", "comp1"), log);
    }
}
