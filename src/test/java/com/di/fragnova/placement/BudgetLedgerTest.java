package com.di.fragnova.placement;

import com.di.fragnova.exception.InvariantViolationException;
import com.di.fragnova.model.Node;
import com.di.fragnova.model.ResourceUsage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BudgetLedger Tests")
class BudgetLedgerTest {

    private final Node node = Node.builder().id("n").capacityBudget(1000).unitBudget(3L).build();

    @Test
    @DisplayName("Commit returns a new ledger and leaves the original untouched")
    void commitIsImmutable() {
        BudgetLedger empty = BudgetLedger.open(List.of(node));
        BudgetLedger after = empty.commit("n", new ResourceUsage(400, 1));

        assertEquals(ResourceUsage.NONE, empty.used("n"));
        assertEquals(new ResourceUsage(400, 1), after.used("n"));
        assertEquals(600.0, after.remainingCapacity("n"), 1e-9);
    }

    @Test
    @DisplayName("Admits up to exactly the budget on both dimensions")
    void admitsExactFit() {
        BudgetLedger ledger = BudgetLedger.open(List.of(node)).commit("n", new ResourceUsage(600, 2));
        assertTrue(ledger.admits("n", new ResourceUsage(400, 1)));
        assertFalse(ledger.admits("n", new ResourceUsage(400.5, 1)));
        assertFalse(ledger.admits("n", new ResourceUsage(10, 2)));
    }

    @Test
    @DisplayName("Unknown node admits nothing")
    void unknownNode() {
        assertFalse(BudgetLedger.open(List.of(node)).admits("other", new ResourceUsage(1, 0)));
    }

    @Test
    @DisplayName("Over-budget commit is an invariant violation")
    void overBudgetCommitThrows() {
        BudgetLedger ledger = BudgetLedger.open(List.of(node));
        assertThrows(InvariantViolationException.class, () -> ledger.commit("n", new ResourceUsage(1001, 1)));
    }
}
