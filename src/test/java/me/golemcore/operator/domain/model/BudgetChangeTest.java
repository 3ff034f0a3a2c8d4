package me.golemcore.operator.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BudgetChangeTest {

    @Test
    void shouldApplyPercentageChanges() {
        assertEquals(60.0, BudgetChange.increase(20).applyTo(50), 1e-9);
        assertEquals(40.0, BudgetChange.decrease(20).applyTo(50), 1e-9);
        assertTrue(BudgetChange.increase(20).isPercentage());
    }

    @Test
    void shouldIgnoreCurrentBudgetForAbsoluteChange() {
        BudgetChange change = BudgetChange.dailyBudget(75);

        assertFalse(change.isPercentage());
        assertEquals(75.0, change.applyTo(10), 1e-9);
    }

    @Test
    void shouldDescribeEffect() {
        assertEquals("daily budget by 20%", BudgetChange.increase(20).describe());
        assertEquals("daily budget by 12.50%", BudgetChange.decrease(12.5).describe());
        assertEquals("daily budget to $50.00", BudgetChange.dailyBudget(50).describe());
    }

    @Test
    void shouldParseDomainWireNames() {
        assertEquals(EntityDomain.TIKTOK_AD_GROUP, EntityDomain.fromWireName(" TikTok_AdGroup ").orElseThrow());
        assertTrue(EntityDomain.fromWireName("google_ads").isEmpty());
    }
}
