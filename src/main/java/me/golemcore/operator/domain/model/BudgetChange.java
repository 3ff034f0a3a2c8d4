package me.golemcore.operator.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Locale;

/**
 * A daily budget change: either an absolute amount in dollars or a percentage
 * delta relative to the current budget.
 */
public record BudgetChange(Kind kind, double amount) {

    public enum Kind {
        DAILY_BUDGET, INCREASE_PERCENT, DECREASE_PERCENT
    }

    public static BudgetChange dailyBudget(double dollars) {
        return new BudgetChange(Kind.DAILY_BUDGET, dollars);
    }

    public static BudgetChange increase(double percent) {
        return new BudgetChange(Kind.INCREASE_PERCENT, percent);
    }

    public static BudgetChange decrease(double percent) {
        return new BudgetChange(Kind.DECREASE_PERCENT, percent);
    }

    public boolean isPercentage() {
        return kind != Kind.DAILY_BUDGET;
    }

    /**
     * Applies the change to a current budget, without rounding or platform
     * minimums.
     */
    public double applyTo(double current) {
        return switch (kind) {
        case DAILY_BUDGET -> amount;
        case INCREASE_PERCENT -> current * (1 + amount / 100);
        case DECREASE_PERCENT -> current * (1 - amount / 100);
        };
    }

    /**
     * Describes the effect, e.g. "budget by 20%" or "daily budget to $50.00".
     */
    public String describe() {
        return switch (kind) {
        case DAILY_BUDGET -> String.format(Locale.ROOT, "daily budget to $%.2f", amount);
        case INCREASE_PERCENT, DECREASE_PERCENT -> "daily budget by " + formatPercent(amount) + "%";
        };
    }

    private static String formatPercent(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
