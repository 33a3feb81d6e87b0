package com.dailyfin.backend.services.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.dailyfin.backend.enums.BudgetStatusLevel;

/**
 * Regras de classificação de orçamento: >= 100% estourado, >= 80% atenção, senão seguro.
 */
public final class BudgetStatusCalculator {

    public static final BigDecimal WARNING_THRESHOLD = new BigDecimal("80");
    public static final BigDecimal EXCEEDED_THRESHOLD = new BigDecimal("100");

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
    private static final int PERCENT_SCALE = 2;

    private BudgetStatusCalculator() {
    }

    /**
     * spent / budget * 100, arredondado em 2 casas (HALF_UP). Orçamento zero ou ausente resulta em 0.
     */
    public static BigDecimal percentage(BigDecimal spent, BigDecimal budget) {
        if (budget == null || budget.signum() == 0) {
            return BigDecimal.ZERO.setScale(PERCENT_SCALE);
        }
        BigDecimal safeSpent = spent != null ? spent : BigDecimal.ZERO;
        return safeSpent
                .multiply(ONE_HUNDRED)
                .divide(budget, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    public static BudgetStatusLevel classify(BigDecimal percentage) {
        if (percentage.compareTo(EXCEEDED_THRESHOLD) >= 0) {
            return BudgetStatusLevel.EXCEEDED;
        }
        if (percentage.compareTo(WARNING_THRESHOLD) >= 0) {
            return BudgetStatusLevel.WARNING;
        }
        return BudgetStatusLevel.SAFE;
    }

    public static boolean shouldAlert(BigDecimal percentage) {
        return percentage.compareTo(WARNING_THRESHOLD) >= 0;
    }
}
