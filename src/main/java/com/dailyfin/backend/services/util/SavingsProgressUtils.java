package com.dailyfin.backend.services.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import com.dailyfin.backend.entities.SavingsGoal;

/**
 * Funções puras sobre metas de economia. Progresso e restante nunca são persistidos.
 */
public final class SavingsProgressUtils {

    public static final List<Integer> MILESTONES = List.of(25, 50, 75, 100);

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private SavingsProgressUtils() {
    }

    /** Percentual bruto (sem teto), usado na detecção de marcos. */
    public static BigDecimal rawProgress(BigDecimal current, BigDecimal target) {
        if (target == null || target.signum() <= 0 || current == null) {
            return BigDecimal.ZERO;
        }
        return current.multiply(ONE_HUNDRED).divide(target, 6, RoundingMode.HALF_UP);
    }

    /** Percentual exibido: limitado a 100 e arredondado em 2 casas. */
    public static BigDecimal progress(BigDecimal current, BigDecimal target) {
        BigDecimal raw = rawProgress(current, target);
        if (raw.compareTo(ONE_HUNDRED) > 0) {
            raw = ONE_HUNDRED;
        }
        return raw.setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal remaining(BigDecimal current, BigDecimal target) {
        BigDecimal diff = target.subtract(current);
        return diff.signum() < 0 ? BigDecimal.ZERO : diff;
    }

    /**
     * Menor marco cruzado de forma ascendente: old < m <= new. Vazio se nenhum.
     */
    public static Optional<Integer> lowestCrossedMilestone(BigDecimal oldProgress, BigDecimal newProgress) {
        for (Integer milestone : MILESTONES) {
            BigDecimal m = BigDecimal.valueOf(milestone);
            if (oldProgress.compareTo(m) < 0 && m.compareTo(newProgress) <= 0) {
                return Optional.of(milestone);
            }
        }
        return Optional.empty();
    }

    /**
     * Mantém isCompleted == (currentAmount >= targetAmount). Ajusta completedAt nas transições,
     * inclusive quando uma redução desfaz a conclusão.
     */
    public static void recomputeCompletion(SavingsGoal goal, LocalDateTime now) {
        boolean reached = goal.getCurrentAmount().compareTo(goal.getTargetAmount()) >= 0;
        if (reached && !goal.isCompleted()) {
            goal.setCompleted(true);
            goal.setCompletedAt(now);
        } else if (!reached && goal.isCompleted()) {
            goal.setCompleted(false);
            goal.setCompletedAt(null);
        }
    }
}
