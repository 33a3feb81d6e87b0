package com.dailyfin.backend.services.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.dailyfin.backend.entities.SavingsGoal;

class SavingsProgressUtilsTest {

    @Test
    void progress_isCappedAtOneHundred() {
        assertEquals(new BigDecimal("100.00"), SavingsProgressUtils.progress(new BigDecimal("150"), new BigDecimal("100")));
        assertEquals(new BigDecimal("33.33"), SavingsProgressUtils.progress(new BigDecimal("1"), new BigDecimal("3")));
    }

    @Test
    void rawProgress_zeroTarget_isZero() {
        assertEquals(0, BigDecimal.ZERO.compareTo(SavingsProgressUtils.rawProgress(new BigDecimal("10"), BigDecimal.ZERO)));
    }

    @Test
    void remaining_neverNegative() {
        assertEquals(BigDecimal.ZERO, SavingsProgressUtils.remaining(new BigDecimal("120"), new BigDecimal("100")));
        assertEquals(new BigDecimal("40"), SavingsProgressUtils.remaining(new BigDecimal("60"), new BigDecimal("100")));
    }

    @Test
    void lowestCrossedMilestone_boundaries() {
        assertEquals(Optional.of(25), milestone("0", "25"));
        assertEquals(Optional.of(25), milestone("10", "90"));
        assertEquals(Optional.empty(), milestone("25", "49.99"));
        assertEquals(Optional.of(100), milestone("99", "130"));
        assertEquals(Optional.empty(), milestone("100", "150"));
        assertEquals(Optional.empty(), milestone("60", "40"));
    }

    @Test
    void recomputeCompletion_tracksTransitionsBothWays() {
        SavingsGoal goal = SavingsGoal.builder()
                .targetAmount(new BigDecimal("100"))
                .currentAmount(new BigDecimal("100"))
                .build();
        LocalDateTime now = LocalDateTime.of(2024, 6, 1, 8, 0);

        SavingsProgressUtils.recomputeCompletion(goal, now);
        assertTrue(goal.isCompleted());
        assertEquals(now, goal.getCompletedAt());

        goal.setCurrentAmount(new BigDecimal("99.99"));
        SavingsProgressUtils.recomputeCompletion(goal, now.plusDays(1));
        assertFalse(goal.isCompleted());
        assertEquals(null, goal.getCompletedAt());
    }

    private Optional<Integer> milestone(String from, String to) {
        return SavingsProgressUtils.lowestCrossedMilestone(new BigDecimal(from), new BigDecimal(to));
    }
}
