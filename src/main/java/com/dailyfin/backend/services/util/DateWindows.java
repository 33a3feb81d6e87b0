package com.dailyfin.backend.services.util;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.YearMonth;

/**
 * Janelas de tempo usadas pelos cálculos de orçamento, estatísticas e dashboard.
 * Todas em horário local do servidor (zona do {@link Clock}) e inclusivas nas duas pontas.
 */
public final class DateWindows {

    /** 23:59:59.999, precisão compatível com timestamps do Postgres. */
    public static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);

    private DateWindows() {
    }

    public record Window(LocalDateTime start, LocalDateTime end) {

        public boolean contains(LocalDateTime instant) {
            return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
        }
    }

    public static Window currentMonth(Clock clock) {
        return month(YearMonth.now(clock));
    }

    public static Window lastMonth(Clock clock) {
        return month(YearMonth.now(clock).minusMonths(1));
    }

    public static Window month(YearMonth ym) {
        return new Window(ym.atDay(1).atStartOfDay(), ym.atEndOfMonth().atTime(END_OF_DAY));
    }

    public static Window today(Clock clock) {
        return day(LocalDate.now(clock));
    }

    public static Window day(LocalDate date) {
        return new Window(date.atStartOfDay(), date.atTime(END_OF_DAY));
    }

    public static LocalDateTime startOfToday(Clock clock) {
        return LocalDate.now(clock).atStartOfDay();
    }

    /** Instante "agora menos N dias" (janela móvel, não alinhada à meia-noite). */
    public static LocalDateTime daysAgo(Clock clock, int days) {
        return LocalDateTime.now(clock).minusDays(days);
    }
}
