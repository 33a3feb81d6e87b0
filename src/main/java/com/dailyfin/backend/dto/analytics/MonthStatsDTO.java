package com.dailyfin.backend.dto.analytics;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthStatsDTO {

    private BigDecimal total;
    private long count;

    // média diária até hoje
    private BigDecimal average;

    private BigDecimal projected;
}
