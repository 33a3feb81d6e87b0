package com.dailyfin.backend.dto.dashboard;

import java.math.BigDecimal;

import com.dailyfin.backend.enums.ChangeType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialSummaryDTO {

    private BigDecimal thisMonth;
    private BigDecimal lastMonth;
    private BigDecimal change;
    private ChangeType changeType;
}
