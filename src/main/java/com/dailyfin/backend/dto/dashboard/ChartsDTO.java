package com.dailyfin.backend.dto.dashboard;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChartsDTO {

    // sempre 7 pontos, do mais antigo para hoje
    private List<TrendPointDTO> expenseTrends;

    private List<CategorySpendingDTO> categorySpending;
}
