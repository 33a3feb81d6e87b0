package com.dailyfin.backend.dto.task;

import java.time.LocalDate;

import com.dailyfin.backend.enums.RecurrenceInterval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepeatDTO {

    private boolean enabled;
    private RecurrenceInterval interval;
    private LocalDate endDate;
}
