package com.dailyfin.backend.entities;

import java.time.LocalDate;

import com.dailyfin.backend.enums.RecurrenceInterval;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskRepeat {

    @Column(name = "repeat_enabled", nullable = false)
    private boolean enabled;

    @Enumerated(EnumType.STRING)
    @Column(name = "repeat_interval")
    private RecurrenceInterval interval;

    @Column(name = "repeat_end_date")
    private LocalDate endDate;
}
