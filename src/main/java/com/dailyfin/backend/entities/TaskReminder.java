package com.dailyfin.backend.entities;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskReminder {

    @Column(name = "reminder_enabled", nullable = false)
    private boolean enabled;

    @Column(name = "reminder_time")
    private LocalDateTime time;

    @Column(name = "reminder_sent", nullable = false)
    private boolean sent;
}
