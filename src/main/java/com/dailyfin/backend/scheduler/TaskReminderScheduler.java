package com.dailyfin.backend.scheduler;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.dailyfin.backend.services.TaskService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Dispara os lembretes de tarefas vencidos. Roda de hora em hora por padrão.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.tasks.reminder.enabled", havingValue = "true", matchIfMissing = true)
public class TaskReminderScheduler {

    private final TaskService taskService;

    @Scheduled(cron = "${app.tasks.reminder.cron:0 0 * * * *}")
    public void sendDueReminders() {
        try {
            int sent = taskService.processDueReminders();
            if (sent > 0) {
                log.info("[TaskReminder] {} lembrete(s) enviado(s)", sent);
            }
        } catch (Exception e) {
            log.error("[TaskReminder] Falha ao processar lembretes", e);
        }
    }
}
