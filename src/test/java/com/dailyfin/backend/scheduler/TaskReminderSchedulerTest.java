package com.dailyfin.backend.scheduler;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dailyfin.backend.services.TaskService;

@ExtendWith(MockitoExtension.class)
class TaskReminderSchedulerTest {

    @Mock
    private TaskService taskService;

    @InjectMocks
    private TaskReminderScheduler scheduler;

    @Test
    void sendDueReminders_delegatesToTaskService() {
        when(taskService.processDueReminders()).thenReturn(2);

        scheduler.sendDueReminders();

        verify(taskService).processDueReminders();
    }

    @Test
    void sendDueReminders_failureDoesNotEscapeTheJob() {
        when(taskService.processDueReminders()).thenThrow(new IllegalStateException("db offline"));

        assertDoesNotThrow(() -> scheduler.sendDueReminders());
    }
}
