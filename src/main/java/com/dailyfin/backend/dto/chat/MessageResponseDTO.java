package com.dailyfin.backend.dto.chat;

import java.time.LocalDateTime;
import java.util.UUID;

import com.dailyfin.backend.dto.auth.UserSummaryDTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponseDTO {

    private UUID id;
    private UserSummaryDTO sender;
    private UserSummaryDTO receiver;
    private String message;
    private Boolean isRead;
    private LocalDateTime readAt;
    private LocalDateTime createdAt;
}
