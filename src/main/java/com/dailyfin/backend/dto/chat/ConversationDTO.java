package com.dailyfin.backend.dto.chat;

import java.time.LocalDateTime;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationDTO {

    private UUID userId;
    private String userName;
    private String userEmail;
    private String userAvatar;
    private String lastMessage;
    private LocalDateTime lastMessageTime;
    private long unreadCount;
    private Boolean isOnline;
}
