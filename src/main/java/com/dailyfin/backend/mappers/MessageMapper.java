package com.dailyfin.backend.mappers;

import com.dailyfin.backend.dto.chat.MessageResponseDTO;
import com.dailyfin.backend.entities.Message;

public class MessageMapper {

    private MessageMapper() {

    }

    public static MessageResponseDTO toResponseDTO(Message m) {
        if (m == null) return null;

        return MessageResponseDTO.builder()
                .id(m.getId())
                .sender(UserMapper.toSummaryDTO(m.getSender()))
                .receiver(UserMapper.toSummaryDTO(m.getReceiver()))
                .message(m.getMessage())
                .isRead(m.isRead())
                .readAt(m.getReadAt())
                .createdAt(m.getCreatedAt())
                .build();
    }
}
