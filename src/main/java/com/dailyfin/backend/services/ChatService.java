package com.dailyfin.backend.services;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dailyfin.backend.dto.PaginatedResponse;
import com.dailyfin.backend.dto.chat.ConversationDTO;
import com.dailyfin.backend.dto.chat.MessageResponseDTO;
import com.dailyfin.backend.entities.Message;
import com.dailyfin.backend.entities.User;
import com.dailyfin.backend.exceptions.BadRequestException;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.mappers.MessageMapper;
import com.dailyfin.backend.notifications.NotificationDispatch;
import com.dailyfin.backend.notifications.NotificationService;
import com.dailyfin.backend.realtime.PresenceRegistry;
import com.dailyfin.backend.repositories.MessageRepository;
import com.dailyfin.backend.repositories.MessageRepository.UnreadBySenderProjection;
import com.dailyfin.backend.repositories.UserRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class ChatService {

    private static final Logger logger = LoggerFactory.getLogger(ChatService.class);

    public static final int DEFAULT_PAGE_SIZE = 50;
    static final int SEARCH_LIMIT = 50;
    static final Duration DELETE_WINDOW = Duration.ofMinutes(5);

    private final MessageRepository messageRepository;
    private final UserRepository userRepository;
    private final PresenceRegistry presenceRegistry;
    private final NotificationService notificationService;
    private final Clock clock;

    @Transactional
    public MessageResponseDTO sendMessage(UUID senderId, UUID receiverId, String text) {
        if (senderId.equals(receiverId)) {
            throw new BadRequestException("Não é possível enviar mensagem para si mesmo");
        }

        User receiver = userRepository.findById(receiverId)
                .orElseThrow(() -> new ResourceNotFoundException("Destinatário não encontrado"));
        User sender = userRepository.findById(senderId)
                .orElseThrow(() -> new ResourceNotFoundException("Usuário não encontrado"));

        Message message = Message.builder()
                .sender(sender)
                .receiver(receiver)
                .message(text.trim())
                .build();

        Message saved = messageRepository.save(message);
        NotificationDispatch.dispatch("mensagem de chat",
                () -> notificationService.sendChatNotification(receiverId, sender.getName(), saved.getMessage()));

        logger.debug("[Chat] Mensagem {} de {} para {}", saved.getId(), senderId, receiverId);
        return MessageMapper.toResponseDTO(saved);
    }

    /**
     * Página de uma conversa. A página 1 traz as mensagens mais recentes,
     * devolvidas em ordem cronológica.
     */
    @Transactional(readOnly = true)
    public PaginatedResponse<MessageResponseDTO> conversation(UUID userId, UUID otherUserId, int page, int limit) {
        if (!userRepository.existsById(otherUserId)) {
            throw new ResourceNotFoundException("Usuário não encontrado");
        }

        int safePage = Math.max(page, 1);
        int safeLimit = limit > 0 ? limit : DEFAULT_PAGE_SIZE;

        Page<Message> result = messageRepository.findConversation(
                userId, otherUserId,
                PageRequest.of(safePage - 1, safeLimit, Sort.by(Sort.Direction.DESC, "createdAt")));

        List<MessageResponseDTO> data = new ArrayList<>(result.getContent().stream()
                .map(MessageMapper::toResponseDTO)
                .toList());
        Collections.reverse(data);

        return PaginatedResponse.of(data, safePage, safeLimit, result.getTotalElements());
    }

    /**
     * Uma entrada por interlocutor, a mais recente primeiro.
     */
    @Transactional(readOnly = true)
    public List<ConversationDTO> conversations(UUID userId) {
        Map<UUID, Long> unreadBySender = messageRepository.countUnreadBySender(userId).stream()
                .collect(Collectors.toMap(UnreadBySenderProjection::getSenderId, UnreadBySenderProjection::getUnread));

        // Mensagens já vêm da mais recente para a mais antiga; a primeira de cada par vence
        Map<UUID, ConversationDTO> byCounterpart = new LinkedHashMap<>();
        for (Message m : messageRepository.findAllInvolving(userId)) {
            User other = m.getSender().getId().equals(userId) ? m.getReceiver() : m.getSender();
            byCounterpart.computeIfAbsent(other.getId(), id -> ConversationDTO.builder()
                    .userId(id)
                    .userName(other.getName())
                    .userEmail(other.getEmail())
                    .userAvatar(other.getAvatar())
                    .lastMessage(m.getMessage())
                    .lastMessageTime(m.getCreatedAt())
                    .unreadCount(unreadBySender.getOrDefault(id, 0L))
                    .isOnline(presenceRegistry.isOnline(id))
                    .build());
        }

        return new ArrayList<>(byCounterpart.values());
    }

    /**
     * Marca como lidas as mensagens recebidas de {@code senderId}.
     */
    @Transactional
    public int markAsRead(UUID userId, UUID senderId) {
        return messageRepository.markAsRead(senderId, userId, LocalDateTime.now(clock));
    }

    public long unreadCount(UUID userId) {
        return messageRepository.countUnread(userId);
    }

    @Transactional
    public void deleteMessage(UUID userId, UUID messageId) {
        Message message = messageRepository.findById(messageId)
                .orElseThrow(() -> new ResourceNotFoundException("Mensagem não encontrada"));

        if (!message.getSender().getId().equals(userId)) {
            throw new BadRequestException("Você só pode excluir suas próprias mensagens");
        }

        LocalDateTime limit = message.getCreatedAt().plus(DELETE_WINDOW);
        if (LocalDateTime.now(clock).isAfter(limit)) {
            throw new BadRequestException("Mensagens só podem ser excluídas em até 5 minutos após o envio");
        }

        messageRepository.delete(message);
    }

    @Transactional(readOnly = true)
    public List<MessageResponseDTO> search(UUID userId, UUID otherUserId, String query) {
        if (query == null || query.isBlank()) {
            throw new BadRequestException("Informe o termo de busca");
        }
        return messageRepository.search(userId, otherUserId, query.trim(), PageRequest.of(0, SEARCH_LIMIT))
                .stream()
                .map(MessageMapper::toResponseDTO)
                .toList();
    }
}
