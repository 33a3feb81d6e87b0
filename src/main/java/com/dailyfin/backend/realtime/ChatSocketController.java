package com.dailyfin.backend.realtime;

import java.security.Principal;
import java.util.Set;
import java.util.UUID;

import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import com.dailyfin.backend.dto.ApiResponse;
import com.dailyfin.backend.dto.chat.MessageResponseDTO;
import com.dailyfin.backend.dto.chat.SendMessageRequestDTO;
import com.dailyfin.backend.dto.chat.TypingEventDTO;
import com.dailyfin.backend.dto.chat.TypingRequestDTO;
import com.dailyfin.backend.exceptions.BadRequestException;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.services.ChatService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Destinos de aplicação do chat ({@code /app/chat.*}).
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class ChatSocketController {

    static final String MESSAGES_QUEUE = "/queue/messages";
    static final String TYPING_QUEUE = "/queue/typing";

    private final ChatService chatService;
    private final PresenceRegistry presenceRegistry;
    private final SimpMessagingTemplate messagingTemplate;

    @MessageMapping("chat.send")
    public void send(@Payload SendMessageRequestDTO request, Principal principal) {
        UUID senderId = UUID.fromString(principal.getName());
        if (request.getReceiverId() == null || request.getMessage() == null || request.getMessage().isBlank()) {
            throw new BadRequestException("Destinatário e mensagem são obrigatórios");
        }

        MessageResponseDTO saved = chatService.sendMessage(senderId, request.getReceiverId(), request.getMessage());

        messagingTemplate.convertAndSendToUser(request.getReceiverId().toString(), MESSAGES_QUEUE, saved);
        messagingTemplate.convertAndSendToUser(principal.getName(), MESSAGES_QUEUE, saved);
    }

    @MessageMapping("chat.typing")
    public void typing(@Payload TypingRequestDTO request, Principal principal) {
        if (request.getReceiverId() == null) return;
        UUID senderId = UUID.fromString(principal.getName());
        messagingTemplate.convertAndSendToUser(
                request.getReceiverId().toString(), TYPING_QUEUE, new TypingEventDTO(senderId, request.isTyping()));
    }

    @MessageMapping("chat.online-users")
    @SendToUser("/queue/online-users")
    public Set<UUID> onlineUsers() {
        return presenceRegistry.onlineUsers();
    }

    @MessageExceptionHandler({BadRequestException.class, ResourceNotFoundException.class})
    @SendToUser("/queue/errors")
    public ApiResponse<Void> handleOperationalError(RuntimeException ex) {
        log.debug("[WebSocket] Erro no chat: {}", ex.getMessage());
        return ApiResponse.error(ex.getMessage());
    }
}
