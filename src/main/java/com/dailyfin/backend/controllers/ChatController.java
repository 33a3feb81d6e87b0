package com.dailyfin.backend.controllers;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.dailyfin.backend.dto.ApiResponse;
import com.dailyfin.backend.dto.PaginatedResponse;
import com.dailyfin.backend.dto.chat.ConversationDTO;
import com.dailyfin.backend.dto.chat.MarkReadResultDTO;
import com.dailyfin.backend.dto.chat.MessageResponseDTO;
import com.dailyfin.backend.dto.chat.SendMessageRequestDTO;
import com.dailyfin.backend.security.SecurityService;
import com.dailyfin.backend.services.ChatService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    private final ChatService chatService;
    private final SecurityService securityService;
    private final SimpMessagingTemplate messagingTemplate;

    // Envio via HTTP também entrega em tempo real para quem estiver conectado
    @PostMapping("/send")
    public ResponseEntity<ApiResponse<MessageResponseDTO>> send(@Valid @RequestBody SendMessageRequestDTO dto) {
        UUID senderId = securityService.getCurrentUserId();
        MessageResponseDTO sent = chatService.sendMessage(senderId, dto.getReceiverId(), dto.getMessage());
        messagingTemplate.convertAndSendToUser(dto.getReceiverId().toString(), "/queue/messages", sent);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(sent, "Mensagem enviada"));
    }

    @GetMapping("/conversations")
    public ResponseEntity<ApiResponse<List<ConversationDTO>>> conversations() {
        List<ConversationDTO> conversations = chatService.conversations(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(conversations, "Conversas carregadas"));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<ApiResponse<Map<String, Long>>> unreadCount() {
        long count = chatService.unreadCount(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(Map.of("unreadCount", count), "Mensagens não lidas"));
    }

    @GetMapping("/conversation/{userId}")
    public ResponseEntity<ApiResponse<PaginatedResponse<MessageResponseDTO>>> conversation(
            @PathVariable UUID userId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "" + ChatService.DEFAULT_PAGE_SIZE) int limit
    ) {
        PaginatedResponse<MessageResponseDTO> messages =
                chatService.conversation(securityService.getCurrentUserId(), userId, page, limit);
        return ResponseEntity.ok(ApiResponse.success(messages, "Mensagens carregadas"));
    }

    @PutMapping("/read/{userId}")
    public ResponseEntity<ApiResponse<MarkReadResultDTO>> markAsRead(@PathVariable UUID userId) {
        int marked = chatService.markAsRead(securityService.getCurrentUserId(), userId);
        return ResponseEntity.ok(ApiResponse.success(new MarkReadResultDTO(marked), "Mensagens marcadas como lidas"));
    }

    @DeleteMapping("/message/{messageId}")
    public ResponseEntity<ApiResponse<Void>> deleteMessage(@PathVariable UUID messageId) {
        chatService.deleteMessage(securityService.getCurrentUserId(), messageId);
        return ResponseEntity.ok(ApiResponse.message("Mensagem removida"));
    }

    @GetMapping("/search/{userId}")
    public ResponseEntity<ApiResponse<List<MessageResponseDTO>>> search(
            @PathVariable UUID userId,
            @RequestParam("q") String query
    ) {
        List<MessageResponseDTO> results = chatService.search(securityService.getCurrentUserId(), userId, query);
        return ResponseEntity.ok(ApiResponse.success(results, "Resultados da busca"));
    }
}
