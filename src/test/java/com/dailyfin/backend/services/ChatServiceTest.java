package com.dailyfin.backend.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import com.dailyfin.backend.dto.PaginatedResponse;
import com.dailyfin.backend.dto.chat.ConversationDTO;
import com.dailyfin.backend.dto.chat.MessageResponseDTO;
import com.dailyfin.backend.entities.Message;
import com.dailyfin.backend.entities.User;
import com.dailyfin.backend.exceptions.BadRequestException;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.notifications.NotificationService;
import com.dailyfin.backend.realtime.PresenceRegistry;
import com.dailyfin.backend.repositories.MessageRepository;
import com.dailyfin.backend.repositories.MessageRepository.UnreadBySenderProjection;
import com.dailyfin.backend.repositories.UserRepository;

@ExtendWith(MockitoExtension.class)
class ChatServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T18:00:00Z");

    @Mock
    private MessageRepository messageRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private NotificationService notificationService;

    private final PresenceRegistry presenceRegistry = new PresenceRegistry();

    private ChatService chatService;

    private final User alice = user("Alice");
    private final User bob = user("Bob");
    private final User carol = user("Carol");

    @BeforeEach
    void setUp() {
        chatService = new ChatService(messageRepository, userRepository, presenceRegistry,
                notificationService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void sendMessage_persistsTrimmedTextAndNotifiesReceiver() {
        when(userRepository.findById(bob.getId())).thenReturn(Optional.of(bob));
        when(userRepository.findById(alice.getId())).thenReturn(Optional.of(alice));
        when(messageRepository.save(any(Message.class))).thenAnswer(inv -> inv.getArgument(0));

        MessageResponseDTO sent = chatService.sendMessage(alice.getId(), bob.getId(), "  oi!  ");

        assertEquals("oi!", sent.getMessage());
        assertEquals(bob.getId(), sent.getReceiver().getId());
        assertThat(sent.getIsRead()).isFalse();
        verify(notificationService).sendChatNotification(bob.getId(), "Alice", "oi!");
    }

    @Test
    void sendMessage_notificationRejected_messageStillPersisted() {
        when(userRepository.findById(bob.getId())).thenReturn(Optional.of(bob));
        when(userRepository.findById(alice.getId())).thenReturn(Optional.of(alice));
        when(messageRepository.save(any(Message.class))).thenAnswer(inv -> inv.getArgument(0));
        doThrow(new TaskRejectedException("fila cheia"))
                .when(notificationService).sendChatNotification(any(), anyString(), anyString());

        MessageResponseDTO sent = chatService.sendMessage(alice.getId(), bob.getId(), "tudo bem?");

        assertEquals("tudo bem?", sent.getMessage());
        verify(messageRepository).save(any(Message.class));
    }

    @Test
    void sendMessage_toSelf_isRejected() {
        assertThrows(BadRequestException.class,
                () -> chatService.sendMessage(alice.getId(), alice.getId(), "eco"));
        verify(messageRepository, never()).save(any());
    }

    @Test
    void sendMessage_unknownReceiver_throwsNotFound() {
        UUID ghost = UUID.randomUUID();
        when(userRepository.findById(ghost)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> chatService.sendMessage(alice.getId(), ghost, "alô"));
        verify(notificationService, never()).sendChatNotification(any(), anyString(), anyString());
    }

    @Test
    void conversation_returnsNewestPageInChronologicalOrder() {
        Message newer = message(bob, alice, "segunda", LocalDateTime.of(2024, 6, 1, 17, 0));
        Message older = message(alice, bob, "primeira", LocalDateTime.of(2024, 6, 1, 16, 0));
        when(userRepository.existsById(bob.getId())).thenReturn(true);
        when(messageRepository.findConversation(eq(alice.getId()), eq(bob.getId()), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(newer, older)));

        PaginatedResponse<MessageResponseDTO> page = chatService.conversation(alice.getId(), bob.getId(), 0, 0);

        assertThat(page.getData()).extracting(MessageResponseDTO::getMessage)
                .containsExactly("primeira", "segunda");
    }

    @Test
    void conversations_oneEntryPerCounterpartWithUnreadAndPresence() {
        presenceRegistry.connect(bob.getId(), "s-1");
        when(messageRepository.countUnreadBySender(alice.getId()))
                .thenReturn(List.of(unread(bob.getId(), 2L)));
        when(messageRepository.findAllInvolving(alice.getId())).thenReturn(List.of(
                message(bob, alice, "bob recente", LocalDateTime.of(2024, 6, 1, 17, 30)),
                message(alice, carol, "para carol", LocalDateTime.of(2024, 6, 1, 17, 0)),
                message(alice, bob, "bob antiga", LocalDateTime.of(2024, 6, 1, 9, 0))));

        List<ConversationDTO> result = chatService.conversations(alice.getId());

        assertEquals(2, result.size());
        assertEquals(bob.getId(), result.get(0).getUserId());
        assertEquals("bob recente", result.get(0).getLastMessage());
        assertEquals(2L, result.get(0).getUnreadCount());
        assertThat(result.get(0).getIsOnline()).isTrue();
        assertEquals(carol.getId(), result.get(1).getUserId());
        assertEquals(0L, result.get(1).getUnreadCount());
        assertThat(result.get(1).getIsOnline()).isFalse();
    }

    @Test
    void markAsRead_stampsWithClock() {
        when(messageRepository.markAsRead(bob.getId(), alice.getId(), LocalDateTime.of(2024, 6, 1, 18, 0)))
                .thenReturn(3);

        assertEquals(3, chatService.markAsRead(alice.getId(), bob.getId()));
    }

    @Test
    void deleteMessage_withinWindow_deletes() {
        Message m = message(alice, bob, "ops", LocalDateTime.of(2024, 6, 1, 17, 56));
        when(messageRepository.findById(m.getId())).thenReturn(Optional.of(m));

        chatService.deleteMessage(alice.getId(), m.getId());

        verify(messageRepository).delete(m);
    }

    @Test
    void deleteMessage_afterWindow_isRejected() {
        Message m = message(alice, bob, "tarde demais", LocalDateTime.of(2024, 6, 1, 17, 54));
        when(messageRepository.findById(m.getId())).thenReturn(Optional.of(m));

        assertThrows(BadRequestException.class, () -> chatService.deleteMessage(alice.getId(), m.getId()));
        verify(messageRepository, never()).delete(any());
    }

    @Test
    void deleteMessage_notSender_isRejected() {
        Message m = message(bob, alice, "minha", LocalDateTime.of(2024, 6, 1, 17, 59));
        when(messageRepository.findById(m.getId())).thenReturn(Optional.of(m));

        assertThrows(BadRequestException.class, () -> chatService.deleteMessage(alice.getId(), m.getId()));
    }

    @Test
    void search_blankQuery_isRejected() {
        assertThrows(BadRequestException.class, () -> chatService.search(alice.getId(), bob.getId(), "  "));
    }

    private static User user(String name) {
        return User.builder()
                .id(UUID.randomUUID())
                .name(name)
                .email(name.toLowerCase() + "@dailyfin.app")
                .password("x")
                .build();
    }

    private static Message message(User from, User to, String text, LocalDateTime at) {
        return Message.builder()
                .id(UUID.randomUUID())
                .sender(from)
                .receiver(to)
                .message(text)
                .createdAt(at)
                .build();
    }

    private static UnreadBySenderProjection unread(UUID senderId, Long count) {
        return new UnreadBySenderProjection() {
            @Override
            public UUID getSenderId() {
                return senderId;
            }

            @Override
            public Long getUnread() {
                return count;
            }
        };
    }
}
