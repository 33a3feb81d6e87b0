package com.dailyfin.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dailyfin.backend.dto.auth.UpdateProfileRequestDTO;
import com.dailyfin.backend.dto.auth.UserResponseDTO;
import com.dailyfin.backend.entities.User;
import com.dailyfin.backend.exceptions.BadRequestException;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.repositories.UserRepository;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private UserService userService;

    private final UUID userId = UUID.randomUUID();

    @Test
    void updateProfile_onlyTouchesProvidedFields() {
        User user = User.builder().id(userId).name("Nadia").email("nadia@dailyfin.app").phone("0171").build();
        when(userRepository.findById(userId)).thenReturn(Optional.of(user));
        when(userRepository.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));

        UpdateProfileRequestDTO dto = new UpdateProfileRequestDTO();
        dto.setCurrency("usd");
        dto.setName("   ");

        UserResponseDTO response = userService.updateProfile(userId, dto);

        assertEquals("Nadia", response.getName());
        assertEquals("0171", response.getPhone());
        assertEquals("USD", response.getCurrency());
    }

    @Test
    void findById_missing_throwsNotFound() {
        when(userRepository.findById(userId)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> userService.findById(userId));
    }

    @Test
    void deviceTokens_addAndRemove() {
        User user = User.builder().id(userId).name("Nadia").email("nadia@dailyfin.app").build();
        when(userRepository.findById(userId)).thenReturn(Optional.of(user));

        userService.addDeviceToken(userId, "token-a");
        userService.addDeviceToken(userId, "token-b");
        userService.removeDeviceTokens(userId, List.of("token-a"));

        assertFalse(user.getDeviceTokens().contains("token-a"));
        assertTrue(user.getDeviceTokens().contains("token-b"));
    }

    @Test
    void addDeviceToken_blank_isRejected() {
        assertThrows(BadRequestException.class, () -> userService.addDeviceToken(userId, " "));
    }

    @Test
    void search_blankQuery_returnsEmptyWithoutQuerying() {
        assertTrue(userService.search(userId, "").isEmpty());
        verifyNoInteractions(userRepository);
    }
}
