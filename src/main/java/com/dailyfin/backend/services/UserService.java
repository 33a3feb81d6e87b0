package com.dailyfin.backend.services;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dailyfin.backend.dto.auth.UpdateProfileRequestDTO;
import com.dailyfin.backend.dto.auth.UserResponseDTO;
import com.dailyfin.backend.dto.auth.UserSummaryDTO;
import com.dailyfin.backend.entities.User;
import com.dailyfin.backend.exceptions.BadRequestException;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.mappers.UserMapper;
import com.dailyfin.backend.repositories.UserRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class UserService {

    static final int SEARCH_LIMIT = 20;

    private final UserRepository userRepository;

    public User findById(UUID id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Usuário não encontrado"));
    }

    public User findByEmail(String email) {
        return userRepository.findByEmail(email.trim().toLowerCase())
                .orElseThrow(() -> new ResourceNotFoundException("Usuário não encontrado com este e-mail"));
    }

    // Atualiza apenas os campos informados
    @Transactional
    public UserResponseDTO updateProfile(UUID userId, UpdateProfileRequestDTO dto) {
        User user = findById(userId);

        if (dto.getName() != null && !dto.getName().isBlank()) {
            user.setName(dto.getName().trim());
        }
        if (dto.getPhone() != null) {
            user.setPhone(dto.getPhone());
        }
        if (dto.getAvatar() != null) {
            user.setAvatar(dto.getAvatar());
        }
        if (dto.getCurrency() != null && !dto.getCurrency().isBlank()) {
            user.setCurrency(dto.getCurrency().toUpperCase());
        }

        return UserMapper.toResponseDTO(userRepository.save(user));
    }

    @Transactional
    public void addDeviceToken(UUID userId, String token) {
        if (token == null || token.isBlank()) {
            throw new BadRequestException("Token do dispositivo é obrigatório");
        }
        User user = findById(userId);
        user.getDeviceTokens().add(token);
    }

    @Transactional
    public void removeDeviceToken(UUID userId, String token) {
        User user = findById(userId);
        user.getDeviceTokens().remove(token);
    }

    // Chamado pelo envio de push quando o provedor rejeita tokens
    @Transactional
    public void removeDeviceTokens(UUID userId, Collection<String> tokens) {
        userRepository.findById(userId)
                .ifPresent(user -> user.getDeviceTokens().removeAll(tokens));
    }

    public List<UserSummaryDTO> search(UUID currentUserId, String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return userRepository.searchByNameOrEmail(query.trim(), currentUserId, PageRequest.of(0, SEARCH_LIMIT))
                .stream()
                .map(UserMapper::toSummaryDTO)
                .toList();
    }
}
