package com.dailyfin.backend.services;

import java.time.Clock;
import java.time.LocalDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dailyfin.backend.dto.auth.AuthRequestDTO;
import com.dailyfin.backend.dto.auth.RegisterRequestDTO;
import com.dailyfin.backend.entities.User;
import com.dailyfin.backend.exceptions.BadRequestException;
import com.dailyfin.backend.exceptions.ConflictException;
import com.dailyfin.backend.repositories.UserRepository;
import com.dailyfin.backend.security.JwtService;

import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final CategoryService categoryService;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final Clock clock;

    /**
     * Cria o usuário e as categorias padrão na mesma transação.
     */
    @Transactional
    public User register(RegisterRequestDTO request) {
        String normalized = normalizeEmail(request.getEmail());

        if (normalized == null || normalized.isBlank()) {
            throw new BadRequestException("E-mail é obrigatório");
        }

        if (userRepository.existsByEmail(normalized)) {
            throw new ConflictException("E-mail já cadastrado");
        }

        User user = User.builder()
                .name(request.getName().trim())
                .email(normalized)
                .password(passwordEncoder.encode(request.getPassword()))
                .lastLoginAt(LocalDateTime.now(clock))
                .build();

        User created = userRepository.save(user);
        categoryService.createDefaultCategories(created);

        log.info("[Auth] Novo usuário registrado id={}", created.getId());
        return created;
    }

    @Transactional
    public User login(AuthRequestDTO request) {
        String normalized = normalizeEmail(request.getEmail());

        User user = userRepository.findByEmail(normalized == null ? "" : normalized)
                .orElseThrow(() -> new BadRequestException("Credenciais inválidas"));

        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            throw new BadRequestException("Credenciais inválidas");
        }

        user.setLastLoginAt(LocalDateTime.now(clock));
        return userRepository.save(user);
    }

    /**
     * Valida o refresh token e devolve o usuário dono dele.
     */
    public User userFromRefreshToken(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new BadRequestException("Refresh token ausente");
        }

        String email;
        try {
            if (!jwtService.isRefreshToken(refreshToken)) {
                throw new BadRequestException("Refresh token inválido");
            }
            email = jwtService.extractUsername(refreshToken);
        } catch (JwtException | IllegalArgumentException e) {
            throw new BadRequestException("Refresh token inválido ou expirado");
        }

        return userRepository.findByEmail(email)
                .orElseThrow(() -> new BadRequestException("Refresh token inválido ou expirado"));
    }

    private String normalizeEmail(String email) {
        if (email == null) return null;
        return email.trim().toLowerCase();
    }
}
