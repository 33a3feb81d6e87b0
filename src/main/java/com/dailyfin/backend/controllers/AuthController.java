package com.dailyfin.backend.controllers;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.dailyfin.backend.dto.ApiResponse;
import com.dailyfin.backend.dto.auth.AuthRequestDTO;
import com.dailyfin.backend.dto.auth.AuthResponseDTO;
import com.dailyfin.backend.dto.auth.DeviceTokenRequestDTO;
import com.dailyfin.backend.dto.auth.RegisterRequestDTO;
import com.dailyfin.backend.dto.auth.UpdateProfileRequestDTO;
import com.dailyfin.backend.dto.auth.UserResponseDTO;
import com.dailyfin.backend.entities.User;
import com.dailyfin.backend.mappers.UserMapper;
import com.dailyfin.backend.security.JwtService;
import com.dailyfin.backend.security.SecurityService;
import com.dailyfin.backend.services.AuthService;
import com.dailyfin.backend.services.UserService;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    static final String REFRESH_COOKIE = "refresh";
    static final String REFRESH_COOKIE_PATH = "/api/auth";

    private final AuthService authService;
    private final UserService userService;
    private final JwtService jwtService;
    private final SecurityService securityService;

    @PostMapping("/register")
    public ResponseEntity<ApiResponse<AuthResponseDTO>> register(
            @Valid @RequestBody RegisterRequestDTO request,
            HttpServletResponse response
    ) {
        User user = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(issueTokens(user, response), "Cadastro realizado com sucesso"));
    }

    @PostMapping("/login")
    public ResponseEntity<ApiResponse<AuthResponseDTO>> login(
            @Valid @RequestBody AuthRequestDTO request,
            HttpServletResponse response
    ) {
        User user = authService.login(request);
        return ResponseEntity.ok(ApiResponse.success(issueTokens(user, response), "Login realizado com sucesso"));
    }

    @PostMapping("/refresh")
    public ResponseEntity<ApiResponse<AuthResponseDTO>> refresh(HttpServletRequest request, HttpServletResponse response) {
        String refreshToken = null;
        if (request.getCookies() != null) {
            for (Cookie c : request.getCookies()) {
                if (REFRESH_COOKIE.equals(c.getName())) {
                    refreshToken = c.getValue();
                    break;
                }
            }
        }

        User user = authService.userFromRefreshToken(refreshToken);
        return ResponseEntity.ok(ApiResponse.success(issueTokens(user, response), "Token renovado"));
    }

    @PostMapping("/logout")
    public ResponseEntity<ApiResponse<Void>> logout(HttpServletResponse response) {
        response.addCookie(refreshCookie("", 0));
        return ResponseEntity.ok(ApiResponse.message("Logout efetuado"));
    }

    @GetMapping("/me")
    public ResponseEntity<ApiResponse<UserResponseDTO>> me() {
        User user = userService.findById(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(UserMapper.toResponseDTO(user), "Perfil carregado"));
    }

    @GetMapping("/profile")
    public ResponseEntity<ApiResponse<UserResponseDTO>> profile() {
        return me();
    }

    @PutMapping("/profile")
    public ResponseEntity<ApiResponse<UserResponseDTO>> updateProfile(@Valid @RequestBody UpdateProfileRequestDTO request) {
        UserResponseDTO updated = userService.updateProfile(securityService.getCurrentUserId(), request);
        return ResponseEntity.ok(ApiResponse.success(updated, "Perfil atualizado com sucesso"));
    }

    @PostMapping("/device-token")
    public ResponseEntity<ApiResponse<Void>> addDeviceToken(@Valid @RequestBody DeviceTokenRequestDTO request) {
        userService.addDeviceToken(securityService.getCurrentUserId(), request.getToken());
        return ResponseEntity.ok(ApiResponse.message("Token do dispositivo registrado"));
    }

    @DeleteMapping("/device-token")
    public ResponseEntity<ApiResponse<Void>> removeDeviceToken(@Valid @RequestBody DeviceTokenRequestDTO request) {
        UUID userId = securityService.getCurrentUserId();
        userService.removeDeviceToken(userId, request.getToken());
        return ResponseEntity.ok(ApiResponse.message("Token do dispositivo removido"));
    }

    // Access token no corpo, refresh token em cookie HttpOnly
    private AuthResponseDTO issueTokens(User user, HttpServletResponse response) {
        String token = jwtService.generateToken(user);
        String refresh = jwtService.generateRefreshToken(user);

        response.addCookie(refreshCookie(refresh, (int) (jwtService.getRefreshExpirationMillis() / 1000)));

        return AuthResponseDTO.builder()
                .token(token)
                .tokenType("Bearer")
                .expiresIn(jwtService.getExpirationMillis())
                .user(UserMapper.toResponseDTO(user))
                .build();
    }

    private static Cookie refreshCookie(String value, int maxAge) {
        Cookie cookie = new Cookie(REFRESH_COOKIE, value);
        cookie.setHttpOnly(true);
        cookie.setPath(REFRESH_COOKIE_PATH);
        cookie.setMaxAge(maxAge);
        return cookie;
    }
}
