package com.dailyfin.backend.controllers;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.dailyfin.backend.dto.ApiResponse;
import com.dailyfin.backend.dto.auth.UserSummaryDTO;
import com.dailyfin.backend.security.SecurityService;
import com.dailyfin.backend.services.UserService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final SecurityService securityService;

    // Busca por nome ou e-mail para iniciar conversas
    @GetMapping("/search")
    public ResponseEntity<ApiResponse<List<UserSummaryDTO>>> search(@RequestParam("q") String query) {
        List<UserSummaryDTO> users = userService.search(securityService.getCurrentUserId(), query);
        return ResponseEntity.ok(ApiResponse.success(users, "Usuários encontrados"));
    }

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<Map<String, String>>> health() {
        return ResponseEntity.ok(ApiResponse.success(Map.of("status", "UP"), "Serviço disponível"));
    }
}
