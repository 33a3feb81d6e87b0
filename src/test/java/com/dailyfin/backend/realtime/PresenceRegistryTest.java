package com.dailyfin.backend.realtime;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.UUID;

import org.junit.jupiter.api.Test;

class PresenceRegistryTest {

    private final PresenceRegistry registry = new PresenceRegistry();
    private final UUID userId = UUID.randomUUID();

    @Test
    void firstSessionGoesOnlineAndLastSessionGoesOffline() {
        assertTrue(registry.connect(userId, "tab-1"));
        assertFalse(registry.connect(userId, "tab-2"));
        assertTrue(registry.isOnline(userId));

        assertFalse(registry.disconnect(userId, "tab-1"));
        assertTrue(registry.isOnline(userId));

        assertTrue(registry.disconnect(userId, "tab-2"));
        assertFalse(registry.isOnline(userId));
    }

    @Test
    void disconnectUnknownUser_isNoop() {
        assertFalse(registry.disconnect(userId, "nope"));
        assertFalse(registry.isOnline(userId));
        assertFalse(registry.isOnline(null));
    }

    @Test
    void onlineUsersReflectsConnectedSet() {
        UUID other = UUID.randomUUID();
        registry.connect(userId, "a");
        registry.connect(other, "b");
        registry.disconnect(other, "b");

        assertTrue(registry.onlineUsers().contains(userId));
        assertFalse(registry.onlineUsers().contains(other));
    }
}
