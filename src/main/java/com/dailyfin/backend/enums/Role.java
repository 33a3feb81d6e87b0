package com.dailyfin.backend.enums;

public enum Role {
    USER,
    ADMIN
}
