package com.dailyfin.backend.enums;

public enum ContributionType {
    DEPOSIT,
    WITHDRAWAL
}
