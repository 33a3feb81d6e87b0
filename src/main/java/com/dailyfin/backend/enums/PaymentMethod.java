package com.dailyfin.backend.enums;

public enum PaymentMethod {
    CASH,
    CARD,
    MOBILE_BANKING,
    BANK_TRANSFER,
    OTHER
}
