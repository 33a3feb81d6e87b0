package com.dailyfin.backend.notifications;

import java.util.Map;

import com.dailyfin.backend.enums.NotificationType;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PushNotification {
    NotificationType type;
    String title;
    String body;
    Map<String, String> data;
}
