package com.civicdesk.backend.modules.notification.domain;

public enum NotificationState {
    UNREAD,
    READ
}
