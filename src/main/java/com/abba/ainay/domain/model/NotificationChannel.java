package com.abba.ainay.domain.model;

public enum NotificationChannel {
    PUSH,
    TELEGRAM,
    EMAIL
}
