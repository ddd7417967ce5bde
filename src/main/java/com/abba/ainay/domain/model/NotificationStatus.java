package com.abba.ainay.domain.model;

public enum NotificationStatus {
    SENT,
    FAILED
}
