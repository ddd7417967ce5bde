package com.abba.ainay.domain.model;

public enum CompanionLinkStatus {
    PENDING,
    ACCEPTED,
    REJECTED
}
