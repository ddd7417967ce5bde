package com.abba.ainay.domain.model;

public enum ProfileRole {
    PATIENT,
    COMPANION
}
