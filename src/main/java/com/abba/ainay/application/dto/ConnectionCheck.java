package com.abba.ainay.application.dto;

public record ConnectionCheck(
        boolean success,
        String error
) {

    public static ConnectionCheck ok() {
        return new ConnectionCheck(true, null);
    }

    public static ConnectionCheck failed(String error) {
        return new ConnectionCheck(false, error);
    }
}
