package com.abba.ainay.application.dto;

import java.util.List;

public record Recipient(
        String id,
        String name,
        String email,
        String telegramChatId,
        List<String> pushTokens
) {

    public Recipient {
        pushTokens = pushTokens == null ? List.of() : List.copyOf(pushTokens);
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }

    public boolean hasTelegram() {
        return telegramChatId != null && !telegramChatId.isBlank();
    }

    public boolean hasPush() {
        return !pushTokens.isEmpty();
    }
}
