package com.abba.ainay.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "profiles")
@Data
public class Profile {

    @Id
    private String id;

    private String name;
    private String email;

    @Indexed
    private ProfileRole role = ProfileRole.PATIENT;

    @Indexed
    private String telegramChatId;

    private boolean emailRemindersEnabled;
    private Integer emailReminderMinutes;

    public boolean hasTelegram() {
        return telegramChatId != null && !telegramChatId.isBlank();
    }
}
