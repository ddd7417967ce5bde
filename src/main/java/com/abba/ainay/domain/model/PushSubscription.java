package com.abba.ainay.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A device registration token that Firebase Cloud Messaging delivers to.
 */
@Document(collection = "push_subscriptions")
@CompoundIndex(name = "user_token_idx", def = "{'userId': 1, 'token': 1}", unique = true)
@Data
public class PushSubscription {

    @Id
    private String id;

    private String userId;
    private String token;
    private Instant createdAt = Instant.now();
    private Instant updatedAt = Instant.now();
}
