package com.abba.ainay.application.notification;

import com.abba.ainay.domain.model.NotificationTier;

import java.util.Set;

/**
 * Snapshot of the (medication, recipient, tier) triples already notified today. A non-null
 * {@code error} means history could not be read and the set is empty.
 */
public record DedupIndex(Set<String> keys, String error) {

    public DedupIndex {
        keys = Set.copyOf(keys);
    }

    public static DedupIndex empty() {
        return new DedupIndex(Set.of(), null);
    }

    public static DedupIndex failed(String error) {
        return new DedupIndex(Set.of(), error);
    }

    public static String key(String medicationId, String recipientId, NotificationTier tier) {
        return medicationId + "|" + recipientId + "|" + tier.key();
    }

    public boolean contains(String medicationId, String recipientId, NotificationTier tier) {
        return keys.contains(key(medicationId, recipientId, tier));
    }

    public boolean failed() {
        return error != null;
    }

    public int size() {
        return keys.size();
    }
}
