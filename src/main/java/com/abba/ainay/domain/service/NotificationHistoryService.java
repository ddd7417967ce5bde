package com.abba.ainay.domain.service;

import com.abba.ainay.application.dto.NotificationStats;
import com.abba.ainay.application.notification.DedupIndex;
import com.abba.ainay.application.notification.RecordOutcome;
import com.abba.ainay.domain.model.NotificationHistory;

import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Set;

public interface NotificationHistoryService {

    DedupIndex loadSentToday(Collection<String> medicationIds, ZonedDateTime now);

    Set<String> loadRemindersSentToday(Collection<String> medicationIds, ZonedDateTime now);

    RecordOutcome recordBatch(List<NotificationHistory> records);

    NotificationStats getStats(ZonedDateTime now);
}
