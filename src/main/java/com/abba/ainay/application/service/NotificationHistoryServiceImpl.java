package com.abba.ainay.application.service;

import com.abba.ainay.application.dto.NotificationStats;
import com.abba.ainay.application.notification.DedupIndex;
import com.abba.ainay.application.notification.RecordOutcome;
import com.abba.ainay.domain.model.NotificationHistory;
import com.abba.ainay.domain.model.NotificationType;
import com.abba.ainay.domain.repository.NotificationHistoryRepository;
import com.abba.ainay.domain.service.NotificationHistoryService;
import com.mongodb.MongoBulkWriteException;
import com.mongodb.bulk.BulkWriteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationHistoryServiceImpl implements NotificationHistoryService {

    private final NotificationHistoryRepository notificationHistoryRepository;

    @Override
    public DedupIndex loadSentToday(Collection<String> medicationIds, ZonedDateTime now) {
        if (medicationIds == null || medicationIds.isEmpty()) {
            return DedupIndex.empty();
        }
        try {
            List<NotificationHistory> sent = notificationHistoryRepository.findSentBetween(
                    medicationIds, NotificationType.tierTypes(), startOfDay(now), endOfDay(now));
            Set<String> keys = new HashSet<>();
            for (NotificationHistory history : sent) {
                if (history.getType() == null) {
                    continue;
                }
                history.getType().tier().ifPresent(tier ->
                        keys.add(DedupIndex.key(history.getMedicationId(), history.getCompanionId(), tier)));
            }
            return new DedupIndex(keys, null);
        } catch (DataAccessException e) {
            log.error("Error checking notification history: {}", e.getMessage(), e);
            return DedupIndex.failed(e.getMessage());
        }
    }

    @Override
    public Set<String> loadRemindersSentToday(Collection<String> medicationIds, ZonedDateTime now) {
        if (medicationIds == null || medicationIds.isEmpty()) {
            return Set.of();
        }
        return notificationHistoryRepository.findSentBetween(
                        medicationIds, List.of(NotificationType.MEDICATION_REMINDER), startOfDay(now), endOfDay(now))
                .stream()
                .map(NotificationHistory::getMedicationId)
                .collect(Collectors.toSet());
    }

    @Override
    public RecordOutcome recordBatch(List<NotificationHistory> records) {
        if (records == null || records.isEmpty()) {
            return RecordOutcome.written(0);
        }
        try {
            List<NotificationHistory> saved = notificationHistoryRepository.insert(records);
            log.debug("Recorded {} notification(s)", saved.size());
            return RecordOutcome.written(saved.size());
        } catch (DataAccessException e) {
            int written = insertedBeforeFailure(e);
            log.error("Error recording notifications batch: {} of {} written: {}", written, records.size(), e.getMessage(), e);
            return RecordOutcome.partial(written, e.getMessage());
        }
    }

    /**
     * Ordered inserts stop at the first bad row; the driver reports how many went in before it.
     */
    private int insertedBeforeFailure(DataAccessException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof MongoBulkWriteException) {
                BulkWriteResult result = ((MongoBulkWriteException) cause).getWriteResult();
                return result.wasAcknowledged() ? result.getInsertedCount() : 0;
            }
        }
        return 0;
    }

    @Override
    public NotificationStats getStats(ZonedDateTime now) {
        return new NotificationStats(
                notificationHistoryRepository.countBySentAtGreaterThanEqual(startOfDay(now)),
                notificationHistoryRepository.count());
    }

    private Instant startOfDay(ZonedDateTime now) {
        return now.toLocalDate().atStartOfDay(now.getZone()).toInstant();
    }

    private Instant endOfDay(ZonedDateTime now) {
        return now.toLocalDate().plusDays(1).atStartOfDay(now.getZone()).toInstant().minusMillis(1);
    }
}
