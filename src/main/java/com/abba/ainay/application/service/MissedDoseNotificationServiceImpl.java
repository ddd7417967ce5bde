package com.abba.ainay.application.service;

import com.abba.ainay.application.dto.DoseAlert;
import com.abba.ainay.application.dto.DoseCandidate;
import com.abba.ainay.application.dto.NotificationDetail;
import com.abba.ainay.application.dto.NotificationRunResult;
import com.abba.ainay.application.dto.Recipient;
import com.abba.ainay.application.notification.ChannelDispatcher;
import com.abba.ainay.application.notification.DedupIndex;
import com.abba.ainay.application.notification.DispatchAttempt;
import com.abba.ainay.application.notification.DispatchOutcome;
import com.abba.ainay.application.notification.DispatchSettings;
import com.abba.ainay.application.notification.RecordOutcome;
import com.abba.ainay.application.notification.ScheduleTimeClassifier;
import com.abba.ainay.domain.model.NotificationChannel;
import com.abba.ainay.domain.model.NotificationHistory;
import com.abba.ainay.domain.model.NotificationStatus;
import com.abba.ainay.domain.model.NotificationTier;
import com.abba.ainay.domain.service.ChannelGateway;
import com.abba.ainay.domain.service.CompanionService;
import com.abba.ainay.domain.service.DoseCandidateService;
import com.abba.ainay.domain.service.MissedDoseNotificationService;
import com.abba.ainay.domain.service.NotificationHistoryService;
import com.abba.ainay.domain.service.PushSubscriptionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Detects overdue doses and escalates them to companions tier by tier.
 *
 * <p>A pass fetches candidates, classifies each by minutes overdue, resolves companions and
 * loads today's sent triples, then sends every (dose, companion, tier) triple not yet sent
 * through the tier's channels. Only successful sends are recorded, so a failed send is retried
 * on the next pass. Store failures before dispatch abort the pass; channel failures stay local
 * to their attempt.
 */
@Service
@Slf4j
public class MissedDoseNotificationServiceImpl implements MissedDoseNotificationService {

    private final DoseCandidateService doseCandidateService;
    private final CompanionService companionService;
    private final NotificationHistoryService notificationHistoryService;
    private final PushSubscriptionService pushSubscriptionService;
    private final ScheduleTimeClassifier classifier;
    private final ChannelDispatcher channelDispatcher;
    private final Map<NotificationChannel, ChannelGateway> gatewaysByChannel;
    private final DispatchSettings settings;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MissedDoseNotificationServiceImpl(DoseCandidateService doseCandidateService,
                                             CompanionService companionService,
                                             NotificationHistoryService notificationHistoryService,
                                             PushSubscriptionService pushSubscriptionService,
                                             ScheduleTimeClassifier classifier,
                                             ChannelDispatcher channelDispatcher,
                                             List<ChannelGateway> gateways,
                                             DispatchSettings settings,
                                             Clock clock) {
        this.doseCandidateService = doseCandidateService;
        this.companionService = companionService;
        this.notificationHistoryService = notificationHistoryService;
        this.pushSubscriptionService = pushSubscriptionService;
        this.classifier = classifier;
        this.channelDispatcher = channelDispatcher;
        this.gatewaysByChannel = ChannelGateway.byChannel(gateways);
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public Optional<NotificationRunResult> checkAndNotifyMissedDoses() {
        if (!running.compareAndSet(false, true)) {
            log.info("Missed-dose check already in progress, skipping");
            return Optional.empty();
        }
        try {
            return Optional.of(runOnce());
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    private NotificationRunResult runOnce() {
        if (!settings.enabled()) {
            log.info("Missed-dose notifications are disabled");
            return NotificationRunResult.empty();
        }

        ZonedDateTime now = ZonedDateTime.now(clock);
        log.debug("Checking for missed doses at {}", now);

        List<DoseCandidate> candidates;
        try {
            candidates = doseCandidateService.fetchCandidateDoses();
        } catch (DataAccessException e) {
            log.error("Failed to fetch medications: {}", e.getMessage(), e);
            return NotificationRunResult.aborted(0, "Failed to fetch medications: " + e.getMessage());
        }
        int checked = candidates.size();

        Map<NotificationTier, List<ClassifiedDose>> dosesByTier = classify(candidates, now);
        if (dosesByTier.isEmpty()) {
            log.debug("No overdue doses among {} candidate(s)", checked);
            return new NotificationRunResult(checked, 0, 0, 0, 0, 0, List.of(), List.of());
        }

        Set<String> patientIds = new LinkedHashSet<>();
        Set<String> medicationIds = new LinkedHashSet<>();
        dosesByTier.values().forEach(doses -> doses.forEach(dose -> {
            patientIds.add(dose.candidate().patientId());
            medicationIds.add(dose.candidate().medicationId());
        }));

        Map<String, List<Recipient>> recipientsByPatient;
        try {
            recipientsByPatient = companionService.resolveRecipients(patientIds);
        } catch (DataAccessException e) {
            log.error("Failed to resolve companions: {}", e.getMessage(), e);
            return NotificationRunResult.aborted(checked, "Failed to resolve companions: " + e.getMessage());
        }

        DedupIndex sentToday = notificationHistoryService.loadSentToday(medicationIds, now);
        if (sentToday.failed()) {
            log.error("Aborting run, notification history unavailable: {}", sentToday.error());
            return NotificationRunResult.aborted(checked, "Failed to check notification history: " + sentToday.error());
        }

        List<DispatchAttempt> attempts = planAttempts(dosesByTier, recipientsByPatient, sentToday);
        if (attempts.isEmpty()) {
            log.debug("Nothing to send: every overdue dose already notified or unreachable");
            return new NotificationRunResult(checked, 0, 0, 0, 0, 0, List.of(), List.of());
        }

        log.info("Sending {} missed-dose notification(s) for {} medication(s)", attempts.size(), medicationIds.size());
        List<DispatchOutcome> outcomes = channelDispatcher.dispatch(attempts, settings.maxConcurrentSends(), settings.sendTimeout());
        return summarize(checked, outcomes);
    }

    private Map<NotificationTier, List<ClassifiedDose>> classify(List<DoseCandidate> candidates, ZonedDateTime now) {
        Map<NotificationTier, List<ClassifiedDose>> dosesByTier = new LinkedHashMap<>();
        settings.tiers().tiers().forEach(tier -> dosesByTier.put(tier, new ArrayList<>()));

        for (DoseCandidate candidate : candidates) {
            double minutesMissed = classifier.minutesSince(candidate.scheduleTime(), now);
            Set<NotificationTier> tiers = classifier.classify(minutesMissed, settings.tiers(), settings.maxMinutesPast());
            if (tiers.isEmpty()) {
                if (minutesMissed > settings.maxMinutesPast()) {
                    log.debug("Skipping {} - too old ({} min)", candidate.medicationName(), Math.round(minutesMissed));
                }
                continue;
            }
            ClassifiedDose dose = new ClassifiedDose(candidate, minutesMissed);
            tiers.forEach(tier -> dosesByTier.get(tier).add(dose));
        }

        dosesByTier.values().removeIf(List::isEmpty);
        return dosesByTier;
    }

    private List<DispatchAttempt> planAttempts(Map<NotificationTier, List<ClassifiedDose>> dosesByTier,
                                               Map<String, List<Recipient>> recipientsByPatient,
                                               DedupIndex sentToday) {
        List<DispatchAttempt> attempts = new ArrayList<>();
        for (Map.Entry<NotificationTier, List<ClassifiedDose>> entry : dosesByTier.entrySet()) {
            NotificationTier tier = entry.getKey();
            for (ClassifiedDose dose : entry.getValue()) {
                DoseCandidate candidate = dose.candidate();
                List<Recipient> recipients = recipientsByPatient.getOrDefault(candidate.patientId(), List.of());
                if (recipients.isEmpty()) {
                    log.debug("No companions linked for patient {}", candidate.patientId());
                    continue;
                }
                for (Recipient recipient : recipients) {
                    if (sentToday.contains(candidate.medicationId(), recipient.id(), tier)) {
                        continue;
                    }
                    for (NotificationChannel channel : tier.channels()) {
                        ChannelGateway gateway = gatewaysByChannel.get(channel);
                        if (gateway == null || !gateway.isConfigured()) {
                            continue;
                        }
                        if (!gateway.canReach(recipient)) {
                            log.debug("Companion {} has no {} contact, skipping {}", recipient.name(), channel, tier.key());
                            continue;
                        }
                        attempts.add(new DispatchAttempt(candidate, recipient, gateway, alert(dose, recipient, tier)));
                    }
                }
            }
        }
        return attempts;
    }

    private NotificationRunResult summarize(int checked, List<DispatchOutcome> outcomes) {
        Map<NotificationChannel, Integer> sentByChannel = new EnumMap<>(NotificationChannel.class);
        List<String> errors = new ArrayList<>();
        List<NotificationDetail> details = new ArrayList<>();
        List<NotificationHistory> records = new ArrayList<>();

        for (DispatchOutcome outcome : outcomes) {
            DispatchAttempt attempt = outcome.attempt();
            ChannelGateway.DeliveryResult result = outcome.result();
            if (result.permanentFailure()) {
                deregisterStale(attempt.recipient(), result.staleAddresses());
            }
            if (!result.success()) {
                log.warn("Failed {}: {}", attempt.describe(), result.error());
                errors.add("Failed to notify %s about %s via %s: %s".formatted(
                        attempt.recipient().name(), attempt.dose().medicationName(),
                        attempt.gateway().channel(), result.error()));
                continue;
            }
            NotificationChannel channel = attempt.gateway().channel();
            sentByChannel.merge(channel, 1, Integer::sum);
            records.add(toHistory(attempt));
            details.add(new NotificationDetail(
                    attempt.dose().medicationName(),
                    attempt.dose().patientName(),
                    attempt.recipient().name(),
                    attempt.alert().tier(),
                    channel,
                    attempt.alert().minutesOffset(),
                    result.messageId()));
        }

        RecordOutcome recorded = notificationHistoryService.recordBatch(records);
        if (!recorded.success()) {
            errors.add("Failed to record notifications: " + recorded.error());
        }

        int notified = details.size();
        log.info("Missed-dose check complete: {} notification(s) sent ({} push, {} telegram, {} email), {} error(s)",
                notified,
                sentByChannel.getOrDefault(NotificationChannel.PUSH, 0),
                sentByChannel.getOrDefault(NotificationChannel.TELEGRAM, 0),
                sentByChannel.getOrDefault(NotificationChannel.EMAIL, 0),
                errors.size());

        return new NotificationRunResult(
                checked,
                notified,
                sentByChannel.getOrDefault(NotificationChannel.PUSH, 0),
                sentByChannel.getOrDefault(NotificationChannel.TELEGRAM, 0),
                sentByChannel.getOrDefault(NotificationChannel.EMAIL, 0),
                recorded.recorded(),
                errors,
                details);
    }

    private void deregisterStale(Recipient recipient, List<String> staleTokens) {
        try {
            int removed = pushSubscriptionService.deregister(recipient.id(), staleTokens);
            log.info("Removed {} expired push subscription(s) for {}", removed, recipient.id());
        } catch (DataAccessException e) {
            log.warn("Could not remove expired push subscriptions for {}: {}", recipient.id(), e.getMessage());
        }
    }

    private DoseAlert alert(ClassifiedDose dose, Recipient recipient, NotificationTier tier) {
        DoseCandidate candidate = dose.candidate();
        return DoseAlert.builder()
                .kind(DoseAlert.Kind.MISSED_DOSE)
                .tier(tier)
                .medicationId(candidate.medicationId())
                .patientName(candidate.patientName())
                .recipientName(recipient.name())
                .medicationName(candidate.medicationName())
                .dosage(candidate.dosage())
                .scheduledTime(candidate.scheduleText())
                .minutesOffset(dose.minutesMissed())
                .build();
    }

    private NotificationHistory toHistory(DispatchAttempt attempt) {
        NotificationHistory history = new NotificationHistory();
        history.setPatientId(attempt.dose().patientId());
        history.setCompanionId(attempt.recipient().id());
        history.setMedicationId(attempt.dose().medicationId());
        history.setType(attempt.alert().tier().historyType());
        history.setChannel(attempt.gateway().channel());
        history.setRecipientEmail(attempt.recipient().email());
        history.setMessage(attempt.alert().summary());
        history.setScheduledTime(attempt.dose().scheduleText());
        history.setSentAt(Instant.now(clock));
        history.setStatus(NotificationStatus.SENT);
        return history;
    }

    private record ClassifiedDose(DoseCandidate candidate, double minutesMissed) {
    }
}
