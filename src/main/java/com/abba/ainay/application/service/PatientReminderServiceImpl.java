package com.abba.ainay.application.service;

import com.abba.ainay.application.dto.DoseAlert;
import com.abba.ainay.application.dto.DoseCandidate;
import com.abba.ainay.application.dto.Recipient;
import com.abba.ainay.application.dto.ReminderDetail;
import com.abba.ainay.application.dto.ReminderRunResult;
import com.abba.ainay.application.notification.ChannelDispatcher;
import com.abba.ainay.application.notification.DispatchAttempt;
import com.abba.ainay.application.notification.DispatchOutcome;
import com.abba.ainay.application.notification.DispatchSettings;
import com.abba.ainay.application.notification.RecordOutcome;
import com.abba.ainay.application.notification.ScheduleTimeClassifier;
import com.abba.ainay.domain.model.Medication;
import com.abba.ainay.domain.model.NotificationChannel;
import com.abba.ainay.domain.model.NotificationHistory;
import com.abba.ainay.domain.model.NotificationStatus;
import com.abba.ainay.domain.model.NotificationType;
import com.abba.ainay.domain.model.Profile;
import com.abba.ainay.domain.repository.MedicationRepository;
import com.abba.ainay.domain.repository.ProfileRepository;
import com.abba.ainay.domain.service.ChannelGateway;
import com.abba.ainay.domain.service.NotificationHistoryService;
import com.abba.ainay.domain.service.PatientReminderService;
import com.abba.ainay.infrastructure.config.ReminderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reminds patients shortly before a dose is due, by email and Telegram. One reminder per
 * medication per day; it counts as sent when either channel delivers.
 */
@Service
@Slf4j
public class PatientReminderServiceImpl implements PatientReminderService {

    private static final List<NotificationChannel> REMINDER_CHANNELS = List.of(NotificationChannel.EMAIL, NotificationChannel.TELEGRAM);

    private final ProfileRepository profileRepository;
    private final MedicationRepository medicationRepository;
    private final NotificationHistoryService notificationHistoryService;
    private final ScheduleTimeClassifier classifier;
    private final ChannelDispatcher channelDispatcher;
    private final Map<NotificationChannel, ChannelGateway> gatewaysByChannel;
    private final ReminderProperties properties;
    private final DispatchSettings dispatchSettings;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public PatientReminderServiceImpl(ProfileRepository profileRepository,
                                      MedicationRepository medicationRepository,
                                      NotificationHistoryService notificationHistoryService,
                                      ScheduleTimeClassifier classifier,
                                      ChannelDispatcher channelDispatcher,
                                      List<ChannelGateway> gateways,
                                      ReminderProperties properties,
                                      DispatchSettings dispatchSettings,
                                      Clock clock) {
        this.profileRepository = profileRepository;
        this.medicationRepository = medicationRepository;
        this.notificationHistoryService = notificationHistoryService;
        this.classifier = classifier;
        this.channelDispatcher = channelDispatcher;
        this.gatewaysByChannel = ChannelGateway.byChannel(gateways);
        this.properties = properties;
        this.dispatchSettings = dispatchSettings;
        this.clock = clock;
    }

    @Override
    public Optional<ReminderRunResult> checkAndSendReminders() {
        if (!running.compareAndSet(false, true)) {
            log.info("Patient reminder check already in progress, skipping");
            return Optional.empty();
        }
        try {
            return Optional.of(runOnce());
        } finally {
            running.set(false);
        }
    }

    private ReminderRunResult runOnce() {
        if (!properties.isEnabled()) {
            log.info("Patient reminders are disabled");
            return ReminderRunResult.empty();
        }
        ChannelGateway email = gatewaysByChannel.get(NotificationChannel.EMAIL);
        if (email == null || !email.isConfigured()) {
            log.info("Email not configured, skipping patient reminders");
            return ReminderRunResult.aborted("Email not configured");
        }

        ZonedDateTime now = ZonedDateTime.now(clock);
        List<Profile> patients;
        List<Medication> medications;
        try {
            patients = profileRepository.findPatientsWithRemindersEnabled();
            if (patients.isEmpty()) {
                return ReminderRunResult.empty();
            }
            medications = medicationRepository.findByUserIdInAndActiveTrueAndTakenFalse(
                    patients.stream().map(Profile::getId).toList());
        } catch (DataAccessException e) {
            log.error("Failed to fetch patients: {}", e.getMessage(), e);
            return ReminderRunResult.aborted("Failed to fetch patients: " + e.getMessage());
        }

        List<String> errors = new ArrayList<>();
        int checked = medications.size();
        log.debug("Found {} active medication(s) across {} patient(s)", checked, patients.size());
        if (medications.isEmpty()) {
            return ReminderRunResult.empty();
        }

        Set<String> remindedToday;
        try {
            remindedToday = notificationHistoryService.loadRemindersSentToday(
                    medications.stream().map(Medication::getId).toList(), now);
        } catch (DataAccessException e) {
            log.warn("Failed to check reminder history: {}", e.getMessage());
            errors.add("Failed to check reminder history: " + e.getMessage());
            remindedToday = Set.of();
        }

        Map<String, Profile> patientsById = patients.stream()
                .collect(Collectors.toMap(Profile::getId, Function.identity(), (left, right) -> left));
        List<DispatchAttempt> attempts = new ArrayList<>();
        for (Medication medication : medications) {
            if (remindedToday.contains(medication.getId())) {
                continue;
            }
            Profile patient = patientsById.get(medication.getUserId());
            Optional<LocalTime> scheduleTime = classifier.parseScheduleTime(medication.scheduleText());
            if (patient == null || scheduleTime.isEmpty()) {
                continue;
            }
            double minutesUntil = -classifier.minutesSince(scheduleTime.get(), now);
            int minutesBefore = patient.getEmailReminderMinutes() == null || patient.getEmailReminderMinutes() <= 0
                    ? properties.getDefaultMinutesBefore() : patient.getEmailReminderMinutes();
            if (!inReminderWindow(minutesUntil, minutesBefore)) {
                continue;
            }
            attempts.addAll(plan(patient, medication, scheduleTime.get(), minutesUntil));
        }

        if (attempts.isEmpty()) {
            log.debug("No reminders to send");
            return new ReminderRunResult(checked, 0, errors, List.of());
        }

        List<DispatchOutcome> outcomes = channelDispatcher.dispatch(
                attempts, dispatchSettings.maxConcurrentSends(), dispatchSettings.sendTimeout());
        return summarize(checked, outcomes, errors);
    }

    private boolean inReminderWindow(double minutesUntil, int minutesBefore) {
        double windowStart = minutesBefore - properties.getWindowMinutes();
        double windowEnd = minutesBefore + properties.getWindowMinutes();
        return minutesUntil >= windowStart && minutesUntil <= windowEnd;
    }

    private List<DispatchAttempt> plan(Profile patient, Medication medication, LocalTime scheduleTime, double minutesUntil) {
        Recipient recipient = new Recipient(patient.getId(), patient.getName(), patient.getEmail(), patient.getTelegramChatId(), List.of());
        DoseCandidate dose = new DoseCandidate(medication.getId(), patient.getId(), patient.getName(),
                medication.getName(), medication.getDosage(), medication.scheduleText(), scheduleTime);
        DoseAlert alert = DoseAlert.builder()
                .kind(DoseAlert.Kind.UPCOMING_DOSE)
                .medicationId(medication.getId())
                .patientName(patient.getName())
                .recipientName(patient.getName())
                .medicationName(medication.getName())
                .dosage(medication.getDosage())
                .scheduledTime(medication.scheduleText())
                .minutesOffset(Math.max(1, Math.floor(minutesUntil)))
                .build();

        List<DispatchAttempt> attempts = new ArrayList<>();
        for (NotificationChannel channel : REMINDER_CHANNELS) {
            ChannelGateway gateway = gatewaysByChannel.get(channel);
            if (gateway != null && gateway.isConfigured() && gateway.canReach(recipient)) {
                attempts.add(new DispatchAttempt(dose, recipient, gateway, alert));
            }
        }
        if (attempts.isEmpty()) {
            log.debug("Patient {} has no contact method (email or Telegram)", patient.getId());
        }
        return attempts;
    }

    private ReminderRunResult summarize(int checked, List<DispatchOutcome> outcomes, List<String> errors) {
        Map<String, List<DispatchOutcome>> byMedication = new LinkedHashMap<>();
        outcomes.forEach(outcome -> byMedication
                .computeIfAbsent(outcome.attempt().dose().medicationId(), ignored -> new ArrayList<>())
                .add(outcome));

        List<ReminderDetail> details = new ArrayList<>();
        List<NotificationHistory> records = new ArrayList<>();
        for (List<DispatchOutcome> medicationOutcomes : byMedication.values()) {
            boolean emailSent = false;
            boolean telegramSent = false;
            for (DispatchOutcome outcome : medicationOutcomes) {
                NotificationChannel channel = outcome.attempt().gateway().channel();
                if (outcome.success()) {
                    emailSent |= channel == NotificationChannel.EMAIL;
                    telegramSent |= channel == NotificationChannel.TELEGRAM;
                } else {
                    log.warn("Failed {}: {}", outcome.attempt().describe(), outcome.result().error());
                    errors.add("Failed to send %s reminder to %s: %s".formatted(
                            channel, outcome.attempt().recipient().name(), outcome.result().error()));
                }
            }
            if (!emailSent && !telegramSent) {
                continue;
            }
            DispatchAttempt first = medicationOutcomes.get(0).attempt();
            details.add(new ReminderDetail(first.recipient().name(), first.dose().medicationName(),
                    first.dose().scheduleText(), Math.round(first.alert().minutesOffset()), emailSent, telegramSent));
            records.add(toHistory(first, emailSent ? NotificationChannel.EMAIL : NotificationChannel.TELEGRAM));
        }

        RecordOutcome recorded = notificationHistoryService.recordBatch(records);
        if (!recorded.success()) {
            errors.add("Failed to record reminders: " + recorded.error());
        }
        log.info("Patient reminder check complete: {} reminder(s) sent", details.size());
        return new ReminderRunResult(checked, details.size(), errors, details);
    }

    private NotificationHistory toHistory(DispatchAttempt attempt, NotificationChannel channel) {
        NotificationHistory history = new NotificationHistory();
        history.setPatientId(attempt.dose().patientId());
        history.setCompanionId(attempt.dose().patientId());
        history.setMedicationId(attempt.dose().medicationId());
        history.setType(NotificationType.MEDICATION_REMINDER);
        history.setChannel(channel);
        history.setRecipientEmail(attempt.recipient().email());
        history.setMessage(attempt.alert().summary());
        history.setScheduledTime(attempt.dose().scheduleText());
        history.setSentAt(Instant.now(clock));
        history.setStatus(NotificationStatus.SENT);
        return history;
    }
}
