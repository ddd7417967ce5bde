package com.abba.ainay.application.service;

import com.abba.ainay.application.dto.DoseCandidate;
import com.abba.ainay.application.notification.ScheduleTimeClassifier;
import com.abba.ainay.domain.model.Medication;
import com.abba.ainay.domain.model.Profile;
import com.abba.ainay.domain.repository.MedicationRepository;
import com.abba.ainay.domain.repository.ProfileRepository;
import com.abba.ainay.domain.service.DoseCandidateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class DoseCandidateServiceImpl implements DoseCandidateService {

    static final String FALLBACK_PATIENT_NAME = "Your patient";

    private final MedicationRepository medicationRepository;
    private final ProfileRepository profileRepository;
    private final ScheduleTimeClassifier classifier;

    @Override
    public List<DoseCandidate> fetchCandidateDoses() {
        List<Medication> medications = medicationRepository.findByActiveTrueAndTakenFalse();
        if (medications.isEmpty()) {
            return List.of();
        }

        Map<String, Profile> profiles = loadPatientProfiles(medications);

        List<DoseCandidate> candidates = new ArrayList<>(medications.size());
        for (Medication medication : medications) {
            String scheduleText = medication.scheduleText();
            Optional<LocalTime> scheduleTime = classifier.parseScheduleTime(scheduleText);
            if (scheduleTime.isEmpty()) {
                log.debug("Skipping medication {} ({}): unparseable schedule '{}'",
                        medication.getId(), medication.getName(), scheduleText);
                continue;
            }
            candidates.add(new DoseCandidate(
                    medication.getId(),
                    medication.getUserId(),
                    patientName(profiles.get(medication.getUserId())),
                    medication.getName(),
                    medication.getDosage(),
                    scheduleText,
                    scheduleTime.get()));
        }
        return candidates;
    }

    private Map<String, Profile> loadPatientProfiles(List<Medication> medications) {
        List<String> patientIds = medications.stream()
                .map(Medication::getUserId)
                .distinct()
                .toList();
        try {
            return profileRepository.findAllById(patientIds).stream()
                    .collect(Collectors.toMap(Profile::getId, Function.identity(), (left, right) -> left));
        } catch (DataAccessException e) {
            log.warn("Could not load patient profiles, continuing without names: {}", e.getMessage());
            return Map.of();
        }
    }

    private String patientName(Profile profile) {
        if (profile == null || profile.getName() == null || profile.getName().isBlank()) {
            return FALLBACK_PATIENT_NAME;
        }
        return profile.getName();
    }
}
