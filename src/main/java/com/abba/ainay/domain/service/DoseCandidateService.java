package com.abba.ainay.domain.service;

import com.abba.ainay.application.dto.DoseCandidate;

import java.util.List;

public interface DoseCandidateService {

    /**
     * Active, untaken medications whose schedule parses, with the owning patient's display name.
     */
    List<DoseCandidate> fetchCandidateDoses();
}
