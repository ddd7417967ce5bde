package com.abba.ainay.domain.service;

import com.abba.ainay.application.dto.Recipient;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface CompanionService {

    Map<String, List<Recipient>> resolveRecipients(Collection<String> patientIds);
}
