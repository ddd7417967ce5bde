package com.abba.ainay.application.notification;

import com.abba.ainay.application.dto.DoseAlert;
import com.abba.ainay.application.dto.DoseCandidate;
import com.abba.ainay.application.dto.Recipient;
import com.abba.ainay.domain.service.ChannelGateway;

/**
 * One send through one channel to one recipient.
 */
public record DispatchAttempt(
        DoseCandidate dose,
        Recipient recipient,
        ChannelGateway gateway,
        DoseAlert alert
) {

    public String describe() {
        return "%s via %s to %s for %s".formatted(
                alert.tier() == null ? "reminder" : alert.tier().key(),
                gateway.channel(),
                recipient.name(),
                dose.medicationName());
    }
}
