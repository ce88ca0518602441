package com.example.roomchat.service;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one fan-out. Failed identities are reported only; removing them is left to their
 * own session's disconnect handling.
 */
@Value
@Builder
public class DeliveryReport {

    int delivered;
    List<String> failedIdentities;

    public static DeliveryReport empty() {
        return DeliveryReport.builder().delivered(0).failedIdentities(List.of()).build();
    }

    public boolean hasFailures() {
        return !failedIdentities.isEmpty();
    }
}
