package com.z254.hivemind.dispatch.service;

import java.util.List;

/**
 * @param alertId    id shared by every copy of the alert
 * @param recipients agents that received a durable copy
 */
public record EmergencyBroadcastResult(String alertId, List<String> recipients) {
}
