package com.fintracker.recurring.services.recurring;

/**
 * @param deleted   instances removed
 * @param unlinked  instances kept with their template link cleared
 * @param restamped instances recreated with the template's new values
 */
public record ReconciliationResult(int deleted, int unlinked, int restamped) {
}
