package com.fintracker.recurring.enums;

import java.util.Locale;

/**
 * Recurrence period of a template. Persisted as the lowercase {@link #getValue() value}.
 */
public enum RecurringFrequency {
    WEEKLY("weekly"),
    BIWEEKLY("biweekly"),
    MONTHLY("monthly"),
    QUARTERLY("quarterly"),
    YEARLY("yearly");

    private final String value;

    RecurringFrequency(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static RecurringFrequency fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Frequência ausente");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (RecurringFrequency frequency : values()) {
            if (frequency.value.equals(normalized)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("Frequência desconhecida: " + raw);
    }
}
