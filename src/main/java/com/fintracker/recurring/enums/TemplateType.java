package com.fintracker.recurring.enums;

import java.util.Locale;

public enum TemplateType {
    EXPENSE("expense"),
    INCOME("income");

    private final String value;

    TemplateType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TemplateType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Tipo de template ausente");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TemplateType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Tipo de template desconhecido: " + raw);
    }
}
