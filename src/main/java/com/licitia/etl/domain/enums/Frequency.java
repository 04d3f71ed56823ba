package com.licitia.etl.domain.enums;

import com.licitia.etl.exception.InvalidFrequencyException;

import java.util.Locale;

public enum Frequency {
    MONTHLY("Mensual", 1),
    QUARTERLY("Trimestral", 3),
    ANNUAL("Anual", 12);

    private final String label;
    private final int monthsBetweenAnchors;

    Frequency(String label, int monthsBetweenAnchors) {
        this.label = label;
        this.monthsBetweenAnchors = monthsBetweenAnchors;
    }

    /** Label persisted in {@code scheduler.tasks.schedule_expr}. */
    public String getLabel() {
        return label;
    }

    public int getMonthsBetweenAnchors() {
        return monthsBetweenAnchors;
    }

    /**
     * Accepts the stored Spanish label or the enum name, case-insensitively.
     */
    public static Frequency parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidFrequencyException(value);
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Frequency f : values()) {
            if (f.label.toLowerCase(Locale.ROOT).equals(normalized)
                    || f.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return f;
            }
        }
        throw new InvalidFrequencyException(value);
    }
}
