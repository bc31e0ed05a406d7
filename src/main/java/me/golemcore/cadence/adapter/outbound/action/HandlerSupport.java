package me.golemcore.cadence.adapter.outbound.action;

import me.golemcore.cadence.domain.model.ActionRequest;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parameter parsing shared by the action handlers.
 */
final class HandlerSupport {

    static final double HIGH_RISK = 0.7;
    static final double MEDIUM_RISK = 0.4;

    private HandlerSupport() {
    }

    static LocalDate requireDate(ActionRequest request, String name) {
        return parseDate(name, request.requireString(name));
    }

    static Optional<LocalDate> optionalDate(ActionRequest request, String name) {
        return request.optionalString(name).map(value -> parseDate(name, value));
    }

    static String riskLevel(double score) {
        if (score >= HIGH_RISK) {
            return "high";
        }
        return score >= MEDIUM_RISK ? "medium" : "low";
    }

    static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    private static LocalDate parseDate(String name, String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Parameter " + name + " must be a YYYY-MM-DD date: " + value, e);
        }
    }
}
