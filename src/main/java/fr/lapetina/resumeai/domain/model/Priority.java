package fr.lapetina.resumeai.domain.model;

/**
 * Queue priority of an AI request. Declaration order is dispatch order.
 */
public enum Priority {
    HIGH,
    NORMAL,
    LOW;

    public static Priority fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
