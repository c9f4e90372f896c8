package com.payments.controls.domain;

/**
 * Payment channel a control is scoped to.
 * <p>
 * All rails share one transaction record shape; rail-specific fields are simply
 * left empty on the rows of other rails.
 */
public enum Rail {

    ACH,

    CARD,

    CRYPTO;

    /**
     * Parses a rail name, ignoring case and surrounding whitespace.
     *
     * @param value the raw rail string
     * @return the rail, or null if the value does not name a known rail
     */
    public static Rail fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toUpperCase()) {
            case "ACH" -> ACH;
            case "CARD" -> CARD;
            case "CRYPTO" -> CRYPTO;
            default -> null;
        };
    }

    /**
     * Checks whether a transaction row belongs to this rail.
     * Row rails are compared exactly, as they appear in the batch.
     *
     * @param recordRail the rail column value of a transaction row
     * @return true if the row is on this rail
     */
    public boolean matches(String recordRail) {
        return name().equals(recordRail);
    }
}
