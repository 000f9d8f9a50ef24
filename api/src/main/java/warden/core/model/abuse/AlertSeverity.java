package warden.core.model.abuse;

/**
 * Severity of a security alert. HIGH alerts block the offending identifier.
 */
public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Returns true if this severity is at least as severe as the other.
     *
     * @param other the severity to compare against
     * @return true when {@code this >= other}
     */
    public boolean isAtLeast(AlertSeverity other) {
        return compareTo(other) >= 0;
    }
}
