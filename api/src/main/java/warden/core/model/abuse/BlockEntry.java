package warden.core.model.abuse;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An active block on an identifier.
 *
 * <p>Blocks are stored in the counter store as a compact string value
 * ({@code <blockedAtMillis>|<reason>}); the store TTL determines the expiry.
 *
 * @param identifier the blocked identifier
 * @param reason why the identifier was blocked
 * @param blockedAt when the block was created
 * @param expiresAt when the block ends
 */
public record BlockEntry(String identifier, String reason, Instant blockedAt, Instant expiresAt) {

    private static final char SEPARATOR = '|';

    public BlockEntry {
        Objects.requireNonNull(identifier, "identifier must not be null");
        reason = reason != null ? reason : "";
        Objects.requireNonNull(blockedAt, "blockedAt must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }

    /**
     * Returns the time left on the block, never negative.
     *
     * @param now the current instant
     * @return the remaining block duration
     */
    public Duration remaining(Instant now) {
        final var remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Returns the value stored for this entry.
     *
     * @return the encoded value
     */
    public String encode() {
        return blockedAt.toEpochMilli() + String.valueOf(SEPARATOR) + reason;
    }

    /**
     * Decode a stored block value.
     *
     * <p>Values that do not carry a timestamp are treated as blocked now with
     * the whole value as the reason.
     *
     * @param identifier the blocked identifier
     * @param value the stored value
     * @param ttlRemainingMs the remaining TTL of the stored key
     * @param now the current instant
     * @return the decoded entry
     */
    public static BlockEntry decode(String identifier, String value, long ttlRemainingMs, Instant now) {
        final var expiresAt = now.plusMillis(Math.max(0, ttlRemainingMs));
        final var separator = value.indexOf(SEPARATOR);
        if (separator > 0) {
            try {
                final var blockedAt = Instant.ofEpochMilli(Long.parseLong(value.substring(0, separator)));
                return new BlockEntry(identifier, value.substring(separator + 1), blockedAt, expiresAt);
            } catch (NumberFormatException e) {
                return new BlockEntry(identifier, value, now, expiresAt);
            }
        }
        return new BlockEntry(identifier, value, now, expiresAt);
    }
}
