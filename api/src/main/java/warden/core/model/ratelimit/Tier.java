package warden.core.model.ratelimit;

import java.util.Locale;
import java.util.Optional;

/**
 * Caller classification used to select among rule variants.
 *
 * <p>Tiers are declared in ascending order of privilege, so the natural enum
 * order is the tier order: {@code ANONYMOUS < AUTHENTICATED < ELEVATED_ROLE < SERVICE_ACCOUNT}.
 */
public enum Tier {
    ANONYMOUS("anonymous"),
    AUTHENTICATED("authenticated"),
    ELEVATED_ROLE("elevated"),
    SERVICE_ACCOUNT("service");

    /** Name of the per-endpoint fallback pseudo-tier. */
    public static final String DEFAULT = "default";

    private final String value;

    Tier(String value) {
        this.value = value;
    }

    /**
     * Returns the canonical name used in rule keys and configuration.
     *
     * @return the canonical tier name
     */
    public String value() {
        return value;
    }

    /**
     * Parse a tier name.
     *
     * <p>Accepts the canonical names plus the usual spellings
     * ({@code elevated-role}, {@code elevatedRole}, {@code service-account}, ...),
     * case-insensitively.
     *
     * @param name the tier name (may be null)
     * @return the tier, or empty if the name is not a known tier
     */
    public static Optional<Tier> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        final var normalized =
                name.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        return switch (normalized) {
            case "anonymous" -> Optional.of(ANONYMOUS);
            case "authenticated" -> Optional.of(AUTHENTICATED);
            case "elevated", "elevatedrole" -> Optional.of(ELEVATED_ROLE);
            case "service", "serviceaccount" -> Optional.of(SERVICE_ACCOUNT);
            default -> Optional.empty();
        };
    }
}
