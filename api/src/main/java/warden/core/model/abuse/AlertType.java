package warden.core.model.abuse;

import java.util.Locale;

/**
 * Kind of abusive pattern detected by the violation monitor.
 */
public enum AlertType {
    /** Repeated rate limit violations on login endpoints. */
    BRUTE_FORCE,
    /** Sustained rate limit violations on any endpoint. */
    API_ABUSE;

    /**
     * Returns the lowercase name used in store keys and metric tags.
     *
     * @return the key segment for this type
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
