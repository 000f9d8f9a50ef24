package warden.core.service;

import warden.core.model.abuse.AlertType;

/**
 * Builds the keys enforcement state is stored under.
 *
 * <ul>
 *   <li>Counters: {@code <prefix>rl:<hash(endpoint)>:<identifier>}</li>
 *   <li>Blocks: {@code <prefix>blocked:<identifier>}</li>
 *   <li>Alert cooldowns: {@code <prefix>alert:<type>:<identifier>}</li>
 * </ul>
 */
public final class StoreKeys {

    private final String prefix;

    public StoreKeys(String prefix) {
        this.prefix = prefix != null ? prefix : "";
    }

    public String counter(String endpoint, String identifier) {
        return prefix + "rl:" + hashEndpoint(endpoint) + ":" + identifier;
    }

    public String block(String identifier) {
        return prefix + "blocked:" + identifier;
    }

    public String alertCooldown(AlertType type, String identifier) {
        return prefix + "alert:" + type.key() + ":" + identifier;
    }

    public String prefix() {
        return prefix;
    }

    // Endpoint names can contain ':' and other characters that would make keys ambiguous.
    static String hashEndpoint(String endpoint) {
        return String.format("%08x", endpoint.hashCode());
    }
}
