package warden.core.service.abuse;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Matches logical endpoint names against glob patterns.
 *
 * <p>Endpoint names are dot-separated ({@code auth.login}). In a pattern, {@code *}
 * matches within one segment, {@code **} matches across segments and {@code ?}
 * matches a single character. Matching is case-insensitive. Compiled patterns are cached.
 */
public class EndpointPatternMatcher {

    private final List<String> globs;
    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public EndpointPatternMatcher(List<String> globs) {
        this.globs = globs != null ? List.copyOf(globs) : List.of();
    }

    /**
     * Tests if an endpoint matches any configured pattern.
     *
     * @param endpoint the endpoint name
     * @return true if any pattern matches
     */
    public boolean matchesAny(String endpoint) {
        if (endpoint == null) {
            return false;
        }
        for (var glob : globs) {
            if (matches(glob, endpoint)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Tests if an endpoint matches a glob pattern.
     *
     * @param glob the glob pattern (e.g., "*.login", "admin.**")
     * @param endpoint the endpoint name
     * @return true if the endpoint matches
     */
    public boolean matches(String glob, String endpoint) {
        return patternCache.computeIfAbsent(glob, EndpointPatternMatcher::compile)
                .matcher(endpoint)
                .matches();
    }

    public List<String> globs() {
        return globs;
    }

    private static Pattern compile(String glob) {
        final var regex = new StringBuilder();
        final var trimmed = glob.trim();
        for (var i = 0; i < trimmed.length(); i++) {
            final var c = trimmed.charAt(i);
            if (c == '*') {
                if (i + 1 < trimmed.length() && trimmed.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^.]*");
                }
            } else if (c == '?') {
                regex.append("[^.]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE);
    }
}
