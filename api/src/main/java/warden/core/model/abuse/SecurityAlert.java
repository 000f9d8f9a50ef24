package warden.core.model.abuse;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Alert emitted to subscribers when an abusive pattern is detected.
 *
 * @param type the detected pattern
 * @param severity the alert severity
 * @param identifier the offending identifier
 * @param evidence the violations that triggered the alert, oldest first
 * @param summary derived figures for the evidence (violation count, threshold, window, endpoints)
 * @param detectedAt when the pattern was detected
 */
public record SecurityAlert(
        AlertType type,
        AlertSeverity severity,
        String identifier,
        List<Violation> evidence,
        Map<String, Object> summary,
        Instant detectedAt) {

    public SecurityAlert {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(identifier, "identifier must not be null");
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        summary = summary != null ? Map.copyOf(summary) : Map.of();
        detectedAt = detectedAt != null ? detectedAt : Instant.now();
    }
}
