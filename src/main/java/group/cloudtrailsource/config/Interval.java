package group.cloudtrailsource.config;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Time window used to prune CloudTrail object keys. Either bound may be absent.
 */
public record Interval(
        Instant start,
        Instant end
) {
    public static final Interval UNBOUNDED = new Interval(null, null);

    private static final DateTimeFormatter DATE_PATH_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd/").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter KEY_TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmm").withZone(ZoneOffset.UTC);

    public boolean hasStart() {
        return start != null;
    }

    public boolean hasEnd() {
        return end != null;
    }

    public boolean isUnbounded() {
        return start == null && end == null;
    }

    /**
     * The start bound as a CloudTrail date path, e.g. "2024/01/15/".
     * Appended to a region prefix it makes a StartAfter marker that skips earlier days.
     */
    public String startDatePath() {
        return start == null ? null : DATE_PATH_FORMAT.format(start);
    }

    /**
     * The start bound in the minute resolution CloudTrail embeds in object names, e.g. "20240115T1030".
     */
    public String startKeyTimestamp() {
        return start == null ? null : KEY_TIMESTAMP_FORMAT.format(start);
    }

    public String endKeyTimestamp() {
        return end == null ? null : KEY_TIMESTAMP_FORMAT.format(end);
    }
}
