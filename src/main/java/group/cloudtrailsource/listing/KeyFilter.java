package group.cloudtrailsource.listing;

import group.cloudtrailsource.config.Interval;
import group.cloudtrailsource.source.FileReference;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts object keys that name CloudTrail files inside the configured window.
 * The window is compared against the timestamp CloudTrail embeds in the file name;
 * keys without one are kept.
 */
public class KeyFilter {

    private static final Pattern KEY_TIMESTAMP_PATTERN = Pattern.compile(".*_CloudTrail_[^_]+_([^_]+)Z_");

    private final String startTimestamp;
    private final String endTimestamp;

    public KeyFilter(Interval interval) {
        this.startTimestamp = interval.startKeyTimestamp();
        this.endTimestamp = interval.endKeyTimestamp();
    }

    public boolean accept(String key) {
        if (!FileReference.isCloudTrailFile(key)) {
            return false;
        }
        if (startTimestamp == null && endTimestamp == null) {
            return true;
        }

        String keyTimestamp = extractTimestamp(key);
        if (keyTimestamp == null) {
            return true;
        }
        if (startTimestamp != null && keyTimestamp.compareTo(startTimestamp) < 0) {
            return false;
        }
        return endTimestamp == null || keyTimestamp.compareTo(endTimestamp) <= 0;
    }

    static String extractTimestamp(String key) {
        Matcher matcher = KEY_TIMESTAMP_PATTERN.matcher(key);
        return matcher.lookingAt() ? matcher.group(1) : null;
    }
}
