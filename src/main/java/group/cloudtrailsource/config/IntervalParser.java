package group.cloudtrailsource.config;

import group.cloudtrailsource.SourceException;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses interval expressions into an {@link Interval}.
 *
 * Accepted forms:
 * - "" (no window)
 * - a duration such as "30m", "12h", "2d", "1w" or "1d12h": from now minus the duration
 * - an RFC3339 timestamp: from that instant
 * - "A - B" where each side is a duration or an RFC3339 timestamp
 *
 * Durations are always taken relative to the parser's clock.
 */
public class IntervalParser {

    private static final String DURATION = "(?:\\d+[smhdw])+";
    private static final String TIMESTAMP = "\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:Z|[+-]\\d{2}:\\d{2})";
    private static final String TOKEN = "(" + DURATION + "|" + TIMESTAMP + ")";

    private static final Pattern INTERVAL_PATTERN = Pattern.compile("^\\s*" + TOKEN + "\\s*(?:-\\s*" + TOKEN + "\\s*)?$");
    private static final Pattern DURATION_PART = Pattern.compile("(\\d+)([smhdw])");

    private final Clock clock;

    public IntervalParser(Clock clock) {
        this.clock = clock;
    }

    public Interval parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return Interval.UNBOUNDED;
        }

        Matcher matcher = INTERVAL_PATTERN.matcher(expression);
        if (!matcher.matches()) {
            throw SourceException.badConfiguration("config", "invalid interval: \"" + expression + "\"");
        }

        Instant now = clock.instant();
        Instant start = toInstant(matcher.group(1), now, expression);
        Instant end = matcher.group(2) == null ? null : toInstant(matcher.group(2), now, expression);

        if (end != null && end.isBefore(start)) {
            throw SourceException.badConfiguration("config", String.format(
                    "start time %s must be less than end time %s", start, end));
        }
        return new Interval(start, end);
    }

    private static Instant toInstant(String token, Instant now, String expression) {
        try {
            if (token.indexOf('T') >= 0) {
                return OffsetDateTime.parse(token, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
            }
            return now.minus(parseDuration(token));
        } catch (DateTimeException | ArithmeticException | NumberFormatException e) {
            // out of range amounts and instants land here as well as bad dates
            throw new SourceException(SourceException.Kind.BAD_CONFIGURATION, "config",
                    "invalid interval: \"" + expression + "\": " + e.getMessage(), e);
        }
    }

    static Duration parseDuration(String token) {
        Duration total = Duration.ZERO;
        Matcher part = DURATION_PART.matcher(token);
        while (part.find()) {
            long amount = Long.parseLong(part.group(1));
            total = total.plus(switch (part.group(2)) {
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                case "d" -> Duration.ofDays(amount);
                case "w" -> Duration.ofDays(Math.multiplyExact(amount, 7L));
                default -> throw new IllegalArgumentException("Unknown duration unit: " + part.group(2));
            });
        }
        return total;
    }
}
