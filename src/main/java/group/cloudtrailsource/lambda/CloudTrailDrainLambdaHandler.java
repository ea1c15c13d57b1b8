package group.cloudtrailsource.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import group.cloudtrailsource.CloudTrailSource;
import group.cloudtrailsource.SourceException;
import group.cloudtrailsource.config.SourceConfig;
import group.cloudtrailsource.producer.EventProducer;
import group.cloudtrailsource.producer.PullResult;
import group.cloudtrailsource.producer.SkipReason;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lambda handler that opens a CloudTrail source session and drains it on a schedule.
 *
 * The event carries the locator, the session options understood by {@link SourceConfig} and an
 * optional record budget. The handler pulls until the budget is spent, the stream ends or the
 * queue has nothing more, and returns a summary of what it saw.
 */
public class CloudTrailDrainLambdaHandler implements RequestHandler<Map<String, Object>, Map<String, Object>> {

    static final int DEFAULT_MAX_RECORDS = 1000;
    static final int PULLS_PER_RECORD = 10;

    private final CloudTrailSource source;

    public CloudTrailDrainLambdaHandler() {
        this(new CloudTrailSource());
    }

    CloudTrailDrainLambdaHandler(CloudTrailSource source) {
        this.source = source;
    }

    @Override
    public Map<String, Object> handleRequest(Map<String, Object> event, Context context) {
        if (!(event.get("locator") instanceof String locator) || locator.isEmpty()) {
            throw new IllegalArgumentException("locator is required");
        }

        int maxRecords = maxRecords(event.get("maxRecords"));
        SourceConfig config = SourceConfig.fromMap(event);
        context.getLogger().log("Draining up to " + maxRecords + " records from " + locator);

        try (EventProducer producer = source.open(locator, config)) {
            return drain(producer, maxRecords, context);
        } catch (SourceException e) {
            context.getLogger().log("Error reading " + locator + ": " + e.getMessage());
            throw new RuntimeException("Failed to drain CloudTrail source", e);
        }
    }

    private Map<String, Object> drain(EventProducer producer, int maxRecords, Context context) {
        int records = 0;
        long pulls = 0;
        long maxPulls = (long) maxRecords * PULLS_PER_RECORD;
        boolean endOfStream = false;
        Long earliest = null;
        Long latest = null;
        Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);

        while (records < maxRecords && pulls < maxPulls) {
            PullResult result = producer.next();
            pulls++;

            if (result.isEndOfStream()) {
                endOfStream = true;
                break;
            }
            if (result.isTryAgain()) {
                skipped.merge(result.skipReason(), 1, Integer::sum);
                if (result.skipReason() == SkipReason.EMPTY_POLL) {
                    break;
                }
                continue;
            }

            long timestamp = result.event().timestampNanos();
            earliest = earliest == null ? timestamp : Math.min(earliest, timestamp);
            latest = latest == null ? timestamp : Math.max(latest, timestamp);
            records++;
        }

        context.getLogger().log(String.format("Read %d records in %d pulls, skipped %s, endOfStream=%s",
                records, pulls, skipped, endOfStream));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("records", records);
        Map<String, Integer> skippedByReason = new LinkedHashMap<>();
        skipped.forEach((reason, count) -> skippedByReason.put(reason.name(), count));
        summary.put("skipped", skippedByReason);
        summary.put("endOfStream", endOfStream);
        summary.put("earliestEventTime", earliest);
        summary.put("latestEventTime", latest);
        return summary;
    }

    private static int maxRecords(Object value) {
        if (value == null) {
            return DEFAULT_MAX_RECORDS;
        }

        long maxRecords;
        try {
            maxRecords = value instanceof Number number ? number.longValue() : Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("maxRecords must be a positive integer, got \"" + value + "\"", e);
        }
        if (maxRecords < 1 || maxRecords > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxRecords must be a positive integer, got " + value);
        }
        return (int) maxRecords;
    }
}
