package group.cloudtrailsource.producer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.util.ByteBufferBackedInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.concurrent.TimeUnit;

/**
 * Reads the two fields needed to emit a raw record: eventTime and eventType.
 * Records without a usable eventTime or eventType, and insight records, are skipped.
 */
public class RecordParser {

    private static final Logger logger = LoggerFactory.getLogger(RecordParser.class);

    static final String INSIGHT_EVENT_TYPE = "AwsCloudTrailInsight";

    // RFC3339: seconds required, optional fraction, upper case 'T' and 'Z' only
    static final DateTimeFormatter RFC3339 = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .appendOffset("+HH:MM", "Z")
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private final ObjectMapper objectMapper;

    public RecordParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PullResult parse(ByteBuffer raw) {
        JsonNode record;
        try (InputStream in = new ByteBufferBackedInputStream(raw.duplicate())) {
            record = objectMapper.readTree(in);
        } catch (IOException e) {
            logger.warn("Skipping record that is not valid JSON: {}", e.getMessage());
            return PullResult.tryAgain(SkipReason.MALFORMED_RECORD);
        }
        if (record == null || !record.isObject()) {
            return PullResult.tryAgain(SkipReason.MALFORMED_RECORD);
        }

        JsonNode eventTime = record.get("eventTime");
        if (eventTime == null || !eventTime.isTextual()) {
            return PullResult.tryAgain(SkipReason.MISSING_EVENT_TIME);
        }

        Instant time;
        try {
            time = OffsetDateTime.parse(eventTime.asText(), RFC3339).toInstant();
        } catch (DateTimeParseException e) {
            logger.debug("Skipping record with unparsable eventTime {}", eventTime.asText());
            return PullResult.tryAgain(SkipReason.MISSING_EVENT_TIME);
        }

        JsonNode eventType = record.get("eventType");
        if (eventType == null || !eventType.isTextual()) {
            return PullResult.tryAgain(SkipReason.MISSING_EVENT_TYPE);
        }
        if (INSIGHT_EVENT_TYPE.equals(eventType.asText())) {
            return PullResult.tryAgain(SkipReason.INSIGHT_EVENT);
        }

        return PullResult.record(new CloudTrailEvent(raw, toEpochNanos(time)));
    }

    static long toEpochNanos(Instant instant) {
        return TimeUnit.SECONDS.toNanos(instant.getEpochSecond()) + instant.getNano();
    }
}
