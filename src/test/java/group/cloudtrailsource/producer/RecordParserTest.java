package group.cloudtrailsource.producer;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static group.cloudtrailsource.CloudTrailFixtures.insightRecord;
import static group.cloudtrailsource.CloudTrailFixtures.record;
import static org.junit.jupiter.api.Assertions.*;

class RecordParserTest {

    private final RecordParser parser = new RecordParser(new ObjectMapper());

    @Test
    void testEmitsRecordWithOriginalBytesAndEventTime() {
        // Given: A regular API call record
        String json = record("GetObject", "2024-01-15T10:30:15Z");

        // When: Parsing
        PullResult result = parser.parse(buffer(json));

        // Then: The record bytes are untouched and the time is in nanoseconds
        assertTrue(result.hasRecord());
        assertEquals(json, result.event().json());
        assertEquals(Instant.parse("2024-01-15T10:30:15Z").getEpochSecond() * 1_000_000_000L,
                result.event().timestampNanos());
    }

    @Test
    void testFractionalSecondsAndOffsetsAreHonoured() {
        PullResult result = parser.parse(buffer(record("GetObject", "2024-01-15T12:30:15.123456789+02:00")));

        assertTrue(result.hasRecord());
        assertEquals(RecordParser.toEpochNanos(Instant.parse("2024-01-15T10:30:15.123456789Z")),
                result.event().timestampNanos());
    }

    @Test
    void testFractionWithFewerDigitsIsAccepted() {
        PullResult result = parser.parse(buffer(record("GetObject", "2024-01-15T10:30:15.5Z")));

        assertTrue(result.hasRecord());
        assertEquals(RecordParser.toEpochNanos(Instant.parse("2024-01-15T10:30:15.500Z")),
                result.event().timestampNanos());
    }

    @Test
    void testInsightRecordsAreSkipped() {
        PullResult result = parser.parse(buffer(insightRecord("2024-01-15T10:30:15Z")));

        assertTrue(result.isTryAgain());
        assertEquals(SkipReason.INSIGHT_EVENT, result.skipReason());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"eventType\":\"AwsApiCall\"}",
            "{\"eventTime\":12345,\"eventType\":\"AwsApiCall\"}",
            "{\"eventTime\":\"yesterday\",\"eventType\":\"AwsApiCall\"}",
            "{\"eventTime\":\"2024-01-15T10:30Z\",\"eventType\":\"AwsApiCall\"}",
            "{\"eventTime\":\"2024-01-15t10:30:15z\",\"eventType\":\"AwsApiCall\"}",
            "{\"eventTime\":\"2024-01-15T10:30:15\",\"eventType\":\"AwsApiCall\"}",
            "{\"eventTime\":\"2024-02-30T10:30:15Z\",\"eventType\":\"AwsApiCall\"}"
    })
    void testRecordsWithoutUsableEventTimeAreSkipped(String json) {
        PullResult result = parser.parse(buffer(json));

        assertEquals(SkipReason.MISSING_EVENT_TIME, result.skipReason());
    }

    @Test
    void testRecordsWithoutEventTypeAreSkipped() {
        PullResult result = parser.parse(buffer("{\"eventTime\":\"2024-01-15T10:30:15Z\"}"));

        assertEquals(SkipReason.MISSING_EVENT_TYPE, result.skipReason());
    }

    @ParameterizedTest
    @ValueSource(strings = {"{\"eventTime\":", "[1,2]", "\"text\""})
    void testMalformedRecordsAreSkipped(String json) {
        PullResult result = parser.parse(buffer(json));

        assertTrue(result.isTryAgain());
        assertEquals(SkipReason.MALFORMED_RECORD, result.skipReason());
    }

    @Test
    void testParsingDoesNotConsumeTheBuffer() {
        ByteBuffer raw = buffer(record("GetObject", "2024-01-15T10:30:15Z"));
        int remaining = raw.remaining();

        parser.parse(raw);

        assertEquals(remaining, raw.remaining());
    }

    private static ByteBuffer buffer(String json) {
        return ByteBuffer.wrap(json.getBytes(StandardCharsets.UTF_8)).asReadOnlyBuffer();
    }
}
