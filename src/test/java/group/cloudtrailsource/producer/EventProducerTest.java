package group.cloudtrailsource.producer;

import com.fasterxml.jackson.databind.ObjectMapper;
import group.cloudtrailsource.SourceException;
import group.cloudtrailsource.download.FileFetcher;
import group.cloudtrailsource.queue.NotificationPoller;
import group.cloudtrailsource.source.FileReference;
import group.cloudtrailsource.source.OriginKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static group.cloudtrailsource.CloudTrailFixtures.envelopeBytes;
import static group.cloudtrailsource.CloudTrailFixtures.gzip;
import static group.cloudtrailsource.CloudTrailFixtures.insightRecord;
import static group.cloudtrailsource.CloudTrailFixtures.record;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventProducerTest {

    private static final String BUCKET = "trail-bucket";

    private final RecordParser parser = new RecordParser(new ObjectMapper());
    private final Map<String, byte[]> contents = new HashMap<>();
    private final List<Integer> fetchedIndexes = new ArrayList<>();
    private final FileFetcher fetcher = (files, index) -> {
        fetchedIndexes.add(index);
        return contents.get(files.get(index).name());
    };

    @Mock
    private NotificationPoller poller;

    // ============================================================================
    // FINITE SESSION TESTS
    // ============================================================================

    @Test
    void testRecordsComeOutInFileOrderThenEndOfStream() {
        // Given: Two files, one compressed
        FileReference first = file("a.json.gz", gzip(envelopeBytes(
                record("GetObject", "2024-01-15T10:00:00Z"),
                record("PutObject", "2024-01-15T10:00:01Z"))));
        FileReference second = file("b.json", envelopeBytes(record("DeleteObject", "2024-01-15T10:00:02Z")));
        EventProducer producer = new EventProducer(OriginKind.S3_DIRECT, List.of(first, second), fetcher, null, parser);

        // When: Draining the session
        List<String> names = drainEventNames(producer);

        // Then: File order, then record order
        assertEquals(List.of("GetObject", "PutObject", "DeleteObject"), names);
        assertEquals(List.of(0, 1), fetchedIndexes);
        assertEquals(2, producer.getNextFileIndex());
    }

    @Test
    void testEndOfStreamIsSticky() {
        EventProducer producer = new EventProducer(OriginKind.LOCAL,
                List.of(file("a.json", envelopeBytes(record("GetObject", "2024-01-15T10:00:00Z")))),
                fetcher, null, parser);

        assertTrue(producer.next().hasRecord());
        assertTrue(producer.next().isEndOfStream());
        assertTrue(producer.next().isEndOfStream());
        assertTrue(producer.next().isEndOfStream());
        assertEquals(List.of(0), fetchedIndexes);
    }

    @Test
    void testEmptySessionEndsImmediately() {
        EventProducer producer = new EventProducer(OriginKind.S3_DIRECT, List.of(), fetcher, null, parser);

        assertSame(PullResult.endOfStream(), producer.next());
    }

    @Test
    void testFileWithoutRecordsIsPassedOverWithinOnePull() {
        // Given: An empty envelope followed by a file with one record
        FileReference empty = file("empty.json", envelopeBytes());
        FileReference full = file("full.json", envelopeBytes(record("GetObject", "2024-01-15T10:00:00Z")));
        EventProducer producer = new EventProducer(OriginKind.S3_DIRECT, List.of(empty, full), fetcher, null, parser);

        // When: Pulling once
        PullResult result = producer.next();

        // Then: The record of the second file is returned
        assertTrue(result.hasRecord());
        assertEquals(List.of(0, 1), fetchedIndexes);
    }

    @Test
    void testCorruptGzipIsSkippedAndReadingContinues() {
        // Given: A .json.gz file holding plain text, then a valid file
        FileReference corrupt = file("corrupt.json.gz", envelopeBytes(record("Lost", "2024-01-15T10:00:00Z")));
        FileReference valid = file("valid.json", envelopeBytes(record("GetObject", "2024-01-15T10:00:00Z")));
        EventProducer producer = new EventProducer(OriginKind.S3_DIRECT, List.of(corrupt, valid), fetcher, null, parser);

        // When / Then: One TRY_AGAIN for the corrupt file, then the next file's record
        PullResult skipped = producer.next();
        assertTrue(skipped.isTryAgain());
        assertEquals(SkipReason.CORRUPT_FILE, skipped.skipReason());

        PullResult next = producer.next();
        assertTrue(next.hasRecord());
        assertTrue(next.event().json().contains("GetObject"));
        assertTrue(producer.next().isEndOfStream());
    }

    @Test
    void testSkippedRecordsAreReportedOnePerPull() {
        FileReference mixed = file("mixed.json", envelopeBytes(
                insightRecord("2024-01-15T10:00:00Z"),
                record("GetObject", "2024-01-15T10:00:01Z")));
        EventProducer producer = new EventProducer(OriginKind.LOCAL, List.of(mixed), fetcher, null, parser);

        assertEquals(SkipReason.INSIGHT_EVENT, producer.next().skipReason());
        assertTrue(producer.next().hasRecord());
        assertTrue(producer.next().isEndOfStream());
    }

    @Test
    void testFetchFailureIsPropagated() {
        FileFetcher failing = (files, index) -> {
            throw SourceException.noInput("downloader", "file vanished: " + files.get(index).name());
        };
        EventProducer producer = new EventProducer(OriginKind.LOCAL,
                List.of(FileReference.local(Path.of("/tmp/missing.json"))), failing, null, parser);

        SourceException e = assertThrows(SourceException.class, producer::next);

        assertEquals(SourceException.Kind.NO_INPUT, e.getKind());
        assertEquals(1, producer.getNextFileIndex());
    }

    // ============================================================================
    // QUEUE SESSION TESTS
    // ============================================================================

    @Test
    void testQueueSessionNeverEnds() {
        // Given: A queue that stays empty
        when(poller.poll()).thenReturn(List.of());
        EventProducer producer = new EventProducer(OriginKind.S3_VIA_QUEUE, List.of(), fetcher, poller, parser);

        // When / Then: Every pull is TRY_AGAIN with an empty poll
        for (int i = 0; i < 5; i++) {
            PullResult result = producer.next();
            assertTrue(result.isTryAgain());
            assertEquals(SkipReason.EMPTY_POLL, result.skipReason());
        }
        verify(poller, times(5)).poll();
    }

    @Test
    void testQueueSessionAppendsAnnouncedFiles() {
        // Given: A first poll announcing one file, then silence
        FileReference announced = file("new.json.gz", gzip(envelopeBytes(
                record("GetObject", "2024-01-15T10:00:00Z"))));
        when(poller.poll()).thenReturn(List.of(announced)).thenReturn(List.of());
        EventProducer producer = new EventProducer(OriginKind.S3_VIA_QUEUE, List.of(), fetcher, poller, parser);

        // When: Pulling
        PullResult first = producer.next();
        PullResult second = producer.next();

        // Then: The announced file is read, then the queue is polled again
        assertTrue(first.hasRecord());
        assertEquals(SkipReason.EMPTY_POLL, second.skipReason());
        assertEquals(List.of(announced), producer.getFiles());
    }

    @Test
    void testQueueSessionReadsInitialFilesBeforePolling() {
        FileReference initial = file("initial.json", envelopeBytes(record("GetObject", "2024-01-15T10:00:00Z")));
        EventProducer producer = new EventProducer(OriginKind.S3_VIA_QUEUE, List.of(initial), fetcher, poller, parser);

        assertTrue(producer.next().hasRecord());
        verifyNoInteractions(poller);
    }

    // ============================================================================
    // LIFECYCLE TESTS
    // ============================================================================

    @Test
    void testPullAfterCloseFails() {
        EventProducer producer = new EventProducer(OriginKind.LOCAL, List.of(), fetcher, null, parser);
        producer.close();

        assertThrows(IllegalStateException.class, producer::next);
    }

    @Test
    void testPollerMustMatchOrigin() {
        assertThrows(IllegalArgumentException.class,
                () -> new EventProducer(OriginKind.S3_VIA_QUEUE, List.of(), fetcher, null, parser));
        assertThrows(IllegalArgumentException.class,
                () -> new EventProducer(OriginKind.S3_DIRECT, List.of(), fetcher, poller, parser));
    }

    private FileReference file(String key, byte[] data) {
        contents.put(key, data);
        return FileReference.s3(BUCKET, key);
    }

    private static List<String> drainEventNames(EventProducer producer) {
        List<String> names = new ArrayList<>();
        ObjectMapper objectMapper = new ObjectMapper();
        for (PullResult result = producer.next(); !result.isEndOfStream(); result = producer.next()) {
            if (result.hasRecord()) {
                try {
                    names.add(objectMapper.readTree(result.event().bytes()).get("eventName").asText());
                } catch (IOException e) {
                    fail(new String(result.event().bytes(), StandardCharsets.UTF_8));
                }
            }
        }
        return names;
    }
}
