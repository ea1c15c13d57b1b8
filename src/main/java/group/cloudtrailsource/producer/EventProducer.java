package group.cloudtrailsource.producer;

import group.cloudtrailsource.codec.Decompressor;
import group.cloudtrailsource.codec.RecordBuffer;
import group.cloudtrailsource.codec.RecordSplitter;
import group.cloudtrailsource.download.FileFetcher;
import group.cloudtrailsource.queue.NotificationPoller;
import group.cloudtrailsource.source.FileReference;
import group.cloudtrailsource.source.OriginKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Pull side of a CloudTrail source session: every call to {@link #next()} yields at most one record.
 *
 * Files are opened in list order and their records handed out in file order. Local and direct S3
 * sessions end with END_OF_STREAM once every file is consumed, and keep returning it. Queue sessions
 * never end: when the known files run out they poll the queue, and an empty poll is TRY_AGAIN.
 *
 * Not thread safe; a session has a single owner that serialises its pulls.
 */
public class EventProducer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventProducer.class);

    private final OriginKind originKind;
    private final List<FileReference> files;
    private final FileFetcher fetcher;
    private final NotificationPoller poller;
    private final RecordParser parser;

    private int nextFile = 0;
    private RecordBuffer current = RecordBuffer.EMPTY;
    private boolean endOfStream = false;
    private boolean closed = false;

    /**
     * @param poller the queue to poll for more files, or null unless the origin is S3_VIA_QUEUE
     */
    public EventProducer(OriginKind originKind, List<FileReference> initialFiles, FileFetcher fetcher,
                         NotificationPoller poller, RecordParser parser) {
        if ((originKind == OriginKind.S3_VIA_QUEUE) != (poller != null)) {
            throw new IllegalArgumentException("A notification poller is required for, and only for, queue origins");
        }
        this.originKind = originKind;
        this.files = new ArrayList<>(initialFiles);
        this.fetcher = fetcher;
        this.poller = poller;
        this.parser = parser;
    }

    public PullResult next() {
        if (closed) {
            throw new IllegalStateException("Session is closed");
        }
        if (endOfStream) {
            return PullResult.endOfStream();
        }

        while (!current.hasRemaining()) {
            if (nextFile >= files.size()) {
                if (poller == null) {
                    logger.info("All {} files consumed", files.size());
                    endOfStream = true;
                    return PullResult.endOfStream();
                }

                List<FileReference> announced = poller.poll();
                if (announced.isEmpty()) {
                    return PullResult.tryAgain(SkipReason.EMPTY_POLL);
                }
                files.addAll(announced);
                continue;
            }

            if (!openNextFile()) {
                return PullResult.tryAgain(SkipReason.CORRUPT_FILE);
            }
        }

        return parser.parse(current.next());
    }

    /**
     * Reads, inflates and splits the next file.
     *
     * @return false if the file could not be inflated; it is skipped either way
     */
    private boolean openNextFile() {
        int index = nextFile++;
        FileReference file = files.get(index);
        byte[] data = fetcher.fetch(files, index);

        try {
            data = Decompressor.decode(file, data);
        } catch (IOException e) {
            logger.warn("Skipping corrupt compressed file {}: {}", file, e.getMessage());
            current = RecordBuffer.EMPTY;
            return false;
        }

        current = RecordSplitter.split(data);
        logger.debug("Opened {} with {} records", file, current.size());
        return true;
    }

    public OriginKind getOriginKind() {
        return originKind;
    }

    /**
     * Files discovered so far, in the order they are read.
     */
    public List<FileReference> getFiles() {
        return List.copyOf(files);
    }

    public int getNextFileIndex() {
        return nextFile;
    }

    @Override
    public void close() {
        closed = true;
        current = RecordBuffer.EMPTY;
    }
}
