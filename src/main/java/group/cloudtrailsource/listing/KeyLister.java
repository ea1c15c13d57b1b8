package group.cloudtrailsource.listing;

import group.cloudtrailsource.FanOut;
import group.cloudtrailsource.SourceException;
import group.cloudtrailsource.config.Interval;
import group.cloudtrailsource.source.FileReference;
import group.cloudtrailsource.source.ListingCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Lists the CloudTrail object keys of a bucket.
 *
 * Roots ending in "/CloudTrail/" are expanded into one cursor per region prefix. Cursors are
 * listed in chunks of at most {@code concurrency} concurrent workers; each worker collects its
 * own keys and the chunk is merged, in cursor order, only once every worker has finished.
 */
public class KeyLister {

    private static final Logger logger = LoggerFactory.getLogger(KeyLister.class);

    private static final String REGION_MARKER = "/CloudTrail/";
    private static final String DELIMITER = "/";

    private final S3Client s3Client;
    private final int concurrency;

    public KeyLister(S3Client s3Client, int concurrency) {
        this.s3Client = s3Client;
        this.concurrency = concurrency;
    }

    /**
     * @param bucket the bucket to list
     * @param roots listing roots derived from the user's prefix
     * @param userPrefix the prefix as given, listed verbatim when no region prefix is found
     * @param interval window used for StartAfter markers and key filtering
     */
    public List<FileReference> listFiles(String bucket, List<String> roots, String userPrefix, Interval interval) {
        List<ListingCursor> cursors = regionCursors(bucket, roots, interval);
        if (cursors.isEmpty()) {
            logger.info("No region prefixes found, listing s3://{}/{} as is", bucket, userPrefix);
            cursors = List.of(new ListingCursor(userPrefix, null));
        }

        KeyFilter filter = new KeyFilter(interval);
        List<FileReference> files = new ArrayList<>();
        List<List<ListingCursor>> chunks = chunk(cursors, concurrency);
        for (int i = 0; i < chunks.size(); i++) {
            List<Callable<List<FileReference>>> workers = new ArrayList<>();
            for (ListingCursor cursor : chunks.get(i)) {
                workers.add(() -> listCursor(bucket, cursor, filter));
            }

            List<List<FileReference>> results = FanOut.runWave("lister", workers);
            results.forEach(files::addAll);
            logger.debug("Listing chunk {} of {} done, {} files so far", i + 1, chunks.size(), files.size());
        }

        logger.info("Listed {} CloudTrail files from {} cursors in s3://{}", files.size(), cursors.size(), bucket);
        return files;
    }

    List<ListingCursor> regionCursors(String bucket, List<String> roots, Interval interval) {
        List<ListingCursor> cursors = new ArrayList<>();
        for (String root : roots) {
            if (!root.endsWith(REGION_MARKER)) {
                continue;
            }

            ListObjectsV2Request request = ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(root)
                    .delimiter(DELIMITER)
                    .build();
            try {
                for (CommonPrefix region : s3Client.listObjectsV2Paginator(request).commonPrefixes()) {
                    String startAfter = interval.hasStart() ? region.prefix() + interval.startDatePath() : null;
                    cursors.add(new ListingCursor(region.prefix(), startAfter));
                }
            } catch (SdkException e) {
                throw SourceException.remote("lister", "failed to list regions under " + root, e);
            }
        }
        return cursors;
    }

    private List<FileReference> listCursor(String bucket, ListingCursor cursor, KeyFilter filter) {
        List<FileReference> files = new ArrayList<>();
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(cursor.prefix())
                .startAfter(cursor.startAfter())
                .build();

        try {
            for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
                if (filter.accept(object.key())) {
                    files.add(FileReference.s3(bucket, object.key()));
                }
            }
        } catch (SdkException e) {
            throw SourceException.remote("lister", "failed to list objects under " + cursor.prefix(), e);
        }
        return files;
    }

    static <T> List<List<T>> chunk(List<T> items, int chunkSize) {
        List<List<T>> chunks = new ArrayList<>();
        if (items.isEmpty() || chunkSize < 1) {
            return chunks;
        }
        for (int i = 0; i < items.size(); i += chunkSize) {
            chunks.add(items.subList(i, Math.min(i + chunkSize, items.size())));
        }
        return chunks;
    }
}
