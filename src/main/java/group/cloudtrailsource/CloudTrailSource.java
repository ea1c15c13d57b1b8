package group.cloudtrailsource;

import com.fasterxml.jackson.databind.ObjectMapper;
import group.cloudtrailsource.config.Interval;
import group.cloudtrailsource.config.IntervalParser;
import group.cloudtrailsource.config.SourceConfig;
import group.cloudtrailsource.download.LocalFileReader;
import group.cloudtrailsource.download.S3BatchDownloader;
import group.cloudtrailsource.listing.KeyLister;
import group.cloudtrailsource.producer.EventProducer;
import group.cloudtrailsource.producer.RecordParser;
import group.cloudtrailsource.queue.NotificationPoller;
import group.cloudtrailsource.source.FileReference;
import group.cloudtrailsource.source.Origin;
import group.cloudtrailsource.source.OriginKind;
import group.cloudtrailsource.source.SourceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sqs.SqsClient;

import java.time.Clock;
import java.util.List;

/**
 * Opens CloudTrail source sessions.
 *
 * Configuration is validated before the first network call. Opening an S3 session lists every
 * matching key up front; opening a queue session resolves the queue and polls it once.
 */
public class CloudTrailSource {

    private static final Logger logger = LoggerFactory.getLogger(CloudTrailSource.class);

    private final S3Client s3Client;
    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CloudTrailSource() {
        this(
                Dependencies.getInstance().getS3Client(),
                Dependencies.getInstance().getSqsClient(),
                Dependencies.getInstance().getObjectMapper(),
                Dependencies.getInstance().getClock()
        );
    }

    public CloudTrailSource(S3Client s3Client, SqsClient sqsClient, ObjectMapper objectMapper, Clock clock) {
        this.s3Client = s3Client;
        this.sqsClient = sqsClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public EventProducer open(String locator, SourceConfig config) {
        Origin origin = Origin.parse(locator);
        List<String> accountIds = config.accountIds();
        Interval interval = new IntervalParser(clock).parse(config.getInterval());
        if (origin.kind() != OriginKind.LOCAL) {
            config.requirePositiveConcurrency();
        }

        logger.info("Opening {} session for {} with {}", origin.kind(), locator, config);
        SourceResolver resolver = new SourceResolver(s3Client, sqsClient);
        RecordParser parser = new RecordParser(objectMapper);

        if (origin instanceof Origin.Local local) {
            List<FileReference> files = resolver.enumerateLocal(local.root());
            return new EventProducer(origin.kind(), files, new LocalFileReader(), null, parser);
        }

        if (origin instanceof Origin.S3Direct s3) {
            List<String> roots = resolver.listingRoots(s3.bucket(), s3.prefix(), accountIds);
            KeyLister lister = new KeyLister(s3Client, config.getDownloadConcurrency());
            List<FileReference> files = lister.listFiles(s3.bucket(), roots, s3.prefix(), interval);
            if (files.isEmpty()) {
                logger.warn("No CloudTrail files found in s3://{}/{}", s3.bucket(), s3.prefix());
            }
            return new EventProducer(origin.kind(), files,
                    new S3BatchDownloader(s3Client, config.getDownloadConcurrency()), null, parser);
        }

        Origin.S3ViaQueue queue = (Origin.S3ViaQueue) origin;
        String queueUrl = resolver.resolveQueueUrl(queue.queueName(), config.getSqsOwnerAccount());
        NotificationPoller poller = new NotificationPoller(sqsClient, objectMapper, queueUrl,
                config.isSqsDelete(), config.isUseS3Sns());
        List<FileReference> files = poller.poll();
        logger.info("Initial poll of {} announced {} files", queueUrl, files.size());
        return new EventProducer(origin.kind(), files,
                new S3BatchDownloader(s3Client, config.getDownloadConcurrency()), poller, parser);
    }
}
