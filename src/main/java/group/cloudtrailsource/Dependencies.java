package group.cloudtrailsource;

import com.fasterxml.jackson.databind.ObjectMapper;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sqs.SqsClient;

import java.time.Clock;

/**
 * Lightweight dependency injection container for CloudTrail source sessions.
 * Uses singleton pattern so AWS clients are shared by every session opened in the same
 * process (or Lambda execution environment) instead of being rebuilt per session.
 */
public class Dependencies {
    private static volatile Dependencies instance;

    private final S3Client s3Client;
    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Private constructor for singleton pattern.
     * Clients pick up region and credentials from the default provider chains.
     */
    private Dependencies() {
        this.s3Client = S3Client.create();
        this.sqsClient = SqsClient.create();
        this.objectMapper = new ObjectMapper();
        this.clock = Clock.systemUTC();
    }

    /**
     * Get the singleton instance of Dependencies.
     * Uses double-checked locking for thread-safe lazy initialization.
     *
     * @return the singleton Dependencies instance
     */
    public static Dependencies getInstance() {
        if (instance == null) {
            synchronized (Dependencies.class) {
                if (instance == null) {
                    instance = new Dependencies();
                }
            }
        }
        return instance;
    }

    public S3Client getS3Client() {
        return s3Client;
    }

    public SqsClient getSqsClient() {
        return sqsClient;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public Clock getClock() {
        return clock;
    }
}
