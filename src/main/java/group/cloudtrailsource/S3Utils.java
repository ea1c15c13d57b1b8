package group.cloudtrailsource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import group.cloudtrailsource.source.FileReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class S3Utils {

    private static final Logger logger = LoggerFactory.getLogger(S3Utils.class);

    private static final String SNS_NOTIFICATION_TYPE = "Notification";

    /**
     * Extracts the CloudTrail files announced by one SQS message body.
     * The body is an SNS envelope whose Message is either a native S3 event
     * ({@code useS3Sns}) or a CloudTrail notification listing a bucket and its new keys.
     *
     * @throws SourceException with kind PROTOCOL when the body is not an SNS notification
     */
    public static List<FileReference> extractFilesFromNotification(String body, boolean useS3Sns, ObjectMapper objectMapper) {
        JsonNode envelope = readTree(body, objectMapper, "SQS message");

        JsonNode type = envelope.get("Type");
        if (type == null) {
            throw SourceException.protocol("queue", "received SQS message that did not have a Type property");
        }
        if (!SNS_NOTIFICATION_TYPE.equals(type.asText())) {
            throw SourceException.protocol("queue", "received SQS message that was not a SNS Notification");
        }

        JsonNode message = envelope.get("Message");
        if (message == null || !message.isTextual()) {
            throw SourceException.protocol("queue", "SNS notification has no Message");
        }

        JsonNode payload = readTree(message.asText(), objectMapper, "SNS message content");
        return useS3Sns ? extractFromS3Event(payload) : extractFromCloudTrailNotification(payload);
    }

    private static List<FileReference> extractFromS3Event(JsonNode s3Event) {
        List<FileReference> files = new ArrayList<>();
        JsonNode records = s3Event.get("Records");
        if (records == null || !records.isArray()) {
            logger.warn("No Records in S3 event notification");
            return files;
        }

        for (JsonNode record : records) {
            JsonNode s3Info = record.get("s3");
            if (s3Info == null || s3Info.path("bucket").path("name").isMissingNode()
                    || s3Info.path("object").path("key").isMissingNode()) {
                logger.warn("No S3 information in record");
                continue;
            }

            String bucketName = s3Info.get("bucket").get("name").asText();
            String objectKey = URLDecoder.decode(s3Info.get("object").get("key").asText(), StandardCharsets.UTF_8);
            addIfCloudTrailFile(files, bucketName, objectKey);
        }
        return files;
    }

    private static List<FileReference> extractFromCloudTrailNotification(JsonNode notification) {
        List<FileReference> files = new ArrayList<>();
        JsonNode bucket = notification.get("s3Bucket");
        JsonNode keys = notification.get("s3ObjectKey");
        if (bucket == null || keys == null || !keys.isArray()) {
            throw SourceException.protocol("queue", "CloudTrail notification must carry s3Bucket and s3ObjectKey");
        }

        for (JsonNode key : keys) {
            addIfCloudTrailFile(files, bucket.asText(), key.asText());
        }
        return files;
    }

    private static void addIfCloudTrailFile(List<FileReference> files, String bucket, String key) {
        if (!FileReference.isCloudTrailFile(key)) {
            logger.debug("Skipping non CloudTrail object s3://{}/{}", bucket, key);
            return;
        }
        files.add(FileReference.s3(bucket, key));
    }

    private static JsonNode readTree(String content, ObjectMapper objectMapper, String what) {
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new SourceException(SourceException.Kind.PROTOCOL, "queue",
                    "error parsing " + what + ": " + e.getOriginalMessage(), e);
        }
    }
}
