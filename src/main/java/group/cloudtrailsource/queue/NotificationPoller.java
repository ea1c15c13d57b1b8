package group.cloudtrailsource.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import group.cloudtrailsource.S3Utils;
import group.cloudtrailsource.SourceException;
import group.cloudtrailsource.source.FileReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;

import java.util.List;

/**
 * Reads "new CloudTrail files" notifications from an SQS queue, one message per poll.
 *
 * When deleting on read, the message is deleted right after it is received and before its
 * payload is parsed. A message that fails to parse, or a crash in between, is not redelivered.
 */
public class NotificationPoller {

    private static final Logger logger = LoggerFactory.getLogger(NotificationPoller.class);

    private static final String ALL_ATTRIBUTES = "All";

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final String queueUrl;
    private final boolean deleteOnRead;
    private final boolean useS3Sns;

    public NotificationPoller(SqsClient sqsClient, ObjectMapper objectMapper, String queueUrl, boolean deleteOnRead, boolean useS3Sns) {
        this.sqsClient = sqsClient;
        this.objectMapper = objectMapper;
        this.queueUrl = queueUrl;
        this.deleteOnRead = deleteOnRead;
        this.useS3Sns = useS3Sns;
    }

    /**
     * @return the files announced by the next message, or an empty list if the queue had none
     */
    public List<FileReference> poll() {
        ReceiveMessageRequest request = ReceiveMessageRequest.builder()
                .queueUrl(queueUrl)
                .maxNumberOfMessages(1)
                .messageAttributeNames(ALL_ATTRIBUTES)
                .build();

        ReceiveMessageResponse response;
        try {
            response = sqsClient.receiveMessage(request);
        } catch (SdkException e) {
            throw SourceException.remote("queue", "failed to receive message", e);
        }

        if (!response.hasMessages() || response.messages().isEmpty()) {
            return List.of();
        }

        Message message = response.messages().get(0);
        if (deleteOnRead) {
            delete(message);
        }

        List<FileReference> files = S3Utils.extractFilesFromNotification(message.body(), useS3Sns, objectMapper);
        logger.debug("Message {} announced {} CloudTrail files", message.messageId(), files.size());
        return files;
    }

    private void delete(Message message) {
        DeleteMessageRequest request = DeleteMessageRequest.builder()
                .queueUrl(queueUrl)
                .receiptHandle(message.receiptHandle())
                .build();
        try {
            sqsClient.deleteMessage(request);
        } catch (SdkException e) {
            throw SourceException.remote("queue", "failed to delete message " + message.messageId(), e);
        }
    }
}
