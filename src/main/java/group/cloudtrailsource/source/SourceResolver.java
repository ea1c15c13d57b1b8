package group.cloudtrailsource.source;

import group.cloudtrailsource.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Turns an origin into its initial listing plan.
 *
 * CloudTrail writes objects as
 * prefix/AWSLogs/[o-orgid/]AccountID/CloudTrail/Region/YYYY/MM/DD/AccountID_CloudTrail_Region_YYYYMMDDTHHmmZ_Unique.json.gz
 * so the shape of the user's prefix tells whether it points at one account or at a whole organization.
 */
public class SourceResolver {

    private static final Logger logger = LoggerFactory.getLogger(SourceResolver.class);

    static final String CLOUDTRAIL_MARKER = "CloudTrail/";
    private static final String DELIMITER = "/";

    private static final Pattern SINGLE_ACCOUNT_PATTERN = Pattern.compile("(?:^|/)AWSLogs/(?:o-[a-z0-9]{10,32}/)?\\d{12}/?$");
    private static final Pattern ORGANIZATION_PATTERN = Pattern.compile("(?:^|/)AWSLogs(?:/o-[a-z0-9]{10,32})?/?$");

    public enum PrefixShape {
        SINGLE_ACCOUNT,
        ORGANIZATION,
        VERBATIM
    }

    private final S3Client s3Client;
    private final SqsClient sqsClient;

    public SourceResolver(S3Client s3Client, SqsClient sqsClient) {
        this.s3Client = s3Client;
        this.sqsClient = sqsClient;
    }

    public static PrefixShape classify(String prefix) {
        if (SINGLE_ACCOUNT_PATTERN.matcher(prefix).find()) {
            return PrefixShape.SINGLE_ACCOUNT;
        }
        if (ORGANIZATION_PATTERN.matcher(prefix).find()) {
            return PrefixShape.ORGANIZATION;
        }
        return PrefixShape.VERBATIM;
    }

    /**
     * Recursively finds every .json and .json.gz file below the root, sorted by path.
     *
     * @throws SourceException with kind NO_INPUT if the root does not exist or holds no CloudTrail file
     */
    public List<FileReference> enumerateLocal(Path root) {
        if (!Files.exists(root)) {
            throw SourceException.noInput("resolver", "cannot open " + root);
        }

        List<FileReference> files;
        try (Stream<Path> paths = Files.walk(root)) {
            files = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> FileReference.isCloudTrailFile(path.toString()))
                    .sorted()
                    .map(FileReference::local)
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new SourceException(SourceException.Kind.IO, "resolver", "failed to walk " + root + ": " + e.getMessage(), e);
        }

        if (files.isEmpty()) {
            throw SourceException.noInput("resolver", "no json files found in " + root);
        }
        logger.info("Found {} CloudTrail files under {}", files.size(), root);
        return files;
    }

    /**
     * Derives the roots to list for a bucket prefix.
     *
     * A single account prefix gets "CloudTrail/" appended. An organization prefix expands to one
     * ".../Account/CloudTrail/" root per allowed account, or per account discovered by a delimited
     * listing when no allow-list is given. Any other prefix is listed as is.
     */
    public List<String> listingRoots(String bucket, String prefix, List<String> accountIds) {
        List<String> roots = new ArrayList<>();
        String normalized = prefix.endsWith(DELIMITER) || prefix.isEmpty() ? prefix : prefix + DELIMITER;

        switch (classify(prefix)) {
            case SINGLE_ACCOUNT -> roots.add(normalized + CLOUDTRAIL_MARKER);
            case ORGANIZATION -> {
                if (!accountIds.isEmpty()) {
                    for (String account : accountIds) {
                        roots.add(normalized + account + DELIMITER + CLOUDTRAIL_MARKER);
                    }
                } else {
                    roots.addAll(discoverAccountRoots(bucket, normalized));
                }
            }
            case VERBATIM -> roots.add(prefix);
        }

        logger.info("Derived {} listing roots for s3://{}/{}", roots.size(), bucket, prefix);
        return roots;
    }

    private List<String> discoverAccountRoots(String bucket, String organizationPrefix) {
        List<String> roots = new ArrayList<>();
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(organizationPrefix)
                .delimiter(DELIMITER)
                .build();

        try {
            for (CommonPrefix commonPrefix : s3Client.listObjectsV2Paginator(request).commonPrefixes()) {
                String accountPrefix = commonPrefix.prefix();
                if (SINGLE_ACCOUNT_PATTERN.matcher(accountPrefix).find()) {
                    roots.add(accountPrefix + CLOUDTRAIL_MARKER);
                } else {
                    logger.debug("Ignoring non-account prefix {}", accountPrefix);
                }
            }
        } catch (SdkException e) {
            throw SourceException.remote("resolver", "failed to list accounts", e);
        }

        if (roots.isEmpty()) {
            logger.warn("No account prefixes found under s3://{}/{}", bucket, organizationPrefix);
        }
        return roots;
    }

    /**
     * Resolves a queue name, optionally owned by another account, to its URL.
     */
    public String resolveQueueUrl(String queueName, String ownerAccount) {
        GetQueueUrlRequest.Builder request = GetQueueUrlRequest.builder().queueName(queueName);
        if (ownerAccount != null && !ownerAccount.isEmpty()) {
            request.queueOwnerAWSAccountId(ownerAccount);
        }

        try {
            String queueUrl = sqsClient.getQueueUrl(request.build()).queueUrl();
            logger.info("Resolved queue {} to {}", queueName, queueUrl);
            return queueUrl;
        } catch (SdkException e) {
            throw SourceException.remote("resolver", "failed to resolve queue " + queueName, e);
        }
    }
}
