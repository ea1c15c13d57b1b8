package group.cloudtrailsource.source;

import group.cloudtrailsource.SourceException;

import java.nio.file.Path;

/**
 * Where a session reads CloudTrail files from. Fixed when the session opens.
 *
 * Locators: "s3://bucket[/prefix]", "sqs://queue-name", anything else is a local path.
 */
public interface Origin {

    String S3_SCHEME = "s3://";
    String SQS_SCHEME = "sqs://";

    OriginKind kind();

    record Local(Path root) implements Origin {
        @Override
        public OriginKind kind() {
            return OriginKind.LOCAL;
        }
    }

    record S3Direct(String bucket, String prefix) implements Origin {
        @Override
        public OriginKind kind() {
            return OriginKind.S3_DIRECT;
        }
    }

    record S3ViaQueue(String queueName) implements Origin {
        @Override
        public OriginKind kind() {
            return OriginKind.S3_VIA_QUEUE;
        }
    }

    static Origin parse(String locator) {
        if (locator == null || locator.isEmpty()) {
            throw SourceException.badConfiguration("resolver", "missing input locator");
        }

        if (locator.startsWith(S3_SCHEME)) {
            String path = locator.substring(S3_SCHEME.length());
            int slash = path.indexOf('/');
            String bucket = slash == -1 ? path : path.substring(0, slash);
            String prefix = slash == -1 ? "" : path.substring(slash + 1);
            if (bucket.isEmpty()) {
                throw SourceException.badConfiguration("resolver", "missing bucket name in \"" + locator + "\"");
            }
            return new S3Direct(bucket, prefix);
        }

        if (locator.startsWith(SQS_SCHEME)) {
            String queueName = locator.substring(SQS_SCHEME.length());
            if (queueName.isEmpty()) {
                throw SourceException.badConfiguration("resolver", "missing queue name in \"" + locator + "\"");
            }
            return new S3ViaQueue(queueName);
        }

        return new Local(Path.of(locator));
    }
}
