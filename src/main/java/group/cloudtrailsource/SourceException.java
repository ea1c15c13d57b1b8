package group.cloudtrailsource;

import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Fatal failure of a CloudTrail source session.
 * Carries the subsystem that failed and the kind of failure, so operators can tell
 * missing input apart from remote API failures and bad configuration.
 */
public class SourceException extends RuntimeException {

    public enum Kind {
        NO_INPUT("no input found"),
        REMOTE_API("remote API failure"),
        IO("I/O failure"),
        BAD_CONFIGURATION("bad configuration"),
        PROTOCOL("unexpected message format");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Kind kind;
    private final String subsystem;

    public SourceException(Kind kind, String subsystem, String detail) {
        super(format(kind, subsystem, detail));
        this.kind = kind;
        this.subsystem = subsystem;
    }

    public SourceException(Kind kind, String subsystem, String detail, Throwable cause) {
        super(format(kind, subsystem, detail), cause);
        this.kind = kind;
        this.subsystem = subsystem;
    }

    public Kind getKind() {
        return kind;
    }

    public String getSubsystem() {
        return subsystem;
    }

    public static SourceException noInput(String subsystem, String detail) {
        return new SourceException(Kind.NO_INPUT, subsystem, detail);
    }

    public static SourceException badConfiguration(String subsystem, String detail) {
        return new SourceException(Kind.BAD_CONFIGURATION, subsystem, detail);
    }

    public static SourceException protocol(String subsystem, String detail) {
        return new SourceException(Kind.PROTOCOL, subsystem, detail);
    }

    /**
     * Wraps an AWS SDK failure, preferring the service error code and message when the
     * service answered at all.
     *
     * @param subsystem the subsystem that issued the call
     * @param action what the call was trying to do, e.g. "failed to list objects"
     * @param e the SDK failure
     */
    public static SourceException remote(String subsystem, String action, SdkException e) {
        if (e instanceof AwsServiceException serviceException && serviceException.awsErrorDetails() != null) {
            String detail = serviceException.awsErrorDetails().errorCode() + ": "
                    + serviceException.awsErrorDetails().errorMessage();
            return new SourceException(Kind.REMOTE_API, subsystem, action + ": " + detail, e);
        }
        return new SourceException(Kind.REMOTE_API, subsystem, action + ": " + e.getMessage(), e);
    }

    private static String format(Kind kind, String subsystem, String detail) {
        return subsystem + ": " + kind.getDescription() + ": " + detail;
    }
}
