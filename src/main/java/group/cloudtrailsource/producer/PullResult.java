package group.cloudtrailsource.producer;

/**
 * Outcome of one pull. END_OF_STREAM is terminal; TRY_AGAIN means "nothing this time, pull again".
 */
public record PullResult(
        Status status,
        CloudTrailEvent event,
        SkipReason skipReason
) {
    public enum Status {
        RECORD,
        END_OF_STREAM,
        TRY_AGAIN
    }

    private static final PullResult END_OF_STREAM = new PullResult(Status.END_OF_STREAM, null, null);

    public static PullResult record(CloudTrailEvent event) {
        return new PullResult(Status.RECORD, event, null);
    }

    public static PullResult endOfStream() {
        return END_OF_STREAM;
    }

    public static PullResult tryAgain(SkipReason reason) {
        return new PullResult(Status.TRY_AGAIN, null, reason);
    }

    public boolean hasRecord() {
        return status == Status.RECORD;
    }

    public boolean isEndOfStream() {
        return status == Status.END_OF_STREAM;
    }

    public boolean isTryAgain() {
        return status == Status.TRY_AGAIN;
    }
}
