package group.cloudtrailsource.producer;

/**
 * Why a pull produced no record but the caller should simply pull again.
 */
public enum SkipReason {
    EMPTY_POLL,
    CORRUPT_FILE,
    MALFORMED_RECORD,
    MISSING_EVENT_TIME,
    MISSING_EVENT_TYPE,
    INSIGHT_EVENT
}
