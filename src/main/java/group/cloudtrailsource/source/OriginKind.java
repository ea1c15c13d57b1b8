package group.cloudtrailsource.source;

public enum OriginKind {
    LOCAL,
    S3_DIRECT,
    S3_VIA_QUEUE
}
