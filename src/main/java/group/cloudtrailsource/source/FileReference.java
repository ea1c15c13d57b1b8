package group.cloudtrailsource.source;

import java.nio.file.Path;

/**
 * One CloudTrail file to read. The bucket is null for local files.
 */
public record FileReference(
        String bucket,
        String name,
        boolean compressed
) {
    public static final String JSON_SUFFIX = ".json";
    public static final String GZIP_JSON_SUFFIX = ".json.gz";

    public static FileReference local(Path path) {
        String name = path.toString();
        return new FileReference(null, name, isCompressed(name));
    }

    public static FileReference s3(String bucket, String key) {
        return new FileReference(bucket, key, isCompressed(key));
    }

    public boolean isLocal() {
        return bucket == null;
    }

    public static boolean isCompressed(String name) {
        return name.endsWith(GZIP_JSON_SUFFIX);
    }

    /**
     * Only plain and gzipped JSON files hold CloudTrail records; digests and other objects are skipped.
     */
    public static boolean isCloudTrailFile(String name) {
        return name.endsWith(JSON_SUFFIX) || name.endsWith(GZIP_JSON_SUFFIX);
    }

    @Override
    public String toString() {
        return bucket == null ? name : "s3://" + bucket + "/" + name;
    }
}
