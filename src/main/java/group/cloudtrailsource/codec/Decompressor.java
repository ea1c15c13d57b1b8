package group.cloudtrailsource.codec;

import group.cloudtrailsource.source.FileReference;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;

/**
 * Inflates gzipped CloudTrail files. Whether a file is compressed is decided by its name only.
 */
public class Decompressor {

    private Decompressor() {
    }

    /**
     * @return the file content, inflated when the file name ends in .json.gz
     * @throws IOException if the compressed stream is corrupt or truncated
     */
    public static byte[] decode(FileReference file, byte[] data) throws IOException {
        if (!file.compressed()) {
            return data;
        }
        return gunzip(data);
    }

    public static byte[] gunzip(byte[] data) throws IOException {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }
}
