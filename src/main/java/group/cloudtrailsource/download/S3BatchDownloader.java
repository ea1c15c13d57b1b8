package group.cloudtrailsource.download;

import group.cloudtrailsource.FanOut;
import group.cloudtrailsource.SourceException;
import group.cloudtrailsource.source.FileReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Downloads S3 files in batches of up to {@code concurrency} concurrent fetches.
 *
 * Each batch fills the first slots of a fixed buffer array, one slot per file, starting at the
 * requested file. Later requests inside the batch are served from the slots; a request past
 * the batch starts the next one. A failed fetch does not cancel its siblings but fails the
 * whole batch once all of them have finished.
 */
public class S3BatchDownloader implements FileFetcher {

    private static final Logger logger = LoggerFactory.getLogger(S3BatchDownloader.class);

    private final S3Client s3Client;
    private final byte[][] slots;

    private int batchStart = 0;
    private int filledSlots = 0;

    public S3BatchDownloader(S3Client s3Client, int concurrency) {
        if (concurrency < 1) {
            throw SourceException.badConfiguration("downloader", "download concurrency must be at least 1, got " + concurrency);
        }
        this.s3Client = s3Client;
        this.slots = new byte[concurrency][];
    }

    int capacity() {
        return slots.length;
    }

    @Override
    public byte[] fetch(List<FileReference> files, int index) {
        if (index < batchStart || index >= batchStart + filledSlots) {
            downloadBatch(files, index);
        }

        int slot = index - batchStart;
        byte[] data = slots[slot];
        slots[slot] = null;
        return data;
    }

    private void downloadBatch(List<FileReference> files, int start) {
        int batchSize = Math.min(slots.length, files.size() - start);
        batchStart = start;
        filledSlots = 0;

        List<Callable<byte[]>> fetches = new ArrayList<>(batchSize);
        for (int j = 0; j < batchSize; j++) {
            FileReference file = files.get(start + j);
            fetches.add(() -> download(file));
        }

        logger.debug("Downloading batch of {} files starting at file {}", batchSize, start);
        List<byte[]> bodies = FanOut.runWave("downloader", fetches);
        for (int j = 0; j < batchSize; j++) {
            slots[j] = bodies.get(j);
        }
        filledSlots = batchSize;
    }

    private byte[] download(FileReference file) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(file.bucket())
                .key(file.name())
                .build();

        try (ResponseInputStream<GetObjectResponse> body = s3Client.getObject(request)) {
            return body.readAllBytes();
        } catch (SdkException e) {
            throw SourceException.remote("downloader", "failed to download " + file, e);
        } catch (IOException e) {
            throw new SourceException(SourceException.Kind.IO, "downloader", "failed to read " + file + ": " + e.getMessage(), e);
        }
    }
}
