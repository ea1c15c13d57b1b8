package group.cloudtrailsource.codec;

import java.nio.ByteBuffer;

/**
 * The records of one file, kept as byte ranges over the file content.
 * Records are read once, in file order.
 */
public class RecordBuffer {

    public static final RecordBuffer EMPTY = new RecordBuffer(new byte[0], new int[0], new int[0], 0);

    private final byte[] content;
    private final int[] starts;
    private final int[] ends;
    private final int size;
    private int position = 0;

    RecordBuffer(byte[] content, int[] starts, int[] ends, int size) {
        this.content = content;
        this.starts = starts;
        this.ends = ends;
        this.size = size;
    }

    public int size() {
        return size;
    }

    public boolean hasRemaining() {
        return position < size;
    }

    /**
     * Returns the next record as a read-only view over the file content and advances past it.
     */
    public ByteBuffer next() {
        if (!hasRemaining()) {
            throw new IllegalStateException("No records left (" + size + " read)");
        }
        ByteBuffer record = ByteBuffer.wrap(content, starts[position], ends[position] - starts[position])
                .slice()
                .asReadOnlyBuffer();
        position++;
        return record;
    }

    /**
     * Range of record {@code i} as {start, endExclusive} offsets into the file content.
     */
    int[] range(int i) {
        return new int[]{starts[i], ends[i]};
    }
}
