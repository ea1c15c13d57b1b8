package group.cloudtrailsource.codec;

import java.util.Arrays;

/**
 * Splits a CloudTrail file into its records without parsing it.
 *
 * CloudTrail files look like
 * <pre>
 * {"Records":[
 *     {...},
 *     {...}
 * ]}
 * </pre>
 * Every object opened at brace depth 1 is a record. The scan only counts braces, so a brace
 * inside a string value would throw the depth off; CloudTrail records are assumed not to
 * contain unbalanced braces in strings.
 */
public class RecordSplitter {

    private static final int INITIAL_CAPACITY = 64;

    private RecordSplitter() {
    }

    public static RecordBuffer split(byte[] content) {
        int[] starts = new int[INITIAL_CAPACITY];
        int[] ends = new int[INITIAL_CAPACITY];
        int count = 0;

        int depth = 0;
        int recordStart = 0;
        for (int pos = 0; pos < content.length; pos++) {
            byte b = content[pos];
            if (b == '{') {
                if (depth == 1) {
                    recordStart = pos;
                }
                depth++;
            } else if (b == '}') {
                depth--;
                // a record cannot end on the envelope's last byte
                if (depth == 1 && pos < content.length - 1) {
                    if (count == starts.length) {
                        starts = Arrays.copyOf(starts, count * 2);
                        ends = Arrays.copyOf(ends, count * 2);
                    }
                    starts[count] = recordStart;
                    ends[count] = pos + 1;
                    count++;
                }
            }
        }

        return count == 0 ? RecordBuffer.EMPTY : new RecordBuffer(content, starts, ends, count);
    }
}
