package io.weatherstreams.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Accumulates arbitrarily chunked event-stream text and splits it into complete blocks.
 *
 * <p>Chunks may end anywhere, including between the two line feeds of a delimiter. After every
 * {@link #append(CharSequence)} all complete blocks are returned in arrival order and at most one
 * incomplete trailing fragment stays buffered. {@code \r\n} and lone {@code \r} line endings are
 * normalized to {@code \n}; a {@code \r} that ends a chunk is held back until the next chunk shows
 * whether it is followed by {@code \n}.
 *
 * <p>Not thread-safe. One instance belongs to exactly one connection.
 */
public final class IncrementalFrameBuffer {

    private final StringBuilder pending = new StringBuilder();
    private boolean pendingCarriageReturn;
    private int scanFrom;

    /**
     * Appends a chunk and extracts the blocks it completes.
     *
     * @param chunk the raw text chunk
     * @return the complete blocks, without delimiters, possibly empty
     */
    public List<String> append(CharSequence chunk) {
        if (chunk == null || chunk.length() == 0) return List.of();

        for (int i = 0; i < chunk.length(); i++) {
            char c = chunk.charAt(i);
            if (pendingCarriageReturn) {
                pendingCarriageReturn = false;
                pending.append('\n');
                if (c == '\n') continue;
            }
            if (c == '\r') {
                pendingCarriageReturn = true;
            } else {
                pending.append(c);
            }
        }
        return drainComplete();
    }

    /**
     * Signals end of input and returns the unterminated remainder, if any.
     *
     * <p>The server may omit the delimiter after its last message; such a remainder is emitted once
     * as a final block. The buffer is empty afterwards.
     *
     * @return the final block, or empty if nothing but whitespace was buffered
     */
    public Optional<String> finish() {
        if (pendingCarriageReturn) {
            pendingCarriageReturn = false;
            pending.append('\n');
        }
        List<String> complete = drainComplete();
        String rest = pending.toString();
        pending.setLength(0);
        scanFrom = 0;

        if (!complete.isEmpty()) {
            // a held-back \r completed one last delimiter
            return Optional.of(complete.get(complete.size() - 1));
        }
        return rest.isBlank() ? Optional.empty() : Optional.of(rest);
    }

    /** @return the number of buffered characters not yet emitted */
    public int bufferedLength() {
        return pending.length() + (pendingCarriageReturn ? 1 : 0);
    }

    private List<String> drainComplete() {
        List<String> blocks = null;
        int blockStart = 0;
        int idx;
        while ((idx = pending.indexOf(Protocol.FRAME_DELIMITER, Math.max(scanFrom, blockStart))) >= 0) {
            String block = pending.substring(blockStart, idx);
            blockStart = idx + Protocol.FRAME_DELIMITER.length();
            if (!block.isBlank()) {
                if (blocks == null) blocks = new ArrayList<>();
                blocks.add(block);
            }
        }
        if (blockStart > 0) {
            pending.delete(0, blockStart);
        }
        // a delimiter may straddle the next append, so rescan the last char
        scanFrom = Math.max(0, pending.length() - 1);
        return blocks == null ? List.of() : blocks;
    }
}
