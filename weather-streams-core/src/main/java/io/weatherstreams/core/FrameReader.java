package io.weatherstreams.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Incremental reader that turns a live event-stream body into frames.
 *
 * <p>Each underlying read is fed to an {@link IncrementalFrameBuffer}; blocks are handed out one
 * at a time in the order their delimiters arrived. At end of input an unterminated final block is
 * flushed once. UTF-8 sequences split across reads are reassembled by the decoder.
 */
public final class FrameReader implements AutoCloseable {

    public static final int DEFAULT_READ_BUFFER_SIZE = 1024;

    private final Reader in;
    private final char[] readBuffer;
    private final Runnable chunkObserver;
    private final IncrementalFrameBuffer buffer = new IncrementalFrameBuffer();
    private final Deque<String> ready = new ArrayDeque<>();
    private boolean eof;

    /**
     * Creates a reader over a UTF-8 byte stream.
     *
     * @param is the stream to read from
     */
    public FrameReader(InputStream is) {
        this(is, () -> {});
    }

    /**
     * Creates a reader over a UTF-8 byte stream.
     *
     * @param is the stream to read from
     * @param chunkObserver invoked after every successful read, before frames are extracted
     */
    public FrameReader(InputStream is, Runnable chunkObserver) {
        this(new InputStreamReader(Objects.requireNonNull(is, "is"), StandardCharsets.UTF_8),
                DEFAULT_READ_BUFFER_SIZE, chunkObserver);
    }

    public FrameReader(Reader in, int readBufferSize, Runnable chunkObserver) {
        this.in = Objects.requireNonNull(in, "in");
        if (readBufferSize <= 0) {
            throw new IllegalArgumentException("readBufferSize must be > 0");
        }
        this.readBuffer = new char[readBufferSize];
        this.chunkObserver = Objects.requireNonNull(chunkObserver, "chunkObserver");
    }

    /**
     * Reads the next complete block, blocking until one is available.
     *
     * @return the next block text, or {@code null} once the stream is exhausted
     * @throws IOException if reading fails
     */
    public String nextBlock() throws IOException {
        while (ready.isEmpty()) {
            if (eof) return null;
            int n = in.read(readBuffer);
            if (n < 0) {
                eof = true;
                buffer.finish().ifPresent(ready::add);
            } else if (n > 0) {
                chunkObserver.run();
                ready.addAll(buffer.append(java.nio.CharBuffer.wrap(readBuffer, 0, n)));
            }
        }
        return ready.poll();
    }

    /**
     * Reads the next block that parses to a frame, skipping comment-only and data-less blocks.
     *
     * @return the next frame, or {@code null} once the stream is exhausted
     * @throws IOException if reading fails
     */
    public StreamFrame nextFrame() throws IOException {
        String block;
        while ((block = nextBlock()) != null) {
            Optional<StreamFrame> frame = FrameParser.parse(block);
            if (frame.isPresent()) return frame.get();
        }
        return null;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
