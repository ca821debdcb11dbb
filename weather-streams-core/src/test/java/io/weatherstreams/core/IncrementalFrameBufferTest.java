package io.weatherstreams.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IncrementalFrameBufferTest {

    private static final String STREAM = "data: one\n\n: ping\n\nid: 2\ndata: two\ndata: lines\n\ndata: three\n\n";

    @Test
    void emitsCompleteBlocksAndKeepsRemainder() {
        IncrementalFrameBuffer buffer = new IncrementalFrameBuffer();

        assertThat(buffer.append("data: a\n\ndata: b")).containsExactly("data: a");
        assertThat(buffer.bufferedLength()).isEqualTo("data: b".length());
        assertThat(buffer.append("\n\n")).containsExactly("data: b");
        assertThat(buffer.bufferedLength()).isZero();
    }

    @Test
    void everySplitPointGivesTheSameBlocks() {
        List<String> expected = new IncrementalFrameBuffer().append(STREAM);
        assertThat(expected).hasSize(4);

        for (int i = 0; i <= STREAM.length(); i++) {
            IncrementalFrameBuffer buffer = new IncrementalFrameBuffer();
            List<String> blocks = new ArrayList<>(buffer.append(STREAM.substring(0, i)));
            blocks.addAll(buffer.append(STREAM.substring(i)));

            assertThat(blocks).as("split at %d", i).isEqualTo(expected);
            assertThat(buffer.finish()).isEmpty();
        }
    }

    @Test
    void delimiterSplitAcrossChunks() {
        IncrementalFrameBuffer buffer = new IncrementalFrameBuffer();

        assertThat(buffer.append("data: x\n")).isEmpty();
        assertThat(buffer.append("\ndata: y\n")).containsExactly("data: x");
        assertThat(buffer.append("\n")).containsExactly("data: y");
    }

    @Test
    void oneCharacterAtATime() {
        IncrementalFrameBuffer buffer = new IncrementalFrameBuffer();
        List<String> blocks = new ArrayList<>();
        for (char c : STREAM.toCharArray()) {
            blocks.addAll(buffer.append(String.valueOf(c)));
        }

        assertThat(blocks).containsExactly("data: one", ": ping", "id: 2\ndata: two\ndata: lines", "data: three");
    }

    @Test
    void normalizesCrLfAndLoneCr() {
        IncrementalFrameBuffer buffer = new IncrementalFrameBuffer();

        assertThat(buffer.append("data: a\r\n\r\ndata: b\r\rdata: c\n\n"))
                .containsExactly("data: a", "data: b", "data: c");
    }

    @Test
    void crLfSplitBetweenChunks() {
        IncrementalFrameBuffer buffer = new IncrementalFrameBuffer();

        assertThat(buffer.append("data: a\r")).isEmpty();
        assertThat(buffer.append("\n\r")).isEmpty();
        assertThat(buffer.append("\ndata: b")).containsExactly("data: a");
        assertThat(buffer.bufferedLength()).isEqualTo("data: b".length());
    }

    @Test
    void skipsBlankBlocks() {
        IncrementalFrameBuffer buffer = new IncrementalFrameBuffer();

        assertThat(buffer.append("\n\n\n\ndata: a\n\n\n\n")).containsExactly("data: a");
    }

    @Test
    void finishFlushesUnterminatedBlockOnce() {
        IncrementalFrameBuffer buffer = new IncrementalFrameBuffer();
        buffer.append("data: last");

        assertThat(buffer.finish()).contains("data: last");
        assertThat(buffer.finish()).isEmpty();
        assertThat(buffer.bufferedLength()).isZero();
    }

    @Test
    void finishCompletesHeldBackCarriageReturn() {
        IncrementalFrameBuffer buffer = new IncrementalFrameBuffer();
        assertThat(buffer.append("data: a\r\n\r")).isEmpty();

        assertThat(buffer.finish()).contains("data: a");
    }

    @Test
    void finishIgnoresWhitespace() {
        IncrementalFrameBuffer buffer = new IncrementalFrameBuffer();
        buffer.append("data: a\n\n  \n");

        assertThat(buffer.finish()).isEmpty();
    }

    @Test
    void emptyChunkIsNoop() {
        IncrementalFrameBuffer buffer = new IncrementalFrameBuffer();

        assertThat(buffer.append("")).isEmpty();
        assertThat(buffer.append(null)).isEmpty();
        assertThat(buffer.bufferedLength()).isZero();
    }
}
