package io.weatherstreams.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Parses one delimiter-bounded block of event-stream text into a {@link StreamFrame}.
 *
 * <p>Lines starting with {@code :} are comments (keep-alives) and never produce data. Unknown
 * fields and lines without a colon are ignored. A block without any {@code data} field yields
 * no frame.
 */
public final class FrameParser {

    private static final Logger log = LoggerFactory.getLogger(FrameParser.class);

    private FrameParser() {}

    /**
     * Parses a block of text that contains no blank line.
     *
     * @param block the block text, without its trailing delimiter
     * @return the frame, or empty if the block carries no {@code data}
     */
    public static Optional<StreamFrame> parse(String block) {
        if (block == null || block.isEmpty()) return Optional.empty();

        String id = null;
        String event = null;
        StringBuilder data = null;
        Integer retry = null;

        int start = 0;
        int len = block.length();
        while (start <= len) {
            int end = block.indexOf('\n', start);
            if (end < 0) end = len;
            String line = stripCarriageReturn(block.substring(start, end));
            start = end + 1;

            if (line.isEmpty() || line.charAt(0) == ':') continue;

            int colon = line.indexOf(':');
            if (colon < 0) continue;

            String field = line.substring(0, colon).trim();
            String value = line.substring(colon + 1);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }

            switch (field) {
                case Protocol.F_ID -> id = value;
                case Protocol.F_EVENT -> event = value;
                case Protocol.F_DATA -> {
                    if (data == null) {
                        data = new StringBuilder(value);
                    } else {
                        data.append('\n').append(value);
                    }
                }
                case Protocol.F_RETRY -> {
                    Integer parsed = parseRetry(value);
                    if (parsed != null) retry = parsed;
                }
                default -> {
                    // unknown field
                }
            }
        }

        if (data == null) return Optional.empty();
        return Optional.of(new StreamFrame(id, event, data.toString(), retry));
    }

    private static Integer parseRetry(String value) {
        try {
            int millis = Integer.parseInt(value.trim());
            if (millis < 0) {
                log.debug("Ignoring negative retry value {}", millis);
                return null;
            }
            return millis;
        } catch (NumberFormatException e) {
            log.debug("Ignoring invalid retry value '{}'", value);
            return null;
        }
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
