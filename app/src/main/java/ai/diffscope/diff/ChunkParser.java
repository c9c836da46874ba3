package ai.diffscope.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Turns the lines of one file's diff into hunks.
 *
 * <p>Only lines following a valid {@code @@} header are body lines, so the {@code ---}/{@code +++} metadata lines
 * are never mistaken for a deletion or an addition.
 */
public final class ChunkParser {
    private static final Logger logger = LogManager.getLogger(ChunkParser.class);

    static final Pattern HUNK_HEADER = Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@(.*)$");

    private ChunkParser() {}

    public static List<DiffChunk> parse(List<String> blockLines) {
        var fold = new Fold();
        for (String line : blockLines) {
            fold.accept(stripCarriageReturn(line));
        }
        return fold.finish();
    }

    /** Drops the {@code \r} left over when a CRLF patch is split on {@code \n}. */
    static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /** Per-call accumulator; nothing survives between parses. */
    private static final class Fold {
        private final List<DiffChunk> chunks = new ArrayList<>();
        private @Nullable OpenChunk open;
        private int oldLine;
        private int newLine;

        void accept(String line) {
            if (line.startsWith("@@")) {
                flush();
                open = OpenChunk.fromHeader(line);
                if (open != null) {
                    oldLine = open.oldStart;
                    newLine = open.newStart;
                } else {
                    logger.debug("Skipping hunk with malformed header: {}", line);
                }
                return;
            }
            if (open == null) {
                return;
            }
            if (line.startsWith("+")) {
                open.lines.add(DiffLine.added(line.substring(1), newLine++));
            } else if (line.startsWith("-")) {
                open.lines.add(DiffLine.deleted(line.substring(1), oldLine++));
            } else if (line.startsWith(" ")) {
                open.lines.add(DiffLine.context(line.substring(1), oldLine++, newLine++));
            }
            // "\ No newline at end of file" and anything else carries no line
        }

        List<DiffChunk> finish() {
            flush();
            return List.copyOf(chunks);
        }

        private void flush() {
            if (open != null) {
                chunks.add(open.toChunk());
                open = null;
            }
        }
    }

    private static final class OpenChunk {
        final String header;
        final int oldStart;
        final int oldLines;
        final int newStart;
        final int newLines;
        final List<DiffLine> lines = new ArrayList<>();

        private OpenChunk(String header, int oldStart, int oldLines, int newStart, int newLines) {
            this.header = header;
            this.oldStart = oldStart;
            this.oldLines = oldLines;
            this.newStart = newStart;
            this.newLines = newLines;
        }

        static @Nullable OpenChunk fromHeader(String line) {
            Matcher m = HUNK_HEADER.matcher(line);
            if (!m.matches()) {
                return null;
            }
            try {
                return new OpenChunk(
                        line,
                        Integer.parseInt(m.group(1)),
                        m.group(2) != null ? Integer.parseInt(m.group(2)) : 1,
                        Integer.parseInt(m.group(3)),
                        m.group(4) != null ? Integer.parseInt(m.group(4)) : 1);
            } catch (NumberFormatException e) {
                // digits that overflow an int
                return null;
            }
        }

        DiffChunk toChunk() {
            return new DiffChunk(header, oldStart, oldLines, newStart, newLines, lines);
        }
    }
}
