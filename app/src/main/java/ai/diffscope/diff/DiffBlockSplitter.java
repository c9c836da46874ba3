package ai.diffscope.diff;

import ai.diffscope.git.FileSummary;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Splits unified-diff text into per-file blocks and resolves each block's paths, status and counts.
 *
 * <p>Git reports a file's paths in up to four places, with different reliability:
 *
 * <ol>
 *   <li>{@code rename from}/{@code rename to} lines, present only for renames;
 *   <li>the {@code ---}/{@code +++} lines, present whenever there is a textual hunk;
 *   <li>the {@code diff --git} header, which is ambiguous when unquoted paths contain spaces;
 *   <li>the summary record, when the caller has one.
 * </ol>
 *
 * The first source that yields a path wins.
 */
public class DiffBlockSplitter {
    private static final Logger logger = LogManager.getLogger(DiffBlockSplitter.class);

    static final String HEADER_PREFIX = "diff --git ";
    private static final String DEV_NULL = "/dev/null";
    private static final Splitter LINE_SPLITTER = Splitter.on('\n');

    private final GeneratedFileClassifier classifier;
    private final ParseMode parseMode;

    public DiffBlockSplitter(GeneratedFileClassifier classifier, ParseMode parseMode) {
        this.classifier = classifier;
        this.parseMode = parseMode;
    }

    /** Returns one block per {@code diff --git} header, in order. Anything before the first header is dropped. */
    public static List<String> split(String diffText) {
        var blocks = new ArrayList<String>();
        StringBuilder current = null;
        for (String line : LINE_SPLITTER.split(diffText)) {
            if (line.startsWith(HEADER_PREFIX)) {
                if (current != null) {
                    blocks.add(current.toString());
                }
                current = new StringBuilder(line);
            } else if (current != null) {
                current.append('\n').append(line);
            }
        }
        if (current != null) {
            blocks.add(current.toString());
        }
        return blocks;
    }

    /**
     * Parses every block of {@code diffText}, pairing the i-th block with the i-th summary. Blocks that cannot be
     * given a path are dropped in lenient mode.
     */
    public List<DiffFile> parseAll(String diffText, List<FileSummary> summaries) throws DiffParseException {
        var blocks = split(diffText);
        if (!summaries.isEmpty() && summaries.size() != blocks.size()) {
            logger.debug("Diff has {} blocks but {} summary records", blocks.size(), summaries.size());
        }
        var files = new ArrayList<DiffFile>(blocks.size());
        for (int i = 0; i < blocks.size(); i++) {
            var summary = i < summaries.size() ? summaries.get(i) : null;
            var file = parseBlock(blocks.get(i), summary);
            if (file != null) {
                files.add(file);
            }
        }
        return files;
    }

    public @Nullable DiffFile parseBlock(String block, @Nullable FileSummary summary) throws DiffParseException {
        List<String> lines = LINE_SPLITTER.splitToList(block).stream()
                .map(ChunkParser::stripCarriageReturn)
                .toList();
        List<String> metadata = lines.subList(1, firstHunkIndex(lines));

        var headerPaths = parseHeaderPaths(lines.get(0));
        String minusLine = firstWithPrefix(metadata, "--- ");
        String plusLine = firstWithPrefix(metadata, "+++ ");
        String minusPath = PathCodec.pathAfter(minusLine, "--- ");
        String plusPath = PathCodec.pathAfter(plusLine, "+++ ");
        String renameFrom = PathCodec.pathAfter(firstWithPrefix(metadata, "rename from "), "rename from ");
        String renameTo = PathCodec.pathAfter(firstWithPrefix(metadata, "rename to "), "rename to ");

        String newPath = firstNonNull(
                renameTo,
                plusPath,
                headerPaths != null ? headerPaths.newPath() : null,
                summary != null ? summary.path() : null);
        if (newPath == null) {
            if (parseMode == ParseMode.STRICT) {
                throw new DiffParseException("Unable to determine file path for diff block: " + lines.get(0));
            }
            logger.debug("Dropping diff block without a resolvable path: {}", lines.get(0));
            return null;
        }
        String oldPath = firstNonNull(
                renameFrom,
                minusPath,
                headerPaths != null ? headerPaths.oldPath() : null,
                summary != null ? summary.fromPath() : null,
                newPath);

        FileStatus status;
        if (firstWithPrefix(metadata, "new file mode") != null || isDevNull(minusLine, "--- ")) {
            status = FileStatus.ADDED;
        } else if (firstWithPrefix(metadata, "deleted file mode") != null || isDevNull(plusLine, "+++ ")) {
            status = FileStatus.DELETED;
        } else if (!newPath.equals(oldPath)) {
            status = FileStatus.RENAMED;
        } else {
            status = FileStatus.MODIFIED;
        }

        boolean binary = (summary != null && summary.binary())
                || metadata.stream().anyMatch(DiffBlockSplitter::isBinaryMarker);
        List<DiffChunk> chunks = binary ? List.of() : ChunkParser.parse(lines);

        int additions;
        int deletions;
        if (binary) {
            additions = 0;
            deletions = 0;
        } else if (summary != null) {
            additions = summary.insertions();
            deletions = summary.deletions();
        } else {
            additions = countLines(chunks, LineType.ADD);
            deletions = countLines(chunks, LineType.DELETE);
        }

        return new DiffFile(
                newPath,
                status == FileStatus.RENAMED ? oldPath : null,
                status,
                additions,
                deletions,
                chunks,
                classifier.isGeneratedPath(newPath));
    }

    record HeaderPaths(@Nullable String oldPath, @Nullable String newPath) {}

    /**
     * Splits the two path tokens of a {@code diff --git} header. Returns {@code null} unless exactly two tokens are
     * found, which is the case for quoted paths and for unquoted paths without spaces.
     */
    static @Nullable HeaderPaths parseHeaderPaths(String headerLine) {
        if (!headerLine.startsWith(HEADER_PREFIX)) {
            return null;
        }
        var tokens = tokenize(headerLine.substring(HEADER_PREFIX.length()));
        if (tokens.size() != 2) {
            return null;
        }
        return new HeaderPaths(PathCodec.decode(tokens.get(0)), PathCodec.decode(tokens.get(1)));
    }

    /** Splits on spaces outside double quotes; a backslash protects the following quote or space. */
    static List<String> tokenize(String text) {
        var tokens = new ArrayList<String>();
        var current = new StringBuilder();
        boolean inQuotes = false;
        char previous = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' && previous != '\\') {
                inQuotes = !inQuotes;
                current.append(c);
            } else if (c == ' ' && !inQuotes && previous != '\\') {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
            // an escaped backslash does not escape what follows it
            previous = (c == '\\' && previous == '\\') ? 0 : c;
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static int firstHunkIndex(List<String> lines) {
        for (int i = 1; i < lines.size(); i++) {
            if (lines.get(i).startsWith("@@")) {
                return i;
            }
        }
        return lines.size();
    }

    private static @Nullable String firstWithPrefix(List<String> lines, String prefix) {
        for (String line : lines) {
            if (line.startsWith(prefix)) {
                return line;
            }
        }
        return null;
    }

    private static boolean isDevNull(@Nullable String line, String prefix) {
        if (line == null || !line.startsWith(prefix)) {
            return false;
        }
        String token = line.substring(prefix.length());
        int tab = token.indexOf('\t');
        return (tab >= 0 ? token.substring(0, tab) : token).equals(DEV_NULL);
    }

    private static boolean isBinaryMarker(String line) {
        return (line.startsWith("Binary files ") && line.endsWith(" differ")) || line.equals("GIT binary patch");
    }

    private static int countLines(List<DiffChunk> chunks, LineType type) {
        int count = 0;
        for (var chunk : chunks) {
            for (var line : chunk.lines()) {
                if (line.type() == type) {
                    count++;
                }
            }
        }
        return count;
    }

    @SafeVarargs
    private static <T> @Nullable T firstNonNull(@Nullable T... candidates) {
        for (T candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
