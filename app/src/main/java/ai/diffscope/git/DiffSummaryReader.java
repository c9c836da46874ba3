package ai.diffscope.git;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Parses the output of {@code git diff --numstat -z}.
 *
 * <p>Each record is {@code added TAB deleted TAB path NUL}. For renames and copies the path field is empty and is
 * followed by two NUL-terminated fields, the old path and the new path. Binary files report {@code -} for both
 * counts. With {@code -z} git never quotes paths, so the paths are taken verbatim.
 */
public final class DiffSummaryReader {
    private static final Logger logger = LogManager.getLogger(DiffSummaryReader.class);

    private static final Splitter NUL_SPLITTER = Splitter.on('\0');
    private static final Splitter TAB_SPLITTER = Splitter.on('\t').limit(3);

    private DiffSummaryReader() {}

    public static List<FileSummary> parse(String numstatOutput) {
        var fields = NUL_SPLITTER.splitToList(numstatOutput);
        var summaries = new ArrayList<FileSummary>();
        int i = 0;
        while (i < fields.size()) {
            String record = stripLeadingNewline(fields.get(i));
            i++;
            if (record.isEmpty()) {
                continue;
            }
            var parts = TAB_SPLITTER.splitToList(record);
            if (parts.size() < 3) {
                logger.debug("Skipping malformed numstat record: {}", record);
                continue;
            }
            boolean binary = "-".equals(parts.get(0)) && "-".equals(parts.get(1));
            int insertions = binary ? 0 : parseCount(parts.get(0));
            int deletions = binary ? 0 : parseCount(parts.get(1));

            String path = parts.get(2);
            String fromPath = null;
            if (path.isEmpty()) {
                if (i + 1 >= fields.size()) {
                    logger.debug("Truncated rename record in numstat output");
                    break;
                }
                fromPath = fields.get(i);
                path = fields.get(i + 1);
                i += 2;
            }
            summaries.add(new FileSummary(path, fromPath, insertions, deletions, binary));
        }
        return List.copyOf(summaries);
    }

    // git may separate -z records with a newline when other output formats are combined
    private static String stripLeadingNewline(String field) {
        return field.startsWith("\n") ? field.substring(1) : field;
    }

    private static int parseCount(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.debug("Unparseable numstat count '{}'", value);
            return 0;
        }
    }
}
