package ai.diffscope.diff;

import com.google.common.base.Splitter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a file is machine generated, which lets the UI collapse it by default.
 *
 * <p>The path check is cheap and runs for every parsed file. The content check needs the file's bytes and only runs
 * on explicit request.
 */
public class GeneratedFileClassifier {
    private static final Set<String> LOCKFILE_NAMES = Set.of(
            "package-lock.json",
            "yarn.lock",
            "pnpm-lock.yaml",
            "Cargo.lock",
            "Gemfile.lock",
            "poetry.lock",
            "composer.lock",
            "Pipfile.lock",
            "go.sum",
            "go.mod",
            "pubspec.lock",
            "flake.lock",
            "npm-shrinkwrap.json",
            "bun.lockb");

    private static final Splitter LINE_SPLITTER = Splitter.on('\n');

    private static final List<String> GENERATED_SUFFIXES = List.of(".lock", ".min.js", ".min.css", ".map");

    /** Only the head of a file is scanned for markers. */
    static final int CONTENT_SCAN_BYTES = 4096;

    public boolean isGeneratedPath(String path) {
        int slash = path.lastIndexOf('/');
        String name = slash >= 0 ? path.substring(slash + 1) : path;
        if (LOCKFILE_NAMES.contains(name)) {
            return true;
        }
        for (String suffix : GENERATED_SUFFIXES) {
            if (name.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasGeneratedMarker(byte[] content) {
        int length = Math.min(content.length, CONTENT_SCAN_BYTES);
        String head = new String(content, 0, length, StandardCharsets.UTF_8);
        for (String line : LINE_SPLITTER.split(head)) {
            if (line.contains("@generated")) {
                return true;
            }
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.contains("auto-generated")) {
                return true;
            }
            if (line.contains("DO NOT EDIT") && lower.contains("generated")) {
                return true;
            }
        }
        return false;
    }
}
