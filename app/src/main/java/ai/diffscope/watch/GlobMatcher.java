package ai.diffscope.watch;

import com.google.common.base.Splitter;
import java.util.List;

/**
 * A compiled path glob.
 *
 * <p>Patterns are matched segment by segment against {@code /}-separated relative paths: {@code **} matches any
 * number of whole segments (including none), {@code *} matches within one segment, {@code ?} matches one character.
 * A pattern matches at any segment boundary unless it starts with {@code /}, so {@code node_modules/**} also matches
 * {@code web/node_modules/react/index.js}. A leading {@code !} inverts the match.
 *
 * <p>Matching never backtracks into a regex engine, so hostile file names cannot cause super-linear work per segment.
 */
public final class GlobMatcher {
    private static final Splitter SEGMENT_SPLITTER = Splitter.on('/').omitEmptyStrings();
    private static final String ANY_SEGMENTS = "**";

    private final String pattern;
    private final List<String> segments;
    private final boolean negated;
    private final boolean anchored;

    private GlobMatcher(String pattern, List<String> segments, boolean negated, boolean anchored) {
        this.pattern = pattern;
        this.segments = segments;
        this.negated = negated;
        this.anchored = anchored;
    }

    public static GlobMatcher compile(String pattern) {
        String body = pattern;
        boolean negated = body.startsWith("!");
        if (negated) {
            body = body.substring(1);
        }
        boolean anchored = body.startsWith("/");
        var segments = SEGMENT_SPLITTER.splitToList(body);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Empty glob pattern: '" + pattern + "'");
        }
        return new GlobMatcher(pattern, segments, negated, anchored);
    }

    public static List<GlobMatcher> compileAll(List<String> patterns) {
        return patterns.stream().map(GlobMatcher::compile).toList();
    }

    public String pattern() {
        return pattern;
    }

    public boolean matches(String relativePath) {
        var path = SEGMENT_SPLITTER.splitToList(relativePath);
        boolean matched = false;
        if (anchored) {
            matched = matchSegments(0, path, 0);
        } else {
            for (int start = 0; start < Math.max(1, path.size()) && !matched; start++) {
                matched = matchSegments(0, path, start);
            }
        }
        return matched != negated;
    }

    private boolean matchSegments(int patternIndex, List<String> path, int pathIndex) {
        while (patternIndex < segments.size()) {
            String segment = segments.get(patternIndex);
            if (segment.equals(ANY_SEGMENTS)) {
                // collapse runs of ** and try every split point
                while (patternIndex + 1 < segments.size() && segments.get(patternIndex + 1).equals(ANY_SEGMENTS)) {
                    patternIndex++;
                }
                if (patternIndex + 1 == segments.size()) {
                    return true;
                }
                for (int i = pathIndex; i < path.size(); i++) {
                    if (matchSegments(patternIndex + 1, path, i)) {
                        return true;
                    }
                }
                return false;
            }
            if (pathIndex >= path.size() || !matchSegment(segment, path.get(pathIndex))) {
                return false;
            }
            patternIndex++;
            pathIndex++;
        }
        return pathIndex == path.size();
    }

    /** Wildcard match of one segment with the usual two-pointer star backtracking. */
    static boolean matchSegment(String glob, String text) {
        int g = 0;
        int t = 0;
        int starGlob = -1;
        int starText = -1;
        while (t < text.length()) {
            if (g < glob.length() && (glob.charAt(g) == '?' || glob.charAt(g) == text.charAt(t))) {
                g++;
                t++;
            } else if (g < glob.length() && glob.charAt(g) == '*') {
                starGlob = g++;
                starText = t;
            } else if (starGlob >= 0) {
                g = starGlob + 1;
                t = ++starText;
            } else {
                return false;
            }
        }
        while (g < glob.length() && glob.charAt(g) == '*') {
            g++;
        }
        return g == glob.length();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
