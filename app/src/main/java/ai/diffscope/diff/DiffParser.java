package ai.diffscope.diff;

import ai.diffscope.git.DiffSummaryReader;
import ai.diffscope.git.FileSummary;
import ai.diffscope.git.GitCommandException;
import ai.diffscope.git.GitExecutor;
import ai.diffscope.git.ProcessGitExecutor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Produces {@link DiffResponse}s for revision ranges of one repository and answers the per-file questions the UI asks
 * afterwards (blob content, line counts, generated status).
 *
 * <p>Revision specs are git commit-ishes plus three special targets: {@code working} (unstaged changes),
 * {@code staged} (index against a base) and {@code .} (all uncommitted changes against a base).
 */
public class DiffParser {
    private static final Logger logger = LogManager.getLogger(DiffParser.class);

    public static final String WORKING = "working";
    public static final String STAGED = "staged";
    public static final String DOT = ".";

    private static final Set<String> SPECIAL_TARGETS = Set.of(WORKING, STAGED, DOT);

    public static final Duration GENERATED_STATUS_TTL = Duration.ofSeconds(60);

    private static final List<String> DIFF_OPTIONS = List.of("--no-ext-diff", "--color=never");

    private final Path repoRoot;
    private final GitExecutor git;
    private final GeneratedFileClassifier classifier;
    private final DiffBlockSplitter splitter;
    private final ExpiringCache<String, GeneratedStatus> generatedStatusCache;
    private final long maxBlobBytes;

    public DiffParser(Path repoRoot, GitExecutor git) {
        this(repoRoot, git, ParseMode.LENIENT, Clock.systemUTC(), ProcessGitExecutor.DEFAULT_MAX_OUTPUT_BYTES);
    }

    public DiffParser(Path repoRoot, GitExecutor git, ParseMode parseMode, Clock clock, long maxBlobBytes) {
        this.repoRoot = repoRoot.toAbsolutePath().normalize();
        this.git = git;
        this.classifier = new GeneratedFileClassifier();
        this.splitter = new DiffBlockSplitter(classifier, parseMode);
        this.generatedStatusCache = new ExpiringCache<>(GENERATED_STATUS_TTL, clock);
        this.maxBlobBytes = maxBlobBytes;
    }

    public Path getRepoRoot() {
        return repoRoot;
    }

    /**
     * Diffs {@code base} against {@code target}.
     *
     * @throws DiffParseException if git rejects either revision or its output cannot be parsed; the message names
     *     both revisions
     */
    public DiffResponse parseDiff(String target, String base, boolean ignoreWhitespace) throws DiffParseException {
        validateArguments(target, base);
        try {
            String label;
            var args = new ArrayList<String>();
            switch (target) {
                case WORKING -> label = "Working Directory (unstaged changes)";
                case STAGED -> {
                    String baseHash = resolveCommitish(base);
                    label = shortHash(baseHash) + " vs Staging Area (staged changes)";
                    args.add("--cached");
                    args.add(baseHash);
                }
                case DOT -> {
                    String baseHash = resolveCommitish(base);
                    label = shortHash(baseHash) + " vs Working Directory (all uncommitted changes)";
                    args.add(baseHash);
                }
                default -> {
                    String targetHash = resolveCommitish(target);
                    String baseHash = resolveCommitish(base);
                    label = shortHash(baseHash) + "..." + shortHash(targetHash);
                    args.add(baseHash + "..." + targetHash);
                }
            }
            if (ignoreWhitespace) {
                args.add("-w");
            }
            args.addAll(DIFF_OPTIONS);

            var numstatArgs = new ArrayList<String>(List.of("diff", "--numstat", "-z"));
            numstatArgs.addAll(args);
            List<FileSummary> summaries = DiffSummaryReader.parse(git.runText(repoRoot, numstatArgs));

            var diffArgs = new ArrayList<String>(List.of("diff"));
            diffArgs.addAll(args);
            String diffText = git.runText(repoRoot, diffArgs);

            var files = splitter.parseAll(diffText, summaries);
            logger.debug("Parsed {} files for {} vs {}", files.size(), target, base);
            return DiffResponse.of(label, files);
        } catch (GitCommandException | DiffParseException e) {
            throw new DiffParseException(
                    "Failed to parse diff for %s vs %s: %s".formatted(target, base, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiffParseException("Interrupted while diffing %s vs %s".formatted(target, base), e);
        }
    }

    /** Parses a patch that did not come from this repository, e.g. one piped in on stdin. */
    public DiffResponse parsePatch(String diffText) throws DiffParseException {
        return DiffResponse.of("stdin diff", splitter.parseAll(diffText, List.of()));
    }

    /**
     * Classifies a file as generated. The path check wins without touching the file; otherwise the head of the blob
     * at {@code ref} is scanned. Results are cached per ref and path for {@link #GENERATED_STATUS_TTL}.
     */
    public GeneratedStatus getGeneratedStatus(String path, String ref) {
        String key = ref + ":" + path;
        var cached = generatedStatusCache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        GeneratedStatus status;
        if (classifier.isGeneratedPath(path)) {
            status = GeneratedStatus.byPath(true);
        } else {
            try {
                status = GeneratedStatus.byContent(classifier.hasGeneratedMarker(getBlobContent(path, ref)));
            } catch (IOException e) {
                logger.debug("Unable to read {} at {} for generated check: {}", path, ref, e.getMessage());
                status = GeneratedStatus.byPath(false);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                status = GeneratedStatus.byPath(false);
            }
        }
        generatedStatusCache.put(key, status);
        return status;
    }

    public void clearCaches() {
        generatedStatusCache.clear();
    }

    /**
     * Reads a file as of {@code ref}. {@code working} and {@code .} read the working tree, {@code staged} reads the
     * index, anything else is resolved as {@code ref:path}.
     *
     * @throws GitCommandException.OutputTooLargeException if the file exceeds the output ceiling
     */
    public byte[] getBlobContent(String path, String ref) throws IOException, InterruptedException {
        if (WORKING.equals(ref) || DOT.equals(ref)) {
            Path file = repoRoot.resolve(path).normalize();
            if (!file.startsWith(repoRoot)) {
                throw new IOException("Path escapes the repository: " + path);
            }
            long size = Files.size(file);
            if (size > maxBlobBytes) {
                throw new GitCommandException.OutputTooLargeException(
                        "%s is %d bytes, more than the %d byte limit".formatted(path, size, maxBlobBytes),
                        maxBlobBytes);
            }
            return Files.readAllBytes(file);
        }
        if (STAGED.equals(ref)) {
            return git.run(repoRoot, List.of("show", ":" + path));
        }
        String blobHash = git.runText(repoRoot, "rev-parse", ref + ":" + path).strip();
        return git.run(repoRoot, List.of("cat-file", "blob", blobHash));
    }

    /** Number of lines in the file as of {@code ref}; a final line without a newline still counts. */
    public int getLineCount(String path, String ref) throws IOException, InterruptedException {
        byte[] content = getBlobContent(path, ref);
        if (content.length == 0) {
            return 0;
        }
        int lines = 0;
        for (byte b : content) {
            if (b == '\n') {
                lines++;
            }
        }
        return content[content.length - 1] == '\n' ? lines : lines + 1;
    }

    /** Resolves a commit-ish to a full hash. Special targets resolve to themselves. */
    public String resolveCommitish(String commitish) throws GitCommandException, InterruptedException {
        if (SPECIAL_TARGETS.contains(commitish)) {
            return commitish;
        }
        return git.runText(repoRoot, "rev-parse", "--verify", "--end-of-options", commitish + "^{commit}")
                .strip();
    }

    /** Whether {@code commitish} names a commit, or, for a special target, whether this is a git work tree. */
    public boolean validateCommit(String commitish) {
        try {
            if (SPECIAL_TARGETS.contains(commitish)) {
                git.runText(repoRoot, "rev-parse", "--is-inside-work-tree");
            } else {
                resolveCommitish(commitish);
            }
            return true;
        } catch (GitCommandException e) {
            logger.debug("{} is not a valid commit: {}", commitish, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** The base used when none is given: the staging area for {@code working}, HEAD for other special targets. */
    public static String defaultBase(String target) {
        if (WORKING.equals(target)) {
            return STAGED;
        }
        return SPECIAL_TARGETS.contains(target) ? "HEAD" : target + "^";
    }

    static void validateArguments(String target, String base) throws DiffParseException {
        if (SPECIAL_TARGETS.contains(base) && !(STAGED.equals(base) && WORKING.equals(target))) {
            throw new DiffParseException(
                    "Special arguments (working, staged, .) are only allowed as target, not base. Got base: " + base);
        }
        if (target.equals(base)) {
            throw new DiffParseException("Cannot compare %s with itself".formatted(target));
        }
        if (WORKING.equals(target) && !STAGED.equals(base)) {
            throw new DiffParseException("\"working\" shows unstaged changes and can only be compared with \"staged\";"
                    + " use \".\" to compare all uncommitted changes with a commit");
        }
    }

    private static String shortHash(String hash) {
        return hash.length() > 7 ? hash.substring(0, 7) : hash;
    }
}
