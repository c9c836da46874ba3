package ai.diffscope.diff;

import static org.junit.jupiter.api.Assertions.*;

import ai.diffscope.git.FakeGitExecutor;
import ai.diffscope.git.GitCommandException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DiffParserTest {

    private static final String BASE_HASH = "1111111aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    private static final String TARGET_HASH = "2222222bbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb";
    private static final String RANGE = BASE_HASH + "..." + TARGET_HASH;
    private static final String OPTIONS = " --no-ext-diff --color=never";

    private static final String TWO_FILE_DIFF = String.join(
            "\n",
            "diff --git a/src/app.js b/src/app.js",
            "index 1111111..2222222 100644",
            "--- a/src/app.js",
            "+++ b/src/app.js",
            "@@ -1,2 +1,2 @@",
            " const a = 1;",
            "-const b = 2;",
            "+const b = 3;",
            "diff --git a/old.txt b/new.txt",
            "similarity index 100%",
            "rename from old.txt",
            "rename to new.txt",
            "");

    @TempDir
    Path repo;

    private FakeGitExecutor git;
    private DiffParser parser;

    @BeforeEach
    void setUp() {
        git = new FakeGitExecutor()
                .respond("rev-parse --verify --end-of-options HEAD^{commit}", TARGET_HASH + "\n")
                .respond("rev-parse --verify --end-of-options HEAD^^{commit}", BASE_HASH + "\n");
        parser = new DiffParser(repo, git);
    }

    @Test
    void testParseDiffBetweenCommits() throws Exception {
        git.respond("diff --numstat -z " + RANGE + OPTIONS, "1\t1\tsrc/app.js\0" + "0\t0\t\0old.txt\0new.txt\0")
                .respond("diff " + RANGE + OPTIONS, TWO_FILE_DIFF);

        var response = parser.parseDiff("HEAD", "HEAD^", false);

        assertEquals("1111111...2222222", response.commit());
        assertFalse(response.isEmpty());
        assertEquals(2, response.files().size());
        var modified = response.files().get(0);
        assertEquals("src/app.js", modified.path());
        assertEquals(FileStatus.MODIFIED, modified.status());
        assertEquals(1, modified.additions());
        var renamed = response.files().get(1);
        assertEquals(FileStatus.RENAMED, renamed.status());
        assertEquals("old.txt", renamed.oldPath());
        assertEquals("new.txt", renamed.path());
    }

    @Test
    void testIgnoreWhitespacePassesDashW() throws Exception {
        git.respond("diff --numstat -z " + RANGE + " -w" + OPTIONS, "")
                .respond("diff " + RANGE + " -w" + OPTIONS, "");

        var response = parser.parseDiff("HEAD", "HEAD^", true);

        assertTrue(response.isEmpty());
        assertTrue(response.files().isEmpty());
    }

    @Test
    void testStagedTargetDiffsTheIndex() throws Exception {
        git.respond("rev-parse --verify --end-of-options main^{commit}", BASE_HASH + "\n")
                .respond("diff --numstat -z --cached " + BASE_HASH + OPTIONS, "")
                .respond("diff --cached " + BASE_HASH + OPTIONS, "");

        var response = parser.parseDiff("staged", "main", false);

        assertEquals("1111111 vs Staging Area (staged changes)", response.commit());
    }

    @Test
    void testWorkingTargetDiffsAgainstIndex() throws Exception {
        git.respond("diff --numstat -z" + OPTIONS, "").respond("diff" + OPTIONS, "");

        var response = parser.parseDiff("working", "staged", false);

        assertEquals("Working Directory (unstaged changes)", response.commit());
    }

    @Test
    void testDotTargetDiffsWorkingTreeAgainstBase() throws Exception {
        git.respond("rev-parse --verify --end-of-options HEAD^{commit}", BASE_HASH + "\n")
                .respond("diff --numstat -z " + BASE_HASH + OPTIONS, "")
                .respond("diff " + BASE_HASH + OPTIONS, "");

        var response = parser.parseDiff(".", "HEAD", false);

        assertEquals("1111111 vs Working Directory (all uncommitted changes)", response.commit());
    }

    @Test
    void testUnresolvableRevisionNamesBothSpecs() {
        var e = assertThrows(DiffParseException.class, () -> parser.parseDiff("HEAD", "nope", false));

        assertTrue(e.getMessage().contains("HEAD"), e.getMessage());
        assertTrue(e.getMessage().contains("nope"), e.getMessage());
    }

    @Test
    void testRejectsInvalidRevisionPairs() {
        assertThrows(DiffParseException.class, () -> parser.parseDiff("HEAD", "HEAD", false));
        assertThrows(DiffParseException.class, () -> parser.parseDiff("HEAD", "working", false));
        assertThrows(DiffParseException.class, () -> parser.parseDiff("working", "HEAD", false));
        assertTrue(git.calls().isEmpty(), "validation happens before any git call");
    }

    @Test
    void testParsePatchUsesStdinLabel() throws Exception {
        var response = parser.parsePatch(TWO_FILE_DIFF);

        assertEquals("stdin diff", response.commit());
        assertEquals(2, response.files().size());
        assertEquals(1, response.files().get(0).additions(), "counted from lines without a summary");
    }

    @Test
    void testPathBasedGeneratedStatusNeedsNoBlob() {
        var status = parser.getGeneratedStatus("package-lock.json", "HEAD");

        assertEquals(GeneratedStatus.byPath(true), status);
        assertTrue(git.calls().isEmpty(), "no blob should be read for a lockfile");
    }

    @Test
    void testContentBasedGeneratedStatusIsCached() {
        git.respond("rev-parse HEAD:gen/api.ts", "abc123\n").respond("cat-file blob abc123", "// @generated\n");

        var first = parser.getGeneratedStatus("gen/api.ts", "HEAD");
        var second = parser.getGeneratedStatus("gen/api.ts", "HEAD");

        assertEquals(GeneratedStatus.byContent(true), first);
        assertEquals(first, second);
        assertEquals(1, git.callCount("cat-file"), "second lookup should come from the cache");

        parser.clearCaches();
        parser.getGeneratedStatus("gen/api.ts", "HEAD");
        assertEquals(2, git.callCount("cat-file"));
    }

    @Test
    void testUnreadableContentFailsOpen() {
        var status = parser.getGeneratedStatus("missing.ts", "HEAD");

        assertEquals(GeneratedStatus.byPath(false), status);
    }

    @Test
    void testWorkingTreeBlobIsReadFromDisk() throws Exception {
        Files.writeString(repo.resolve("notes.txt"), "one\ntwo\nthree");

        assertEquals("one\ntwo\nthree", new String(parser.getBlobContent("notes.txt", "working")));
        assertEquals(3, parser.getLineCount("notes.txt", "."));
        assertTrue(git.calls().isEmpty());
    }

    @Test
    void testStagedBlobComesFromIndex() throws Exception {
        git.respond("show :notes.txt", "a\nb\n");

        assertEquals(2, parser.getLineCount("notes.txt", "staged"));
    }

    @Test
    void testOversizedWorkingFileIsTooLarge() throws Exception {
        var small = new DiffParser(repo, git, ParseMode.LENIENT, Clock.systemUTC(), 4);
        Files.writeString(repo.resolve("big.txt"), "0123456789");

        assertThrows(
                GitCommandException.OutputTooLargeException.class, () -> small.getBlobContent("big.txt", "working"));
    }

    @Test
    void testWorkingTreeReadCannotEscapeRepository() {
        assertThrows(IOException.class, () -> parser.getBlobContent("../outside.txt", "working"));
    }

    @Test
    void testValidateCommit() {
        git.respond("rev-parse --is-inside-work-tree", "true\n");

        assertTrue(parser.validateCommit("HEAD"));
        assertTrue(parser.validateCommit("staged"));
        assertFalse(parser.validateCommit("no-such-branch"));
    }

    @Test
    void testDefaultBase() {
        assertEquals("staged", DiffParser.defaultBase("working"));
        assertEquals("HEAD", DiffParser.defaultBase("."));
        assertEquals("HEAD", DiffParser.defaultBase("staged"));
        assertEquals("main^", DiffParser.defaultBase("main"));
    }
}
