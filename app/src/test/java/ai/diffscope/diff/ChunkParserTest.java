package ai.diffscope.diff;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class ChunkParserTest {

    @Test
    void testLineNumbersAdvancePerSide() {
        var chunks = ChunkParser.parse(List.of(
                "diff --git a/f.txt b/f.txt",
                "--- a/f.txt",
                "+++ b/f.txt",
                "@@ -10,3 +10,4 @@ class Foo",
                " keep",
                "-old",
                "+new",
                "+extra",
                " tail"));

        assertEquals(1, chunks.size());
        var chunk = chunks.get(0);
        assertEquals("@@ -10,3 +10,4 @@ class Foo", chunk.header());
        assertEquals(10, chunk.oldStart());
        assertEquals(3, chunk.oldLines());
        assertEquals(10, chunk.newStart());
        assertEquals(4, chunk.newLines());
        assertEquals(
                List.of(
                        DiffLine.context("keep", 10, 10),
                        DiffLine.deleted("old", 11),
                        DiffLine.added("new", 11),
                        DiffLine.added("extra", 12),
                        DiffLine.context("tail", 12, 13)),
                chunk.lines());
    }

    @Test
    void testMissingRunLengthsDefaultToOne() {
        var chunks = ChunkParser.parse(List.of("@@ -1 +1 @@", "-a", "+b"));

        assertEquals(1, chunks.get(0).oldLines());
        assertEquals(1, chunks.get(0).newLines());
    }

    @Test
    void testMetadataLinesAreNeverBodyLines() {
        var chunks = ChunkParser.parse(List.of("--- a/x", "+++ b/x", "@@ -0,0 +1 @@", "+only"));

        assertEquals(List.of(DiffLine.added("only", 1)), chunks.get(0).lines());
    }

    @Test
    void testNoNewlineMarkerIsIgnored() {
        var chunks = ChunkParser.parse(List.of("@@ -1 +1 @@", "-a", "\\ No newline at end of file", "+b"));

        assertEquals(2, chunks.get(0).lines().size());
    }

    @Test
    void testMalformedHeaderSkipsUntilNextValidHeader() {
        var chunks = ChunkParser.parse(List.of(
                "@@ -1,2 +1,2 @@", " a", "-b", "+c", "@@ garbage @@", "+lost", "-lost", "@@ -20 +20 @@", "+found"));

        assertEquals(2, chunks.size());
        assertEquals(3, chunks.get(0).lines().size());
        assertEquals(List.of(DiffLine.added("found", 20)), chunks.get(1).lines());
    }

    @Test
    void testOverflowingNumbersCountAsMalformed() {
        var chunks = ChunkParser.parse(List.of("@@ -99999999999 +1 @@", "+x"));

        assertTrue(chunks.isEmpty());
    }

    @Test
    void testMarkerOnlyLinesHaveEmptyContent() {
        var chunks = ChunkParser.parse(List.of("@@ -1,2 +1,2 @@", " ", "-", "+"));

        var lines = chunks.get(0).lines();
        assertEquals("", lines.get(0).content());
        assertEquals(LineType.DELETE, lines.get(1).type());
        assertEquals(LineType.ADD, lines.get(2).type());
    }

    @Test
    void testChunksAreImmutable() {
        var chunks = ChunkParser.parse(List.of("@@ -1 +1 @@", "+x"));

        assertThrows(UnsupportedOperationException.class, () -> chunks.add(chunks.get(0)));
        assertThrows(UnsupportedOperationException.class, () -> chunks.get(0).lines().clear());
    }

    @Test
    void testCrlfLinesStillParse() {
        var chunks = ChunkParser.parse(List.of("@@ -1,2 +1,2 @@ fn\r", " keep\r", "-old\r", "+new\r"));

        assertEquals(1, chunks.size());
        assertEquals("@@ -1,2 +1,2 @@ fn", chunks.get(0).header());
        assertEquals(
                List.of(DiffLine.context("keep", 1, 1), DiffLine.deleted("old", 2), DiffLine.added("new", 2)),
                chunks.get(0).lines());
    }
}
