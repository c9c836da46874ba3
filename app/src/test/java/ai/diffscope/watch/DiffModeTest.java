package ai.diffscope.watch;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class DiffModeTest {

    @Test
    void testModeFromTarget() {
        assertEquals(DiffMode.DEFAULT, DiffMode.forRevisions("HEAD", null));
        assertEquals(DiffMode.DEFAULT, DiffMode.forRevisions("main", null));
        assertEquals(DiffMode.WORKING, DiffMode.forRevisions("working", null));
        assertEquals(DiffMode.STAGED, DiffMode.forRevisions("staged", null));
        assertEquals(DiffMode.DOT, DiffMode.forRevisions(".", null));
    }

    @Test
    void testExplicitBaseDisablesWatchingUnlessTargetMoves() {
        assertEquals(DiffMode.SPECIFIC, DiffMode.forRevisions("feature", "main"));
        assertEquals(DiffMode.DEFAULT, DiffMode.forRevisions("HEAD", "main"));
        assertEquals(DiffMode.DOT, DiffMode.forRevisions(".", "main"));
    }

    @Test
    void testChangeTypeIsFixedPerMode() {
        assertEquals(ChangeType.COMMIT, DiffMode.DEFAULT.changeType());
        assertEquals(ChangeType.COMMIT, DiffMode.DOT.changeType());
        assertEquals(ChangeType.STAGING, DiffMode.STAGED.changeType());
        assertEquals(ChangeType.FILE, DiffMode.WORKING.changeType());
    }

    @Test
    void testRelevantGitFiles() {
        assertTrue(DiffMode.DEFAULT.isRelevantGitFile("HEAD"));
        assertFalse(DiffMode.DEFAULT.isRelevantGitFile("index"));
        assertTrue(DiffMode.WORKING.isRelevantGitFile("index"));
        assertTrue(DiffMode.STAGED.isRelevantGitFile("index"));
        assertFalse(DiffMode.DOT.isRelevantGitFile("index"));
    }

    @Test
    void testWatchRoots() {
        assertFalse(DiffMode.DEFAULT.watchesWorkTree());
        assertTrue(DiffMode.DEFAULT.watchesGitDir());
        assertTrue(DiffMode.WORKING.watchesWorkTree());
        assertTrue(DiffMode.DOT.watchesWorkTree());
        assertFalse(DiffMode.SPECIFIC.watchesGitDir());
        assertTrue(DiffMode.DOT.ignoreGlobs().contains(".git/logs/**"));
        assertFalse(DiffMode.STAGED.ignoreGlobs().contains("node_modules/**"));
    }

    @Test
    void testEventJsonShape() throws Exception {
        var mapper = new ObjectMapper();
        var json = mapper.readTree(mapper.writeValueAsString(WatchEvent.reload(DiffMode.STAGED)));

        assertEquals("reload", json.get("type").asText());
        assertEquals("staged", json.get("mode").asText());
        assertEquals("staging", json.get("changeType").asText());
        assertEquals("Changes detected in staged mode", json.get("message").asText());
        assertNotNull(json.get("timestamp"));
    }
}
