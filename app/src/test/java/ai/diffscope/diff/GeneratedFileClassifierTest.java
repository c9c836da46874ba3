package ai.diffscope.diff;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class GeneratedFileClassifierTest {

    private final GeneratedFileClassifier classifier = new GeneratedFileClassifier();

    @Test
    void testLockfilesByBasename() {
        assertTrue(classifier.isGeneratedPath("package-lock.json"));
        assertTrue(classifier.isGeneratedPath("frontend/yarn.lock"));
        assertTrue(classifier.isGeneratedPath("go.sum"));
        assertTrue(classifier.isGeneratedPath("crates/core/Cargo.lock"));
    }

    @Test
    void testGeneratedSuffixes() {
        assertTrue(classifier.isGeneratedPath("dist/app.min.js"));
        assertTrue(classifier.isGeneratedPath("dist/app.min.css"));
        assertTrue(classifier.isGeneratedPath("dist/app.js.map"));
        assertTrue(classifier.isGeneratedPath("deps.lock"));
    }

    @Test
    void testOrdinarySourceIsNotGenerated() {
        assertFalse(classifier.isGeneratedPath("src/main.js"));
        assertFalse(classifier.isGeneratedPath("package.json"));
        assertFalse(classifier.isGeneratedPath("lock/readme.md"), "directory names do not count");
    }

    @Test
    void testContentMarkers() {
        assertTrue(classifier.hasGeneratedMarker(bytes("// @generated by protoc\npackage x;")));
        assertTrue(classifier.hasGeneratedMarker(bytes("# This file is auto-generated\n")));
        assertTrue(classifier.hasGeneratedMarker(bytes("// Code generated by mockgen. DO NOT EDIT.\n")));
        assertFalse(classifier.hasGeneratedMarker(bytes("// DO NOT EDIT without telling the team\n")));
        assertFalse(classifier.hasGeneratedMarker(bytes("public class Plain {}\n")));
    }

    @Test
    void testOnlyTheHeadIsScanned() {
        var content = "x".repeat(GeneratedFileClassifier.CONTENT_SCAN_BYTES) + "\n// @generated\n";

        assertFalse(classifier.hasGeneratedMarker(bytes(content)));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
