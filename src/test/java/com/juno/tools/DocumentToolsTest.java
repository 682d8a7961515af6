package com.juno.tools;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentToolsTest {

    @TempDir
    Path workspace;

    private DocumentTools tools;

    @BeforeEach
    void setUp() {
        tools = new DocumentTools(workspace);
    }

    @Test
    @DisplayName("createOutline writes a numbered list")
    void createOutline() throws Exception {
        String result = tools.createOutline(List.of("Intro", "Tides", "Summary"), "outline.txt");

        assertEquals("Outline saved to outline.txt", result);
        assertEquals("1. Intro\n2. Tides\n3. Summary\n", Files.readString(workspace.resolve("outline.txt")));
    }

    @Test
    @DisplayName("writeDocument creates parent directories")
    void writeNested() {
        assertEquals("Document saved to drafts/essay.md", tools.writeDocument("Body", "drafts/essay.md"));
        assertTrue(Files.exists(workspace.resolve("drafts/essay.md")));
    }

    @Nested
    @DisplayName("readDocument")
    class ReadDocument {

        @BeforeEach
        void write() {
            tools.writeDocument("one\ntwo\nthree\nfour", "doc.txt");
        }

        @Test
        @DisplayName("reads the whole file by default")
        void whole() {
            assertEquals("one\ntwo\nthree\nfour\n", tools.readDocument("doc.txt", null, null));
        }

        @Test
        @DisplayName("reads a clamped line range")
        void range() {
            assertEquals("two\nthree\n", tools.readDocument("doc.txt", 1, 3));
            assertEquals("four\n", tools.readDocument("doc.txt", 3, 99));
        }

        @Test
        @DisplayName("reports a missing file")
        void missing() {
            assertEquals("Error: File nope.txt not found", tools.readDocument("nope.txt", null, null));
        }
    }

    @Test
    @DisplayName("editDocument inserts lines in ascending order")
    void edit() throws Exception {
        tools.writeDocument("a\nb", "doc.txt");

        String result = tools.editDocument("doc.txt", Map.of(1, "title", 3, "middle"));

        assertEquals("Document edited and saved to doc.txt", result);
        assertEquals(List.of("title", "a", "middle", "b"), Files.readAllLines(workspace.resolve("doc.txt")));
    }

    @Test
    @DisplayName("editDocument rejects out-of-range lines")
    void editOutOfRange() {
        tools.writeDocument("a", "doc.txt");

        assertEquals("Error: Line number 5 is out of range.", tools.editDocument("doc.txt", Map.of(5, "x")));
    }

    @Test
    @DisplayName("paths outside the workspace are reported as errors")
    void escape() {
        String result = tools.writeDocument("x", "../outside.txt");

        assertTrue(result.startsWith("Error: "));
        assertFalse(Files.exists(workspace.getParent().resolve("outside.txt")));
    }

    @Test
    @DisplayName("listDocuments returns sorted relative paths")
    void list() {
        tools.writeDocument("b", "b.txt");
        tools.writeDocument("a", "sub/a.txt");

        assertEquals(List.of("b.txt", Path.of("sub", "a.txt").toString()), tools.listDocuments());
    }

    @Test
    @DisplayName("listDocuments is empty for a missing workspace")
    void listMissing() {
        assertEquals(List.of(), new DocumentTools(workspace.resolve("absent")).listDocuments());
    }
}
