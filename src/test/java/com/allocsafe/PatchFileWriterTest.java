package com.allocsafe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatchFileWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void unifiedDiffOfAChangedLine() {
        String before = String.join("\n", "int a;", "char *p = malloc(1);", "int b;", "");
        String after = String.join("\n", "int a;", "char *p = malloc(1); if (!p) { return ENOMEM; }", "int b;", "");
        List<String> diff = PatchFileWriter.diff("x.c", before, after);
        assertEquals("--- a/x.c", diff.get(0));
        assertEquals("+++ b/x.c", diff.get(1));
        assertTrue(diff.get(2).startsWith("@@"), diff.get(2));
        assertTrue(diff.contains("-char *p = malloc(1);"), diff.toString());
        assertTrue(diff.contains("+char *p = malloc(1); if (!p) { return ENOMEM; }"), diff.toString());
    }

    @Test
    void missingFinalNewlineIsMarked() {
        List<String> diff = PatchFileWriter.diff("x.c", "int a;\nchar *p = malloc(1);", "int a;\nchar *p = malloc(1);\n");
        assertTrue(diff.get(2).startsWith("@@"), diff.get(2));
        assertEquals(List.of(" int a;", "-char *p = malloc(1);", "\\ No newline at end of file",
                "+char *p = malloc(1);"), diff.subList(3, diff.size()));

        List<String> both = PatchFileWriter.diff("y.c", "p = malloc(1);", "p = malloc(1); if (!p) { return ENOMEM; }");
        assertEquals(List.of("-p = malloc(1);", "\\ No newline at end of file",
                "+p = malloc(1); if (!p) { return ENOMEM; }", "\\ No newline at end of file"),
                both.subList(3, both.size()));
    }

    @Test
    void identicalTextGivesNoDiff() {
        assertTrue(PatchFileWriter.diff("x.c", "int a;\n", "int a;\n").isEmpty());
    }

    @Test
    void writePatchAppends() throws Exception {
        Path patch = tempDir.resolve("out.patch");
        PatchFileWriter.writePatch(patch, List.of("one", "two"));
        PatchFileWriter.writePatch(patch, List.of("three"));
        PatchFileWriter.writePatch(patch, List.of());
        assertEquals(List.of("one", "two", "three"), Files.readAllLines(patch));
    }

    @Test
    void emptyDiffCreatesNoFile() throws Exception {
        Path patch = tempDir.resolve("none.patch");
        PatchFileWriter.writePatch(patch, List.of());
        assertFalse(Files.exists(patch));
    }
}
