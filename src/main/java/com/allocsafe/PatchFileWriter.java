package com.allocsafe;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

public class PatchFileWriter {

    private static final int CONTEXT_LINES = 3;

    static final String NO_NEWLINE = "\\ No newline at end of file";

    // tags the last line of a text without a final newline, so that the two
    // endings compare unequal and the marker can be emitted after the line
    private static final char UNTERMINATED = '\u0000';

    /** Unified diff between {@code original} and {@code modified}; empty if they are equal. */
    public static List<String> diff(String fileName, String original, String modified) {
        List<String> oldLines = toLines(original);
        List<String> newLines = toLines(modified);
        Patch<String> patch = DiffUtils.diff(oldLines, newLines);
        if (patch.getDeltas().isEmpty()) {
            return Collections.emptyList();
        }
        List<String> out = new ArrayList<>();
        for (String line : UnifiedDiffUtils.generateUnifiedDiff("a/" + fileName, "b/" + fileName, oldLines, patch,
                CONTEXT_LINES)) {
            if (!line.isEmpty() && line.charAt(line.length() - 1) == UNTERMINATED) {
                out.add(line.substring(0, line.length() - 1));
                out.add(NO_NEWLINE);
            } else {
                out.add(line);
            }
        }
        return out;
    }

    private static List<String> toLines(String text) {
        List<String> lines = text.lines().collect(Collectors.toList());
        if (!text.isEmpty() && !text.endsWith("\n")) {
            int last = lines.size() - 1;
            lines.set(last, lines.get(last) + UNTERMINATED);
        }
        return lines;
    }

    /** Append diff lines to {@code patchFile}, creating it if necessary. */
    public static void writePatch(Path patchFile, List<String> diffLines) throws IOException {
        if (!diffLines.isEmpty()) {
            Files.write(patchFile, diffLines,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        }
    }
}
