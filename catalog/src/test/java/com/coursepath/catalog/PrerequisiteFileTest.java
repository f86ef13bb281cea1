package com.coursepath.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PrerequisiteFileTest {

    @Test
    void parsesRecordsSkippingBlankLines() {
        Map<String, String> m = PrerequisiteFile.parse("A:\r\n\r\nB: A\n  \nC : A and B\n", "test");
        assertEquals(List.of("A", "B", "C"), List.copyOf(m.keySet()));
        assertEquals("", m.get("A"));
        assertEquals("A and B", m.get("C"));
    }

    @Test
    void repeatedCourseLinesStayOnSeparateLines() {
        Map<String, String> m = PrerequisiteFile.parse("A: B or consent of instructor\nA: one of C or D\nE:\nE: B", "test");
        assertEquals("B or consent of instructor\none of C or D", m.get("A"));
        assertEquals("B", m.get("E"));
    }

    @Test
    void everyBadLineIsReported() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> PrerequisiteFile.parse("A: B\nnonsense\n\n: C", "prereq.txt"));
        assertTrue(e.getMessage().startsWith("Invalid prerequisite file prereq.txt"), e.getMessage());
        assertTrue(e.getMessage().contains("line 2: expected 'COURSE : prerequisites' but found 'nonsense'"), e.getMessage());
        assertTrue(e.getMessage().contains("line 4: missing course id in ': C'"), e.getMessage());
    }

    @Test
    void renderSortsAndEndsWithNewline() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("B", "A");
        m.put("A", "");
        assertEquals("A:\nB: A\n", PrerequisiteFile.render(m));
        assertEquals("", PrerequisiteFile.render(Map.of()));
    }

    @Test
    void renderRejectsUnwritableEntries() {
        assertThrows(IllegalArgumentException.class, () -> PrerequisiteFile.render(Map.of("A:B", "")));
    }

    @Test
    void writtenFileReadsBack(@TempDir Path dir) throws Exception {
        Map<String, String> m = Map.of("CHEM 101", "", "CHEM 102", "CHEM 101", "BIOCH 200", "CHEM 101 and CHEM 102");
        Path file = dir.resolve("prereq.txt");
        PrerequisiteFile.write(m, file);

        assertEquals("BIOCH 200: CHEM 101 and CHEM 102\nCHEM 101:\nCHEM 102: CHEM 101\n", Files.readString(file));
        assertEquals(m, PrerequisiteFile.fromPath(file).load());
    }

    @Test
    void multiLineTextIsWrittenOneRecordPerLine(@TempDir Path dir) throws Exception {
        Map<String, String> m = Map.of("A", "", "B", "A or consent of instructor\nC", "C", "");
        Path file = dir.resolve("prereq.txt");
        PrerequisiteFile.write(m, file);

        assertEquals("A:\nB: A or consent of instructor\nB: C\nC:\n", Files.readString(file));
        assertEquals(m, PrerequisiteFile.fromPath(file).load());
    }

    @Test
    void missingFile(@TempDir Path dir) {
        CatalogSource source = PrerequisiteFile.fromPath(dir.resolve("absent.txt"));
        assertThrows(UncheckedIOException.class, source::load);
    }

    @Test
    void classpathResource() {
        Map<String, String> m = PrerequisiteFile.fromResource("catalog/prereq.txt").load();
        assertEquals(6, m.size());
        assertEquals("BIOCH 200 or consent of the instructor\nCHEM 263", m.get("BIOCH 310"));
    }

    @Test
    void missingResource() {
        assertThrows(IllegalArgumentException.class, () -> PrerequisiteFile.fromResource("catalog/absent.txt").load());
    }
}
