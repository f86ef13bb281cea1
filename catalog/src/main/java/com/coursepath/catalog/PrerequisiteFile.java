package com.coursepath.catalog;

import com.coursepath.common.codec.Codec;
import com.coursepath.common.errorsor.ErrorsOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The flat prerequisite file: one {@code COURSE : text} record per line, blank lines ignored.
 * A course listed on several lines keeps one line of text per record; each line is parsed on its own and all of
 * them are required.
 */
public final class PrerequisiteFile {
    private static final Logger log = LoggerFactory.getLogger(PrerequisiteFile.class);
    private static final Codec<List<CatalogLine>, String> LINES = Codec.lines(CatalogLineCodec.INSTANCE);

    private PrerequisiteFile() {}

    /**
     * @throws IllegalArgumentException naming every line that is not a {@code COURSE : text} record
     */
    public static Map<String, String> parse(String text, String descriptionForError) {
        ErrorsOr<List<CatalogLine>> decoded = LINES.decode(text);
        if (decoded.isError()) {
            throw new IllegalArgumentException("Invalid prerequisite file " + descriptionForError + "\n"
                    + String.join("\n", decoded.getErrors()));
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (CatalogLine line : decoded.valueOrThrow()) {
            out.merge(line.courseId(), line.prerequisites(), PrerequisiteFile::joinLines);
        }
        log.info("Read {} course(s) from {}", out.size(), descriptionForError);
        return out;
    }

    /** Sorted by course id, one record per line of text; courses without prerequisites included so the file round-trips. */
    public static String render(Map<String, String> entries) {
        List<CatalogLine> lines = new ArrayList<>();
        new TreeMap<>(entries).forEach((course, text) -> {
            List<String> records = text.lines().filter(l -> !l.isBlank()).toList();
            if (records.isEmpty()) lines.add(new CatalogLine(course, ""));
            else records.forEach(r -> lines.add(new CatalogLine(course, r)));
        });
        ErrorsOr<String> encoded = LINES.encode(lines);
        return encoded.fold(s -> s.isEmpty() ? s : s + "\n", errors -> {
            throw new IllegalArgumentException("Cannot write prerequisite file\n" + String.join("\n", errors));
        });
    }

    public static void write(Map<String, String> entries, Path path) {
        try {
            Files.writeString(path, render(entries), StandardCharsets.UTF_8);
            log.info("Wrote {} course(s) to {}", entries.size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write prerequisite file " + path, e);
        }
    }

    public static CatalogSource fromPath(Path path) {
        Objects.requireNonNull(path, "path");
        return () -> {
            try {
                return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read prerequisite file " + path, e);
            }
        };
    }

    public static CatalogSource fromResource(String resourceName) {
        Objects.requireNonNull(resourceName, "resourceName");
        return () -> {
            try (InputStream in = Resources.open(resourceName)) {
                return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), resourceName);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read prerequisite resource " + resourceName, e);
            }
        };
    }

    private static String joinLines(String first, String second) {
        if (first.isBlank()) return second;
        if (second.isBlank()) return first;
        return first + "\n" + second;
    }
}
