package com.coursepath.catalog;

import com.coursepath.common.codec.Codec;
import com.coursepath.common.errorsor.ErrorsOr;

/** {@code "BIOCH 310 : BIOCH 200 and CHEM 263"} ⇄ {@link CatalogLine}. The first ':' separates the two parts. */
public final class CatalogLineCodec implements Codec<CatalogLine, String> {
    public static final CatalogLineCodec INSTANCE = new CatalogLineCodec();

    private CatalogLineCodec() {}

    @Override
    public ErrorsOr<String> encode(CatalogLine line) {
        if (line.courseId().isBlank()) return ErrorsOr.error("Course id must not be blank");
        if (line.courseId().indexOf(':') >= 0) return ErrorsOr.error("Course id must not contain ':' " + line.courseId());
        if (line.prerequisites().indexOf('\n') >= 0) return ErrorsOr.error("Prerequisites of " + line.courseId() + " span several lines");
        String text = line.prerequisites().trim();
        return ErrorsOr.lift(text.isEmpty() ? line.courseId() + ":" : line.courseId() + ": " + text);
    }

    @Override
    public ErrorsOr<CatalogLine> decode(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) return ErrorsOr.error("expected 'COURSE : prerequisites' but found '" + text.trim() + "'");
        String course = text.substring(0, colon).trim();
        if (course.isEmpty()) return ErrorsOr.error("missing course id in '" + text.trim() + "'");
        return ErrorsOr.lift(new CatalogLine(course, text.substring(colon + 1).trim()));
    }
}
