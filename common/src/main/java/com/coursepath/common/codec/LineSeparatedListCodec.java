package com.coursepath.common.codec;

import com.coursepath.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Codec for line-oriented text files. Errors are reported per line (1-based) and all of them are returned together.
 */
public final class LineSeparatedListCodec<T> implements Codec<List<T>, String> {
    private final Codec<T, String> item;

    public LineSeparatedListCodec(Codec<T, String> item) {
        this.item = Objects.requireNonNull(item, "item");
    }

    @Override
    public ErrorsOr<String> encode(List<T> from) {
        try {
            if (from == null || from.isEmpty()) return ErrorsOr.lift("");
            StringBuilder sb = new StringBuilder();
            var errors = new ArrayList<String>();
            for (int i = 0; i < from.size(); i++) {
                if (i > 0) sb.append('\n');
                ErrorsOr<String> encode = item.encode(from.get(i));
                if (encode.isError()) errors.addAll(encode.errorsOrThrow());
                else sb.append(encode.valueOrThrow());
            }
            return errors.isEmpty() ? ErrorsOr.lift(sb.toString()) : ErrorsOr.errors(errors);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode list: " + e.getMessage());
        }
    }

    @Override
    public ErrorsOr<List<T>> decode(String to) {
        try {
            if (to == null || to.isEmpty()) return ErrorsOr.lift(List.of());
            String[] lines = to.split("\r?\n", -1);

            List<T> out = new ArrayList<>(lines.length);
            List<String> errors = new ArrayList<>();
            for (int i = 0; i < lines.length; i++) {
                String line = stripBom(lines[i]);
                if (line.isBlank()) continue;
                ErrorsOr<T> decode = item.decode(line).addPrefixIfError("line " + (i + 1) + ": ");
                if (decode.isError()) errors.addAll(decode.errorsOrThrow());
                else out.add(decode.valueOrThrow());
            }
            return errors.isEmpty() ? ErrorsOr.lift(out) : ErrorsOr.errors(errors);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode list: " + e.getMessage());
        }
    }

    private static String stripBom(String s) {
        return (!s.isEmpty() && s.charAt(0) == '\uFEFF') ? s.substring(1) : s;
    }
}
