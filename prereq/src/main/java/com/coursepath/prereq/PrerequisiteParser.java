package com.coursepath.prereq;

import com.coursepath.common.errorsor.ErrorsOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads free-form prerequisite text into a {@link RequirementExpression}.
 * <p>
 * Each line is read on its own and the lines are combined with "and". Within a line the grammar is two levels deep:
 * the text is split on "and" into conjuncts, then each conjunct is either a list of alternatives ("one of A, B or C",
 * "A or B", "A/B"), a comma list of required courses, or one course.
 * <p>
 * A cutoff phrase (see {@link ParserOptions#cutoffPhrases()}) ends the line. Offered as an alternative
 * ("A or consent of instructor") it satisfies that conjunct, which is dropped; anywhere else it waives the whole line.
 * <p>
 * Anything that does not fit is rejected with a {@link MalformedPrerequisiteException}; nothing is dropped silently.
 * Instances are immutable and thread safe.
 */
public final class PrerequisiteParser {
    private static final Logger log = LoggerFactory.getLogger(PrerequisiteParser.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n|\\r");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NESTING = Pattern.compile("[()\\[\\]{}]");
    private static final Pattern AND = Pattern.compile("\\s*(?:,\\s*)?\\band\\b\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern ONE_OF = Pattern.compile("one\\s+of\\b\\s*[:\\-]?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern OR = Pattern.compile("\\bor\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_OR = Pattern.compile("(?:^|[\\s,])or$|/$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ALTERNATIVE_SEPARATOR =
            Pattern.compile("\\s*(?:,\\s*or\\b|[,;/]|\\bor\\b)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST_SEPARATOR = Pattern.compile("\\s*[,;]\\s*");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\s.,;:]+|[\\s.,;:]+$");
    private static final Pattern NOT_TOKEN_CHAR = Pattern.compile("[^A-Za-z0-9\\s-]");

    private final ParserOptions options;
    private final List<Pattern> cutoffs;

    public PrerequisiteParser() {
        this(ParserOptions.DEFAULT);
    }

    public PrerequisiteParser(ParserOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.cutoffs = options.cutoffPhrases().stream()
                .map(p -> Pattern.compile("\\b" + Pattern.quote(p) + "\\b", Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public ParserOptions options() {
        return options;
    }

    /**
     * @return the requirement; an empty {@link AllOf} for blank or fully waived text
     * @throws MalformedPrerequisiteException if the text does not match the grammar
     */
    public RequirementExpression parse(String raw) {
        if (raw == null || raw.isBlank()) return AllOf.none();

        Set<RequirementExpression> conjuncts = new LinkedHashSet<>();
        for (String line : LINE_BREAK.split(raw)) {
            if (!line.isBlank()) conjuncts.addAll(parseLine(line));
        }
        RequirementExpression result;
        if (conjuncts.isEmpty()) result = AllOf.none();
        else if (conjuncts.size() == 1) result = conjuncts.iterator().next();
        else result = new AllOf(List.copyOf(conjuncts));
        log.debug("Parsed '{}' as {}", raw, result);
        return result;
    }

    /** As {@link #parse(String)}, with a malformed text reported as an error instead of thrown. */
    public ErrorsOr<RequirementExpression> tryParse(String raw) {
        try {
            return ErrorsOr.lift(parse(raw));
        } catch (MalformedPrerequisiteException e) {
            return ErrorsOr.error(e.getMessage());
        }
    }

    private List<RequirementExpression> parseLine(String line) {
        String text = stripEdgePunctuation(WHITESPACE.matcher(line.trim()).replaceAll(" "));
        if (text.isEmpty()) return List.of();

        List<String> segments;
        int cut = cutoffStart(text);
        if (cut < 0) {
            segments = List.of(AND.split(text, -1));
        } else {
            List<String> kept = new ArrayList<>(List.of(AND.split(text.substring(0, cut), -1)));
            String waived = stripEdgePunctuation(kept.remove(kept.size() - 1));
            if (!isAlternativeList(waived)) {
                log.debug("Cutoff phrase waives '{}'", text);
                return List.of();
            }
            log.debug("Cutoff phrase satisfies '{}' in '{}'", waived, text);
            segments = kept;
        }

        List<RequirementExpression> out = new ArrayList<>();
        for (String segment : segments) {
            String conjunct = stripEdgePunctuation(segment);
            if (conjunct.isEmpty()) throw new MalformedPrerequisiteException(text, "empty 'and' segment");
            if (NESTING.matcher(conjunct).find()) {
                throw new MalformedPrerequisiteException(text, "nested expressions are not supported");
            }
            out.addAll(parseConjunct(conjunct));
        }
        return out;
    }

    private List<RequirementExpression> parseConjunct(String conjunct) {
        Matcher oneOf = ONE_OF.matcher(conjunct);
        boolean disjunction = oneOf.lookingAt();
        String body = disjunction ? conjunct.substring(oneOf.end()).trim() : conjunct;
        if (body.isEmpty()) throw new MalformedPrerequisiteException(conjunct, "no alternatives listed");

        if (disjunction || OR.matcher(body).find() || body.indexOf('/') >= 0) {
            Set<RequirementExpression> alternatives = new LinkedHashSet<>();
            for (String alternative : ALTERNATIVE_SEPARATOR.split(body, -1)) {
                if (alternative.isBlank()) throw new MalformedPrerequisiteException(conjunct, "empty alternative");
                alternatives.add(new Leaf(courseToken(alternative)));
            }
            return List.of(new AnyOf(List.copyOf(alternatives)));
        }

        List<RequirementExpression> required = new ArrayList<>();
        for (String item : LIST_SEPARATOR.split(body, -1)) {
            if (item.isBlank()) throw new MalformedPrerequisiteException(conjunct, "empty list item");
            required.add(new Leaf(courseToken(item)));
        }
        return required;
    }

    private String courseToken(String fragment) {
        String cleaned = NOT_TOKEN_CHAR.matcher(fragment).replaceAll(" ");
        List<String> words = new ArrayList<>();
        for (String w : WHITESPACE.split(cleaned.trim())) {
            String word = trimHyphens(w);
            if (!word.isEmpty() && !options.fillerWords().contains(word.toLowerCase(Locale.ROOT))) words.add(word);
        }
        if (words.isEmpty()) throw new MalformedPrerequisiteException(fragment.trim(), "no course identifier");

        String candidate = words.size() <= 2 ? String.join(" ", words) : null;
        if (!CourseIds.isCourseId(candidate)) {
            throw new MalformedPrerequisiteException(fragment.trim(), "not a course identifier");
        }
        return options.normalizeId(candidate);
    }

    private int cutoffStart(String text) {
        int cut = -1;
        for (Pattern p : cutoffs) {
            Matcher m = p.matcher(text);
            if (m.find() && (cut < 0 || m.start() < cut)) cut = m.start();
        }
        return cut;
    }

    /** Text left of a cutoff phrase that lists it as one more alternative: "A or", "A/", "one of A, B". */
    private static boolean isAlternativeList(String beforeCutoff) {
        if (beforeCutoff.isEmpty()) return false;
        return TRAILING_OR.matcher(beforeCutoff).find() || ONE_OF.matcher(beforeCutoff).lookingAt();
    }

    private static String stripEdgePunctuation(String s) {
        return EDGE_PUNCTUATION.matcher(s).replaceAll("");
    }

    private static String trimHyphens(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && word.charAt(start) == '-') start++;
        while (end > start && word.charAt(end - 1) == '-') end--;
        return word.substring(start, end);
    }
}
