package com.radioautomation.intake.service.pattern;

import com.radioautomation.intake.model.FilePattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Matches filenames against the glob-style patterns configured on a show.
 * <p>
 * {@code *} matches any run of characters and {@code ?} exactly one character. Matching is case-insensitive and
 * anchored to the whole filename. Date placeholders such as {@code {YYYY}} and brace alternation such as
 * {@code {mp3,wav}} are also understood. A malformed pattern never throws; it is logged and matches nothing.
 */
@Slf4j
@Component
public class PatternMatcher {

    private static final Map<String, String> PLACEHOLDERS = Map.ofEntries(
            Map.entry("YYYY", "\\d{4}"),
            Map.entry("YY", "\\d{2}"),
            Map.entry("MM", "\\d{1,2}"),
            Map.entry("DD", "\\d{1,2}"),
            Map.entry("HH", "\\d{1,2}"),
            Map.entry("mm", "\\d{1,2}"),
            Map.entry("ss", "\\d{1,2}"),
            Map.entry("DOTW", "[A-Za-z]+"),
            Map.entry("DOW", "[A-Za-z]{3}"),
            Map.entry("MONTH", "[A-Za-z]+"),
            Map.entry("MON", "[A-Za-z]{3}"),
            Map.entry("SHOW", "[^_\\-\\s]+"),
            Map.entry("EPISODE", "[^_\\-\\s.]+"),
            Map.entry("SEGMENT", "[^_\\-\\s.]+"),
            Map.entry("ANY", ".*"));

    private final Map<String, Optional<Pattern>> compiled = new ConcurrentHashMap<>();

    /**
     * Tests whether a filename matches a single glob pattern.
     *
     * @param filename The bare filename, without directory components.
     * @param pattern  The glob pattern.
     * @return {@code true} if the whole filename matches, ignoring case.
     */
    public boolean matches(final String filename, final String pattern) {
        if (filename == null || !StringUtils.hasText(pattern)) {
            return false;
        }
        final boolean matches = compiled.computeIfAbsent(pattern, this::compile)
                                        .map(regex -> regex.matcher(filename).matches())
                                        .orElse(false);
        log.debug("File '{}' {} pattern '{}'", filename, matches ? "matches" : "does not match", pattern);
        return matches;
    }

    /**
     * Finds the first watch pattern, in list order, that matches the filename.
     *
     * @param filename The bare filename.
     * @param patterns The show's patterns. FTP patterns are skipped.
     * @return The first matching watch pattern, or empty if none match.
     */
    public Optional<FilePattern> findMatchingPattern(final String filename, final List<FilePattern> patterns) {
        if (patterns == null) {
            return Optional.empty();
        }
        return patterns.stream()
                       .filter(FilePattern::isWatchPattern)
                       .filter(p -> matches(filename, p.getPattern()))
                       .findFirst();
    }

    private Optional<Pattern> compile(final String pattern) {
        try {
            return Optional.of(Pattern.compile("^" + toRegex(pattern, true) + "$",
                                               Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        } catch (IllegalArgumentException e) {
            // PatternSyntaxException is an IllegalArgumentException as well
            log.warn("Invalid file pattern '{}' will not match any file: {}", pattern, e.getMessage());
            return Optional.empty();
        }
    }

    private String toRegex(final String glob, final boolean allowBraces) {
        final StringBuilder regex = new StringBuilder();
        final StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            final char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                flushLiteral(literal, regex);
                regex.append(c == '*' ? ".*" : ".");
                i++;
            } else if (c == '{') {
                if (!allowBraces) {
                    throw new IllegalArgumentException("Nested brace group at index " + i);
                }
                final int close = glob.indexOf('}', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unbalanced '{' at index " + i);
                }
                flushLiteral(literal, regex);
                regex.append(braceGroup(glob.substring(i + 1, close)));
                i = close + 1;
            } else if (c == '}') {
                throw new IllegalArgumentException("Unbalanced '}' at index " + i);
            } else {
                literal.append(c);
                i++;
            }
        }
        flushLiteral(literal, regex);
        return regex.toString();
    }

    private String braceGroup(final String body) {
        final String placeholder = PLACEHOLDERS.get(body);
        if (placeholder != null) {
            return placeholder;
        }
        if (body.isEmpty()) {
            throw new IllegalArgumentException("Empty brace group");
        }
        if (body.indexOf(',') < 0) {
            return Pattern.quote("{" + body + "}");
        }
        final StringBuilder alternation = new StringBuilder("(?:");
        final String[] options = body.split(",", -1);
        for (int i = 0; i < options.length; i++) {
            if (i > 0) {
                alternation.append('|');
            }
            alternation.append(toRegex(options[i], false));
        }
        return alternation.append(')').toString();
    }

    private static void flushLiteral(final StringBuilder literal, final StringBuilder regex) {
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }
}
