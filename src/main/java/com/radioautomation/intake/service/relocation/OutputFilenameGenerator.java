package com.radioautomation.intake.service.relocation;

import com.radioautomation.intake.model.ShowProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes the destination filename for a relocated file from the show's naming template.
 * <p>
 * Date placeholders are filled from the current date (the day the file is ingested), not from the file itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutputFilenameGenerator {

    private static final Pattern SHOW_NAME = Pattern.compile("\\{showName}", Pattern.CASE_INSENSITIVE);
    private static final Pattern ORIGINAL_FILENAME = Pattern.compile("\\{originalFilename}", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR = Pattern.compile("\\{YYYY}", Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH = Pattern.compile("\\{MM}", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY = Pattern.compile("\\{DD}", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNRESOLVED = Pattern.compile("\\{[^}]*}");

    private static final Pattern RESERVED_CHARACTERS = Pattern.compile("[<>:\"/\\\\|?*]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_+");

    private final Clock clock;

    /**
     * Builds the output filename, keeping the original file's extension.
     *
     * @param originalFilename The filename as detected in the watch directory.
     * @param show             The show that owns the file.
     * @return The sanitized output filename.
     */
    public String generate(final String originalFilename, final ShowProfile show) {
        final String extension = FilenameUtils.getExtension(originalFilename);
        final String baseName = FilenameUtils.getBaseName(originalFilename);

        String outputName;
        if (StringUtils.hasText(show.getOutputFilenameTemplate())) {
            final LocalDate today = LocalDate.now(clock);
            outputName = show.getOutputFilenameTemplate();
            outputName = replace(SHOW_NAME, outputName, nullToEmpty(show.getName()));
            outputName = replace(ORIGINAL_FILENAME, outputName, baseName);
            outputName = replace(YEAR, outputName, String.format("%04d", today.getYear()));
            outputName = replace(MONTH, outputName, String.format("%02d", today.getMonthValue()));
            outputName = replace(DAY, outputName, String.format("%02d", today.getDayOfMonth()));
            outputName = UNRESOLVED.matcher(outputName).replaceAll("");
            outputName = sanitize(outputName);
        } else {
            outputName = sanitize(nullToEmpty(show.getName()));
        }

        if (!StringUtils.hasText(outputName)) {
            log.warn("Output name for '{}' resolved to an empty string, falling back to the original name.",
                     originalFilename);
            outputName = sanitize(baseName);
        }
        return extension.isEmpty() ? outputName : outputName + "." + extension;
    }

    /**
     * Replaces characters reserved by common filesystems with {@code _} and collapses whitespace.
     */
    static String sanitize(final String name) {
        String sanitized = RESERVED_CHARACTERS.matcher(name).replaceAll("_");
        sanitized = WHITESPACE.matcher(sanitized).replaceAll("_");
        sanitized = REPEATED_UNDERSCORES.matcher(sanitized).replaceAll("_");
        return sanitized.trim();
    }

    private static String replace(final Pattern placeholder, final String input, final String value) {
        return placeholder.matcher(input).replaceAll(Matcher.quoteReplacement(value));
    }

    private static String nullToEmpty(final String value) {
        return value == null ? "" : value;
    }
}
