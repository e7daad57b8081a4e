package com.radioautomation.intake.service.relocation;

import com.radioautomation.intake.config.IntakeProperties;
import com.radioautomation.intake.exception.IntakeErrorCode;
import com.radioautomation.intake.exception.RelocationException;
import com.radioautomation.intake.model.ShowProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Moves a detected file into its show's output directory under a conflict-free name.
 * <p>
 * The source is copied, never moved, and an existing output file is never overwritten: when the computed
 * destination is taken, {@code _1}, {@code _2}, ... are appended to the base name until a free name is found.
 * Every failure, including filesystem errors, is returned as a failed {@link RelocationResult}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileRelocator {

    private final IntakeProperties properties;
    private final OutputFilenameGenerator filenameGenerator;
    private final OutputFileWriter outputFileWriter;

    /**
     * Validates the source file and copies it to the show's output directory.
     *
     * @param sourcePath The detected file.
     * @param show       The show that owns the file.
     * @return The output path and bytes written, or the reason the file could not be relocated.
     */
    public RelocationResult relocate(final Path sourcePath, final ShowProfile show) {
        final String filename = String.valueOf(sourcePath.getFileName());
        log.info("Relocating file '{}' for show '{}'", filename, show.getName());
        try {
            validateExtension(filename);
            validateSource(sourcePath);

            final Path outputDirectory = resolveOutputDirectory(show);
            Files.createDirectories(outputDirectory);

            final String outputFilename = filenameGenerator.generate(filename, show);
            final RelocationResult result = copyToFreeName(sourcePath, outputDirectory.resolve(outputFilename));
            log.info("File successfully relocated: {} -> {} ({} bytes)", filename, result.getOutputPath(),
                     result.getBytesProcessed());
            return result;
        } catch (RelocationException e) {
            log.warn("Relocation of '{}' rejected: {}", filename, e.getMessage());
            return RelocationResult.failure(e.getErrorCode(), e.getMessage());
        } catch (IOException | InvalidPathException | SecurityException e) {
            log.error("Failed to relocate file '{}'", filename, e);
            return RelocationResult.failure(IntakeErrorCode.UNKNOWN_PROCESSING_ERROR, describe(e));
        }
    }

    /**
     * Resolves the directory a show's files are written to. Surrounding quotes are stripped and relative
     * paths are resolved against the working directory.
     */
    Path resolveOutputDirectory(final ShowProfile show) {
        String configured = show.getOutputDirectory();
        if (StringUtils.hasText(configured)) {
            configured = configured.trim().replaceAll("^[\"']|[\"']$", "");
        }
        if (!StringUtils.hasText(configured)) {
            configured = properties.getDefaultOutputDirectory();
        }
        return Paths.get(configured).toAbsolutePath().normalize();
    }

    private void validateExtension(final String filename) {
        final String extension = FilenameUtils.getExtension(filename).toLowerCase(Locale.ROOT);
        final boolean allowed = properties.getAllowedExtensions().stream()
                                          .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
                                          .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                                          .anyMatch(extension::equals);
        if (!allowed) {
            throw new RelocationException(IntakeErrorCode.UNSUPPORTED_EXTENSION,
                                          "Unsupported file extension: ." + extension);
        }
    }

    private void validateSource(final Path sourcePath) {
        if (!Files.exists(sourcePath)) {
            throw new RelocationException(IntakeErrorCode.SOURCE_NOT_FOUND, "Source file not found: " + sourcePath);
        }
        if (!Files.isRegularFile(sourcePath)) {
            throw new RelocationException(IntakeErrorCode.SOURCE_NOT_FOUND,
                                          "Source path is not a file: " + sourcePath);
        }
    }

    private RelocationResult copyToFreeName(final Path sourcePath, final Path destination) throws IOException {
        final int maxAttempts = properties.getMaxConflictAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            final Path candidate = attempt == 0 ? destination : withSuffix(destination, attempt);
            if (Files.exists(candidate)) {
                continue;
            }
            try {
                final long bytes = outputFileWriter.copy(sourcePath, candidate);
                if (attempt > 0) {
                    log.info("File conflict resolved: {} -> {}", destination, candidate);
                }
                return RelocationResult.success(candidate, bytes, attempt > 0);
            } catch (FileAlreadyExistsException e) {
                log.debug("Output name {} was taken while copying, trying the next suffix.", candidate);
            }
        }
        throw new RelocationException(IntakeErrorCode.TOO_MANY_CONFLICTS,
                                      "Too many file conflicts, unable to resolve a free name for " + destination);
    }

    private static Path withSuffix(final Path destination, final int suffix) {
        final String filename = destination.getFileName().toString();
        final String extension = FilenameUtils.getExtension(filename);
        final String baseName = FilenameUtils.getBaseName(filename);
        final String suffixed = extension.isEmpty()
                ? baseName + "_" + suffix
                : baseName + "_" + suffix + "." + extension;
        return destination.resolveSibling(suffixed);
    }

    private static String describe(final Exception e) {
        final String message = e.getMessage();
        return StringUtils.hasText(message)
                ? e.getClass().getSimpleName() + ": " + message
                : e.getClass().getSimpleName();
    }
}
