package com.lanhub.collector.intake.storage;

import com.lanhub.collector.intake.model.VersioningMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes {@code (identity, version, timestamp)} into artifact file names and allocates the next
 * free version in a folder. Callers hold the {@link IoSerializer} lock around
 * {@link #allocate} and the write that follows it.
 */
@Component
public class FilenameVersioner {
    private static final Logger log = LoggerFactory.getLogger(FilenameVersioner.class);

    private static final DateTimeFormatter STAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final DateTimeFormatter STAMP_PARSE = DateTimeFormatter.ofPattern("uuuuMMddHHmmss")
        .withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern SUBMISSION_NAME =
        Pattern.compile("^(.+)-([^-]+)-([^-]+)_v(\\d+)-(\\d{8})-(\\d{6})$");

    public String simpleName(String prefix, int version, String extension) {
        return prefix + "_v" + version + extension;
    }

    public String timestampedName(String prefix, int version, LocalDateTime timestamp, String extension) {
        return prefix + "_v" + version + "-" + STAMP_FORMAT.format(timestamp) + extension;
    }

    /**
     * Version encoded in {@code nameWithoutExtension} for the given prefix, accepting both the
     * simple and the timestamped form.
     */
    public OptionalInt parseVersion(String prefix, String nameWithoutExtension) {
        Matcher matcher = versionPattern(prefix).matcher(nameWithoutExtension);
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException e) {
            log.debug("Version out of range in {}", nameWithoutExtension);
            return OptionalInt.empty();
        }
    }

    public int nextVersion(Path folder, String prefix, String extension) throws IOException {
        int max = 0;
        for (Path file : listMatching(folder, prefix + "_v", extension)) {
            String name = file.getFileName().toString();
            String stem = name.substring(0, name.length() - extension.length());
            OptionalInt version = parseVersion(prefix, stem);
            if (version.isPresent()) {
                max = Math.max(max, version.getAsInt());
            } else {
                log.debug("Ignoring {} while computing next version of {}", name, prefix);
            }
        }
        return max + 1;
    }

    /**
     * Deletes every file starting with {@code prefix} and ending with {@code extension}. This is
     * broader than the version grammar, so a prefix-colliding name that {@link #nextVersion}
     * ignores is still removed here.
     */
    public int deleteForOverwrite(Path folder, String prefix, String extension) throws IOException {
        int deleted = 0;
        for (Path file : listMatching(folder, prefix, extension)) {
            log.info("Deleting old file for overwrite: {}", file);
            Files.deleteIfExists(file);
            deleted++;
        }
        return deleted;
    }

    /**
     * Picks the target path for a new artifact. With {@code timestamp == null} the simple
     * {@code _v<N>} form is used.
     */
    public StoredArtifact allocate(
        Path folder,
        String prefix,
        String extension,
        VersioningMode mode,
        LocalDateTime timestamp
    ) throws IOException {
        int version;
        if (mode == VersioningMode.OVERWRITE) {
            deleteForOverwrite(folder, prefix, extension);
            version = 1;
        } else {
            version = nextVersion(folder, prefix, extension);
        }
        String name = timestamp == null
            ? simpleName(prefix, version, extension)
            : timestampedName(prefix, version, timestamp, extension);
        return new StoredArtifact(folder.resolve(name), version);
    }

    public Optional<ParsedArtifactName> decode(String nameWithoutExtension) {
        if (nameWithoutExtension == null) {
            return Optional.empty();
        }
        Matcher matcher = SUBMISSION_NAME.matcher(nameWithoutExtension);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            int version = Integer.parseInt(matcher.group(4));
            LocalDateTime timestamp = LocalDateTime.parse(matcher.group(5) + matcher.group(6), STAMP_PARSE);
            return Optional.of(new ParsedArtifactName(
                matcher.group(1),
                matcher.group(2),
                matcher.group(3),
                version,
                timestamp
            ));
        } catch (NumberFormatException | DateTimeParseException e) {
            log.debug("Unparseable artifact name {}: {}", nameWithoutExtension, e.getMessage());
            return Optional.empty();
        }
    }

    private Pattern versionPattern(String prefix) {
        return Pattern.compile("^" + Pattern.quote(prefix) + "_v(\\d+)(-\\d{8}-\\d{6})?$");
    }

    private List<Path> listMatching(Path folder, String startsWith, String endsWith) throws IOException {
        List<Path> matches = new ArrayList<>();
        if (!Files.isDirectory(folder)) {
            return matches;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                if (Files.isRegularFile(file)
                    && name.length() >= startsWith.length() + endsWith.length()
                    && name.startsWith(startsWith)
                    && name.endsWith(endsWith)) {
                    matches.add(file);
                }
            }
        }
        return matches;
    }
}
