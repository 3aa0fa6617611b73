package com.lanhub.collector.intake.merge;

import com.lanhub.collector.intake.storage.FilenameVersioner;
import com.lanhub.collector.intake.storage.ParsedArtifactName;
import com.lanhub.collector.intake.util.FileNameSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reduces a folder of versioned submissions to the newest artifact per submitter. Names that do
 * not follow the submission grammar each form their own group.
 */
@Component
public class LatestVersionSelector {
    private static final Logger log = LoggerFactory.getLogger(LatestVersionSelector.class);

    private static final Comparator<Candidate> NEWEST_FIRST = Comparator
        .comparingInt(Candidate::version)
        .thenComparing(Candidate::timestamp)
        .reversed();

    private final FilenameVersioner versioner;

    public LatestVersionSelector(FilenameVersioner versioner) {
        this.versioner = versioner;
    }

    public LatestVersionSelection selectLatest(Path folder, String extension) throws IOException {
        return selectLatest(folder, extension, null);
    }

    public LatestVersionSelection selectLatest(Path folder, String extension, Path excluded) throws IOException {
        List<Path> files = listFiles(folder, extension, excluded);
        Map<String, List<Candidate>> groups = new LinkedHashMap<>();
        for (Path file : files) {
            Candidate candidate = toCandidate(file, extension);
            groups.computeIfAbsent(candidate.identity(), ignored -> new ArrayList<>()).add(candidate);
        }

        List<Path> selected = new ArrayList<>(groups.size());
        for (List<Candidate> group : groups.values()) {
            group.sort(NEWEST_FIRST);
            selected.add(group.get(0).path());
        }
        log.info(
            "Version filtering in {}: {} files -> {} (skipped {} older versions)",
            folder,
            files.size(),
            selected.size(),
            files.size() - selected.size()
        );
        return new LatestVersionSelection(selected, files.size());
    }

    private Candidate toCandidate(Path file, String extension) throws IOException {
        String fileName = file.getFileName().toString();
        String stem = fileName.substring(0, fileName.length() - extension.length());
        Optional<ParsedArtifactName> parsed = versioner.decode(stem);
        if (parsed.isPresent()) {
            ParsedArtifactName name = parsed.get();
            return new Candidate(file, name.identityKey(), name.version(), name.timestamp());
        }
        log.debug("{} does not follow the submission naming scheme, treating it as its own group", fileName);
        return new Candidate(file, "file:" + fileName, 1, creationTime(file));
    }

    private LocalDateTime creationTime(Path file) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        return LocalDateTime.ofInstant(attributes.creationTime().toInstant(), ZoneId.systemDefault());
    }

    private List<Path> listFiles(Path folder, String extension, Path excluded) throws IOException {
        String suffix = extension.toLowerCase(Locale.ROOT);
        Path excludedNormalized = excluded == null ? null : excluded.toAbsolutePath().normalize();
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path file : stream) {
                String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
                if (!Files.isRegularFile(file) || !name.endsWith(suffix) || name.length() == suffix.length()) {
                    continue;
                }
                if (excludedNormalized != null && file.toAbsolutePath().normalize().equals(excludedNormalized)) {
                    log.debug("Skipping merge output {} found in the source folder", file);
                    continue;
                }
                files.add(file);
            }
        }
        files.sort(Comparator.comparing(path -> FileNameSanitizer.stripExtension(path.getFileName().toString())));
        return files;
    }

    private record Candidate(Path path, String identity, int version, LocalDateTime timestamp) {
    }
}
