package com.lanhub.collector.intake.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes merge output next to its destination and moves it into place only once the write has
 * finished. A failed write leaves the previous output as it was.
 */
@Component
public class OutputReplacer {
    private static final Logger log = LoggerFactory.getLogger(OutputReplacer.class);

    @FunctionalInterface
    public interface OutputWriter {
        void write(Path target) throws IOException;
    }

    public void replace(Path output, OutputWriter writer) throws IOException {
        Path destination = output.toAbsolutePath().normalize();
        Path directory = destination.getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, "." + destination.getFileName() + "-", ".tmp");
        try {
            writer.write(temp);
            move(temp, destination);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to produce {}", destination, e);
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    private void move(Path source, Path destination) throws IOException {
        try {
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", destination);
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
