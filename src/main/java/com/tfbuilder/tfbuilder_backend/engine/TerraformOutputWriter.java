package com.tfbuilder.tfbuilder_backend.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Writes generated artifacts into a directory. All files are written to a
 * staging directory next to the target first and only then moved in. Files
 * being replaced are backed up in the staging directory; if a later move
 * fails, the files already moved are put back the way they were.
 */
@Slf4j
@Component
public class TerraformOutputWriter {

    private static final String BACKUP_DIRECTORY = ".previous";

    public List<Path> write(GeneratedTerraform generated, Path outputDirectory) throws IOException {
        Path target = outputDirectory.toAbsolutePath();
        Files.createDirectories(target);
        Path staging = Files.createTempDirectory(target.getParent() != null ? target.getParent() : target, ".tf-staging-");
        try {
            for (Map.Entry<String, String> file : generated.files().entrySet()) {
                Files.writeString(staging.resolve(file.getKey()), file.getValue() + "\n", StandardCharsets.UTF_8);
            }
            Path backup = Files.createDirectory(staging.resolve(BACKUP_DIRECTORY));
            List<Path> written = new ArrayList<>();
            try {
                for (String name : generated.files().keySet()) {
                    Path destination = target.resolve(name);
                    if (Files.isRegularFile(destination)) {
                        Files.copy(destination, backup.resolve(name), StandardCopyOption.REPLACE_EXISTING);
                    }
                    move(staging.resolve(name), destination);
                    written.add(destination);
                }
            } catch (IOException e) {
                log.warn("Writing Terraform files to {} failed, restoring {} replaced files", target, written.size());
                rollback(written, backup, e);
                throw e;
            }
            log.info("Wrote {} Terraform files to {}", written.size(), target);
            return written;
        } finally {
            deleteQuietly(staging);
        }
    }

    private static void rollback(List<Path> written, Path backup, IOException failure) {
        for (Path destination : written) {
            Path previous = backup.resolve(destination.getFileName().toString());
            try {
                if (Files.exists(previous)) {
                    move(previous, destination);
                } else {
                    Files.deleteIfExists(destination);
                }
            } catch (IOException e) {
                log.error("Could not restore {}: {}", destination, e.getMessage());
                failure.addSuppressed(e);
            }
        }
    }

    private static void move(Path source, Path destination) throws IOException {
        try {
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path directory) {
        try (Stream<Path> entries = Files.walk(directory)) {
            for (Path entry : entries.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(entry);
            }
        } catch (IOException e) {
            log.warn("Could not remove staging directory {}: {}", directory, e.getMessage());
        }
    }
}
