package com.tfbuilder.tfbuilder_backend.terraform;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/** Reads the {@code .tf} files of one directory (not recursive), sorted by file name. */
@Slf4j
@Component
public class LocalDirectoryLoader {

    static final String EXTENSION = ".tf";

    /**
     * @throws IllegalArgumentException when {@code directory} is not a directory
     * @throws UncheckedIOException     when the directory listing itself fails
     */
    public List<String> loadDocuments(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }

        List<String> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                documents.add(Files.readString(file, StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.warn("Skipping unreadable file {}: {}", file, e.getMessage());
            }
        }
        log.info("Loaded {} Terraform files from {}", documents.size(), directory);
        return documents;
    }
}
