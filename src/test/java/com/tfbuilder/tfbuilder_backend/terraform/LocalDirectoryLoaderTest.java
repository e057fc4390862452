package com.tfbuilder.tfbuilder_backend.terraform;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalDirectoryLoaderTest {

    private final LocalDirectoryLoader loader = new LocalDirectoryLoader();

    @TempDir
    Path dir;

    @Test
    void readsTerraformFilesInNameOrder() throws IOException {
        Files.writeString(dir.resolve("variables.tf"), "variable \"env\" {}");
        Files.writeString(dir.resolve("main.tf"), "resource \"aws_vpc\" \"main\" {}");
        Files.writeString(dir.resolve("README.md"), "# notes");
        Files.writeString(dir.resolve("terraform.tfvars"), "env = \"dev\"");
        Files.createDirectories(dir.resolve("modules.tf"));

        assertThat(loader.loadDocuments(dir))
                .containsExactly("resource \"aws_vpc\" \"main\" {}", "variable \"env\" {}");
    }

    @Test
    void emptyDirectoryYieldsNothing() {
        assertThat(loader.loadDocuments(dir)).isEmpty();
    }

    @Test
    void rejectsAFile() throws IOException {
        Path file = Files.writeString(dir.resolve("main.tf"), "");

        assertThatThrownBy(() -> loader.loadDocuments(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Not a directory");
    }

    @Test
    void rejectsAMissingPath() {
        assertThatThrownBy(() -> loader.loadDocuments(dir.resolve("missing")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
