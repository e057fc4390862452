package com.tfbuilder.tfbuilder_backend.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TerraformOutputWriterTest {

    private final TerraformOutputWriter writer = new TerraformOutputWriter();

    @TempDir
    Path root;

    private static GeneratedTerraform generated(String main) {
        return new GeneratedTerraform("provider \"aws\" {}", main, "variable \"env\" {}", "", List.of());
    }

    @Test
    void writesAllFourFiles() throws IOException {
        Path out = root.resolve("infra");

        List<Path> written = writer.write(generated("resource \"aws_vpc\" \"main\" {}"), out);

        assertThat(written).extracting(p -> p.getFileName().toString())
                .containsExactly("provider.tf", "main.tf", "variables.tf", "outputs.tf");
        assertThat(Files.readString(out.resolve("main.tf"))).isEqualTo("resource \"aws_vpc\" \"main\" {}\n");
        assertThat(Files.readString(out.resolve("outputs.tf"))).isEqualTo("\n");
    }

    @Test
    void replacesExistingFiles() throws IOException {
        Path out = root.resolve("infra");
        writer.write(generated("first"), out);

        writer.write(generated("second"), out);

        assertThat(Files.readString(out.resolve("main.tf"))).isEqualTo("second\n");
    }

    @Test
    void failedMoveRestoresFilesAlreadyReplaced() throws IOException {
        Path out = root.resolve("infra");
        writer.write(generated("first"), out);
        Files.delete(out.resolve("provider.tf"));
        Files.delete(out.resolve("outputs.tf"));
        Files.createDirectories(out.resolve("outputs.tf"));
        Files.writeString(out.resolve("outputs.tf").resolve("keep.txt"), "blocks the move");

        assertThatThrownBy(() -> writer.write(generated("second"), out)).isInstanceOf(IOException.class);

        assertThat(Files.readString(out.resolve("main.tf"))).isEqualTo("first\n");
        assertThat(out.resolve("provider.tf")).doesNotExist();
        assertThat(out.resolve("outputs.tf").resolve("keep.txt")).exists();
        try (Stream<Path> entries = Files.list(root)) {
            assertThat(entries.map(p -> p.getFileName().toString())).containsExactly("infra");
        }
    }

    @Test
    void leavesNoStagingDirectoryBehind() throws IOException {
        writer.write(generated("x"), root.resolve("infra"));

        try (Stream<Path> entries = Files.list(root)) {
            assertThat(entries.map(p -> p.getFileName().toString())).containsExactly("infra");
        }
    }
}
