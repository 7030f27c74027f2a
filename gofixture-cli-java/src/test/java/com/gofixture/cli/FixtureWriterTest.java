package com.gofixture.cli;

import com.gofixture.cli.io.FixtureWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FixtureWriterTest {

    private final FixtureWriter writer = new FixtureWriter();

    @Test
    void createsParentDirectories(@TempDir Path tmp) throws IOException {
        Path target = tmp.resolve("a/b/fixture.go");
        writer.write(target, "var _ = 1\n");
        assertEquals("var _ = 1\n", Files.readString(target));
    }

    @Test
    void writesUtf8(@TempDir Path tmp) throws IOException {
        Path target = tmp.resolve("fixture.go");
        writer.write(target, "var _ = \"día\"\n");
        assertArrayEquals("var _ = \"día\"\n".getBytes(StandardCharsets.UTF_8), Files.readAllBytes(target));
    }

    @Test
    void overwritesExistingFile(@TempDir Path tmp) throws IOException {
        Path target = tmp.resolve("fixture.go");
        Files.writeString(target, "old contents that are longer");
        writer.write(target, "new");
        assertEquals("new", Files.readString(target));
    }

    @Test
    void directoryTargetFails(@TempDir Path tmp) {
        assertThrows(FixtureWriter.WriteException.class, () -> writer.write(tmp, "x"));
    }
}
