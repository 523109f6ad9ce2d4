package com.signalgate.service.store;

import com.signalgate.core.model.SignalType;
import com.signalgate.service.support.ServiceHarness;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AtomicFileWriterTest {
    @Test
    void writesIntoMissingDirectories() throws Exception {
        Path file = Files.createTempDirectory("atomic-write-").resolve("state/nested/doc.json");

        AtomicFileWriter.write(file, out -> out.write("{\"a\":1}".getBytes(StandardCharsets.UTF_8)));

        assertEquals("{\"a\":1}", Files.readString(file));
        assertEquals(List.of("doc.json"), fileNames(file.getParent()));
    }

    @Test
    void failureMidWriteKeepsPreviousContentAndLeavesNoTempFile() throws Exception {
        Path dir = Files.createTempDirectory("atomic-write-fail-");
        Path file = dir.resolve("signals.json");
        Files.writeString(file, "[\"old\"]");

        assertThrows(IOException.class, () -> AtomicFileWriter.write(file, out -> {
            out.write("[\"half".getBytes(StandardCharsets.UTF_8));
            throw new IOException("disk full");
        }));

        assertEquals("[\"old\"]", Files.readString(file));
        assertEquals(List.of("signals.json"), fileNames(dir));
    }

    @Test
    void interruptedSignalWriteStillReloads() throws Exception {
        Path file = Files.createTempDirectory("atomic-write-reload-").resolve("signals.json");
        JsonFileSignalRepository repository = new JsonFileSignalRepository(file);
        repository.insertIfAbsent(ServiceHarness.approvedSignal(
                "keep", SignalType.IPO, 0.9, Instant.parse("2026-10-14T08:00:00Z")));

        assertThrows(IOException.class, () -> AtomicFileWriter.write(file, out -> {
            out.write("[{\"id\":".getBytes(StandardCharsets.UTF_8));
            throw new IOException("killed");
        }));

        assertEquals(1, new JsonFileSignalRepository(file).findAll().size());
    }

    private static List<String> fileNames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(path -> path.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }
}
