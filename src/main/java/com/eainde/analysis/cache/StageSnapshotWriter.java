package com.eainde.analysis.cache;

import com.eainde.analysis.state.LedgerSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the ledger after every stage to {@code <dir>/<SUBJECT>/<model-key>/<label>_state.json} for
 * inspection. Failures are logged and never affect the run; these files are never read back.
 */
@Log4j2
public class StageSnapshotWriter {

    public static final String INITIAL = "00_initial";
    public static final String FINAL = "99_final";

    private final Path directory;
    private final boolean enabled;
    private final ObjectMapper objectMapper;

    public StageSnapshotWriter(Path directory, boolean enabled, ObjectMapper objectMapper) {
        this.directory = directory;
        this.enabled = enabled;
        this.objectMapper = objectMapper;
    }

    public void write(LedgerSnapshot snapshot, String label) {
        if (!enabled) {
            return;
        }
        Path file = fileOf(snapshot, label);
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), snapshot);
        } catch (IOException e) {
            log.warn("Could not write {} snapshot of run {}: {}", label, snapshot.runId(), e.getMessage());
        }
    }

    Path fileOf(LedgerSnapshot snapshot, String label) {
        return directory.resolve(snapshot.key().subject())
                .resolve(snapshot.key().modelKey())
                .resolve(label + "_state.json");
    }
}
