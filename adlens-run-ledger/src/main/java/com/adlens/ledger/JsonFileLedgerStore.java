package com.adlens.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Persists a ledger as-is to {@code <dir>/run_ledger_<runId>.json}.
 */
public final class JsonFileLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLedgerStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path directory;

    public JsonFileLedgerStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public void save(RunLedger ledger) throws IOException {
        Files.createDirectories(directory);
        Path file = fileFor(ledger.getRunId());
        Files.writeString(file, MAPPER.writeValueAsString(ledger));
        log.info("Ledger saved | runId={} | file={}", ledger.getRunId(), file);
    }

    public Path fileFor(String runId) {
        return directory.resolve("run_ledger_" + runId + ".json");
    }
}
