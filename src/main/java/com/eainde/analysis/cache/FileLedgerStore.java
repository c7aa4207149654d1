package com.eainde.analysis.cache;

import com.eainde.analysis.model.AnalysisKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * One JSON document per key, named after the SHA-256 of the key's canonical form. Entries are written to a
 * temporary file and moved into place, so readers never see a partial document.
 */
@Log4j2
public class FileLedgerStore implements LedgerStore {

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileLedgerStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<CacheEntry> read(AnalysisKey key) {
        Path file = fileOf(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            CacheEntry entry = objectMapper.readValue(file.toFile(), CacheEntry.class);
            if (!key.equals(entry.key())) {
                throw new IllegalStateException("Cache file " + file + " holds " + entry.key().canonical()
                        + " instead of " + key.canonical());
            }
            return Optional.of(entry);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cache entry " + file, e);
        }
    }

    @Override
    public boolean createIfAbsent(CacheEntry entry) {
        Path target = fileOf(entry.key());
        if (Files.exists(target)) {
            return false;
        }
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entry);
            Files.move(temp, target);
            temp = null;
            log.debug("Stored cache entry {} as {}", entry.key().canonical(), target.getFileName());
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write cache entry " + target, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    @Override
    public boolean delete(AnalysisKey key) {
        try {
            return Files.deleteIfExists(fileOf(key));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete cache entry for " + key.canonical(), e);
        }
    }

    Path fileOf(AnalysisKey key) {
        return directory.resolve(sha256(key.canonical()) + ".json");
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary cache file {}: {}", temp, e.getMessage());
        }
    }
}
