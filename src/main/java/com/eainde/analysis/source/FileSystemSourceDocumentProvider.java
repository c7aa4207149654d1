package com.eainde.analysis.source;

import com.eainde.analysis.error.NoSourceDocumentException;
import com.eainde.analysis.error.UnknownSubjectException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code <dir>/<SUBJECT>.txt} and the optional {@code <dir>/<SUBJECT>.json} market data file.
 */
@Log4j2
public class FileSystemSourceDocumentProvider implements SourceDocumentProvider {

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileSystemSourceDocumentProvider(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceDocument load(String subject) {
        Path text = directory.resolve(subject + ".txt");
        Path market = directory.resolve(subject + ".json");
        if (!Files.exists(text) && !Files.exists(market)) {
            throw new UnknownSubjectException(subject);
        }
        if (!Files.isRegularFile(text)) {
            throw new NoSourceDocumentException(subject);
        }
        try {
            String content = Files.readString(text, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                throw new NoSourceDocumentException(subject);
            }
            MarketData data = Files.isRegularFile(market)
                    ? objectMapper.readValue(market.toFile(), MarketData.class)
                    : new MarketData(null, null);
            log.debug("Loaded {} characters of statement text for {}", content.length(), subject);
            return new SourceDocument(subject, content, data.stockPrice(), data.currency());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read source document for " + subject, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MarketData(Double stockPrice, String currency) {
    }
}
