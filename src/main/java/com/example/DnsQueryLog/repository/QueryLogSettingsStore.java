package com.example.DnsQueryLog.repository;

import com.example.DnsQueryLog.dto.QueryLogConfigDto;
import com.example.DnsQueryLog.exception.PersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the operator's query log settings across restarts.
 */
@Slf4j
public class QueryLogSettingsStore {

    private final Path file;
    private final ObjectMapper mapper = JsonMapper.builder().build();

    public QueryLogSettingsStore(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    public Optional<QueryLogConfigDto> load() {
        if (Files.notExists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), QueryLogConfigDto.class));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read query log settings from " + file, e);
        }
    }

    public void save(QueryLogConfigDto config) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(tmp.toFile(), config);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PersistenceException("Failed to save query log settings to " + file, e);
        }
        log.debug("Query log settings saved to {}: {}", file, config);
    }
}
