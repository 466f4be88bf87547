package com.eainde.intent.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Catalog store over a directory of {@code *.json} service specifications.
 *
 * <p>A record matches when its {@code id} or {@code name} equals the lookup key.
 * Files are scanned in name order so repeated lookups resolve to the same record.
 * An unreadable or unparsable file does not stop the scan; it only changes the
 * reported kind when no other file matches.</p>
 */
@Log4j2
public class FileSystemCatalogStore implements CatalogStore {

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileSystemCatalogStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public CatalogLookup lookup(String idOrName) {
        List<Path> files;
        try {
            files = listCatalogFiles();
        } catch (IOException e) {
            log.error("Cannot list catalog directory {}", directory, e);
            return CatalogLookup.ioFailure(idOrName, e.getMessage());
        }

        List<String> malformed = new ArrayList<>();
        List<String> unreadable = new ArrayList<>();

        for (Path file : files) {
            JsonNode record;
            try {
                record = objectMapper.readTree(file.toFile());
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed catalog file {}: {}", file.getFileName(), e.getOriginalMessage());
                malformed.add(file.getFileName().toString());
                continue;
            } catch (IOException e) {
                log.warn("Skipping unreadable catalog file {}: {}", file.getFileName(), e.getMessage());
                unreadable.add(file.getFileName().toString());
                continue;
            }
            if (matches(record, idOrName)) {
                return CatalogLookup.found(idOrName, record);
            }
        }

        if (!unreadable.isEmpty()) {
            return CatalogLookup.ioFailure(idOrName, "unreadable catalog files: " + unreadable);
        }
        if (!malformed.isEmpty()) {
            return CatalogLookup.malformed(idOrName, "malformed catalog files: " + malformed);
        }
        return CatalogLookup.notFound(idOrName);
    }

    private List<Path> listCatalogFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.json")) {
            stream.forEach(files::add);
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return files;
    }

    private boolean matches(JsonNode record, String idOrName) {
        return idOrName.equals(record.path("id").asText(null))
                || idOrName.equals(record.path("name").asText(null));
    }
}
