package com.vidnyan.depindex.adapter.out.index;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.depindex.DepIndexProperties;
import com.vidnyan.depindex.application.port.out.ReverseIndexRepository;
import com.vidnyan.depindex.domain.error.IndexCorruptException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;

/**
 * Persists the reverse index as one pretty-printed JSON object with sorted keys.
 * Writes go to a temp file next to the target, then replace it in one move.
 */
@Slf4j
@Component
public class JsonReverseIndexRepository implements ReverseIndexRepository {

    private static final TypeReference<Map<String, List<String>>> INDEX_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path indexFile;

    @Autowired
    public JsonReverseIndexRepository(ObjectMapper objectMapper, DepIndexProperties properties) {
        this(objectMapper, properties.resolvedIndexFile());
    }

    public JsonReverseIndexRepository(ObjectMapper objectMapper, Path indexFile) {
        this.objectMapper = objectMapper;
        this.indexFile = indexFile;
    }

    @Override
    public Optional<Map<String, List<String>>> load() {
        if (!Files.isRegularFile(indexFile)) {
            return Optional.empty();
        }
        try {
            Map<String, List<String>> loaded = objectMapper.readValue(indexFile.toFile(), INDEX_TYPE);
            if (loaded == null) {
                throw new IndexCorruptException(indexFile, new IllegalArgumentException("empty document"));
            }
            loaded.forEach(this::verifyEntry);
            return Optional.of(loaded);
        } catch (IOException e) {
            throw new IndexCorruptException(indexFile, e);
        }
    }

    private void verifyEntry(String symbol, List<String> files) {
        if (symbol == null || files == null || files.contains(null)) {
            throw new IndexCorruptException(indexFile,
                    new IllegalArgumentException("null entry under symbol " + symbol));
        }
    }

    @Override
    public void save(Map<String, List<String>> index) {
        Map<String, List<String>> sorted = new TreeMap<>(index);
        Path temp = null;
        try {
            Path dir = indexFile.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, ".reverse_index", ".tmp");

            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(sorted);
            Files.writeString(temp, json + "\n", StandardCharsets.UTF_8);
            move(temp, indexFile);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Failed to write " + indexFile, e);
        }
    }

    @Override
    public boolean delete() {
        try {
            return Files.deleteIfExists(indexFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + indexFile, e);
        }
    }

    @Override
    public String location() {
        return indexFile.toString();
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", to);
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
