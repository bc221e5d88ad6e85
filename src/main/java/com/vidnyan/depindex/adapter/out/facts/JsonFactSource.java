package com.vidnyan.depindex.adapter.out.facts;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.depindex.DepIndexProperties;
import com.vidnyan.depindex.application.port.out.FactSource;
import com.vidnyan.depindex.domain.error.MalformedRecordException;
import com.vidnyan.depindex.domain.model.DependencyRecord;
import com.vidnyan.depindex.domain.model.ModulePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * File system based fact source.
 * Reads the {@code *_dependencies.json} records written by the extractor.
 */
@Slf4j
@Component
public class JsonFactSource implements FactSource {

    static final String RECORD_SUFFIX = "_dependencies.json";

    private final ObjectMapper objectMapper;
    private final ModulePaths paths;
    private final Path factsDir;

    public JsonFactSource(ObjectMapper objectMapper, DepIndexProperties properties, ModulePaths paths) {
        this.objectMapper = objectMapper;
        this.paths = paths;
        this.factsDir = properties.resolvedFactsDir();
    }

    @PostConstruct
    public void verifyFactsDir() {
        if (!Files.isDirectory(factsDir)) {
            throw new IllegalStateException("Dependencies directory not found: " + factsDir
                    + " (run the dependency extractor first or set depindex.facts-dir)");
        }
        log.info("Reading dependency records from {}", factsDir);
    }

    @Override
    public Optional<DependencyRecord> read(String filePath) {
        String key = paths.normalize(filePath);
        DependencyRecord fallback = null;

        for (Path candidate : candidates(key)) {
            if (!Files.isRegularFile(candidate)) {
                continue;
            }
            Optional<DependencyRecord> parsed = parseLogged(candidate);
            if (parsed.isEmpty()) {
                continue;
            }
            // two files with the same stem share a record name; prefer the one that matches
            if (matches(parsed.get(), key)) {
                return parsed;
            }
            if (fallback == null) {
                fallback = parsed.get();
            }
        }
        return Optional.ofNullable(fallback);
    }

    @Override
    public List<DependencyRecord> readAll() {
        List<DependencyRecord> records = new ArrayList<>();
        for (Path file : recordFiles()) {
            parseLogged(file).ifPresent(records::add);
        }
        log.debug("Read {} dependency records from {}", records.size(), factsDir);
        return records;
    }

    @Override
    public String location() {
        return factsDir.toString();
    }

    /**
     * Every record file under the facts directory, sorted by path.
     */
    List<Path> recordFiles() {
        if (!Files.isDirectory(factsDir)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(factsDir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(JsonFactSource::isRecordFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + factsDir, e);
        }
    }

    static boolean isRecordFile(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(RECORD_SUFFIX) && !name.startsWith("_");
    }

    /**
     * Record files that may hold {@code key}, restricted to the facts directory.
     */
    private List<Path> candidates(String key) {
        String stem = paths.stem(key);
        Set<Path> candidates = new LinkedHashSet<>();
        insideFactsDir(stem + RECORD_SUFFIX).ifPresent(candidates::add);

        String parent = paths.parentDir(key);
        if (!parent.isEmpty()) {
            insideFactsDir(parent + "/" + stem + RECORD_SUFFIX).ifPresent(candidates::add);
        }

        String module = paths.moduleName(key);
        if (!paths.hasSourceExtension(key) && module.contains(".")) {
            insideFactsDir(module + RECORD_SUFFIX).ifPresent(candidates::add);
        }
        return List.copyOf(candidates);
    }

    private Optional<Path> insideFactsDir(String relative) {
        Path root = factsDir.toAbsolutePath().normalize();
        try {
            Path candidate = root.resolve(relative).normalize();
            if (!candidate.startsWith(root)) {
                log.debug("Ignoring lookup outside {}: {}", factsDir, relative);
                return Optional.empty();
            }
            return Optional.of(candidate);
        } catch (InvalidPathException e) {
            log.debug("Ignoring invalid lookup path {}: {}", relative, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean matches(DependencyRecord record, String key) {
        String recorded = paths.normalize(record.filePath());
        return recorded.equals(key) || paths.moduleName(recorded).equals(paths.moduleName(key));
    }

    private Optional<DependencyRecord> parseLogged(Path file) {
        try {
            return Optional.of(parse(file));
        } catch (MalformedRecordException e) {
            log.warn("Skipping {}", e.getMessage());
            return Optional.empty();
        }
    }

    DependencyRecord parse(Path file) {
        RecordDto dto;
        try {
            dto = objectMapper.readValue(file.toFile(), RecordDto.class);
        } catch (IOException e) {
            throw new MalformedRecordException(file, e);
        }
        if (dto == null) {
            throw new MalformedRecordException(file, new IllegalArgumentException("empty document"));
        }
        return mapToRecord(dto, file);
    }

    private DependencyRecord mapToRecord(RecordDto dto, Path file) {
        String filePath = dto.filePath != null && !dto.filePath.isBlank()
                ? paths.normalize(dto.filePath)
                : recordName(file);

        return new DependencyRecord(
                filePath,
                map(dto.imports, i -> new DependencyRecord.ImportRef(
                        i.module, i.resolvedModule, i.name, i.alias, line(i.line))),
                map(dto.functionCalls, c -> new DependencyRecord.FunctionCall(c.function, line(c.line))),
                map(dto.configFiles, c -> new DependencyRecord.ConfigFile(c.file, c.type, line(c.line))),
                map(dto.fileReads, r -> new DependencyRecord.FileAccess(r.path, r.operation, line(r.line))),
                map(dto.fileWrites, w -> new DependencyRecord.FileAccess(w.path, w.operation, line(w.line))),
                map(dto.envVars, e -> new DependencyRecord.EnvVar(e.var, e.defaultValue)),
                map(dto.apiCalls, a -> new DependencyRecord.ApiCall(a.service, a.endpoint)),
                map(dto.subprocessCalls, s -> new DependencyRecord.SubprocessCall(
                        s.command != null ? s.command : s.script))
        );
    }

    private static String recordName(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - RECORD_SUFFIX.length());
    }

    private static <D, T> List<T> map(List<D> dtos, Function<D, T> mapper) {
        if (dtos == null) {
            return List.of();
        }
        return dtos.stream().filter(Objects::nonNull).map(mapper).toList();
    }

    private static int line(Integer line) {
        return line != null ? line : 0;
    }

    // DTO classes for JSON deserialization
    static class RecordDto {
        @JsonProperty("file_path")
        public String filePath;
        public List<ImportDto> imports;
        @JsonProperty("function_calls")
        public List<FunctionCallDto> functionCalls;
        @JsonProperty("config_files")
        public List<ConfigFileDto> configFiles;
        @JsonProperty("file_reads")
        public List<FileAccessDto> fileReads;
        @JsonProperty("file_writes")
        public List<FileAccessDto> fileWrites;
        @JsonProperty("env_vars")
        public List<EnvVarDto> envVars;
        @JsonProperty("api_calls")
        public List<ApiCallDto> apiCalls;
        @JsonProperty("subprocess_calls")
        public List<SubprocessDto> subprocessCalls;
    }

    static class ImportDto {
        public String module;
        @JsonProperty("resolved_module")
        public String resolvedModule;
        public String name;
        public String alias;
        public Integer line;
    }

    static class FunctionCallDto {
        @JsonAlias("name")
        public String function;
        public Integer line;
    }

    static class ConfigFileDto {
        public String file;
        public String type;
        public Integer line;
    }

    static class FileAccessDto {
        public String path;
        public String operation;
        public Integer line;
    }

    static class EnvVarDto {
        public String var;
        @JsonProperty("default")
        public String defaultValue;
    }

    static class ApiCallDto {
        public String service;
        public String endpoint;
    }

    static class SubprocessDto {
        public String command;
        public String script;
    }
}
