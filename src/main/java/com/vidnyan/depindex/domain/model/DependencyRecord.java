package com.vidnyan.depindex.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Dependency facts extracted for a single source file.
 * Immutable value object; produced upstream and never mutated here.
 */
public record DependencyRecord(
    String filePath,
    List<ImportRef> imports,
    List<FunctionCall> functionCalls,
    List<ConfigFile> configFiles,
    List<FileAccess> fileReads,
    List<FileAccess> fileWrites,
    List<EnvVar> envVars,
    List<ApiCall> apiCalls,
    List<SubprocessCall> subprocessCalls
) {

    public DependencyRecord {
        Objects.requireNonNull(filePath, "filePath");
        imports = copy(imports);
        functionCalls = copy(functionCalls);
        configFiles = copy(configFiles);
        fileReads = copy(fileReads);
        fileWrites = copy(fileWrites);
        envVars = copy(envVars);
        apiCalls = copy(apiCalls);
        subprocessCalls = copy(subprocessCalls);
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    /**
     * Resolved module names of all imports, in declaration order, without duplicates.
     */
    public List<String> importedModules() {
        return imports.stream()
                .map(ImportRef::effectiveModule)
                .filter(m -> !m.isEmpty())
                .distinct()
                .toList();
    }

    /**
     * Module prefixes of dotted function calls ({@code json.dumps} → {@code json}).
     */
    public List<String> callPrefixes() {
        return functionCalls.stream()
                .map(FunctionCall::qualifier)
                .filter(q -> !q.isEmpty())
                .distinct()
                .toList();
    }

    public boolean hasNoDependencies() {
        return imports.isEmpty() && functionCalls.isEmpty() && configFiles.isEmpty()
                && fileReads.isEmpty() && fileWrites.isEmpty() && envVars.isEmpty()
                && apiCalls.isEmpty() && subprocessCalls.isEmpty();
    }

    public static Builder builder(String filePath) {
        return new Builder(filePath);
    }

    /**
     * An import statement. {@code name} is set for {@code from x import name} forms.
     */
    public record ImportRef(String module, String resolvedModule, String name, String alias, int line) {

        public static ImportRef of(String module) {
            return new ImportRef(module, module, null, null, 0);
        }

        /**
         * The resolved module when known, the raw module otherwise.
         */
        public String effectiveModule() {
            if (resolvedModule != null && !resolvedModule.isBlank()) {
                return resolvedModule;
            }
            return module != null ? module : "";
        }

        /**
         * Final dotted component of the effective module.
         */
        public String moduleStem() {
            String m = effectiveModule();
            return m.substring(m.lastIndexOf('.') + 1);
        }
    }

    public record FunctionCall(String name, int line) {

        public String qualifier() {
            if (name == null) {
                return "";
            }
            int dot = name.indexOf('.');
            return dot > 0 ? name.substring(0, dot) : "";
        }
    }

    public record ConfigFile(String file, String type, int line) {}

    public record FileAccess(String path, String operation, int line) {}

    public record EnvVar(String var, String defaultValue) {}

    public record ApiCall(String service, String endpoint) {}

    public record SubprocessCall(String command) {}

    public static class Builder {
        private final String filePath;
        private final List<ImportRef> imports = new ArrayList<>();
        private final List<FunctionCall> functionCalls = new ArrayList<>();
        private final List<ConfigFile> configFiles = new ArrayList<>();
        private final List<FileAccess> fileReads = new ArrayList<>();
        private final List<FileAccess> fileWrites = new ArrayList<>();
        private final List<EnvVar> envVars = new ArrayList<>();
        private final List<ApiCall> apiCalls = new ArrayList<>();
        private final List<SubprocessCall> subprocessCalls = new ArrayList<>();

        private Builder(String filePath) { this.filePath = filePath; }

        public Builder importModule(String module) { imports.add(ImportRef.of(module)); return this; }
        public Builder call(String name) { functionCalls.add(new FunctionCall(name, 0)); return this; }
        public Builder configFile(String file, String type) { configFiles.add(new ConfigFile(file, type, 0)); return this; }
        public Builder reads(String path) { fileReads.add(new FileAccess(path, "open", 0)); return this; }
        public Builder writes(String path) { fileWrites.add(new FileAccess(path, "write", 0)); return this; }
        public Builder envVar(String var, String defaultValue) { envVars.add(new EnvVar(var, defaultValue)); return this; }
        public Builder apiCall(String service, String endpoint) { apiCalls.add(new ApiCall(service, endpoint)); return this; }
        public Builder subprocess(String command) { subprocessCalls.add(new SubprocessCall(command)); return this; }

        public DependencyRecord build() {
            return new DependencyRecord(filePath, imports, functionCalls, configFiles,
                    fileReads, fileWrites, envVars, apiCalls, subprocessCalls);
        }
    }
}
