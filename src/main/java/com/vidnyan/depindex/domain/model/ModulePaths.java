package com.vidnyan.depindex.domain.model;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes file paths and derives module names and stems from them.
 *
 * <pre>
 *   lib/utils.py   → path "lib/utils.py", module "lib.utils", stem "utils"
 *   lib.utils      → path "lib.utils",    module "lib.utils", stem "utils"
 * </pre>
 */
public final class ModulePaths {

    public static final List<String> DEFAULT_SOURCE_EXTENSIONS =
            List.of("py", "java", "kt", "groovy", "scala", "js", "ts");

    private final Path projectRoot;
    private final Set<String> sourceExtensions;

    public ModulePaths(Path projectRoot, List<String> sourceExtensions) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        Set<String> exts = new LinkedHashSet<>();
        for (String ext : sourceExtensions) {
            String e = ext.startsWith(".") ? ext.substring(1) : ext;
            exts.add(e.toLowerCase(Locale.ROOT));
        }
        this.sourceExtensions = Set.copyOf(exts);
    }

    public static ModulePaths defaults() {
        return new ModulePaths(Path.of("."), DEFAULT_SOURCE_EXTENSIONS);
    }

    /**
     * Unified separators, no leading {@code ./}, relative to the project root when under it.
     */
    public String normalize(String filePath) {
        if (filePath == null) {
            return "";
        }
        String p = filePath.trim().replace('\\', '/');
        if (p.startsWith("/")) {
            try {
                Path abs = Path.of(p).normalize();
                if (abs.startsWith(projectRoot)) {
                    p = projectRoot.relativize(abs).toString().replace('\\', '/');
                }
            } catch (RuntimeException e) {
                // not a valid filesystem path on this platform, keep as given
                return p;
            }
        }
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        return p;
    }

    /**
     * Dotted module name for a path; a path without a source extension is taken as a module name.
     */
    public String moduleName(String filePath) {
        String p = normalize(filePath);
        String ext = extensionOf(p);
        if (ext != null) {
            p = p.substring(0, p.length() - ext.length() - 1);
        }
        p = p.replace('/', '.');
        while (p.startsWith(".")) {
            p = p.substring(1);
        }
        return p;
    }

    /**
     * Final dotted component of the module name.
     */
    public String stem(String filePath) {
        String module = moduleName(filePath);
        return module.substring(module.lastIndexOf('.') + 1);
    }

    /**
     * Directory part of the normalized path, empty for top-level files and dotted module names.
     */
    public String parentDir(String filePath) {
        String p = normalize(filePath);
        int slash = p.lastIndexOf('/');
        return slash > 0 ? p.substring(0, slash) : "";
    }

    public boolean hasSourceExtension(String filePath) {
        return extensionOf(normalize(filePath)) != null;
    }

    private String extensionOf(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash + 1 || dot == path.length() - 1) {
            return null;
        }
        String ext = path.substring(dot + 1);
        return sourceExtensions.contains(ext.toLowerCase(Locale.ROOT)) ? ext : null;
    }
}
