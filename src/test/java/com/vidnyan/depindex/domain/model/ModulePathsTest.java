package com.vidnyan.depindex.domain.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModulePathsTest {

    private final ModulePaths paths = new ModulePaths(Path.of("/work/project"), ModulePaths.DEFAULT_SOURCE_EXTENSIONS);

    @Test
    void normalize_ShouldUnifySeparatorsAndStripLeadingDot() {
        assertEquals("lib/utils.py", paths.normalize("./lib/utils.py"));
        assertEquals("lib/utils.py", paths.normalize("lib\\utils.py"));
        assertEquals("lib/utils.py", paths.normalize("  lib/utils.py "));
    }

    @Test
    void normalize_ShouldRelativizePathsUnderProjectRoot() {
        assertEquals("lib/utils.py", paths.normalize("/work/project/lib/utils.py"));
        assertEquals("/elsewhere/utils.py", paths.normalize("/elsewhere/utils.py"));
    }

    @Test
    void moduleName_ShouldStripSourceExtensionAndDotSeparate() {
        assertEquals("lib.utils", paths.moduleName("lib/utils.py"));
        assertEquals("com.acme.Service", paths.moduleName("com/acme/Service.java"));
        assertEquals("app", paths.moduleName("app.py"));
    }

    @Test
    void moduleName_ShouldKeepDottedNamesWithoutSourceExtension() {
        assertEquals("lib.utils", paths.moduleName("lib.utils"));
        assertEquals("docs.readme.md", paths.moduleName("docs/readme.md"));
    }

    @Test
    void stem_ShouldBeLastDottedComponent() {
        assertEquals("utils", paths.stem("lib/utils.py"));
        assertEquals("utils", paths.stem("lib.utils"));
        assertEquals("app", paths.stem("app"));
    }

    @Test
    void parentDir_ShouldBeEmptyForTopLevelAndModules() {
        assertEquals("lib", paths.parentDir("lib/utils.py"));
        assertEquals("", paths.parentDir("app.py"));
        assertEquals("", paths.parentDir("lib.utils"));
    }

    @Test
    void sourceExtensions_ShouldBeConfigurable() {
        ModulePaths pyOnly = new ModulePaths(Path.of("."), List.of(".py"));

        assertTrue(pyOnly.hasSourceExtension("a/b.py"));
        assertFalse(pyOnly.hasSourceExtension("a/B.java"));
        assertEquals("a.B.java", pyOnly.moduleName("a/B.java"));
    }
}
