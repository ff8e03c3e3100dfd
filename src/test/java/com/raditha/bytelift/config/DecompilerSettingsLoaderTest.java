package com.raditha.bytelift.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DecompilerSettingsLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testBundledDefaults() {
        DecompilerSettings settings = DecompilerSettingsLoader.loadDefault();

        assertTrue(settings.disabledTransforms().isEmpty());
        assertFalse(settings.showDocumentation());
        assertEquals(16, settings.maxPositionRetries());
        assertEquals(8, settings.maxPipelineCycles());
    }

    @Test
    void testYamlValuesAreRead() throws IOException {
        Path config = write("""
                decompiler:
                  disabled_transforms:
                    - TypeOfTransform
                  show_documentation: true
                  abort_after: LogicNotSimplification
                  max_position_retries: 4
                  max_pipeline_cycles: 3
                  parallelism: 2
                """);

        DecompilerSettings settings = DecompilerSettingsLoader.loadConfig(config, null, null, false, null, 0);

        assertEquals(Set.of("TypeOfTransform"), settings.disabledTransforms());
        assertTrue(settings.showDocumentation());
        assertEquals("LogicNotSimplification", settings.abortAfter());
        assertEquals(4, settings.maxPositionRetries());
        assertEquals(3, settings.maxPipelineCycles());
        assertEquals(2, settings.parallelism());
    }

    @Test
    void testCommandLineOverridesYaml() throws IOException {
        Path config = write("""
                decompiler:
                  disabled_transforms: [TypeOfTransform]
                  abort_after: LogicNotSimplification
                  parallelism: 2
                """);

        DecompilerSettings settings = DecompilerSettingsLoader.loadConfig(
                config, null, List.of("RemoveNopsTransform"), true, "StringConcatTransform", 5);

        assertEquals(Set.of("TypeOfTransform", "RemoveNopsTransform"), settings.disabledTransforms());
        assertTrue(settings.showDocumentation());
        assertEquals("StringConcatTransform", settings.abortAfter());
        assertEquals(5, settings.parallelism());
    }

    @Test
    void testPresetFromYamlAndCommandLine() throws IOException {
        Path config = write("""
                decompiler:
                  preset: minimal
                """);

        DecompilerSettings fromYaml = DecompilerSettingsLoader.loadConfig(config, null, null, false, null, 0);
        assertFalse(fromYaml.isEnabled("TypeOfTransform"));
        assertEquals(1, fromYaml.parallelism());

        DecompilerSettings fromCli = DecompilerSettingsLoader.loadConfig(config, "default", null, false, null, 0);
        assertTrue(fromCli.isEnabled("TypeOfTransform"));
    }

    @Test
    void testUnknownPresetFails() {
        assertThrows(ConfigurationException.class,
                () -> DecompilerSettingsLoader.loadConfig(null, "aggressive", null, false, null, 0));
    }

    @Test
    void testMissingFileFails() {
        Path missing = tempDir.resolve("missing.yml");

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> DecompilerSettingsLoader.loadConfig(missing, null, null, false, null, 0));
        assertTrue(ex.getMessage().contains("missing.yml"));
    }

    @Test
    void testInvalidValueIsReportedAsConfigurationError() throws IOException {
        Path config = write("""
                decompiler:
                  disabled_transforms: [NotATransform]
                """);

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> DecompilerSettingsLoader.loadConfig(config, null, null, false, null, 0));
        assertTrue(ex.getMessage().startsWith("Invalid decompiler configuration"));
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    void testFileWithoutSectionUsesDefaults() throws IOException {
        Path config = write("""
                other:
                  key: value
                """);

        DecompilerSettings settings = DecompilerSettingsLoader.loadConfig(config, null, null, false, null, 0);
        assertEquals(DecompilerSettings.DEFAULT_MAX_PIPELINE_CYCLES, settings.maxPipelineCycles());
    }

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("decompiler.yml");
        Files.writeString(file, yaml);
        return file;
    }
}
