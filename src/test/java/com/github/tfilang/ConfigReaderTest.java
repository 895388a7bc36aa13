package com.github.tfilang;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ConfigReaderTest {

    @Test
    public void testReadConfig(@TempDir Path dir) throws Exception {
        var file = dir.resolve("tfi.cfg");
        Files.writeString(file, "formatOutput=true\nstrictMode = TRUE\naddComments=no\n");

        var compiler = new Compiler();
        ConfigReader.readConfig(file).applyConfig(compiler);

        var options = compiler.getOptions();
        assertTrue(options.formatOutput());
        assertTrue(options.strictMode());
        assertFalse(options.addComments());
        assertFalse(options.minifyOutput());
    }

    @Test
    public void testMissingConfigUsesDefaults(@TempDir Path dir) {
        var compiler = new Compiler();
        ConfigReader.readConfig(dir.resolve("tfi.cfg")).applyConfig(compiler);
        assertTrue(compiler.getOptions().isDefault());
    }

    @Test
    public void testUnreadableConfig(@TempDir Path dir) {
        // a directory exists but cannot be loaded as properties
        assertThrows(UncheckedIOException.class, () -> ConfigReader.readConfig(dir));
    }

}
