package org.csu.svrf2pxl.codegen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OperationTableLoaderTest {

    private OperationTableLoader loader;

    @BeforeEach
    void setUp() {
        loader = new OperationTableLoader();
    }

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testLoadBundledTable() throws IOException {
        OperationTable table = loader.loadResource("operation-tables/icv-pxl.json");

        assertEquals("icv-pxl", table.getName());
        assertEquals(List.of("", "#include <icv.rh>"), table.getHeader());
        assertTrue(table.getFooter().isEmpty());
        assertEquals("layer({0}, {1})", table.getTemplates().get(OperationKey.any("LAYER")));
        assertEquals("external_enclosure({0}, {1})", table.getTemplates().get(new OperationKey("ENCLOSURE", 2)));
    }

    @Test
    void testLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("mini.json");
        Files.writeString(file, "{\"templates\": {\"LAYER\": \"layer({0}, {1})\"}, \"comment\": \"ignored\"}");

        OperationTable table = loader.load(file);
        // 没有 name 时使用来源路径
        assertEquals(file.toString(), table.getName());
        assertEquals(1, table.getTemplates().size());
        assertTrue(table.getHeader().isEmpty());
    }

    @Test
    void testMissingResource() {
        IOException e = assertThrows(IOException.class, () -> loader.loadResource("operation-tables/nope.json"));
        assertTrue(e.getMessage().contains("nope.json"));
    }

    @Test
    void testRejectsTableWithoutTemplates() {
        assertThrows(IllegalArgumentException.class, () -> loader.load(json("{\"name\": \"empty\"}"), "test"));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(json("{\"templates\": {}}"), "test"));
    }

    @Test
    void testRejectsBlankTemplate() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> loader.load(json("{\"templates\": {\"WIDTH/1\": \"  \"}}"), "test"));
        assertTrue(e.getMessage().contains("WIDTH/1"));
    }

    @Test
    void testRejectsKeysDifferingOnlyInCase() {
        assertThrows(IllegalArgumentException.class, () -> loader.load(
                json("{\"templates\": {\"AND\": \"{0} and {1}\", \"and\": \"{0} & {1}\"}}"), "test"));
    }

    @Test
    void testMalformedJson() {
        assertThrows(IOException.class, () -> loader.load(json("{\"templates\": "), "test"));
    }
}
