package org.csu.svrf2pxl.codegen;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads an {@link OperationTable} from JSON:
 * <pre>
 * { "name": "icv-pxl",
 *   "header": ["#include &lt;icv.rh&gt;"],
 *   "footer": [],
 *   "templates": { "LAYER": "layer({0}, {1})", "SPACING/1": "external_distance({0}, {0})" } }
 * </pre>
 */
@Slf4j
public class OperationTableLoader {

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public OperationTable load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        }
    }

    /**
     * Loads a table bundled on the classpath, e.g. {@code operation-tables/icv-pxl.json}.
     */
    public OperationTable loadResource(String resource) throws IOException {
        InputStream in = OperationTableLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IOException("Operation table resource not found: " + resource);
        }
        try (in) {
            return load(in, "classpath:" + resource);
        }
    }

    public OperationTable load(InputStream in, String origin) throws IOException {
        Document document = mapper.readValue(in, Document.class);
        if (document.getTemplates() == null || document.getTemplates().isEmpty()) {
            throw new IllegalArgumentException("Operation table " + origin + " defines no templates");
        }
        Map<OperationKey, String> templates = new LinkedHashMap<>();
        document.getTemplates().forEach((key, template) -> {
            if (template == null || template.isBlank()) {
                throw new IllegalArgumentException("Empty template for '" + key + "' in " + origin);
            }
            if (templates.put(OperationKey.parse(key), template) != null) {
                throw new IllegalArgumentException("Duplicate operation key '" + key + "' in " + origin);
            }
        });
        String name = document.getName() != null ? document.getName() : origin;
        log.debug("Loaded operation table '{}' with {} templates from {}", name, templates.size(), origin);
        return new OperationTable(name, document.getHeader(), document.getFooter(), templates);
    }

    @Data
    @NoArgsConstructor
    static class Document {
        private String name;
        private List<String> header = new ArrayList<>();
        private List<String> footer = new ArrayList<>();
        private LinkedHashMap<String, String> templates;
    }
}
