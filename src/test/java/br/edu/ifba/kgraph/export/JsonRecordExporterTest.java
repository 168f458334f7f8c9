package br.edu.ifba.kgraph.export;

import br.edu.ifba.kgraph.IngestionFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class JsonRecordExporterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Should write the full document record")
    void testRecordShape() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        new JsonRecordExporter(objectMapper).export(IngestionFixtures.sampleArtifact("D", "sample"), out);

        JsonNode root = objectMapper.readTree(out.toByteArray());
        assertEquals(DocumentRecord.SCHEMA_VERSION, root.get("schemaVersion").asText());
        assertEquals("D", root.get("document").get("documentId").asText());
        assertEquals("900", root.get("document").get("ndc").get(0).get("code").asText());
        assertEquals(19, root.get("document").get("conceptWeights").size());
        assertEquals(1, root.get("segments").size());
        assertEquals(0L, root.get("segments").get(0).get("timecodeMs").asLong());
        assertEquals(2, root.get("sentences").size());
        assertFalse(root.get("sentences").get(0).has("embeddingRef"));
        assertEquals("cat", root.get("entities").get(0).get("label").asText());
        assertEquals("temporal", root.get("mentions").get(0).get("conceptKey").asText());
    }

    @Test
    @DisplayName("Should leave the target stream open")
    void testStreamLeftOpen() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream() {
            @Override
            public void close() {
                fail("exporter must not close the caller's stream");
            }
        };

        new JsonRecordExporter(objectMapper).export(IngestionFixtures.sampleArtifact("D", "sample"), out);

        assertTrue(out.size() > 0);
    }
}
