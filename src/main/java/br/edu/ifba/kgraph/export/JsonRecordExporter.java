package br.edu.ifba.kgraph.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes the document record as pretty-printed JSON.
 */
@ApplicationScoped
public class JsonRecordExporter implements GraphArtifactExporter {

    private final ObjectWriter writer;

    @Inject
    public JsonRecordExporter(ObjectMapper objectMapper) {
        this.writer = objectMapper.writer()
            .withDefaultPrettyPrinter()
            .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    @Override
    public void export(@NotNull GraphArtifact artifact, @NotNull OutputStream outputStream) throws IOException {
        writer.writeValue(outputStream, artifact.record());
        outputStream.flush();
    }

    @Override
    @NotNull
    public ArtifactFormat getFormat() {
        return ArtifactFormat.JSON;
    }
}
