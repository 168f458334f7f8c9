package br.edu.ifba.kgraph.export;

import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Writes the creation script in a form cypher-shell can run directly.
 *
 * <h2>Output Format:</h2>
 * <pre>
 * // Creation script for A1b2C3d4E5f6_1723862400123_000000_wrk0000
 * // nodes
 * :param id => 'A1b2C3d4E5f6_1723862400123_000000_wrk0000'
 * :param props => {title: 'Hojoki', sourceType: 'local', ...}
 * MERGE (n:Work {baseId: $id}) SET n += $props;
 * </pre>
 */
@ApplicationScoped
public class CypherScriptExporter implements GraphArtifactExporter {

    @Override
    public void export(@NotNull GraphArtifact artifact, @NotNull OutputStream outputStream) throws IOException {
        // Not closed: the caller owns the stream
        Writer writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));
        writer.write(render(artifact));
        writer.flush();
    }

    /**
     * Renders the whole script as text.
     */
    @NotNull
    public String render(@NotNull GraphArtifact artifact) {
        StringBuilder out = new StringBuilder();
        out.append("// Creation script for ").append(artifact.documentId()).append('\n');

        StatementKind section = null;
        for (ScriptStatement statement : artifact.script().getStatements()) {
            if (statement.kind() != section) {
                section = statement.kind();
                out.append('\n').append("// ").append(sectionTitle(section)).append('\n');
            }
            for (Map.Entry<String, Object> parameter : statement.parameters().entrySet()) {
                out.append(":param ")
                    .append(parameter.getKey())
                    .append(" => ")
                    .append(CypherLiteral.render(parameter.getValue()))
                    .append('\n');
            }
            out.append(statement.cypher()).append(";\n");
        }
        return out.toString();
    }

    private static String sectionTitle(StatementKind kind) {
        return switch (kind) {
            case CONSTRAINT -> "constraints";
            case NODE -> "nodes";
            case RELATIONSHIP -> "relationships";
        };
    }

    @Override
    @NotNull
    public ArtifactFormat getFormat() {
        return ArtifactFormat.CYPHER;
    }
}
