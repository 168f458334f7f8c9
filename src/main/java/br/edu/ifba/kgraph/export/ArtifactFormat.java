package br.edu.ifba.kgraph.export;

/**
 * File formats of a graph artifact.
 */
public enum ArtifactFormat {
    JSON("application/json", "json"),
    CYPHER("application/x-cypher-query", "cypher");

    private final String mimeType;
    private final String extension;

    ArtifactFormat(String mimeType, String extension) {
        this.mimeType = mimeType;
        this.extension = extension;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getExtension() {
        return extension;
    }
}
