package com.hartwig.wdl2cwl.cwl;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A generated CWL document and where it goes, relative to the output directory.
 */
public final class CwlDocument {
    private final String relativePath;
    private final ObjectNode content;

    public CwlDocument(String relativePath, ObjectNode content) {
        this.relativePath = relativePath;
        this.content = content;
    }

    public String relativePath() {
        return relativePath;
    }

    public ObjectNode content() {
        return content;
    }

    public String render() {
        return CwlYaml.write(content);
    }
}
