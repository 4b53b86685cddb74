package com.hartwig.wdl2cwl.cwl;

import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Writes a job template for a workflow document: every input with its default, or null where the caller has to
 * provide a value.
 */
public class InputTemplateWriter {

    public static String relativePath(String workflowName) {
        return workflowName + ".inputs.yml";
    }

    public CwlDocument write(CwlDocument workflow) {
        var template = CwlYaml.object();
        var inputs = workflow.content().path("inputs");
        for (Iterator<Map.Entry<String, JsonNode>> it = inputs.fields(); it.hasNext(); ) {
            var input = it.next();
            var defaultValue = input.getValue().get("default");
            if (defaultValue == null) {
                template.putNull(input.getKey());
            } else {
                template.set(input.getKey(), defaultValue.deepCopy());
            }
        }
        return new CwlDocument(relativePath(workflow.content().path("id").asText()), template);
    }
}
