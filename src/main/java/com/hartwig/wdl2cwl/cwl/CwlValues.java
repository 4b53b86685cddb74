package com.hartwig.wdl2cwl.cwl;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.hartwig.wdl2cwl.ir.ParameterType;

/**
 * Evaluated default values as CWL YAML. Strings in a {@code File} position become file objects.
 */
final class CwlValues {

    private CwlValues() {
    }

    static JsonNode of(ParameterType type, Object value) {
        var required = type.required();
        if (required.isFile() && value instanceof String) {
            var file = CwlYaml.object();
            file.put("class", "File");
            file.put("location", (String) value);
            return file;
        }
        if (required.isArray() && value instanceof List) {
            var array = CwlYaml.mapper().createArrayNode();
            for (Object element : (List<?>) value) {
                array.add(of(required.elementType(), element));
            }
            return array;
        }
        return CwlYaml.mapper().valueToTree(value);
    }
}
