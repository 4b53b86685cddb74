package com.hartwig.wdl2cwl.cwl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.hartwig.wdl2cwl.diagnostic.CwlWriteException;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;
import com.hartwig.wdl2cwl.ir.Parameter;
import com.hartwig.wdl2cwl.ir.ParameterType;
import com.hartwig.wdl2cwl.ir.StructDefinition;
import com.hartwig.wdl2cwl.wdl.TaskNamespace;

/**
 * Maps parameter types to CWL types. Short forms ({@code File}, {@code string[]}, {@code int?}, {@code File[]?}) are
 * used where CWL has one, the long form otherwise. Structs become records; the mapper collects the structs it used so
 * the document can declare them in a {@code SchemaDefRequirement}.
 */
public class CwlTypeMapper {
    private final TaskNamespace namespace;
    private final Map<String, StructDefinition> usedStructs = new LinkedHashMap<>();

    public CwlTypeMapper(TaskNamespace namespace) {
        this.namespace = namespace;
    }

    public JsonNode map(ParameterType type, SourceLocation location) throws CwlWriteException {
        switch (type.kind()) {
            case OPTIONAL:
                var inner = map(type.inner().orElseThrow(), location);
                if (inner.isTextual()) {
                    return TextNode.valueOf(inner.asText() + "?");
                }
                var union = CwlYaml.mapper().createArrayNode().add("null");
                return inner.isArray() ? union.addAll((ArrayNode) inner) : union.add(inner);
            case ARRAY:
                var items = map(type.inner().orElseThrow(), location);
                if (items.isTextual() && !items.asText().endsWith("?")) {
                    return TextNode.valueOf(items.asText() + "[]");
                }
                var array = CwlYaml.object();
                array.put("type", "array");
                array.set("items", expandOptional(items));
                return array;
            case STRUCT:
                var name = type.name().orElseThrow();
                registerStruct(name, location);
                return TextNode.valueOf(name);
            case UNSUPPORTED:
                throw new CwlWriteException(location, String.format("Type %s has no CWL equivalent", type.describe()));
            default:
                return TextNode.valueOf(primitive(type.kind()));
        }
    }

    /**
     * Type of a member path below a value of the given type, optional if any step of the path is. Empty when the path
     * does not lead through structs.
     */
    public Optional<ParameterType> memberType(ParameterType type, List<String> members) {
        var current = type;
        var optional = type.isOptional();
        for (String member : members) {
            var required = current.required();
            if (required.kind() != ParameterType.Kind.STRUCT) {
                return Optional.empty();
            }
            var field = namespace.struct(required.name().orElseThrow()).flatMap(struct -> struct.findMember(member));
            if (field.isEmpty()) {
                return Optional.empty();
            }
            current = field.get().type();
            optional |= current.isOptional();
        }
        return Optional.of(optional ? ParameterType.optionalOf(current) : current);
    }

    /**
     * Record schemas of every struct used so far, in order of first use.
     */
    public List<JsonNode> schemas() throws CwlWriteException {
        var schemas = new ArrayList<JsonNode>();
        // mapping the fields can register further structs
        var processed = 0;
        while (processed < usedStructs.size()) {
            var struct = new ArrayList<>(usedStructs.values()).get(processed++);
            var record = CwlYaml.object();
            record.put("name", struct.name());
            record.put("type", "record");
            var fields = record.putArray("fields");
            for (Parameter member : struct.members()) {
                var field = fields.addObject();
                field.put("name", member.name());
                field.set("type", map(member.type(), member.location().orElse(null)));
            }
            schemas.add(record);
        }
        return schemas;
    }

    public boolean usesStructs() {
        return !usedStructs.isEmpty();
    }

    private static JsonNode expandOptional(JsonNode type) {
        if (type.isTextual() && type.asText().endsWith("?")) {
            var text = type.asText();
            return CwlYaml.mapper().createArrayNode().add("null").add(text.substring(0, text.length() - 1));
        }
        return type;
    }

    private void registerStruct(String name, SourceLocation location) throws CwlWriteException {
        if (usedStructs.containsKey(name)) {
            return;
        }
        var struct = namespace.struct(name);
        if (struct.isEmpty()) {
            throw new CwlWriteException(location, String.format("Struct '%s' is not defined", name));
        }
        usedStructs.put(name, struct.get());
    }

    private static String primitive(ParameterType.Kind kind) {
        switch (kind) {
            case FILE:
                return "File";
            case STRING:
                return "string";
            case INT:
                return "int";
            case FLOAT:
                return "float";
            case BOOLEAN:
                return "boolean";
            default:
                throw new IllegalArgumentException("Not a primitive type: " + kind);
        }
    }
}
