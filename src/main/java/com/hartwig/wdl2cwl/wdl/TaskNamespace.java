package com.hartwig.wdl2cwl.wdl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.hartwig.wdl2cwl.diagnostic.AmbiguousDefinitionException;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;
import com.hartwig.wdl2cwl.ir.StructDefinition;
import com.hartwig.wdl2cwl.ir.Task;
import com.hartwig.wdl2cwl.ir.Workflow;

import org.apache.commons.lang3.StringUtils;

/**
 * Every task, workflow and struct visible to one conversion, with the file that defines it. Imported definitions join
 * the namespace of the importing document. A name can only be defined once; registering the same definition again from
 * the same file is allowed, anything else is ambiguous.
 */
public class TaskNamespace {

    private static final class Definition {
        private final Object value;
        private final String origin;
        private final String kind;

        private Definition(Object value, String origin, String kind) {
            this.value = value;
            this.origin = origin;
            this.kind = kind;
        }
    }

    private final Map<String, Definition> callables = new LinkedHashMap<>();
    private final Map<String, Definition> structs = new LinkedHashMap<>();

    public void register(Task task, String origin) throws AmbiguousDefinitionException {
        register(callables, task.name(), new Definition(task, origin, "task"), task.location().orElse(null));
    }

    public void register(Workflow workflow, String origin) throws AmbiguousDefinitionException {
        register(callables, workflow.name(), new Definition(workflow, origin, "workflow"), workflow.location().orElse(null));
    }

    public void register(StructDefinition struct, String origin) throws AmbiguousDefinitionException {
        register(structs, struct.name(), new Definition(struct, origin, "struct"), struct.location().orElse(null));
    }

    private static void register(Map<String, Definition> definitions, String name, Definition definition, SourceLocation location)
            throws AmbiguousDefinitionException {
        var existing = definitions.get(name);
        if (existing == null) {
            definitions.put(name, definition);
            return;
        }
        if (existing.origin.equals(definition.origin) && existing.value.equals(definition.value)) {
            return;
        }
        throw new AmbiguousDefinitionException(location,
                String.format("%s '%s' is defined in both %s and %s", StringUtils.capitalize(definition.kind), name, existing.origin, definition.origin));
    }

    public Optional<Task> task(String name) {
        return find(callables, name, Task.class);
    }

    public Optional<Workflow> workflow(String name) {
        return find(callables, name, Workflow.class);
    }

    public Optional<StructDefinition> struct(String name) {
        return find(structs, name, StructDefinition.class);
    }

    public Optional<String> origin(String name) {
        return Optional.ofNullable(callables.get(name)).map(definition -> definition.origin);
    }

    public List<Task> tasks() {
        return all(callables, Task.class);
    }

    public List<StructDefinition> structs() {
        return all(structs, StructDefinition.class);
    }

    private static <T> Optional<T> find(Map<String, Definition> definitions, String name, Class<T> type) {
        return Optional.ofNullable(definitions.get(name)).map(definition -> definition.value).filter(type::isInstance).map(type::cast);
    }

    private static <T> List<T> all(Map<String, Definition> definitions, Class<T> type) {
        var values = new ArrayList<T>();
        for (Definition definition : definitions.values()) {
            if (type.isInstance(definition.value)) {
                values.add(type.cast(definition.value));
            }
        }
        return values;
    }
}
