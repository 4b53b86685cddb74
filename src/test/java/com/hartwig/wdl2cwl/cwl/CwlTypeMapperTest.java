package com.hartwig.wdl2cwl.cwl;

import static com.hartwig.wdl2cwl.ir.ParameterType.arrayOf;
import static com.hartwig.wdl2cwl.ir.ParameterType.file;
import static com.hartwig.wdl2cwl.ir.ParameterType.optionalOf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import com.hartwig.wdl2cwl.diagnostic.CwlWriteException;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;
import com.hartwig.wdl2cwl.ir.Parameter;
import com.hartwig.wdl2cwl.ir.ParameterType;
import com.hartwig.wdl2cwl.ir.StructDefinition;
import com.hartwig.wdl2cwl.wdl.TaskNamespace;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CwlTypeMapperTest {
    private TaskNamespace namespace;
    private CwlTypeMapper mapper;

    @BeforeEach
    void setUp() throws Exception {
        namespace = new TaskNamespace();
        namespace.register(StructDefinition.builder()
                .name("Sample")
                .addMembers(Parameter.of("id", ParameterType.string()))
                .addMembers(Parameter.of("reads", optionalOf(file())))
                .addMembers(Parameter.of("limits", optionalOf(ParameterType.struct("Limits"))))
                .build(), "structs.wdl");
        namespace.register(StructDefinition.builder()
                .name("Limits")
                .addMembers(Parameter.of("cores", ParameterType.integer()))
                .build(), "structs.wdl");
        mapper = new CwlTypeMapper(namespace);
    }

    @Test
    void usesShortFormsWherePossible() throws CwlWriteException {
        assertThat(mapper.map(file(), null).asText()).isEqualTo("File");
        assertThat(mapper.map(optionalOf(ParameterType.floating()), null).asText()).isEqualTo("float?");
        assertThat(mapper.map(arrayOf(ParameterType.string()), null).asText()).isEqualTo("string[]");
        assertThat(mapper.map(optionalOf(arrayOf(file())), null).asText()).isEqualTo("File[]?");
    }

    @Test
    void arrayOfOptionalsNeedsTheLongForm() throws CwlWriteException {
        var type = mapper.map(arrayOf(optionalOf(file())), null);
        assertThat(type.get("type").asText()).isEqualTo("array");
        assertThat(type.get("items").get(0).asText()).isEqualTo("null");
        assertThat(type.get("items").get(1).asText()).isEqualTo("File");

        var optional = mapper.map(optionalOf(arrayOf(optionalOf(ParameterType.bool()))), null);
        assertThat(optional.isArray()).isTrue();
        assertThat(optional.get(0).asText()).isEqualTo("null");
        assertThat(optional.get(1).get("type").asText()).isEqualTo("array");
    }

    @Test
    void structsBecomeRecordSchemasInOrderOfFirstUse() throws CwlWriteException {
        assertThat(mapper.usesStructs()).isFalse();
        assertThat(mapper.map(ParameterType.struct("Sample"), null).asText()).isEqualTo("Sample");
        assertThat(mapper.usesStructs()).isTrue();

        var schemas = mapper.schemas();
        assertThat(schemas).hasSize(2);
        assertThat(schemas.get(0).get("name").asText()).isEqualTo("Sample");
        assertThat(schemas.get(0).get("type").asText()).isEqualTo("record");
        assertThat(schemas.get(0).get("fields").get(1).get("type").asText()).isEqualTo("File?");
        assertThat(schemas.get(1).get("name").asText()).isEqualTo("Limits");
    }

    @Test
    void resolvesMemberTypesThroughStructs() {
        var sample = optionalOf(ParameterType.struct("Sample"));
        assertThat(mapper.memberType(sample, List.of("id"))).contains(optionalOf(ParameterType.string()));
        assertThat(mapper.memberType(ParameterType.struct("Sample"), List.of("limits", "cores"))).contains(optionalOf(ParameterType.integer()));
        assertThat(mapper.memberType(ParameterType.struct("Sample"), List.of("id"))).contains(ParameterType.string());
        assertThat(mapper.memberType(ParameterType.struct("Sample"), List.of("missing"))).isEmpty();
        assertThat(mapper.memberType(file(), List.of("path"))).isEmpty();
    }

    @Test
    void rejectsUnknownStructs() {
        var location = SourceLocation.of("main.wdl", 3, 5);
        var e = assertThrows(CwlWriteException.class, () -> mapper.map(ParameterType.struct("Unknown"), location));
        assertThat(e.getDiagnostics().get(0).message()).isEqualTo("Struct 'Unknown' is not defined");
        assertThat(e.getDiagnostics().get(0).location()).contains(location);
    }

    @Test
    void rejectsTypesWithoutCwlEquivalent() {
        var e = assertThrows(CwlWriteException.class, () -> mapper.map(ParameterType.unsupported("Map[String, Int]"), null));
        assertThat(e.getDiagnostics().get(0).message()).isEqualTo("Type Map[String, Int] has no CWL equivalent");
    }
}
