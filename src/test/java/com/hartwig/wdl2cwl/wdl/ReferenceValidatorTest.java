package com.hartwig.wdl2cwl.wdl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.hartwig.wdl2cwl.diagnostic.ConversionException;
import com.hartwig.wdl2cwl.diagnostic.DiagnosticKind;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;
import com.hartwig.wdl2cwl.diagnostic.UnresolvedReferenceException;
import com.hartwig.wdl2cwl.ir.SourceDocument;

import org.junit.jupiter.api.Test;

class ReferenceValidatorTest {

    @Test
    void reportsUndeclaredPlaceholderWithItsLocation() throws ConversionException {
        var document = WdlParser.parse("t.wdl", "task T {\n input { String name }\n command <<<\n echo ~{nmae}\n >>>\n}");
        var validator = new ReferenceValidator(namespace(document));
        var e = assertThrows(UnresolvedReferenceException.class, () -> validator.validateTask(document.tasks().get(0)));
        var diagnostic = e.getDiagnostics().get(0);
        assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.UNRESOLVED_REFERENCE);
        assertThat(diagnostic.message()).isEqualTo("Placeholder ~{nmae} in the command of task 'T' references undeclared name 'nmae'");
        assertThat(diagnostic.location()).contains(SourceLocation.of("t.wdl", 4, 7));
    }

    @Test
    void acceptsDeclarationsAndInputs() throws ConversionException {
        var document = WdlParser.parse("t.wdl",
                "task T {\n input { String name }\n String greeting = \"hi \" + name\n command <<< echo ~{greeting} >>>\n output { String g = greeting }\n}");
        new ReferenceValidator(namespace(document)).validateTask(document.tasks().get(0));
    }

    @Test
    void reportsUndeclaredNamesInRuntimeAndDeclarations() throws ConversionException {
        var document = WdlParser.parse("t.wdl",
                "task T {\n input { Int n = size_of }\n String tag = prefix + \"_x\"\n command <<< echo ~{n} ~{tag} >>>\n"
                        + " runtime {\n memory: \"~{missing} GB\"\n cpu: threads\n }\n}");
        var validator = new ReferenceValidator(namespace(document));
        var e = assertThrows(UnresolvedReferenceException.class, () -> validator.validateTask(document.tasks().get(0)));
        assertThat(e.getDiagnostics()).extracting(diagnostic -> diagnostic.message())
                .containsExactly("Default of input 'n' of task 'T' references undeclared name 'size_of'",
                        "Declaration 'tag' of task 'T' references undeclared name 'prefix'",
                        "Runtime attribute 'cpu' of task 'T' references undeclared name 'threads'",
                        "Runtime attribute 'memory' of task 'T' references undeclared name 'missing'");
        assertThat(e.getDiagnostics()).allSatisfy(diagnostic -> {
            assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.UNRESOLVED_REFERENCE);
            assertThat(diagnostic.location()).isPresent();
        });
        assertThat(e.getDiagnostics().get(3).location().orElseThrow().line()).isEqualTo(6);
    }

    @Test
    void reportsDeclarationsThatDependOnThemselves() throws ConversionException {
        var document = WdlParser.parse("t.wdl",
                "task T {\n input { String x }\n String a = b + \"-\"\n String b = a\n String c = c + x\n String d = x\n"
                        + " command <<< echo ~{a} ~{c} ~{d} >>>\n runtime {\n cpu: b\n }\n}");
        var validator = new ReferenceValidator(namespace(document));
        var e = assertThrows(UnresolvedReferenceException.class, () -> validator.validateTask(document.tasks().get(0)));
        assertThat(e.getDiagnostics()).extracting(diagnostic -> diagnostic.message())
                .containsExactly("Declaration 'a' of task 'T' depends on itself",
                        "Declaration 'b' of task 'T' depends on itself",
                        "Declaration 'c' of task 'T' depends on itself");
    }

    @Test
    void reportsUnknownCallOutputsAndTargets() throws ConversionException {
        var document = WdlParser.parse("t.wdl",
                "version 1.0\nworkflow W {\n call A\n call Missing\n call A as B { input: x = A.nothing }\n output { String y = A.out }\n}\n"
                        + "task A {\n input { String? x }\n command <<< true >>>\n output { String out = \"a\" }\n}");
        var validator = new ReferenceValidator(namespace(document));
        var e = assertThrows(UnresolvedReferenceException.class, () -> validator.validateWorkflow(document.workflow().orElseThrow()));
        assertThat(e.getDiagnostics()).extracting(diagnostic -> diagnostic.message())
                .containsExactly("Call target 'Missing' does not match any task or workflow", "Call 'A' has no output 'nothing'");
    }

    @Test
    void rejectsScatterOverNonArray() throws ConversionException {
        var document = WdlParser.parse("t.wdl",
                "version 1.0\nworkflow W {\n input { File f }\n scatter (x in f) {\n call A { input: x = x }\n }\n}\n"
                        + "task A {\n input { File x }\n command <<< true >>>\n}");
        var validator = new ReferenceValidator(namespace(document));
        var e = assertThrows(UnresolvedReferenceException.class, () -> validator.validateWorkflow(document.workflow().orElseThrow()));
        assertThat(e.getDiagnostics().get(0).message()).isEqualTo("Scatter collection 'f' has type File, which is not an array");
    }

    @Test
    void rejectsUnknownStructMember() throws ConversionException {
        var document = WdlParser.parse("t.wdl",
                "version 1.0\nstruct S {\n Int n\n}\nworkflow W {\n input { S s }\n call A { input: n = s.m }\n}\n"
                        + "task A {\n input { Int n }\n command <<< true >>>\n}");
        var validator = new ReferenceValidator(namespace(document));
        var e = assertThrows(UnresolvedReferenceException.class, () -> validator.validateWorkflow(document.workflow().orElseThrow()));
        assertThat(e.getDiagnostics().get(0).message()).isEqualTo("Struct 'S' has no member 'm' (in 's.m')");
    }

    private static TaskNamespace namespace(SourceDocument document) throws ConversionException {
        var namespace = new TaskNamespace();
        for (var struct : document.structs()) {
            namespace.register(struct, "t.wdl");
        }
        for (var task : document.tasks()) {
            namespace.register(task, "t.wdl");
        }
        if (document.workflow().isPresent()) {
            namespace.register(document.workflow().get(), "t.wdl");
        }
        return namespace;
    }
}
