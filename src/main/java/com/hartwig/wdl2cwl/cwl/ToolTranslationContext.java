package com.hartwig.wdl2cwl.cwl;

import java.util.Optional;

import com.hartwig.wdl2cwl.expression.ExpressionEvaluator;
import com.hartwig.wdl2cwl.expression.ResolvedReference;
import com.hartwig.wdl2cwl.expression.TranslationContext;
import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.OverrideFallback;
import com.hartwig.wdl2cwl.ir.Parameter;
import com.hartwig.wdl2cwl.ir.ParameterType;
import com.hartwig.wdl2cwl.ir.Reference;
import com.hartwig.wdl2cwl.ir.Task;

/**
 * Names visible inside a tool. Inputs live under {@code inputs}; private declarations are inlined. An input whose
 * default depends on other inputs has no static CWL default, so it is inlined as "the input if bound, else the
 * default".
 */
class ToolTranslationContext implements TranslationContext {
    private final Task task;
    private final CwlTypeMapper types;
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    ToolTranslationContext(Task task, CwlTypeMapper types) {
        this.task = task;
        this.types = types;
    }

    @Override
    public Optional<ResolvedReference> resolve(Reference reference) {
        var input = task.findInput(reference.root());
        if (input.isEmpty()) {
            return Optional.empty();
        }
        var type = toolType(input.get());
        var memberType = types.memberType(type, reference.members());
        return Optional.of(ResolvedReference.of("inputs." + reference.dotted(), memberType.orElse(null)));
    }

    @Override
    public Optional<Expression> inline(String name) {
        var declaration = task.findDeclaration(name);
        if (declaration.isPresent()) {
            return declaration.get().expression();
        }
        var input = task.findInput(name);
        if (input.isPresent() && hasComputedDefault(input.get())) {
            return Optional.of(OverrideFallback.of(Reference.to(name), input.get().expression().orElseThrow()));
        }
        return Optional.empty();
    }

    /**
     * Type of the input as the tool declares it.
     */
    ParameterType toolType(Parameter input) {
        return hasComputedDefault(input) ? ParameterType.optionalOf(input.type()) : input.type();
    }

    boolean hasComputedDefault(Parameter input) {
        return input.expression().isPresent() && !evaluator.isConstant(input.expression().get());
    }
}
