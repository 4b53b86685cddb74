package com.hartwig.wdl2cwl.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Traversals over expression trees.
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * Every reference in the expression, depth first, in source order.
     */
    public static List<Reference> references(Expression expression) {
        var references = new ArrayList<Reference>();
        collect(expression, references);
        return references;
    }

    public static List<Reference> references(List<TemplatePart> parts) {
        var references = new ArrayList<Reference>();
        for (TemplatePart part : parts) {
            if (!part.isLiteral()) {
                collect(((Placeholder) part).expression(), references);
            }
        }
        return references;
    }

    /**
     * Copy of the expression with every reference replaced by what the function returns for it.
     */
    public static Expression substitute(Expression expression, Function<Reference, Expression> replacement) {
        switch (expression.kind()) {
            case REFERENCE:
                return replacement.apply((Reference) expression);
            case INTERPOLATION:
                var interpolation = (Interpolation) expression;
                return ImmutableInterpolation.copyOf(interpolation).withParts(substitute(interpolation.parts(), replacement));
            case FIRST_DEFINED:
                var firstDefined = (FirstDefined) expression;
                return ImmutableFirstDefined.copyOf(firstDefined).withCandidates(substituteAll(firstDefined.candidates(), replacement));
            case OVERRIDE_FALLBACK:
                var overrideFallback = (OverrideFallback) expression;
                return ImmutableOverrideFallback.copyOf(overrideFallback).withFallback(substitute(overrideFallback.fallback(), replacement));
            case FUNCTION_CALL:
                var call = (FunctionCall) expression;
                return ImmutableFunctionCall.copyOf(call).withArguments(substituteAll(call.arguments(), replacement));
            case NEGATION:
                var negation = (Negation) expression;
                return ImmutableNegation.copyOf(negation).withOperand(substitute(negation.operand(), replacement));
            case OBJECT_LITERAL:
                var object = (ObjectLiteral) expression;
                var members = new LinkedHashMap<String, Expression>();
                object.members().forEach((name, member) -> members.put(name, substitute(member, replacement)));
                return ImmutableObjectLiteral.copyOf(object).withMembers(members);
            case ARRAY_LITERAL:
                var array = (ArrayLiteral) expression;
                return ImmutableArrayLiteral.copyOf(array).withElements(substituteAll(array.elements(), replacement));
            default:
                return expression;
        }
    }

    public static List<TemplatePart> substitute(List<TemplatePart> parts, Function<Reference, Expression> replacement) {
        var substituted = new ArrayList<TemplatePart>();
        for (TemplatePart part : parts) {
            if (part.isLiteral()) {
                substituted.add(part);
            } else {
                var placeholder = (Placeholder) part;
                substituted.add(ImmutablePlaceholder.copyOf(placeholder).withExpression(substitute(placeholder.expression(), replacement)));
            }
        }
        return substituted;
    }

    private static List<Expression> substituteAll(List<Expression> expressions, Function<Reference, Expression> replacement) {
        return expressions.stream().map(expression -> substitute(expression, replacement)).collect(Collectors.toList());
    }

    private static void collect(Expression expression, List<Reference> references) {
        switch (expression.kind()) {
            case REFERENCE:
                references.add((Reference) expression);
                break;
            case INTERPOLATION:
                references.addAll(references(((Interpolation) expression).parts()));
                break;
            case FIRST_DEFINED:
                ((FirstDefined) expression).candidates().forEach(candidate -> collect(candidate, references));
                break;
            case OVERRIDE_FALLBACK:
                references.add(((OverrideFallback) expression).override());
                collect(((OverrideFallback) expression).fallback(), references);
                break;
            case FUNCTION_CALL:
                ((FunctionCall) expression).arguments().forEach(argument -> collect(argument, references));
                break;
            case NEGATION:
                collect(((Negation) expression).operand(), references);
                break;
            case OBJECT_LITERAL:
                ((ObjectLiteral) expression).members().values().forEach(member -> collect(member, references));
                break;
            case ARRAY_LITERAL:
                ((ArrayLiteral) expression).elements().forEach(element -> collect(element, references));
                break;
            default:
                break;
        }
    }
}
