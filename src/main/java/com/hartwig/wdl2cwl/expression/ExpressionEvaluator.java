package com.hartwig.wdl2cwl.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hartwig.wdl2cwl.diagnostic.UnsupportedExpressionException;
import com.hartwig.wdl2cwl.ir.ArrayLiteral;
import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.Expressions;
import com.hartwig.wdl2cwl.ir.FirstDefined;
import com.hartwig.wdl2cwl.ir.FunctionCall;
import com.hartwig.wdl2cwl.ir.Interpolation;
import com.hartwig.wdl2cwl.ir.Literal;
import com.hartwig.wdl2cwl.ir.LiteralText;
import com.hartwig.wdl2cwl.ir.Negation;
import com.hartwig.wdl2cwl.ir.ObjectLiteral;
import com.hartwig.wdl2cwl.ir.OverrideFallback;
import com.hartwig.wdl2cwl.ir.Placeholder;
import com.hartwig.wdl2cwl.ir.Reference;
import com.hartwig.wdl2cwl.ir.TemplatePart;
import com.hartwig.wdl2cwl.ir.UnsupportedExpression;

/**
 * Evaluates expressions against example bindings, with the semantics the translated CWL has at run time. Values are
 * {@link String}, {@link Long}, {@link Double}, {@link Boolean}, {@link List}, {@link Map} or null for unset.
 */
public class ExpressionEvaluator {

    public boolean isConstant(Expression expression) {
        return expression.kind() != Expression.Kind.UNSUPPORTED && Expressions.references(expression).isEmpty() && !containsFunction(expression);
    }

    public Object evaluate(Expression expression) throws UnsupportedExpressionException {
        return evaluate(expression, Map.of());
    }

    public Object evaluate(Expression expression, Map<String, ?> bindings) throws UnsupportedExpressionException {
        switch (expression.kind()) {
            case LITERAL:
                return ((Literal) expression).value();
            case REFERENCE:
                return lookup((Reference) expression, bindings);
            case INTERPOLATION:
                return interpolate(((Interpolation) expression).parts(), bindings);
            case FIRST_DEFINED:
                for (Expression candidate : ((FirstDefined) expression).candidates()) {
                    var value = evaluate(candidate, bindings);
                    if (value != null) {
                        return value;
                    }
                }
                return null;
            case OVERRIDE_FALLBACK:
                var node = (OverrideFallback) expression;
                var override = lookup(node.override(), bindings);
                return override != null ? override : evaluate(node.fallback(), bindings);
            case NEGATION:
                var operand = evaluate(((Negation) expression).operand(), bindings);
                if (!(operand instanceof Boolean)) {
                    throw new UnsupportedExpressionException(expression.location().orElse(null), "Negation of a value that is not a Boolean");
                }
                return !(Boolean) operand;
            case FUNCTION_CALL:
                var call = (FunctionCall) expression;
                if (call.name().equals("defined") && call.arguments().size() == 1) {
                    return evaluate(call.arguments().get(0), bindings) != null;
                }
                throw new UnsupportedExpressionException(expression.location().orElse(null),
                        String.format("Function '%s' cannot be evaluated", call.name()));
            case OBJECT_LITERAL:
                var object = new LinkedHashMap<String, Object>();
                for (Map.Entry<String, Expression> member : ((ObjectLiteral) expression).members().entrySet()) {
                    object.put(member.getKey(), evaluate(member.getValue(), bindings));
                }
                return object;
            case ARRAY_LITERAL:
                var array = new ArrayList<>();
                for (Expression element : ((ArrayLiteral) expression).elements()) {
                    array.add(evaluate(element, bindings));
                }
                return array;
            default:
                throw new UnsupportedExpressionException(expression.location().orElse(null),
                        String.format("Expression '%s' cannot be evaluated", ((UnsupportedExpression) expression).text()));
        }
    }

    private static Object lookup(Reference reference, Map<String, ?> bindings) {
        Object value = bindings.get(reference.root());
        for (String member : reference.members()) {
            if (!(value instanceof Map)) {
                return null;
            }
            value = ((Map<?, ?>) value).get(member);
        }
        return value;
    }

    private String interpolate(List<TemplatePart> parts, Map<String, ?> bindings) throws UnsupportedExpressionException {
        var builder = new StringBuilder();
        for (TemplatePart part : parts) {
            if (part.isLiteral()) {
                builder.append(((LiteralText) part).text());
            } else {
                var placeholder = (Placeholder) part;
                var value = evaluate(placeholder.expression(), bindings);
                if (value != null) {
                    builder.append(value);
                } else if (placeholder.propagatesUndefined()) {
                    return null;
                }
            }
        }
        return builder.toString();
    }

    private static boolean containsFunction(Expression expression) {
        switch (expression.kind()) {
            case FUNCTION_CALL:
                return true;
            case FIRST_DEFINED:
                return ((FirstDefined) expression).candidates().stream().anyMatch(ExpressionEvaluator::containsFunction);
            case ARRAY_LITERAL:
                return ((ArrayLiteral) expression).elements().stream().anyMatch(ExpressionEvaluator::containsFunction);
            case OBJECT_LITERAL:
                return ((ObjectLiteral) expression).members().values().stream().anyMatch(ExpressionEvaluator::containsFunction);
            case NEGATION:
                return containsFunction(((Negation) expression).operand());
            case INTERPOLATION:
                return ((Interpolation) expression).parts()
                        .stream()
                        .anyMatch(part -> !part.isLiteral() && containsFunction(((Placeholder) part).expression()));
            default:
                return false;
        }
    }
}
