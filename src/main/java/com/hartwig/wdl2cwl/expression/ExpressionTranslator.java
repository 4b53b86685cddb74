package com.hartwig.wdl2cwl.expression;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.hartwig.wdl2cwl.diagnostic.ConversionException;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;
import com.hartwig.wdl2cwl.diagnostic.UnresolvedReferenceException;
import com.hartwig.wdl2cwl.diagnostic.UnsupportedExpressionException;
import com.hartwig.wdl2cwl.ir.ArrayLiteral;
import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.FirstDefined;
import com.hartwig.wdl2cwl.ir.FunctionCall;
import com.hartwig.wdl2cwl.ir.Interpolation;
import com.hartwig.wdl2cwl.ir.Literal;
import com.hartwig.wdl2cwl.ir.LiteralText;
import com.hartwig.wdl2cwl.ir.Negation;
import com.hartwig.wdl2cwl.ir.ObjectLiteral;
import com.hartwig.wdl2cwl.ir.OverrideFallback;
import com.hartwig.wdl2cwl.ir.ParameterType;
import com.hartwig.wdl2cwl.ir.Placeholder;
import com.hartwig.wdl2cwl.ir.Reference;
import com.hartwig.wdl2cwl.ir.TemplatePart;
import com.hartwig.wdl2cwl.ir.UnsupportedExpression;

/**
 * Translates IR expressions into CWL parameter references and JavaScript expressions. Each expression kind has one
 * fixed template; kinds without one are rejected with {@link UnsupportedExpressionException}. The translator remembers
 * whether any translation needed JavaScript.
 */
public class ExpressionTranslator {
    private static final Pattern SIMPLE_JAVASCRIPT = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$.]*|-?[0-9.]+|\"(?:[^\"\\\\]|\\\\.)*\"");

    private final TranslationContext context;
    // declarations being inlined on the current path
    private final Set<String> inlining = new HashSet<>();
    private boolean usesJavascript;

    public ExpressionTranslator(TranslationContext context) {
        this.context = context;
    }

    public boolean usesJavascript() {
        return usesJavascript;
    }

    /**
     * Translates a value expression. Plain references become parameter references such as {@code $(inputs.x)},
     * everything else a JavaScript expression.
     */
    public TranslatedExpression translate(Expression expression) throws ConversionException {
        if (expression instanceof Reference && inlined((Reference) expression).isEmpty()) {
            return TranslatedExpression.of("$(" + resolve((Reference) expression).path() + ")", false);
        }
        return javascriptResult("$(" + js(expression) + ")");
    }

    /**
     * Translates a command body or interpolated string into a CWL string with embedded references. Literal text is
     * escaped only when the result is going to be interpolated by CWL.
     */
    public TranslatedExpression template(List<TemplatePart> parts) throws ConversionException {
        var rendered = new ArrayList<String>();
        var javascript = false;
        var interpolated = false;
        for (TemplatePart part : parts) {
            if (part.isLiteral()) {
                var text = ((LiteralText) part).text();
                interpolated |= text.contains("$(") || text.contains("${");
                rendered.add(null);
            } else {
                var placeholder = placeholder((Placeholder) part);
                javascript |= placeholder.usesJavascript();
                interpolated = true;
                rendered.add(placeholder.text());
            }
        }
        var builder = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            if (parts.get(i).isLiteral()) {
                var text = ((LiteralText) parts.get(i)).text();
                builder.append(interpolated ? escape(text) : text);
            } else {
                builder.append(rendered.get(i));
            }
        }
        if (javascript) {
            usesJavascript = true;
        }
        return TranslatedExpression.of(builder.toString(), javascript);
    }

    private TranslatedExpression placeholder(Placeholder placeholder) throws ConversionException {
        var expression = placeholder.expression();
        var sep = placeholder.option("sep");
        if (sep.isPresent()) {
            var value = js(expression);
            var type = typeOf(expression);
            var element = type.filter(ParameterType::isArray).map(ParameterType::elementType);
            var mapped = element.isPresent() && element.get().isFile() ? value + ".map(function(f) { return f.path; })" : value;
            var joined = mapped + ".join(" + quote(sep.get()) + ")";
            if (type.isEmpty() || type.get().isOptional()) {
                joined = value + " === null ? \"\" : " + joined;
            }
            return TranslatedExpression.of("$(" + joined + ")", true);
        }
        var whenTrue = placeholder.option("true");
        var whenFalse = placeholder.option("false");
        if (whenTrue.isPresent() || whenFalse.isPresent()) {
            var condition = wrap(js(expression));
            return TranslatedExpression.of(String.format("$(%s ? %s : %s)", condition, quote(whenTrue.orElse("")), quote(whenFalse.orElse(""))),
                    true);
        }
        var fallback = placeholder.option("default");
        if (expression instanceof Interpolation) {
            var interpolation = (Interpolation) expression;
            return TranslatedExpression.of("$(" + interpolation(interpolation, quote(fallback.orElse(""))) + ")", true);
        }
        if (fallback.isPresent()) {
            var value = js(expression);
            return TranslatedExpression.of(String.format("$(%s != null ? %s : %s)", wrap(value), stringValue(value, expression), quote(fallback.get())),
                    true);
        }
        var type = typeOf(expression);
        if (type.isPresent() && type.get().isArray()) {
            throw unsupported(placeholder.location(),
                    String.format("Placeholder %s interpolates an array without a sep option", placeholder.marker()));
        }
        if (expression instanceof Reference && inlined((Reference) expression).isEmpty()) {
            var path = resolve((Reference) expression).path();
            var required = type.isEmpty() || !type.get().isOptional();
            var access = type.isPresent() && type.get().isFile() ? path + ".path" : path;
            if (required) {
                return TranslatedExpression.of("$(" + access + ")", false);
            }
            return TranslatedExpression.of(String.format("$(%s === null ? \"\" : %s)", path, access), true);
        }
        var value = js(expression);
        return TranslatedExpression.of("$(" + stringValue(value, expression) + ")", true);
    }

    /**
     * JavaScript code for the expression, without the surrounding {@code $()}.
     */
    public String javascript(Expression expression) throws ConversionException {
        usesJavascript = true;
        return js(expression);
    }

    private String js(Expression expression) throws ConversionException {
        switch (expression.kind()) {
            case LITERAL:
                return literal((Literal) expression);
            case REFERENCE:
                return reference((Reference) expression);
            case INTERPOLATION:
                return interpolation((Interpolation) expression);
            case FIRST_DEFINED:
                return firstDefined(((FirstDefined) expression).candidates());
            case OVERRIDE_FALLBACK:
                return overrideFallback((OverrideFallback) expression);
            case FUNCTION_CALL:
                return functionCall((FunctionCall) expression);
            case NEGATION:
                return "!" + wrap(js(((Negation) expression).operand()));
            case OBJECT_LITERAL:
                var members = new ArrayList<String>();
                for (Map.Entry<String, Expression> member : ((ObjectLiteral) expression).members().entrySet()) {
                    members.add(quote(member.getKey()) + ": " + js(member.getValue()));
                }
                return "{" + String.join(", ", members) + "}";
            case ARRAY_LITERAL:
                var elements = new ArrayList<String>();
                for (Expression element : ((ArrayLiteral) expression).elements()) {
                    elements.add(js(element));
                }
                return "[" + String.join(", ", elements) + "]";
            default:
                throw unsupported(expression.location(),
                        String.format("Expression '%s' has no CWL equivalent", ((UnsupportedExpression) expression).text()));
        }
    }

    private static String literal(Literal literal) {
        switch (literal.type()) {
            case STRING:
                return quote(literal.text());
            case NULL:
                return "null";
            default:
                return literal.text();
        }
    }

    private String reference(Reference reference) throws ConversionException {
        var inlined = inlined(reference);
        if (inlined.isPresent()) {
            if (!inlining.add(reference.root())) {
                throw new UnresolvedReferenceException(reference.location().orElse(null),
                        String.format("'%s' depends on itself", reference.root()));
            }
            String value;
            try {
                value = wrap(js(inlined.get()));
            } finally {
                inlining.remove(reference.root());
            }
            return reference.members().isEmpty() ? value : value + "." + String.join(".", reference.members());
        }
        return resolve(reference).path();
    }

    private String interpolation(Interpolation interpolation) throws ConversionException {
        return interpolation(interpolation, "null");
    }

    /**
     * Joins the parts of an interpolation. When an operand of a concatenation is null the whole string is replaced by
     * {@code whenUndefined}.
     */
    private String interpolation(Interpolation interpolation, String whenUndefined) throws ConversionException {
        var values = new ArrayList<String>();
        var undefined = new ArrayList<String>();
        for (TemplatePart part : interpolation.parts()) {
            if (part.isLiteral()) {
                values.add(quote(((LiteralText) part).text()));
            } else {
                var placeholder = (Placeholder) part;
                if (!placeholder.options().isEmpty()) {
                    throw unsupported(placeholder.location(),
                            String.format("Placeholder options of %s are only supported in commands", placeholder.marker()));
                }
                var operand = placeholder.expression();
                var value = js(operand);
                if (placeholder.propagatesUndefined() && mayBeUndefined(operand)) {
                    undefined.add(wrap(value) + " === null");
                    values.add(typeOf(operand).map(ParameterType::isFile).orElse(false) ? wrap(value) + ".path" : value);
                } else {
                    values.add(stringValue(value, operand));
                }
            }
        }
        var joined = "[" + String.join(", ", values) + "].join(\"\")";
        if (undefined.isEmpty()) {
            return joined;
        }
        return String.join(" || ", undefined) + " ? " + whenUndefined + " : " + joined;
    }

    private boolean mayBeUndefined(Expression expression) {
        if (expression instanceof Literal) {
            return ((Literal) expression).type() == Literal.Type.NULL;
        }
        return typeOf(expression).map(ParameterType::isOptional).orElse(true);
    }

    private String firstDefined(List<Expression> candidates) throws ConversionException {
        if (candidates.isEmpty()) {
            throw unsupported(Optional.empty(), "select_first of an empty list");
        }
        var last = wrap(js(candidates.get(candidates.size() - 1)));
        var builder = new StringBuilder();
        for (Expression candidate : candidates.subList(0, candidates.size() - 1)) {
            var value = wrap(js(candidate));
            builder.append(value).append(" != null ? ").append(value).append(" : ");
        }
        return builder.append(last).toString();
    }

    /**
     * Every prefix of the override path is checked, so an unbound struct and an unset member both select the fallback.
     */
    private String overrideFallback(OverrideFallback node) throws ConversionException {
        var override = node.override();
        var root = resolve(Reference.to(override.root())).path();
        var checks = new ArrayList<String>();
        var path = new StringBuilder(root);
        checks.add(path + " != null");
        for (String member : override.members()) {
            path.append('.').append(member);
            checks.add(path + " != null");
        }
        return String.join(" && ", checks) + " ? " + path + " : " + wrap(js(node.fallback()));
    }

    private String functionCall(FunctionCall call) throws ConversionException {
        var arguments = call.arguments();
        switch (call.name()) {
            case "defined":
                requireArguments(call, 1);
                return wrap(js(arguments.get(0))) + " != null";
            case "basename":
                if (arguments.isEmpty() || arguments.size() > 2) {
                    throw unsupported(call.location(), "basename takes one or two arguments");
                }
                var value = wrap(js(arguments.get(0)));
                var isFile = typeOf(arguments.get(0)).map(ParameterType::isFile).orElse(false);
                var name = isFile ? value + ".basename" : value + ".split(\"/\").pop()";
                if (arguments.size() == 1) {
                    return name;
                }
                if (!(arguments.get(1) instanceof Literal)) {
                    throw unsupported(call.location(), "basename with a computed suffix has no CWL equivalent");
                }
                return name + ".replace(/" + regexLiteral(((Literal) arguments.get(1)).text()) + "$/, \"\")";
            case "length":
                requireArguments(call, 1);
                return wrap(js(arguments.get(0))) + ".length";
            default:
                throw unsupported(call.location(), String.format("Function '%s' has no CWL equivalent in this position", call.name()));
        }
    }

    private static void requireArguments(FunctionCall call, int count) throws UnsupportedExpressionException {
        if (call.arguments().size() != count) {
            throw unsupported(call.location(), String.format("%s takes %d argument(s), found %d", call.name(), count, call.arguments().size()));
        }
    }

    /**
     * JavaScript producing the text a WDL placeholder shows for the value: the path of a file, empty for null.
     */
    private String stringValue(String javascript, Expression expression) {
        var type = typeOf(expression);
        if (type.isPresent() && type.get().isFile()) {
            return type.get().isOptional() ? String.format("%s === null ? \"\" : %s.path", wrap(javascript), wrap(javascript)) : wrap(javascript) + ".path";
        }
        return javascript;
    }

    private Optional<ParameterType> typeOf(Expression expression) {
        if (expression instanceof Reference && inlined((Reference) expression).isEmpty()) {
            return context.resolve((Reference) expression).flatMap(ResolvedReference::type);
        }
        return Optional.empty();
    }

    private Optional<Expression> inlined(Reference reference) {
        return context.inline(reference.root());
    }

    private ResolvedReference resolve(Reference reference) throws UnresolvedReferenceException {
        var resolved = context.resolve(reference);
        if (resolved.isEmpty()) {
            throw new UnresolvedReferenceException(reference.location().orElse(null),
                    String.format("'%s' is not declared", reference.dotted()));
        }
        return resolved.get();
    }

    private TranslatedExpression javascriptResult(String text) {
        usesJavascript = true;
        return TranslatedExpression.of(text, true);
    }

    /**
     * Escapes literal text so CWL does not read it as a parameter reference or expression.
     */
    public static String escape(String text) {
        return text.replace("\\", "\\\\").replace("$(", "\\$(").replace("${", "\\${");
    }

    static String quote(String text) {
        return "\"" + new String(JsonStringEncoder.getInstance().quoteAsString(text)) + "\"";
    }

    private static String regexLiteral(String text) {
        return text.replaceAll("[\\\\^$.|?*+()\\[\\]{}/]", "\\\\$0");
    }

    private static String wrap(String javascript) {
        return SIMPLE_JAVASCRIPT.matcher(javascript).matches() ? javascript : "(" + javascript + ")";
    }

    private static UnsupportedExpressionException unsupported(Optional<SourceLocation> location, String message) {
        return new UnsupportedExpressionException(location.orElse(null), message);
    }
}
