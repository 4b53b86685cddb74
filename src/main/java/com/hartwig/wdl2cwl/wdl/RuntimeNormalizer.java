package com.hartwig.wdl2cwl.wdl;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.hartwig.wdl2cwl.diagnostic.Diagnostic;
import com.hartwig.wdl2cwl.diagnostic.DiagnosticKind;
import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.FirstDefined;
import com.hartwig.wdl2cwl.ir.ImmutableLiteral;
import com.hartwig.wdl2cwl.ir.ImmutableReference;
import com.hartwig.wdl2cwl.ir.ImmutableUnsupportedExpression;
import com.hartwig.wdl2cwl.ir.Interpolation;
import com.hartwig.wdl2cwl.ir.Literal;
import com.hartwig.wdl2cwl.ir.LiteralText;
import com.hartwig.wdl2cwl.ir.ObjectLiteral;
import com.hartwig.wdl2cwl.ir.OverrideFallback;
import com.hartwig.wdl2cwl.ir.Parameter;
import com.hartwig.wdl2cwl.ir.Placeholder;
import com.hartwig.wdl2cwl.ir.Reference;
import com.hartwig.wdl2cwl.ir.ResourceSpec;
import com.hartwig.wdl2cwl.ir.RuntimeRequirement;
import com.hartwig.wdl2cwl.ir.TemplatePart;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites the runtime section of a task into a {@link RuntimeRequirement}. Resource values of the form "override if
 * bound, otherwise a literal" become {@link OverrideFallback} nodes, memory and disk values are split into an amount and
 * a unit.
 */
class RuntimeNormalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(RuntimeNormalizer.class);

    private static final Pattern QUANTITY = Pattern.compile("^\\s*([0-9]+(?:\\.[0-9]+)?)\\s*([A-Za-z]*)\\s*$");
    private static final Pattern LOCAL_DISK = Pattern.compile("^\\s*\\S+\\s+([0-9]+(?:\\.[0-9]+)?)\\s+(?:HDD|SSD|LOCAL)\\s*$");
    private static final Pattern DISK_PREFIX = Pattern.compile("^\\s*\\S+\\s+$");
    private static final Pattern DISK_SUFFIX = Pattern.compile("^\\s+(?:HDD|SSD|LOCAL)\\s*$");
    private static final Pattern UNIT = Pattern.compile("^\\s*([A-Za-z]+)\\s*$");

    private static final String DISK_UNIT = "GiB";
    private static final String MEMORY_UNIT = "B";

    private final String taskName;
    private final Map<String, Parameter> inputs;
    private final Map<String, Parameter> declarations;
    private final List<Diagnostic> warnings;
    private String overrideParameter;

    RuntimeNormalizer(String taskName, List<Parameter> inputs, List<Parameter> declarations, List<Diagnostic> warnings) {
        this.taskName = taskName;
        this.inputs = inputs.stream().collect(Collectors.toMap(Parameter::name, Function.identity(), (a, b) -> a));
        this.declarations = declarations.stream().collect(Collectors.toMap(Parameter::name, Function.identity(), (a, b) -> a));
        this.warnings = warnings;
    }

    /**
     * @param entries runtime key to its parsed value and the value's source text
     */
    RuntimeRequirement normalize(Map<String, Pair<Expression, String>> entries) {
        var builder = RuntimeRequirement.builder();
        for (Map.Entry<String, Pair<Expression, String>> entry : entries.entrySet()) {
            var key = entry.getKey();
            var value = entry.getValue().getLeft();
            var text = entry.getValue().getRight();
            switch (key) {
                case "docker":
                case "container":
                    builder.image(value);
                    break;
                case "cpu":
                    builder.cpu(ResourceSpec.of(numeric(amount(value))));
                    break;
                case "memory":
                    builder.memory(quantity(value, text, MEMORY_UNIT));
                    break;
                case "disk":
                    builder.disk(quantity(value, text, DISK_UNIT));
                    break;
                case "disks":
                    builder.disk(disks(value, text));
                    break;
                default:
                    builder.putPlatformHints(key, value);
                    var message = String.format("Runtime attribute '%s' of task '%s' has no CWL equivalent and is not converted", key, taskName);
                    LOGGER.warn("[{}] {}", taskName, message);
                    warnings.add(Diagnostic.warning(DiagnosticKind.PLATFORM_HINT, value.location().orElse(null), message));
            }
        }
        return builder.overrideParameter(Optional.ofNullable(overrideParameter)).build();
    }

    private ResourceSpec quantity(Expression value, String text, String defaultUnit) {
        var resolved = amount(value);
        if (resolved instanceof Literal) {
            var literal = (Literal) resolved;
            if (literal.isNumeric()) {
                return ResourceSpec.of(literal, defaultUnit);
            }
            var matcher = QUANTITY.matcher(literal.text());
            if (literal.type() == Literal.Type.STRING && matcher.matches()) {
                return ResourceSpec.of(number(matcher.group(1)), matcher.group(2).isEmpty() ? defaultUnit : matcher.group(2));
            }
        } else if (resolved instanceof Interpolation) {
            var parts = ((Interpolation) resolved).parts();
            if (parts.size() == 2 && !parts.get(0).isLiteral() && parts.get(1).isLiteral()) {
                var unit = UNIT.matcher(((LiteralText) parts.get(1)).text());
                if (unit.matches()) {
                    return ResourceSpec.of(numeric(amount(((Placeholder) parts.get(0)).expression())), unit.group(1));
                }
            }
        } else if (resolved.kind() != Expression.Kind.UNSUPPORTED) {
            return ResourceSpec.of(resolved, defaultUnit);
        }
        return ResourceSpec.of(unsupported(value, text));
    }

    private ResourceSpec disks(Expression value, String text) {
        var resolved = amount(value);
        if (resolved instanceof Literal && ((Literal) resolved).type() == Literal.Type.STRING) {
            Matcher localDisk = LOCAL_DISK.matcher(((Literal) resolved).text());
            if (localDisk.matches()) {
                return ResourceSpec.of(number(localDisk.group(1)), DISK_UNIT);
            }
            return quantity(resolved, text, DISK_UNIT);
        }
        if (resolved instanceof Interpolation) {
            List<TemplatePart> parts = ((Interpolation) resolved).parts();
            if (parts.size() == 3 && parts.get(0).isLiteral() && !parts.get(1).isLiteral() && parts.get(2).isLiteral()
                    && DISK_PREFIX.matcher(((LiteralText) parts.get(0)).text()).matches()
                    && DISK_SUFFIX.matcher(((LiteralText) parts.get(2)).text()).matches()) {
                return ResourceSpec.of(numeric(amount(((Placeholder) parts.get(1)).expression())), DISK_UNIT);
            }
            return quantity(resolved, text, DISK_UNIT);
        }
        return quantity(value, text, DISK_UNIT);
    }

    /**
     * Resolves declarations and recognizes the override patterns in a resource amount.
     */
    private Expression amount(Expression value) {
        switch (value.kind()) {
            case REFERENCE:
                var resolved = resolve((Reference) value);
                return resolved instanceof Reference ? resolved : amount(resolved);
            case FIRST_DEFINED:
                var candidates = ((FirstDefined) value).candidates().stream().map(this::resolveCandidate).collect(Collectors.toList());
                if (candidates.size() == 2 && candidates.get(0) instanceof Reference && isOverride((Reference) candidates.get(0))
                        && candidates.get(1) instanceof Literal) {
                    var override = (Reference) candidates.get(0);
                    overrideParameter = override.root();
                    return OverrideFallback.of(override, candidates.get(1));
                }
                if (!candidates.isEmpty() && candidates.get(0) instanceof OverrideFallback) {
                    // the fallback arm is a literal, later candidates are never reached
                    return candidates.get(0);
                }
                return FirstDefined.builder().from(value).candidates(candidates).build();
            default:
                return value;
        }
    }

    private Expression resolveCandidate(Expression candidate) {
        return candidate instanceof Reference ? resolve((Reference) candidate) : candidate;
    }

    /**
     * Follows a reference to a private declaration. A member of a declaration bound to
     * {@code select_first([override, defaults])} becomes the same member of the override; a member of an object literal
     * becomes the member's value.
     */
    private Expression resolve(Reference reference) {
        return resolve(reference, new HashSet<>());
    }

    /**
     * @param visiting declarations on the current chain; a declaration that depends on itself is left unresolved
     */
    private Expression resolve(Reference reference, Set<String> visiting) {
        var declaration = declarations.get(reference.root());
        if (declaration == null || declaration.expression().isEmpty() || !visiting.add(reference.root())) {
            return reference;
        }
        var value = declaration.expression().get();
        if (reference.members().isEmpty()) {
            return value instanceof Reference ? resolve((Reference) value, visiting) : value;
        }
        if (value instanceof ObjectLiteral) {
            return member((ObjectLiteral) value, reference.members()).orElse(reference);
        }
        if (value instanceof FirstDefined) {
            var candidates = ((FirstDefined) value).candidates();
            if (candidates.size() == 2 && candidates.get(0) instanceof Reference && isOverride((Reference) candidates.get(0))
                    && candidates.get(1) instanceof Reference) {
                var override = (Reference) candidates.get(0);
                var overrideMember = ImmutableReference.builder().from(override).addAllPath(reference.members()).build();
                var fallbackMember = ImmutableReference.builder().from((Reference) candidates.get(1)).addAllPath(reference.members()).build();
                var fallback = resolve(fallbackMember, visiting);
                if (fallback instanceof Literal) {
                    overrideParameter = override.root();
                    return OverrideFallback.of(overrideMember, fallback);
                }
            }
        }
        return reference;
    }

    private static Optional<Expression> member(ObjectLiteral object, List<String> members) {
        Expression current = object;
        for (String member : members) {
            if (!(current instanceof ObjectLiteral)) {
                return Optional.empty();
            }
            current = ((ObjectLiteral) current).members().get(member);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    private boolean isOverride(Reference reference) {
        var input = inputs.get(reference.root());
        return input != null && input.type().isOptional();
    }

    /**
     * String literals holding a plain number are read as that number.
     */
    private static Expression numeric(Expression amount) {
        if (amount instanceof Literal && ((Literal) amount).type() == Literal.Type.STRING) {
            var text = ((Literal) amount).text().trim();
            if (text.matches("[0-9]+(\\.[0-9]+)?")) {
                return number(text);
            }
        }
        return amount;
    }

    private static Literal number(String text) {
        return text.contains(".") ? Literal.floating(text) : ImmutableLiteral.builder().type(Literal.Type.INT).text(text).build();
    }

    private Expression unsupported(Expression value, String text) {
        return ImmutableUnsupportedExpression.builder().text(text).location(value.location()).build();
    }
}
