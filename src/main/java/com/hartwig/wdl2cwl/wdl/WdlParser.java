package com.hartwig.wdl2cwl.wdl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.hartwig.wdl2cwl.diagnostic.Diagnostic;
import com.hartwig.wdl2cwl.diagnostic.DiagnosticKind;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;
import com.hartwig.wdl2cwl.diagnostic.WdlParseException;
import com.hartwig.wdl2cwl.ir.ArrayLiteral;
import com.hartwig.wdl2cwl.ir.CallStep;
import com.hartwig.wdl2cwl.ir.ConditionalBlock;
import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.FirstDefined;
import com.hartwig.wdl2cwl.ir.FunctionCall;
import com.hartwig.wdl2cwl.ir.ImmutableArrayLiteral;
import com.hartwig.wdl2cwl.ir.ImmutableLiteral;
import com.hartwig.wdl2cwl.ir.ImmutableNegation;
import com.hartwig.wdl2cwl.ir.ImmutableObjectLiteral;
import com.hartwig.wdl2cwl.ir.ImmutableParameterType;
import com.hartwig.wdl2cwl.ir.ImmutableReference;
import com.hartwig.wdl2cwl.ir.ImmutableUnsupportedExpression;
import com.hartwig.wdl2cwl.ir.ImportReference;
import com.hartwig.wdl2cwl.ir.Interpolation;
import com.hartwig.wdl2cwl.ir.Literal;
import com.hartwig.wdl2cwl.ir.LiteralText;
import com.hartwig.wdl2cwl.ir.Parameter;
import com.hartwig.wdl2cwl.ir.ParameterType;
import com.hartwig.wdl2cwl.ir.Placeholder;
import com.hartwig.wdl2cwl.ir.Reference;
import com.hartwig.wdl2cwl.ir.ScatterBlock;
import com.hartwig.wdl2cwl.ir.SourceDocument;
import com.hartwig.wdl2cwl.ir.StructDefinition;
import com.hartwig.wdl2cwl.ir.Task;
import com.hartwig.wdl2cwl.ir.TemplatePart;
import com.hartwig.wdl2cwl.ir.Workflow;
import com.hartwig.wdl2cwl.ir.WorkflowElement;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser for WDL documents. One instance parses one document (or one placeholder of it).
 * Constructs the converter does not handle are skipped with a warning, expressions it cannot translate are kept as
 * {@link com.hartwig.wdl2cwl.ir.UnsupportedExpression}.
 */
public final class WdlParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(WdlParser.class);

    private static final Set<String> PLACEHOLDER_OPTIONS = Set.of("sep", "default", "true", "false");
    private static final Set<String> METADATA_SECTIONS = Set.of("meta", "parameter_meta");

    private final String file;
    private final String source;
    private final List<Token> tokens;
    private final List<Diagnostic> warnings;
    private int position;

    private WdlParser(String file, String source, List<Token> tokens, List<Diagnostic> warnings) {
        this.file = file;
        this.source = source;
        this.tokens = tokens;
        this.warnings = warnings;
    }

    public static SourceDocument parse(String file, String source) throws WdlParseException {
        var tokens = new WdlLexer(file, source).tokenize();
        return new WdlParser(file, source, tokens, new ArrayList<>()).document();
    }

    private SourceDocument document() throws WdlParseException {
        var builder = SourceDocument.builder().path(file);
        var imports = new ArrayList<ImportReference>();
        Workflow workflow = null;
        while (!peek().is(TokenType.EOF)) {
            var token = peek();
            if (token.isKeyword("version")) {
                next();
                builder.version(next().text());
            } else if (token.isKeyword("import")) {
                imports.add(importStatement());
            } else if (token.isKeyword("struct")) {
                builder.addStructs(struct());
            } else if (token.isKeyword("task")) {
                builder.addTasks(task());
            } else if (token.isKeyword("workflow")) {
                if (workflow != null) {
                    throw new WdlParseException(token.location(),
                            String.format("Second workflow in document, '%s' is already defined", workflow.name()));
                }
                workflow = workflow();
            } else {
                skipUnrecognized("top-level construct");
            }
        }
        if (workflow != null) {
            workflow = Workflow.builder().from(workflow).imports(imports).build();
        }
        var document = builder.imports(imports).workflow(Optional.ofNullable(workflow)).warnings(warnings).build();
        LOGGER.debug("[{}] Parsed {} task(s), {} struct(s), {} workflow",
                file,
                document.tasks().size(),
                document.structs().size(),
                workflow == null ? "no" : "one");
        return document;
    }

    private ImportReference importStatement() throws WdlParseException {
        var location = expectKeyword("import").location();
        var path = expect(TokenType.STRING);
        var builder = ImportReference.builder().path(CommandScanner.unescape(path.text())).location(location);
        if (peek().isKeyword("as")) {
            next();
            builder.alias(expect(TokenType.IDENTIFIER).text());
        }
        while (peek().isKeyword("alias")) {
            var alias = next();
            var original = expect(TokenType.IDENTIFIER).text();
            expectKeyword("as");
            var renamed = expect(TokenType.IDENTIFIER).text();
            warn(DiagnosticKind.UNRECOGNIZED_CONSTRUCT,
                    alias.location(),
                    String.format("Struct alias '%s as %s' is not supported and was ignored", original, renamed));
        }
        return builder.build();
    }

    private StructDefinition struct() throws WdlParseException {
        var location = expectKeyword("struct").location();
        var builder = StructDefinition.builder().name(expect(TokenType.IDENTIFIER).text()).location(location);
        expect(TokenType.LBRACE);
        while (!peek().is(TokenType.RBRACE)) {
            builder.addMembers(declaration());
            skipOptional(TokenType.COMMA);
        }
        expect(TokenType.RBRACE);
        return builder.build();
    }

    private Task task() throws WdlParseException {
        var location = expectKeyword("task").location();
        var name = expect(TokenType.IDENTIFIER).text();
        expect(TokenType.LBRACE);
        var builder = Task.builder().name(name).location(location);
        var inputs = new ArrayList<Parameter>();
        var declarations = new ArrayList<Parameter>();
        var runtime = new LinkedHashMap<String, Pair<Expression, String>>();
        List<TemplatePart> command = null;
        while (!peek().is(TokenType.RBRACE)) {
            var token = peek();
            if (token.isKeyword("input") && peekAhead(1).is(TokenType.LBRACE)) {
                inputs.addAll(declarationBlock(false));
            } else if (token.isKeyword("output") && peekAhead(1).is(TokenType.LBRACE)) {
                builder.addAllOutputs(declarationBlock(true));
            } else if (token.isKeyword("command") && peekAhead(1).is(TokenType.COMMAND)) {
                next();
                if (command != null) {
                    throw new WdlParseException(token.location(), String.format("Task '%s' has more than one command section", name));
                }
                command = command(next());
            } else if (token.isKeyword("runtime") && peekAhead(1).is(TokenType.LBRACE)) {
                runtime.putAll(runtimeSection());
            } else if (METADATA_SECTIONS.contains(token.text()) && peekAhead(1).is(TokenType.LBRACE)) {
                next();
                skipBlock();
            } else if (looksLikeDeclaration()) {
                var declaration = declaration();
                if (declaration.expression().isPresent()) {
                    declarations.add(declaration);
                } else {
                    // pre-1.0 documents declare their inputs in the task body
                    inputs.add(declaration);
                }
            } else {
                skipUnrecognized("task section");
            }
        }
        expect(TokenType.RBRACE);
        if (command == null) {
            throw new WdlParseException(location, String.format("Task '%s' has no command section", name));
        }
        var normalizer = new RuntimeNormalizer(name, inputs, declarations, warnings);
        return builder.inputs(inputs)
                .declarations(declarations)
                .command(command)
                .runtime(normalizer.normalize(runtime))
                .build();
    }

    private List<TemplatePart> command(Token token) throws WdlParseException {
        var parts = new ArrayList<TemplatePart>();
        for (CommandScanner.Segment segment : CommandScanner.split(token.text(), token.location(), !token.heredoc())) {
            parts.add(segment.isPlaceholder() ? placeholder(segment) : LiteralText.of(segment.text()));
        }
        return parts;
    }

    private Map<String, Pair<Expression, String>> runtimeSection() throws WdlParseException {
        expectKeyword("runtime");
        expect(TokenType.LBRACE);
        var entries = new LinkedHashMap<String, Pair<Expression, String>>();
        while (!peek().is(TokenType.RBRACE)) {
            var key = expect(TokenType.IDENTIFIER).text();
            expect(TokenType.COLON);
            var start = position;
            var value = expression();
            entries.put(key, Pair.of(value, sourceText(start)));
            skipOptional(TokenType.COMMA);
        }
        expect(TokenType.RBRACE);
        return entries;
    }

    private List<Parameter> declarationBlock(boolean valuesRequired) throws WdlParseException {
        var keyword = next();
        expect(TokenType.LBRACE);
        var parameters = new ArrayList<Parameter>();
        while (!peek().is(TokenType.RBRACE)) {
            if (METADATA_SECTIONS.contains(peek().text()) && peekAhead(1).is(TokenType.LBRACE)) {
                next();
                skipBlock();
                continue;
            }
            var declaration = declaration();
            if (valuesRequired && declaration.expression().isEmpty()) {
                throw new WdlParseException(declaration.location().orElse(keyword.location()),
                        String.format("Output '%s' has no expression", declaration.name()));
            }
            parameters.add(declaration);
        }
        expect(TokenType.RBRACE);
        return parameters;
    }

    private Parameter declaration() throws WdlParseException {
        var location = peek().location();
        var type = type();
        var name = expect(TokenType.IDENTIFIER).text();
        var builder = Parameter.builder().name(name).type(type).location(location);
        if (peek().is(TokenType.ASSIGN)) {
            next();
            builder.expression(expression());
        }
        return builder.build();
    }

    private ParameterType type() throws WdlParseException {
        var start = position;
        var name = expect(TokenType.IDENTIFIER);
        ParameterType type;
        switch (name.text()) {
            case "File":
                type = ParameterType.file();
                break;
            case "String":
                type = ParameterType.string();
                break;
            case "Int":
                type = ParameterType.integer();
                break;
            case "Float":
                type = ParameterType.floating();
                break;
            case "Boolean":
                type = ParameterType.bool();
                break;
            case "Array":
                expect(TokenType.LBRACKET);
                var element = type();
                expect(TokenType.RBRACKET);
                var array = ParameterType.arrayOf(element);
                if (peek().is(TokenType.PLUS)) {
                    next();
                    array = ImmutableParameterType.copyOf(array).withNonEmpty(true);
                }
                type = array;
                break;
            default:
                if (peek().is(TokenType.LBRACKET)) {
                    skipBalanced(TokenType.LBRACKET, TokenType.RBRACKET);
                    type = ParameterType.unsupported(sourceText(start));
                } else if (name.text().equals("Object") || name.text().equals("Directory")) {
                    type = ParameterType.unsupported(name.text());
                } else {
                    type = ParameterType.struct(name.text());
                }
        }
        if (peek().is(TokenType.QUESTION)) {
            next();
            type = ParameterType.optionalOf(type);
        }
        return type;
    }

    private Workflow workflow() throws WdlParseException {
        var location = expectKeyword("workflow").location();
        var builder = Workflow.builder().name(expect(TokenType.IDENTIFIER).text()).location(location);
        expect(TokenType.LBRACE);
        var body = new ArrayList<WorkflowElement>();
        while (!peek().is(TokenType.RBRACE)) {
            var token = peek();
            if (token.isKeyword("input") && peekAhead(1).is(TokenType.LBRACE)) {
                declarationBlock(false).forEach(input -> builder.putInputs(input.name(), input));
            } else if (token.isKeyword("output") && peekAhead(1).is(TokenType.LBRACE)) {
                declarationBlock(true).forEach(output -> builder.putOutputs(output.name(), output));
            } else if (METADATA_SECTIONS.contains(token.text()) && peekAhead(1).is(TokenType.LBRACE)) {
                next();
                skipBlock();
            } else {
                workflowElement(body);
            }
        }
        expect(TokenType.RBRACE);
        return builder.body(body).build();
    }

    private void workflowElement(List<WorkflowElement> body) throws WdlParseException {
        var token = peek();
        if (token.isKeyword("call")) {
            body.add(call());
        } else if (token.isKeyword("scatter") && peekAhead(1).is(TokenType.LPAREN)) {
            body.add(scatter());
        } else if (token.isKeyword("if") && peekAhead(1).is(TokenType.LPAREN)) {
            body.add(conditional());
        } else if (looksLikeDeclaration()) {
            var declaration = declaration();
            warn(DiagnosticKind.UNRECOGNIZED_CONSTRUCT,
                    token.location(),
                    String.format("Workflow body declaration '%s' is not supported and was skipped", declaration.name()));
        } else {
            skipUnrecognized("workflow statement");
        }
    }

    private List<WorkflowElement> block() throws WdlParseException {
        expect(TokenType.LBRACE);
        var body = new ArrayList<WorkflowElement>();
        while (!peek().is(TokenType.RBRACE)) {
            workflowElement(body);
        }
        expect(TokenType.RBRACE);
        return body;
    }

    private CallStep call() throws WdlParseException {
        var location = expectKeyword("call").location();
        var target = new StringBuilder(expect(TokenType.IDENTIFIER).text());
        while (peek().is(TokenType.DOT)) {
            next();
            target.append('.').append(expect(TokenType.IDENTIFIER).text());
        }
        var builder = CallStep.builder().target(target.toString()).location(location);
        if (peek().isKeyword("as")) {
            next();
            builder.alias(expect(TokenType.IDENTIFIER).text());
        }
        while (peek().isKeyword("after")) {
            next();
            expect(TokenType.IDENTIFIER);
        }
        if (peek().is(TokenType.LBRACE)) {
            next();
            if (peek().isKeyword("input") && peekAhead(1).is(TokenType.COLON)) {
                next();
                next();
            }
            while (!peek().is(TokenType.RBRACE)) {
                var name = expect(TokenType.IDENTIFIER);
                if (peek().is(TokenType.ASSIGN)) {
                    next();
                    builder.putBindings(name.text(), expression());
                } else {
                    builder.putBindings(name.text(), ImmutableReference.builder().addPath(name.text()).location(name.location()).build());
                }
                skipOptional(TokenType.COMMA);
            }
            expect(TokenType.RBRACE);
        }
        return builder.build();
    }

    private ScatterBlock scatter() throws WdlParseException {
        var location = expectKeyword("scatter").location();
        expect(TokenType.LPAREN);
        var variable = expect(TokenType.IDENTIFIER).text();
        expectKeyword("in");
        var collection = expression();
        expect(TokenType.RPAREN);
        return ScatterBlock.builder().variable(variable).collection(collection).body(block()).location(location).build();
    }

    private ConditionalBlock conditional() throws WdlParseException {
        var location = expectKeyword("if").location();
        expect(TokenType.LPAREN);
        var condition = expression();
        expect(TokenType.RPAREN);
        return ConditionalBlock.builder().condition(condition).body(block()).location(location).build();
    }

    // Expressions, lowest precedence first.

    Expression expression() throws WdlParseException {
        if (peek().isKeyword("if")) {
            var start = position;
            next();
            expression();
            expectKeyword("then");
            expression();
            expectKeyword("else");
            expression();
            return unsupported(start);
        }
        return or();
    }

    private Expression or() throws WdlParseException {
        var start = position;
        var left = and();
        while (peek().is(TokenType.OR)) {
            next();
            and();
            left = unsupported(start);
        }
        return left;
    }

    private Expression and() throws WdlParseException {
        var start = position;
        var left = comparison();
        while (peek().is(TokenType.AND)) {
            next();
            comparison();
            left = unsupported(start);
        }
        return left;
    }

    private Expression comparison() throws WdlParseException {
        var start = position;
        var left = additive();
        while (peek().is(TokenType.EQ) || peek().is(TokenType.NEQ) || peek().is(TokenType.LT) || peek().is(TokenType.LE)
                || peek().is(TokenType.GT) || peek().is(TokenType.GE)) {
            next();
            additive();
            left = unsupported(start);
        }
        return left;
    }

    private Expression additive() throws WdlParseException {
        var start = position;
        var left = multiplicative();
        var leftText = sourceText(start);
        while (peek().is(TokenType.PLUS) || peek().is(TokenType.MINUS)) {
            var operator = next();
            var rightStart = position;
            var right = multiplicative();
            if (operator.is(TokenType.PLUS) && (isText(left) || isText(right))) {
                left = concatenate(left, leftText, right, sourceText(rightStart));
            } else {
                left = unsupported(start);
            }
            leftText = sourceText(start);
        }
        return left;
    }

    private Expression multiplicative() throws WdlParseException {
        var start = position;
        var left = unary();
        while (peek().is(TokenType.STAR) || peek().is(TokenType.SLASH) || peek().is(TokenType.PERCENT)) {
            next();
            unary();
            left = unsupported(start);
        }
        return left;
    }

    private Expression unary() throws WdlParseException {
        var start = position;
        if (peek().is(TokenType.BANG)) {
            var location = next().location();
            return ImmutableNegation.builder().operand(unary()).location(location).build();
        }
        if (peek().is(TokenType.MINUS)) {
            var location = next().location();
            var operand = unary();
            if (operand instanceof Literal && ((Literal) operand).isNumeric()) {
                var literal = (Literal) operand;
                return ImmutableLiteral.builder().type(literal.type()).text("-" + literal.text()).location(location).build();
            }
            return unsupported(start);
        }
        return postfix();
    }

    private Expression postfix() throws WdlParseException {
        var start = position;
        var expression = primary();
        while (true) {
            if (peek().is(TokenType.DOT)) {
                next();
                var member = expect(TokenType.IDENTIFIER).text();
                if (expression instanceof Reference) {
                    var reference = (Reference) expression;
                    expression = ImmutableReference.builder().from(reference).addPath(member).build();
                } else {
                    expression = unsupported(start);
                }
            } else if (peek().is(TokenType.LBRACKET)) {
                next();
                expression();
                expect(TokenType.RBRACKET);
                expression = unsupported(start);
            } else {
                return expression;
            }
        }
    }

    private Expression primary() throws WdlParseException {
        var start = position;
        var token = next();
        switch (token.type()) {
            case INT:
                if (!fitsInt(token.text())) {
                    throw new WdlParseException(token.location(), String.format("Integer literal '%s' is out of range", token.text()));
                }
                return ImmutableLiteral.builder().type(Literal.Type.INT).text(token.text()).location(token.location()).build();
            case FLOAT:
                return ImmutableLiteral.builder().type(Literal.Type.FLOAT).text(token.text()).location(token.location()).build();
            case STRING:
                return string(token);
            case LPAREN:
                var inner = expression();
                if (peek().is(TokenType.COMMA)) {
                    next();
                    expression();
                    expect(TokenType.RPAREN);
                    return unsupported(start);
                }
                expect(TokenType.RPAREN);
                return inner;
            case LBRACKET:
                var elements = ImmutableArrayLiteral.builder().location(token.location());
                while (!peek().is(TokenType.RBRACKET)) {
                    elements.addElements(expression());
                    skipOptional(TokenType.COMMA);
                }
                expect(TokenType.RBRACKET);
                return elements.build();
            case LBRACE:
                position--;
                skipBalanced(TokenType.LBRACE, TokenType.RBRACE);
                return unsupported(start);
            case IDENTIFIER:
                return identifierExpression(token, start);
            default:
                throw new WdlParseException(token.location(), String.format("Unexpected '%s' in expression", token.text()));
        }
    }

    private Expression identifierExpression(Token token, int start) throws WdlParseException {
        switch (token.text()) {
            case "true":
            case "false":
                return ImmutableLiteral.builder()
                        .type(Literal.Type.BOOLEAN)
                        .text(token.text())
                        .location(token.location())
                        .build();
            case "None":
                return ImmutableLiteral.builder().type(Literal.Type.NULL).text("None").location(token.location()).build();
            case "object":
                if (peek().is(TokenType.LBRACE)) {
                    return objectLiteral(token);
                }
                break;
            default:
                break;
        }
        if (peek().is(TokenType.LPAREN)) {
            return functionCall(token);
        }
        if (peek().is(TokenType.LBRACE) && Character.isUpperCase(token.text().charAt(0))) {
            return objectLiteral(token);
        }
        return ImmutableReference.builder().addPath(token.text()).location(token.location()).build();
    }

    private Expression objectLiteral(Token token) throws WdlParseException {
        expect(TokenType.LBRACE);
        var builder = ImmutableObjectLiteral.builder().location(token.location());
        while (!peek().is(TokenType.RBRACE)) {
            var key = next();
            if (!key.is(TokenType.IDENTIFIER) && !key.is(TokenType.STRING)) {
                throw new WdlParseException(key.location(), String.format("Expected object member name but found '%s'", key.text()));
            }
            expect(TokenType.COLON);
            builder.putMembers(key.text(), expression());
            skipOptional(TokenType.COMMA);
        }
        expect(TokenType.RBRACE);
        return builder.build();
    }

    private Expression functionCall(Token name) throws WdlParseException {
        expect(TokenType.LPAREN);
        var arguments = new ArrayList<Expression>();
        while (!peek().is(TokenType.RPAREN)) {
            arguments.add(expression());
            skipOptional(TokenType.COMMA);
        }
        expect(TokenType.RPAREN);
        if (name.text().equals("select_first") && arguments.size() == 1 && arguments.get(0).kind() == Expression.Kind.ARRAY_LITERAL) {
            var candidates = ((ArrayLiteral) arguments.get(0)).elements();
            return FirstDefined.builder().candidates(candidates).location(name.location()).build();
        }
        return FunctionCall.builder().name(name.text()).arguments(arguments).location(name.location()).build();
    }

    private Expression string(Token token) throws WdlParseException {
        var start = SourceLocation.of(file, token.location().line(), token.location().column() + 1);
        var segments = CommandScanner.split(token.text(), start, true);
        if (segments.stream().noneMatch(CommandScanner.Segment::isPlaceholder)) {
            return ImmutableLiteral.builder()
                    .type(Literal.Type.STRING)
                    .text(CommandScanner.unescape(token.text()))
                    .location(token.location())
                    .build();
        }
        var builder = Interpolation.builder().location(token.location());
        for (CommandScanner.Segment segment : segments) {
            builder.addParts(segment.isPlaceholder() ? placeholder(segment) : LiteralText.of(CommandScanner.unescape(segment.text())));
        }
        return builder.build();
    }

    private Placeholder placeholder(CommandScanner.Segment segment) throws WdlParseException {
        var location = segment.location();
        var tokens = new WdlLexer(file, segment.text(), location.line(), location.column() + 2).tokenize();
        var parser = new WdlParser(file, segment.text(), tokens, warnings);
        var builder = Placeholder.builder().marker(segment.marker()).location(location);
        while (PLACEHOLDER_OPTIONS.contains(parser.peek().text()) && parser.peekAhead(1).is(TokenType.ASSIGN)) {
            var option = parser.next().text();
            parser.next();
            var value = parser.next();
            if (!value.is(TokenType.STRING) && !value.is(TokenType.INT) && !value.is(TokenType.FLOAT) && !value.is(TokenType.IDENTIFIER)) {
                throw new WdlParseException(value.location(),
                        String.format("Placeholder option '%s' in %s needs a literal value", option, segment.marker()));
            }
            builder.putOptions(option, value.is(TokenType.STRING) ? CommandScanner.unescape(value.text()) : value.text());
        }
        builder.expression(parser.expression());
        if (!parser.peek().is(TokenType.EOF)) {
            throw new WdlParseException(parser.peek().location(),
                    String.format("Unexpected '%s' in placeholder %s", parser.peek().text(), segment.marker()));
        }
        return builder.build();
    }

    private static boolean fitsInt(String text) {
        try {
            Long.parseLong(text);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isText(Expression expression) {
        if (expression instanceof Literal) {
            return ((Literal) expression).type() == Literal.Type.STRING;
        }
        return expression.kind() == Expression.Kind.INTERPOLATION;
    }

    /**
     * Normalizes {@code a + b} with at least one textual operand into a single interpolation.
     */
    private Expression concatenate(Expression left, String leftText, Expression right, String rightText) {
        var parts = new ArrayList<TemplatePart>();
        appendParts(parts, left, leftText);
        appendParts(parts, right, rightText);
        return Interpolation.builder().parts(mergeLiterals(parts)).location(left.location()).build();
    }

    private static void appendParts(List<TemplatePart> parts, Expression expression, String text) {
        if (expression instanceof Literal) {
            var literal = (Literal) expression;
            if (literal.type() != Literal.Type.NULL) {
                parts.add(LiteralText.of(literal.text()));
                return;
            }
        }
        if (expression instanceof Interpolation) {
            parts.addAll(((Interpolation) expression).parts());
            return;
        }
        parts.add(Placeholder.builder()
                .expression(expression)
                .marker(text)
                .location(expression.location())
                .propagatesUndefined(true)
                .build());
    }

    private static List<TemplatePart> mergeLiterals(List<TemplatePart> parts) {
        var merged = new ArrayList<TemplatePart>();
        for (TemplatePart part : parts) {
            var last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (part.isLiteral() && last != null && last.isLiteral()) {
                merged.set(merged.size() - 1, LiteralText.of(((LiteralText) last).text() + ((LiteralText) part).text()));
            } else {
                merged.add(part);
            }
        }
        return merged;
    }

    private Expression unsupported(int startPosition) {
        return ImmutableUnsupportedExpression.builder()
                .text(sourceText(startPosition))
                .location(tokens.get(startPosition).location())
                .build();
    }

    /**
     * Verbatim source between the token at {@code startPosition} and the last consumed token.
     */
    private String sourceText(int startPosition) {
        if (position <= startPosition) {
            return "";
        }
        return source.substring(tokens.get(startPosition).start(), tokens.get(position - 1).end());
    }

    // Token stream helpers.

    private boolean looksLikeDeclaration() {
        var i = position;
        if (!tokens.get(i).is(TokenType.IDENTIFIER)) {
            return false;
        }
        i++;
        if (tokens.get(i).is(TokenType.LBRACKET)) {
            var depth = 0;
            do {
                if (tokens.get(i).is(TokenType.LBRACKET)) {
                    depth++;
                } else if (tokens.get(i).is(TokenType.RBRACKET)) {
                    depth--;
                } else if (tokens.get(i).is(TokenType.EOF)) {
                    return false;
                }
                i++;
            } while (depth > 0);
        }
        while (tokens.get(i).is(TokenType.PLUS) || tokens.get(i).is(TokenType.QUESTION)) {
            i++;
        }
        return tokens.get(i).is(TokenType.IDENTIFIER);
    }

    private void skipUnrecognized(String what) throws WdlParseException {
        var first = peek();
        if (first.is(TokenType.EOF)) {
            throw new WdlParseException(first.location(), "Unexpected end of input, missing '}'");
        }
        warn(DiagnosticKind.UNRECOGNIZED_CONSTRUCT,
                first.location(),
                String.format("Skipped unrecognized %s starting with '%s'", what, first.text()));
        var line = first.location().line();
        while (!peek().is(TokenType.EOF) && !peek().is(TokenType.RBRACE) && peek().location().line() == line) {
            if (peek().is(TokenType.LBRACE)) {
                skipBlock();
                return;
            }
            next();
        }
        if (peek() == first) {
            // stray closing brace
            next();
        }
    }

    private void skipBlock() throws WdlParseException {
        skipBalanced(TokenType.LBRACE, TokenType.RBRACE);
    }

    private void skipBalanced(TokenType open, TokenType close) throws WdlParseException {
        var opening = expect(open);
        var depth = 1;
        while (depth > 0) {
            var token = next();
            if (token.is(TokenType.EOF)) {
                throw new WdlParseException(opening.location(), String.format("Unbalanced '%s'", open.symbol()));
            } else if (token.is(open)) {
                depth++;
            } else if (token.is(close)) {
                depth--;
            }
        }
    }

    private void skipOptional(TokenType type) {
        if (peek().is(type)) {
            next();
        }
    }

    private Token expect(TokenType type) throws WdlParseException {
        var token = peek();
        if (!token.is(type)) {
            throw new WdlParseException(token.location(), String.format("Expected %s but found '%s'", type.symbol(), describe(token)));
        }
        return next();
    }

    private Token expectKeyword(String keyword) throws WdlParseException {
        var token = peek();
        if (!token.isKeyword(keyword)) {
            throw new WdlParseException(token.location(), String.format("Expected '%s' but found '%s'", keyword, describe(token)));
        }
        return next();
    }

    private static String describe(Token token) {
        return token.is(TokenType.EOF) ? "end of input" : CommandScanner.abbreviate(token.text());
    }

    private void warn(DiagnosticKind kind, SourceLocation location, String message) {
        LOGGER.warn("[{}] {}", location.describe(), message);
        warnings.add(Diagnostic.warning(kind, location, message));
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token peekAhead(int distance) {
        return tokens.get(Math.min(position + distance, tokens.size() - 1));
    }

    private Token next() {
        var token = tokens.get(position);
        if (!token.is(TokenType.EOF)) {
            position++;
        }
        return token;
    }
}
