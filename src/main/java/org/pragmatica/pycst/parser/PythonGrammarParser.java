package org.pragmatica.pycst.parser;

import org.pragmatica.pycst.deflated.DeflatedExpression;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.Arg;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.CompFor;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.CompIf;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.ComparisonTarget;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.DictElement;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.Element;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.Index;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.KeyValue;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.Param;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.ParamSlash;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.ParamStar;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.ParameterItem;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.Parameters;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.SimpleElement;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.Slice;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.SliceItem;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.StarredDictElement;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.StarredElement;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.SubscriptElement;
import org.pragmatica.pycst.deflated.DeflatedFragment;
import org.pragmatica.pycst.deflated.DeflatedModule;
import org.pragmatica.pycst.deflated.DeflatedPattern;
import org.pragmatica.pycst.deflated.DeflatedPattern.KeywordElement;
import org.pragmatica.pycst.deflated.DeflatedPattern.MappingElement;
import org.pragmatica.pycst.deflated.DeflatedPattern.SequenceElement;
import org.pragmatica.pycst.deflated.DeflatedPattern.SequenceItem;
import org.pragmatica.pycst.deflated.DeflatedSmallStatement;
import org.pragmatica.pycst.deflated.DeflatedStatement;
import org.pragmatica.pycst.deflated.DeflatedStatement.DeflatedOrElse;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.AsName;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.Decorator;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.Else;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.Finally;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.Handler;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.ImportAlias;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.MatchCase;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.NameItem;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.TypeParam;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.TypeParameters;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.TypeVar;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.TypeVarLike;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.TypeVarTuple;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.ParamSpec;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.WithItem;
import org.pragmatica.pycst.deflated.DeflatedSuite;
import org.pragmatica.pycst.deflated.Parens;
import org.pragmatica.pycst.error.ParseError;
import org.pragmatica.pycst.error.PythonParseException;
import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tokenizer.TokenType;
import org.pragmatica.pycst.tree.Expression;
import org.pragmatica.pycst.tree.Operator.AugKind;
import org.pragmatica.pycst.tree.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for Python over the token stream, producing deflated records.
 *
 * <p>Alternatives are chosen by lookahead wherever possible; the soft-keyword {@code match}
 * statement and parenthesized {@code with} items backtrack. Failures are reported at the
 * furthest token any alternative reached.
 */
public final class PythonGrammarParser {
    private static final Set<String> COMPARISON_OPERATORS = Set.of("==", "!=", "<", "<=", ">", ">=");
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of("None", "True", "False", "not", "lambda", "await");
    private static final Set<String> EXPRESSION_OPERATORS = Set.of("(", "[", "{", "-", "+", "~", "...", "*");
    private static final Set<String> SINGLETONS = Set.of("None", "True", "False");

    private final ParsingContext ctx;

    private PythonGrammarParser(List<Token> tokens, ParserConfig config) {
        this.ctx = ParsingContext.create(tokens, config);
    }

    /**
     * Parse a whole module.
     *
     * @throws PythonParseException with {@link ParseError.UnexpectedInput} or {@link ParseError.UnexpectedEof}
     */
    public static DeflatedModule parse(List<Token> tokens, ParserConfig config) throws PythonParseException {
        var parser = new PythonGrammarParser(tokens, config);
        return parser.run(parser::file);
    }

    /**
     * Parse exactly one statement, simple or compound.
     */
    public static DeflatedFragment<Statement> parseStatement(List<Token> tokens, ParserConfig config)
        throws PythonParseException {
        var parser = new PythonGrammarParser(tokens, config);
        return parser.run(() -> {
            var statement = parser.statement();
            parser.ctx.expect(TokenType.ENDMARKER, "end of input");
            return DeflatedFragment.statement(statement);
        });
    }

    /**
     * Parse a single expression; a comma-separated list becomes a tuple.
     */
    public static DeflatedFragment<Expression> parseExpression(List<Token> tokens, ParserConfig config)
        throws PythonParseException {
        var parser = new PythonGrammarParser(tokens, config);
        return parser.run(() -> {
            var expression = parser.starExpressions();
            parser.ctx.expect(TokenType.NEWLINE, "end of input");
            parser.ctx.expect(TokenType.ENDMARKER, "end of input");
            return DeflatedFragment.expression(expression);
        });
    }

    private <T> T run(Supplier<T> rule) throws PythonParseException {
        try {
            return rule.get();
        } catch (SyntaxFailure failure) {
            throw new PythonParseException(toError(failure));
        }
    }

    private ParseError toError(SyntaxFailure failure) {
        var token = failure.fatal()
                    ? failure.token()
                    : ctx.furthestToken();
        var expected = failure.fatal() || ctx.furthestExpected()
                                             .isEmpty()
                       ? failure.expected()
                       : ctx.furthestExpected();
        if (token.is(TokenType.ENDMARKER)) {
            return new ParseError.UnexpectedEof(token.start(), expected);
        }
        return new ParseError.UnexpectedInput(token.start(), token.describe(), expected);
    }

    private <T> Optional<T> attempt(Supplier<T> rule) {
        int mark = ctx.mark();
        try {
            return Optional.of(rule.get());
        } catch (SyntaxFailure failure) {
            if (failure.fatal()) {
                throw failure;
            }
            ctx.reset(mark);
            return Optional.empty();
        }
    }

    private void requireVersion(PythonVersion required, Token token, String feature) {
        var version = ctx.config()
                         .version();
        if (!version.supports(required)) {
            throw ctx.fatal(token, "Python " + required.display() + " or newer for " + feature
                                   + " (configured " + version.display() + ")");
        }
    }

    private static DeflatedExpression.Name name(Token token) {
        return new DeflatedExpression.Name(token, Parens.create());
    }

    // === Module and statements ===

    private DeflatedModule file() {
        var body = new ArrayList<DeflatedStatement>();
        while (!ctx.at(TokenType.ENDMARKER)) {
            body.add(statement());
        }
        return DeflatedModule.create(body, ctx.advance());
    }

    private DeflatedStatement statement() {
        var token = ctx.peek();
        if (token.isOp("@")) {
            return decorated();
        }
        if (token.isKeyword("def")) {
            return functionDef(List.of(), Optional.empty());
        }
        if (token.isKeyword("class")) {
            return classDef(List.of());
        }
        if (token.isKeyword("if")) {
            return ifStatement(false);
        }
        if (token.isKeyword("while")) {
            return whileStatement();
        }
        if (token.isKeyword("for")) {
            return forStatement(Optional.empty());
        }
        if (token.isKeyword("try")) {
            return tryStatement();
        }
        if (token.isKeyword("with")) {
            return withStatement(Optional.empty());
        }
        if (token.isKeyword("async")) {
            return asyncStatement(List.of());
        }
        if (token.isKeyword("match")) {
            var match = attempt(this::matchStatement);
            if (match.isPresent()) {
                return match.get();
            }
        }
        var line = smallStatements();
        return new DeflatedStatement.SimpleStatementLine(line.body(), line.semicolons(), line.newline());
    }

    private record Line(List<DeflatedSmallStatement> body, List<Optional<Token>> semicolons, Token newline) {}

    private Line smallStatements() {
        var body = new ArrayList<DeflatedSmallStatement>();
        var semicolons = new ArrayList<Optional<Token>>();
        while (true) {
            body.add(smallStatement());
            var semicolon = ctx.acceptOp(";");
            semicolons.add(semicolon);
            if (semicolon.isEmpty() || ctx.at(TokenType.NEWLINE)) {
                break;
            }
        }
        var newline = ctx.expect(TokenType.NEWLINE, "newline");
        return new Line(List.copyOf(body), List.copyOf(semicolons), newline);
    }

    private DeflatedSuite block() {
        if (!ctx.at(TokenType.NEWLINE)) {
            var line = smallStatements();
            return new DeflatedSuite.SimpleStatementSuite(line.body(), line.semicolons(), line.newline());
        }
        var newline = ctx.advance();
        var indent = ctx.expect(TokenType.INDENT, "indented block");
        var body = new ArrayList<DeflatedStatement>();
        while (!ctx.at(TokenType.DEDENT)) {
            body.add(statement());
        }
        var dedent = ctx.advance();
        return new DeflatedSuite.IndentedBlock(newline, indent, List.copyOf(body), dedent);
    }

    // === Simple statements ===

    private DeflatedSmallStatement smallStatement() {
        var token = ctx.peek();
        if (token.isKeyword("pass")) {
            return new DeflatedSmallStatement.Pass(ctx.advance());
        }
        if (token.isKeyword("break")) {
            return new DeflatedSmallStatement.Break(ctx.advance());
        }
        if (token.isKeyword("continue")) {
            return new DeflatedSmallStatement.Continue(ctx.advance());
        }
        if (token.isKeyword("return")) {
            var keyword = ctx.advance();
            var value = atStatementEnd()
                        ? Optional.<DeflatedExpression>empty()
                        : Optional.of(starExpressions());
            return new DeflatedSmallStatement.Return(keyword, value);
        }
        if (token.isKeyword("raise")) {
            return raiseStatement();
        }
        if (token.isKeyword("global")) {
            var keyword = ctx.advance();
            return new DeflatedSmallStatement.Global(keyword, nameItems());
        }
        if (token.isKeyword("nonlocal")) {
            var keyword = ctx.advance();
            return new DeflatedSmallStatement.Nonlocal(keyword, nameItems());
        }
        if (token.isKeyword("del")) {
            var keyword = ctx.advance();
            return new DeflatedSmallStatement.Del(keyword, targetList());
        }
        if (token.isKeyword("assert")) {
            var keyword = ctx.advance();
            var test = expression();
            var comma = ctx.acceptOp(",");
            var msg = comma.isPresent()
                      ? Optional.of(expression())
                      : Optional.<DeflatedExpression>empty();
            return new DeflatedSmallStatement.Assert(keyword, test, comma, msg);
        }
        if (token.isKeyword("import")) {
            return importStatement();
        }
        if (token.isKeyword("from")) {
            return importFrom();
        }
        if (token.isKeyword("type") && ParsingContext.isIdentifier(ctx.peek(1))
            && (ctx.peek(2).isOp("=") || ctx.peek(2).isOp("["))) {
            return typeAlias();
        }
        return expressionStatement();
    }

    private boolean atStatementEnd() {
        return ctx.at(TokenType.NEWLINE) || ctx.atOp(";");
    }

    private DeflatedSmallStatement raiseStatement() {
        var keyword = ctx.advance();
        if (atStatementEnd()) {
            return new DeflatedSmallStatement.Raise(keyword, Optional.empty(), Optional.empty(), Optional.empty());
        }
        var exc = expression();
        var from = ctx.acceptKeyword("from");
        var cause = from.isPresent()
                    ? Optional.of(expression())
                    : Optional.<DeflatedExpression>empty();
        return new DeflatedSmallStatement.Raise(keyword, Optional.of(exc), from, cause);
    }

    private List<NameItem> nameItems() {
        var names = new ArrayList<NameItem>();
        while (true) {
            var name = ctx.expectIdentifier();
            var comma = ctx.acceptOp(",");
            names.add(new NameItem(name, comma));
            if (comma.isEmpty()) {
                return List.copyOf(names);
            }
        }
    }

    private DeflatedSmallStatement importStatement() {
        var keyword = ctx.advance();
        var names = new ArrayList<ImportAlias>();
        while (true) {
            var module = dottedName();
            var alias = asName();
            var comma = ctx.acceptOp(",");
            names.add(new ImportAlias(module, alias, comma));
            if (comma.isEmpty()) {
                return new DeflatedSmallStatement.Import(keyword, List.copyOf(names));
            }
        }
    }

    private DeflatedSmallStatement importFrom() {
        var from = ctx.advance();
        var dots = new ArrayList<Token>();
        while (ctx.atOp(".") || ctx.atOp("...")) {
            dots.add(ctx.advance());
        }
        var module = !dots.isEmpty() && ctx.atKeyword("import")
                     ? Optional.<DeflatedExpression>empty()
                     : Optional.of(dottedName());
        var importToken = ctx.expectKeyword("import");
        if (ctx.atOp("*")) {
            var star = ctx.advance();
            return new DeflatedSmallStatement.ImportFrom(from, List.copyOf(dots), module, importToken, Optional.empty(),
                                                         List.of(), Optional.of(star), Optional.empty());
        }
        var lpar = ctx.acceptOp("(");
        var names = new ArrayList<ImportAlias>();
        while (true) {
            var imported = name(ctx.expectIdentifier());
            var alias = asName();
            var comma = ctx.acceptOp(",");
            names.add(new ImportAlias(imported, alias, comma));
            if (comma.isEmpty() || (lpar.isPresent() && ctx.atOp(")"))) {
                break;
            }
        }
        var rpar = lpar.isPresent()
                   ? Optional.of(ctx.expectOp(")"))
                   : Optional.<Token>empty();
        return new DeflatedSmallStatement.ImportFrom(from, List.copyOf(dots), module, importToken, lpar,
                                                     List.copyOf(names), Optional.empty(), rpar);
    }

    private Optional<AsName> asName() {
        if (!ctx.atKeyword("as")) {
            return Optional.empty();
        }
        var as = ctx.advance();
        return Optional.of(new AsName(as, name(ctx.expectIdentifier())));
    }

    private DeflatedExpression dottedName() {
        DeflatedExpression value = name(ctx.expectIdentifier());
        while (ctx.atOp(".")) {
            var dot = ctx.advance();
            value = new DeflatedExpression.Attribute(value, dot, ctx.expectIdentifier(), Parens.create());
        }
        return value;
    }

    private DeflatedSmallStatement typeAlias() {
        var keyword = ctx.advance();
        requireVersion(PythonVersion.PY312, keyword, "type alias statements");
        var aliasName = ctx.expectIdentifier();
        var parameters = optionalTypeParameters();
        var equal = ctx.expectOp("=");
        return new DeflatedSmallStatement.TypeAlias(keyword, aliasName, parameters, equal, expression());
    }

    private DeflatedSmallStatement expressionStatement() {
        var first = assignedValue();
        if (ctx.atOp(":")) {
            var colon = ctx.advance();
            var annotation = expression();
            var equal = ctx.acceptOp("=");
            var value = equal.isPresent()
                        ? Optional.of(assignedValue())
                        : Optional.<DeflatedExpression>empty();
            return new DeflatedSmallStatement.AnnAssign(first, colon, annotation, equal, value);
        }
        var token = ctx.peek();
        if (token.is(TokenType.OP) && AugKind.fromSymbol(token.text())
                                             .isPresent()) {
            var operator = ctx.advance();
            return new DeflatedSmallStatement.AugAssign(first, operator, assignedValue());
        }
        if (!ctx.atOp("=")) {
            return new DeflatedSmallStatement.Expr(first);
        }
        var targets = new ArrayList<DeflatedExpression>();
        var equals = new ArrayList<Token>();
        var current = first;
        while (ctx.atOp("=")) {
            targets.add(current);
            equals.add(ctx.advance());
            current = assignedValue();
        }
        return new DeflatedSmallStatement.Assign(List.copyOf(targets), List.copyOf(equals), current);
    }

    private DeflatedExpression assignedValue() {
        return ctx.atKeyword("yield")
               ? yieldExpression()
               : starExpressions();
    }

    // === Compound statements ===

    private DeflatedStatement decorated() {
        var decorators = new ArrayList<Decorator>();
        while (ctx.atOp("@")) {
            var at = ctx.advance();
            var expression = namedExpression();
            var newline = ctx.expect(TokenType.NEWLINE, "newline");
            decorators.add(new Decorator(at, expression, newline));
        }
        if (ctx.atKeyword("class")) {
            return classDef(List.copyOf(decorators));
        }
        if (ctx.atKeyword("async")) {
            return asyncStatement(List.copyOf(decorators));
        }
        if (ctx.atKeyword("def")) {
            return functionDef(List.copyOf(decorators), Optional.empty());
        }
        throw ctx.fail("function or class definition");
    }

    private DeflatedStatement asyncStatement(List<Decorator> decorators) {
        var async = ctx.advance();
        if (ctx.atKeyword("def")) {
            return functionDef(decorators, Optional.of(async));
        }
        if (!decorators.isEmpty()) {
            throw ctx.fail("'def'");
        }
        if (ctx.atKeyword("for")) {
            return forStatement(Optional.of(async));
        }
        if (ctx.atKeyword("with")) {
            return withStatement(Optional.of(async));
        }
        throw ctx.fail("'def', 'for' or 'with'");
    }

    private DeflatedStatement functionDef(List<Decorator> decorators, Optional<Token> async) {
        var def = ctx.expectKeyword("def");
        var functionName = ctx.expectIdentifier();
        var typeParameters = optionalTypeParameters();
        var lpar = ctx.expectOp("(");
        var params = parameters(true, ")");
        var rpar = ctx.expectOp(")");
        var arrow = ctx.acceptOp("->");
        var returns = arrow.isPresent()
                      ? Optional.of(expression())
                      : Optional.<DeflatedExpression>empty();
        var colon = ctx.expectOp(":");
        var body = block();
        return new DeflatedStatement.FunctionDef(decorators, async, def, functionName, typeParameters, lpar, params,
                                                 rpar, arrow, returns, colon, body);
    }

    private DeflatedStatement classDef(List<Decorator> decorators) {
        var keyword = ctx.expectKeyword("class");
        var className = ctx.expectIdentifier();
        var typeParameters = optionalTypeParameters();
        var lpar = ctx.acceptOp("(");
        var arguments = lpar.isPresent()
                        ? arguments()
                        : List.<Arg>of();
        var rpar = lpar.isPresent()
                   ? Optional.of(ctx.expectOp(")"))
                   : Optional.<Token>empty();
        var colon = ctx.expectOp(":");
        var body = block();
        return new DeflatedStatement.ClassDef(decorators, keyword, className, typeParameters, lpar, arguments, rpar,
                                              colon, body);
    }

    private Optional<TypeParameters> optionalTypeParameters() {
        if (!ctx.atOp("[")) {
            return Optional.empty();
        }
        var lbracket = ctx.advance();
        requireVersion(PythonVersion.PY312, lbracket, "type parameter lists");
        var params = new ArrayList<TypeParam>();
        while (!ctx.atOp("]")) {
            var param = typeVarLike();
            var equal = ctx.acceptOp("=");
            var defaultValue = Optional.<DeflatedExpression>empty();
            if (equal.isPresent()) {
                requireVersion(PythonVersion.PY313, equal.get(), "type parameter defaults");
                defaultValue = Optional.of(expression());
            }
            var comma = ctx.acceptOp(",");
            params.add(new TypeParam(param, equal, defaultValue, comma));
            if (comma.isEmpty()) {
                break;
            }
        }
        if (params.isEmpty()) {
            throw ctx.fail("type parameter");
        }
        var rbracket = ctx.expectOp("]");
        return Optional.of(new TypeParameters(lbracket, List.copyOf(params), rbracket));
    }

    private TypeVarLike typeVarLike() {
        if (ctx.atOp("*")) {
            var star = ctx.advance();
            return new TypeVarTuple(star, ctx.expectIdentifier());
        }
        if (ctx.atOp("**")) {
            var stars = ctx.advance();
            return new ParamSpec(stars, ctx.expectIdentifier());
        }
        var typeName = ctx.expectIdentifier();
        var colon = ctx.acceptOp(":");
        var bound = colon.isPresent()
                    ? Optional.of(expression())
                    : Optional.<DeflatedExpression>empty();
        return new TypeVar(typeName, colon, bound);
    }

    /**
     * Parameter list up to (not including) {@code closer}; annotations only in function definitions.
     */
    private Parameters parameters(boolean annotated, String closer) {
        var items = new ArrayList<ParameterItem>();
        while (!ctx.atOp(closer)) {
            if (ctx.atOp("/")) {
                var slash = ctx.advance();
                var comma = ctx.acceptOp(",");
                items.add(new ParamSlash(slash, comma));
                if (comma.isEmpty()) {
                    break;
                }
                continue;
            }
            if (ctx.atOp("*") && (ctx.peek(1).isOp(",") || ctx.peek(1).isOp(closer))) {
                var star = ctx.advance();
                var comma = ctx.acceptOp(",");
                items.add(new ParamStar(star, comma));
                if (comma.isEmpty()) {
                    break;
                }
                continue;
            }
            var star = ctx.atOp("*") || ctx.atOp("**")
                       ? Optional.of(ctx.advance())
                       : Optional.<Token>empty();
            var paramName = ctx.expectIdentifier();
            var colon = annotated
                        ? ctx.acceptOp(":")
                        : Optional.<Token>empty();
            var annotation = colon.isPresent()
                             ? Optional.of(expression())
                             : Optional.<DeflatedExpression>empty();
            var equal = star.isEmpty()
                        ? ctx.acceptOp("=")
                        : Optional.<Token>empty();
            var defaultValue = equal.isPresent()
                               ? Optional.of(expression())
                               : Optional.<DeflatedExpression>empty();
            var comma = ctx.acceptOp(",");
            items.add(new Param(star, paramName, colon, annotation, equal, defaultValue, comma));
            if (comma.isEmpty()) {
                break;
            }
        }
        return new Parameters(List.copyOf(items));
    }

    private DeflatedStatement.If ifStatement(boolean elif) {
        var keyword = ctx.advance();
        var test = namedExpression();
        var colon = ctx.expectOp(":");
        var body = block();
        var orelse = Optional.<DeflatedOrElse>empty();
        if (ctx.atKeyword("elif")) {
            orelse = Optional.of(DeflatedOrElse.of(ifStatement(true)));
        } else if (ctx.atKeyword("else")) {
            orelse = Optional.of(DeflatedOrElse.of(elseClause()));
        }
        return new DeflatedStatement.If(keyword, elif, test, colon, body, orelse);
    }

    private Else elseClause() {
        var keyword = ctx.advance();
        var colon = ctx.expectOp(":");
        return new Else(keyword, colon, block());
    }

    private Optional<Else> optionalElse() {
        return ctx.atKeyword("else")
               ? Optional.of(elseClause())
               : Optional.empty();
    }

    private DeflatedStatement whileStatement() {
        var keyword = ctx.advance();
        var test = namedExpression();
        var colon = ctx.expectOp(":");
        var body = block();
        return new DeflatedStatement.While(keyword, test, colon, body, optionalElse());
    }

    private DeflatedStatement forStatement(Optional<Token> async) {
        var keyword = ctx.expectKeyword("for");
        var target = targetList();
        var in = ctx.expectKeyword("in");
        var iter = starExpressions();
        var colon = ctx.expectOp(":");
        var body = block();
        return new DeflatedStatement.For(async, keyword, target, in, iter, colon, body, optionalElse());
    }

    private DeflatedStatement tryStatement() {
        var keyword = ctx.advance();
        var colon = ctx.expectOp(":");
        var body = block();
        var handlers = new ArrayList<Handler>();
        while (ctx.atKeyword("except")) {
            handlers.add(handler(handlers));
        }
        var orelse = handlers.isEmpty()
                     ? Optional.<Else>empty()
                     : optionalElse();
        var finalBody = Optional.<Finally>empty();
        if (ctx.atKeyword("finally")) {
            var finallyToken = ctx.advance();
            var finallyColon = ctx.expectOp(":");
            finalBody = Optional.of(new Finally(finallyToken, finallyColon, block()));
        }
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw ctx.fail("'except' or 'finally'");
        }
        return new DeflatedStatement.Try(keyword, colon, body, List.copyOf(handlers), orelse, finalBody);
    }

    private Handler handler(List<Handler> previous) {
        var except = ctx.advance();
        var star = ctx.acceptOp("*");
        if (star.isPresent()) {
            requireVersion(PythonVersion.PY311, star.get(), "except* clauses");
        }
        if (!previous.isEmpty() && previous.get(0)
                                           .starred() != star.isPresent()) {
            throw ctx.fatal(except, "'except' and 'except*' clauses not to be mixed");
        }
        var type = Optional.<DeflatedExpression>empty();
        var alias = Optional.<AsName>empty();
        if (!ctx.atOp(":")) {
            type = Optional.of(expression());
            alias = asName();
        }
        if (star.isPresent() && type.isEmpty()) {
            throw ctx.fail("exception type");
        }
        var colon = ctx.expectOp(":");
        return new Handler(except, star, type, alias, colon, block());
    }

    private record WithHeader(Token lpar, List<WithItem> items, Token rpar, Token colon) {}

    private DeflatedStatement withStatement(Optional<Token> async) {
        var keyword = ctx.expectKeyword("with");
        if (ctx.atOp("(")) {
            var header = attempt(this::parenthesizedWithItems);
            if (header.isPresent()) {
                var parenthesized = header.get();
                return new DeflatedStatement.With(async, keyword, Optional.of(parenthesized.lpar()),
                                                  parenthesized.items(), Optional.of(parenthesized.rpar()),
                                                  parenthesized.colon(), block());
            }
        }
        var items = new ArrayList<WithItem>();
        while (true) {
            var item = withItem();
            items.add(item);
            if (item.comma()
                    .isEmpty()) {
                break;
            }
        }
        var colon = ctx.expectOp(":");
        return new DeflatedStatement.With(async, keyword, Optional.empty(), List.copyOf(items), Optional.empty(), colon,
                                          block());
    }

    private WithHeader parenthesizedWithItems() {
        var lpar = ctx.advance();
        var items = new ArrayList<WithItem>();
        while (!ctx.atOp(")")) {
            var item = withItem();
            items.add(item);
            if (item.comma()
                    .isEmpty()) {
                break;
            }
        }
        if (items.isEmpty()) {
            throw ctx.fail("with item");
        }
        var rpar = ctx.expectOp(")");
        var colon = ctx.expectOp(":");
        return new WithHeader(lpar, List.copyOf(items), rpar, colon);
    }

    private WithItem withItem() {
        var item = expression();
        var alias = Optional.<AsName>empty();
        if (ctx.atKeyword("as")) {
            var as = ctx.advance();
            alias = Optional.of(new AsName(as, bitwiseOr()));
        }
        return new WithItem(item, alias, ctx.acceptOp(","));
    }

    // === Match statement ===

    private DeflatedStatement matchStatement() {
        var keyword = ctx.advance();
        var subject = tupleOf(this::namedExpression);
        var colon = ctx.expectOp(":");
        var newline = ctx.expect(TokenType.NEWLINE, "newline");
        var indent = ctx.expect(TokenType.INDENT, "indented block");
        requireVersion(PythonVersion.PY310, keyword, "match statements");
        var cases = new ArrayList<MatchCase>();
        while (ctx.atKeyword("case")) {
            cases.add(matchCase());
        }
        if (cases.isEmpty()) {
            throw ctx.fail("'case'");
        }
        var dedent = ctx.expect(TokenType.DEDENT, "dedent");
        return new DeflatedStatement.Match(keyword, subject, colon, newline, indent, List.copyOf(cases), dedent);
    }

    private MatchCase matchCase() {
        var keyword = ctx.advance();
        var pattern = casePatterns();
        var ifToken = ctx.acceptKeyword("if");
        var guard = ifToken.isPresent()
                    ? Optional.of(namedExpression())
                    : Optional.<DeflatedExpression>empty();
        var colon = ctx.expectOp(":");
        return new MatchCase(keyword, pattern, ifToken, guard, colon, block());
    }

    private DeflatedPattern casePatterns() {
        var items = sequenceItems();
        if (items.isEmpty()) {
            throw ctx.fail("pattern");
        }
        if (items.size() == 1 && items.get(0)
                                      .comma()
                                      .isEmpty()) {
            if (items.get(0) instanceof SequenceElement element) {
                return element.pattern();
            }
            throw ctx.fail("','");
        }
        return new DeflatedPattern.MatchTuple(items, Parens.create());
    }

    private List<SequenceItem> sequenceItems() {
        var items = new ArrayList<SequenceItem>();
        while (startsPattern()) {
            var item = sequenceItem();
            items.add(item);
            if (item.comma()
                    .isEmpty()) {
                break;
            }
        }
        return List.copyOf(items);
    }

    private SequenceItem sequenceItem() {
        if (ctx.atOp("*")) {
            var star = ctx.advance();
            var capture = ctx.expectIdentifier();
            return new DeflatedPattern.MatchStar(star, capture, ctx.acceptOp(","));
        }
        var pattern = asPattern();
        return new SequenceElement(pattern, ctx.acceptOp(","));
    }

    private boolean startsPattern() {
        var token = ctx.peek();
        return switch (token.type()) {
            case NUMBER, STRING -> true;
            case NAME -> ParsingContext.isIdentifier(token) || SINGLETONS.contains(token.text());
            case OP -> Set.of("(", "[", "{", "-", "*")
                          .contains(token.text());
            default -> false;
        };
    }

    private DeflatedPattern asPattern() {
        var pattern = orPattern();
        if (!ctx.atKeyword("as")) {
            return pattern;
        }
        var as = ctx.advance();
        var capture = ctx.expectIdentifier();
        return new DeflatedPattern.MatchAs(Optional.of(pattern), Optional.of(as), capture, Parens.create());
    }

    private DeflatedPattern orPattern() {
        var first = closedPattern();
        if (!ctx.atOp("|")) {
            return first;
        }
        var patterns = new ArrayList<DeflatedPattern>();
        var bars = new ArrayList<Token>();
        patterns.add(first);
        while (ctx.atOp("|")) {
            bars.add(ctx.advance());
            patterns.add(closedPattern());
        }
        return new DeflatedPattern.MatchOr(List.copyOf(patterns), List.copyOf(bars), Parens.create());
    }

    private DeflatedPattern closedPattern() {
        var token = ctx.peek();
        if (token.isOp("(")) {
            return groupPattern();
        }
        if (token.isOp("[")) {
            var lbracket = ctx.advance();
            var items = sequenceItems();
            var rbracket = ctx.expectOp("]");
            return new DeflatedPattern.MatchList(lbracket, items, rbracket, Parens.create());
        }
        if (token.isOp("{")) {
            return mappingPattern();
        }
        if (token.is(TokenType.NAME) && SINGLETONS.contains(token.text())) {
            return new DeflatedPattern.MatchSingleton(ctx.advance(), Parens.create());
        }
        if (token.is(TokenType.NUMBER) || token.is(TokenType.STRING) || token.isOp("-")) {
            return new DeflatedPattern.MatchValue(literal(), Parens.create());
        }
        if (ctx.atIdentifier()) {
            var next = ctx.peek(1);
            if (!next.isOp(".") && !next.isOp("(")) {
                return new DeflatedPattern.MatchAs(Optional.empty(), Optional.empty(), ctx.advance(), Parens.create());
            }
            var value = dottedName();
            if (ctx.atOp("(")) {
                return classPattern(value);
            }
            return new DeflatedPattern.MatchValue(value, Parens.create());
        }
        throw ctx.fail("pattern");
    }

    private DeflatedPattern groupPattern() {
        var open = ctx.advance();
        if (ctx.atOp(")")) {
            var empty = new DeflatedPattern.MatchTuple(List.of(), Parens.create());
            empty.parens()
                 .wrap(open, ctx.advance());
            return empty;
        }
        var items = sequenceItems();
        if (items.isEmpty()) {
            throw ctx.fail("pattern");
        }
        if (items.size() == 1 && items.get(0)
                                      .comma()
                                      .isEmpty()) {
            if (!(items.get(0) instanceof SequenceElement element)) {
                throw ctx.fail("','");
            }
            var group = element.pattern();
            group.parens()
                 .wrap(open, ctx.expectOp(")"));
            return group;
        }
        var tuple = new DeflatedPattern.MatchTuple(items, Parens.create());
        tuple.parens()
             .wrap(open, ctx.expectOp(")"));
        return tuple;
    }

    private DeflatedPattern mappingPattern() {
        var lbrace = ctx.advance();
        var elements = new ArrayList<MappingElement>();
        var stars = Optional.<Token>empty();
        var rest = Optional.<Token>empty();
        var trailingComma = Optional.<Token>empty();
        while (!ctx.atOp("}")) {
            if (ctx.atOp("**")) {
                stars = Optional.of(ctx.advance());
                rest = Optional.of(ctx.expectIdentifier());
                trailingComma = ctx.acceptOp(",");
                break;
            }
            var key = mappingKey();
            var colon = ctx.expectOp(":");
            var pattern = asPattern();
            var comma = ctx.acceptOp(",");
            elements.add(new MappingElement(key, colon, pattern, comma));
            if (comma.isEmpty()) {
                break;
            }
        }
        var rbrace = ctx.expectOp("}");
        return new DeflatedPattern.MatchMapping(lbrace, List.copyOf(elements), stars, rest, trailingComma, rbrace,
                                                Parens.create());
    }

    private DeflatedExpression mappingKey() {
        var token = ctx.peek();
        if (token.is(TokenType.NAME) && SINGLETONS.contains(token.text())) {
            return name(ctx.advance());
        }
        if (token.is(TokenType.NUMBER) || token.is(TokenType.STRING) || token.isOp("-")) {
            return literal();
        }
        if (ctx.atIdentifier()) {
            return dottedName();
        }
        throw ctx.fail("mapping key");
    }

    private DeflatedPattern classPattern(DeflatedExpression cls) {
        var lpar = ctx.advance();
        var patterns = new ArrayList<SequenceElement>();
        var keywords = new ArrayList<KeywordElement>();
        while (!ctx.atOp(")")) {
            if (ctx.atIdentifier() && ctx.peek(1).isOp("=")) {
                var key = ctx.advance();
                var equal = ctx.advance();
                var pattern = asPattern();
                var comma = ctx.acceptOp(",");
                keywords.add(new KeywordElement(key, equal, pattern, comma));
                if (comma.isEmpty()) {
                    break;
                }
                continue;
            }
            if (!keywords.isEmpty()) {
                throw ctx.fail("keyword pattern");
            }
            var pattern = asPattern();
            var comma = ctx.acceptOp(",");
            patterns.add(new SequenceElement(pattern, comma));
            if (comma.isEmpty()) {
                break;
            }
        }
        var rpar = ctx.expectOp(")");
        return new DeflatedPattern.MatchClass(cls, lpar, List.copyOf(patterns), List.copyOf(keywords), rpar,
                                              Parens.create());
    }

    /**
     * Literal of a value pattern: strings, or a signed number with an optional imaginary part.
     */
    private DeflatedExpression literal() {
        if (ctx.at(TokenType.STRING)) {
            return strings();
        }
        var minus = ctx.acceptOp("-");
        DeflatedExpression number = new DeflatedExpression.Number(ctx.expect(TokenType.NUMBER, "number"),
                                                                  Parens.create());
        DeflatedExpression value = minus.isPresent()
                                   ? new DeflatedExpression.UnaryOperation(minus.get(), number, Parens.create())
                                   : number;
        if (ctx.atOp("+") || ctx.atOp("-")) {
            var operator = ctx.advance();
            var imaginary = new DeflatedExpression.Number(ctx.expect(TokenType.NUMBER, "number"), Parens.create());
            value = new DeflatedExpression.BinaryOperation(value, operator, imaginary, Parens.create());
        }
        return value;
    }

    // === Expressions ===

    /**
     * Items separated by commas; a tuple when any comma is present.
     */
    private DeflatedExpression tupleOf(Supplier<DeflatedExpression> item) {
        var elements = new ArrayList<Element>();
        while (true) {
            var star = ctx.acceptOp("*");
            var value = star.isPresent()
                        ? bitwiseOr()
                        : item.get();
            var comma = ctx.acceptOp(",");
            elements.add(element(star, value, comma));
            if (comma.isEmpty() || !startsExpression()) {
                break;
            }
        }
        var single = elements.get(0);
        if (elements.size() == 1 && single.comma()
                                          .isEmpty()) {
            if (single instanceof StarredElement) {
                throw ctx.fail("','");
            }
            return single.value();
        }
        return new DeflatedExpression.Tuple(List.copyOf(elements), Parens.create());
    }

    private static Element element(Optional<Token> star, DeflatedExpression value, Optional<Token> comma) {
        return star.isPresent()
               ? new StarredElement(star.get(), value, comma)
               : new SimpleElement(value, comma);
    }

    private boolean startsExpression() {
        var token = ctx.peek();
        return switch (token.type()) {
            case NUMBER, STRING -> true;
            case NAME -> ParsingContext.isIdentifier(token) || EXPRESSION_KEYWORDS.contains(token.text());
            case OP -> EXPRESSION_OPERATORS.contains(token.text());
            default -> false;
        };
    }

    private DeflatedExpression starExpressions() {
        return tupleOf(this::namedExpression);
    }

    /**
     * Assignment and loop targets: no comparisons, so {@code in} stays available to the caller.
     */
    private DeflatedExpression targetList() {
        return tupleOf(this::bitwiseOr);
    }

    private DeflatedExpression namedExpression() {
        if (ctx.atIdentifier() && ctx.peek(1).isOp(":=")) {
            var target = name(ctx.advance());
            var walrus = ctx.advance();
            return new DeflatedExpression.NamedExpr(target, walrus, expression(), Parens.create());
        }
        return expression();
    }

    private DeflatedExpression expression() {
        if (ctx.atKeyword("lambda")) {
            return lambda();
        }
        var body = disjunction();
        if (!ctx.atKeyword("if")) {
            return body;
        }
        var ifToken = ctx.advance();
        var test = disjunction();
        var elseToken = ctx.expectKeyword("else");
        var orelse = expression();
        return new DeflatedExpression.IfExp(body, ifToken, test, elseToken, orelse, Parens.create());
    }

    private DeflatedExpression lambda() {
        var keyword = ctx.advance();
        var params = parameters(false, ":");
        var colon = ctx.expectOp(":");
        return new DeflatedExpression.Lambda(keyword, params, colon, expression(), Parens.create());
    }

    private DeflatedExpression yieldExpression() {
        var keyword = ctx.advance();
        var from = ctx.acceptKeyword("from");
        if (from.isPresent()) {
            return new DeflatedExpression.Yield(keyword, from, Optional.of(expression()), Parens.create());
        }
        var value = startsExpression()
                    ? Optional.of(starExpressions())
                    : Optional.<DeflatedExpression>empty();
        return new DeflatedExpression.Yield(keyword, Optional.empty(), value, Parens.create());
    }

    private DeflatedExpression disjunction() {
        var left = conjunction();
        while (ctx.atKeyword("or")) {
            var operator = ctx.advance();
            left = new DeflatedExpression.BooleanOperation(left, operator, conjunction(), Parens.create());
        }
        return left;
    }

    private DeflatedExpression conjunction() {
        var left = inversion();
        while (ctx.atKeyword("and")) {
            var operator = ctx.advance();
            left = new DeflatedExpression.BooleanOperation(left, operator, inversion(), Parens.create());
        }
        return left;
    }

    private DeflatedExpression inversion() {
        if (ctx.atKeyword("not")) {
            var operator = ctx.advance();
            return new DeflatedExpression.UnaryOperation(operator, inversion(), Parens.create());
        }
        return comparison();
    }

    private DeflatedExpression comparison() {
        var left = bitwiseOr();
        var targets = new ArrayList<ComparisonTarget>();
        while (true) {
            var token = ctx.peek();
            if (token.is(TokenType.OP) && COMPARISON_OPERATORS.contains(token.text())) {
                var operator = ctx.advance();
                targets.add(new ComparisonTarget(operator, Optional.empty(), bitwiseOr()));
            } else if (token.isKeyword("in")) {
                var operator = ctx.advance();
                targets.add(new ComparisonTarget(operator, Optional.empty(), bitwiseOr()));
            } else if (token.isKeyword("not") && ctx.peek(1).isKeyword("in")) {
                var operator = ctx.advance();
                var second = ctx.advance();
                targets.add(new ComparisonTarget(operator, Optional.of(second), bitwiseOr()));
            } else if (token.isKeyword("is")) {
                var operator = ctx.advance();
                var second = ctx.acceptKeyword("not");
                targets.add(new ComparisonTarget(operator, second, bitwiseOr()));
            } else {
                break;
            }
        }
        return targets.isEmpty()
               ? left
               : new DeflatedExpression.Comparison(left, List.copyOf(targets), Parens.create());
    }

    private DeflatedExpression binary(Supplier<DeflatedExpression> operand, Set<String> operators) {
        var left = operand.get();
        while (ctx.at(TokenType.OP) && operators.contains(ctx.peek()
                                                             .text())) {
            var operator = ctx.advance();
            left = new DeflatedExpression.BinaryOperation(left, operator, operand.get(), Parens.create());
        }
        return left;
    }

    private DeflatedExpression bitwiseOr() {
        return binary(this::bitwiseXor, Set.of("|"));
    }

    private DeflatedExpression bitwiseXor() {
        return binary(this::bitwiseAnd, Set.of("^"));
    }

    private DeflatedExpression bitwiseAnd() {
        return binary(this::shift, Set.of("&"));
    }

    private DeflatedExpression shift() {
        return binary(this::sum, Set.of("<<", ">>"));
    }

    private DeflatedExpression sum() {
        return binary(this::term, Set.of("+", "-"));
    }

    private DeflatedExpression term() {
        return binary(this::factor, Set.of("*", "/", "//", "%", "@"));
    }

    private DeflatedExpression factor() {
        if (ctx.atOp("+") || ctx.atOp("-") || ctx.atOp("~")) {
            var operator = ctx.advance();
            return new DeflatedExpression.UnaryOperation(operator, factor(), Parens.create());
        }
        return power();
    }

    private DeflatedExpression power() {
        var base = awaitPrimary();
        if (!ctx.atOp("**")) {
            return base;
        }
        var operator = ctx.advance();
        return new DeflatedExpression.BinaryOperation(base, operator, factor(), Parens.create());
    }

    private DeflatedExpression awaitPrimary() {
        if (ctx.atKeyword("await")) {
            var await = ctx.advance();
            return new DeflatedExpression.Await(await, primary(), Parens.create());
        }
        return primary();
    }

    private DeflatedExpression primary() {
        var value = atom();
        while (true) {
            if (ctx.atOp(".")) {
                var dot = ctx.advance();
                value = new DeflatedExpression.Attribute(value, dot, ctx.expectIdentifier(), Parens.create());
            } else if (ctx.atOp("(")) {
                var open = ctx.advance();
                var args = arguments();
                var close = ctx.expectOp(")");
                value = new DeflatedExpression.Call(value, open, args, close, Parens.create());
            } else if (ctx.atOp("[")) {
                var lbracket = ctx.advance();
                var slices = slices();
                var rbracket = ctx.expectOp("]");
                value = new DeflatedExpression.Subscript(value, lbracket, slices, rbracket, Parens.create());
            } else {
                return value;
            }
        }
    }

    private List<Arg> arguments() {
        var args = new ArrayList<Arg>();
        while (!ctx.atOp(")")) {
            var star = Optional.<Token>empty();
            var keyword = Optional.<Token>empty();
            var equal = Optional.<Token>empty();
            DeflatedExpression value;
            if (ctx.atOp("*") || ctx.atOp("**")) {
                star = Optional.of(ctx.advance());
                value = expression();
            } else if (ctx.atIdentifier() && ctx.peek(1).isOp("=")) {
                keyword = Optional.of(ctx.advance());
                equal = Optional.of(ctx.advance());
                value = expression();
            } else {
                value = namedExpression();
                if (atCompFor()) {
                    value = new DeflatedExpression.GeneratorExp(value, compFor(), Parens.create());
                }
            }
            var comma = ctx.acceptOp(",");
            args.add(new Arg(star, keyword, equal, value, comma));
            if (comma.isEmpty()) {
                break;
            }
        }
        return List.copyOf(args);
    }

    private List<SubscriptElement> slices() {
        var elements = new ArrayList<SubscriptElement>();
        while (true) {
            var item = sliceItem();
            var comma = ctx.acceptOp(",");
            elements.add(new SubscriptElement(item, comma));
            if (comma.isEmpty() || ctx.atOp("]")) {
                return List.copyOf(elements);
            }
        }
    }

    private SliceItem sliceItem() {
        if (ctx.atOp("*")) {
            var star = ctx.advance();
            return new Index(Optional.of(star), bitwiseOr());
        }
        var lower = ctx.atOp(":")
                    ? Optional.<DeflatedExpression>empty()
                    : Optional.of(namedExpression());
        if (!ctx.atOp(":")) {
            return new Index(Optional.empty(), lower.orElseThrow());
        }
        var firstColon = ctx.advance();
        var upper = atSliceEnd()
                    ? Optional.<DeflatedExpression>empty()
                    : Optional.of(expression());
        var secondColon = ctx.acceptOp(":");
        var step = secondColon.isPresent() && !atSliceEnd()
                   ? Optional.of(expression())
                   : Optional.<DeflatedExpression>empty();
        return new Slice(lower, firstColon, upper, secondColon, step);
    }

    private boolean atSliceEnd() {
        return ctx.atOp(":") || ctx.atOp(",") || ctx.atOp("]");
    }

    private DeflatedExpression atom() {
        var token = ctx.peek();
        if (token.is(TokenType.NUMBER)) {
            return new DeflatedExpression.Number(ctx.advance(), Parens.create());
        }
        if (token.is(TokenType.STRING)) {
            return strings();
        }
        if (token.is(TokenType.NAME) && (ctx.atIdentifier() || SINGLETONS.contains(token.text()))) {
            return name(ctx.advance());
        }
        if (token.isOp("(")) {
            return parenthesized();
        }
        if (token.isOp("[")) {
            return listDisplay();
        }
        if (token.isOp("{")) {
            return braces();
        }
        if (token.isOp("...")) {
            return new DeflatedExpression.Ellipsis(ctx.advance(), Parens.create());
        }
        throw ctx.fail("expression");
    }

    /**
     * Adjacent string literals; concatenations nest to the right.
     */
    private DeflatedExpression strings() {
        var parts = new ArrayList<DeflatedExpression>();
        while (ctx.at(TokenType.STRING)) {
            parts.add(new DeflatedExpression.SimpleString(ctx.advance(), Parens.create()));
        }
        var result = parts.get(parts.size() - 1);
        for (int i = parts.size() - 2; i >= 0; i--) {
            result = new DeflatedExpression.ConcatenatedString(parts.get(i), result, Parens.create());
        }
        return result;
    }

    private DeflatedExpression parenthesized() {
        var open = ctx.advance();
        if (ctx.atOp(")")) {
            var empty = new DeflatedExpression.Tuple(List.of(), Parens.create());
            empty.parens()
                 .wrap(open, ctx.advance());
            return empty;
        }
        if (ctx.atKeyword("yield")) {
            var yield = yieldExpression();
            yield.parens()
                 .wrap(open, ctx.expectOp(")"));
            return yield;
        }
        var star = ctx.acceptOp("*");
        var value = star.isPresent()
                    ? bitwiseOr()
                    : namedExpression();
        if (star.isEmpty() && atCompFor()) {
            var generator = new DeflatedExpression.GeneratorExp(value, compFor(), Parens.create());
            generator.parens()
                     .wrap(open, ctx.expectOp(")"));
            return generator;
        }
        if (star.isEmpty() && ctx.atOp(")")) {
            value.parens()
                 .wrap(open, ctx.advance());
            return value;
        }
        var comma = ctx.acceptOp(",");
        if (comma.isEmpty()) {
            throw ctx.fail(star.isPresent() ? "','" : "')'");
        }
        var elements = new ArrayList<Element>();
        elements.add(element(star, value, comma));
        collectElements(elements, ")");
        var tuple = new DeflatedExpression.Tuple(List.copyOf(elements), Parens.create());
        tuple.parens()
             .wrap(open, ctx.expectOp(")"));
        return tuple;
    }

    private void collectElements(List<Element> into, String closer) {
        while (!ctx.atOp(closer)) {
            var star = ctx.acceptOp("*");
            var value = star.isPresent()
                        ? bitwiseOr()
                        : namedExpression();
            var comma = ctx.acceptOp(",");
            into.add(element(star, value, comma));
            if (comma.isEmpty()) {
                return;
            }
        }
    }

    private DeflatedExpression listDisplay() {
        var lbracket = ctx.advance();
        if (ctx.atOp("]")) {
            return new DeflatedExpression.ListDisplay(lbracket, List.of(), ctx.advance(), Parens.create());
        }
        var star = ctx.acceptOp("*");
        var value = star.isPresent()
                    ? bitwiseOr()
                    : namedExpression();
        if (star.isEmpty() && atCompFor()) {
            var forIn = compFor();
            var rbracket = ctx.expectOp("]");
            return new DeflatedExpression.ListComp(lbracket, value, forIn, rbracket, Parens.create());
        }
        var elements = new ArrayList<Element>();
        var comma = ctx.acceptOp(",");
        elements.add(element(star, value, comma));
        if (comma.isPresent()) {
            collectElements(elements, "]");
        }
        var rbracket = ctx.expectOp("]");
        return new DeflatedExpression.ListDisplay(lbracket, List.copyOf(elements), rbracket, Parens.create());
    }

    private DeflatedExpression braces() {
        var lbrace = ctx.advance();
        if (ctx.atOp("}")) {
            return new DeflatedExpression.DictDisplay(lbrace, List.of(), ctx.advance(), Parens.create());
        }
        if (ctx.atOp("**")) {
            var elements = new ArrayList<DictElement>();
            collectDictElements(elements);
            var rbrace = ctx.expectOp("}");
            return new DeflatedExpression.DictDisplay(lbrace, List.copyOf(elements), rbrace, Parens.create());
        }
        var star = ctx.acceptOp("*");
        var first = star.isPresent()
                    ? bitwiseOr()
                    : namedExpression();
        if (star.isEmpty() && ctx.atOp(":")) {
            var colon = ctx.advance();
            var value = expression();
            if (atCompFor()) {
                var forIn = compFor();
                var rbrace = ctx.expectOp("}");
                return new DeflatedExpression.DictComp(lbrace, first, colon, value, forIn, rbrace, Parens.create());
            }
            var elements = new ArrayList<DictElement>();
            var comma = ctx.acceptOp(",");
            elements.add(new KeyValue(first, colon, value, comma));
            if (comma.isPresent()) {
                collectDictElements(elements);
            }
            var rbrace = ctx.expectOp("}");
            return new DeflatedExpression.DictDisplay(lbrace, List.copyOf(elements), rbrace, Parens.create());
        }
        if (star.isEmpty() && atCompFor()) {
            var forIn = compFor();
            var rbrace = ctx.expectOp("}");
            return new DeflatedExpression.SetComp(lbrace, first, forIn, rbrace, Parens.create());
        }
        var elements = new ArrayList<Element>();
        var comma = ctx.acceptOp(",");
        elements.add(element(star, first, comma));
        if (comma.isPresent()) {
            collectElements(elements, "}");
        }
        var rbrace = ctx.expectOp("}");
        return new DeflatedExpression.SetDisplay(lbrace, List.copyOf(elements), rbrace, Parens.create());
    }

    private void collectDictElements(List<DictElement> into) {
        while (!ctx.atOp("}")) {
            Optional<Token> comma;
            if (ctx.atOp("**")) {
                var stars = ctx.advance();
                var value = bitwiseOr();
                comma = ctx.acceptOp(",");
                into.add(new StarredDictElement(stars, value, comma));
            } else {
                var key = expression();
                var colon = ctx.expectOp(":");
                var value = expression();
                comma = ctx.acceptOp(",");
                into.add(new KeyValue(key, colon, value, comma));
            }
            if (comma.isEmpty()) {
                return;
            }
        }
    }

    private boolean atCompFor() {
        return ctx.atKeyword("for") || (ctx.atKeyword("async") && ctx.peek(1).isKeyword("for"));
    }

    private CompFor compFor() {
        var async = ctx.acceptKeyword("async");
        var forToken = ctx.expectKeyword("for");
        var target = targetList();
        var in = ctx.expectKeyword("in");
        var iter = disjunction();
        var ifs = new ArrayList<CompIf>();
        while (ctx.atKeyword("if")) {
            var ifToken = ctx.advance();
            ifs.add(new CompIf(ifToken, disjunction()));
        }
        var inner = atCompFor()
                    ? Optional.of(compFor())
                    : Optional.<CompFor>empty();
        return new CompFor(async, forToken, target, in, iter, List.copyOf(ifs), inner);
    }
}
