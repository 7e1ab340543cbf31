package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.CodegenState;
import org.pragmatica.pycst.tree.Operator.CompOperator;
import org.pragmatica.pycst.tree.Punctuation.AssignEqual;
import org.pragmatica.pycst.tree.Punctuation.Asynchronous;
import org.pragmatica.pycst.tree.Punctuation.Colon;
import org.pragmatica.pycst.tree.Punctuation.Comma;
import org.pragmatica.pycst.visitor.CstVisitor;
import org.pragmatica.pycst.visitor.VisitResult;

import java.util.List;
import java.util.Optional;

/**
 * Nodes that only occur inside expressions: arguments, collection elements, slices,
 * comprehension clauses and parameter lists.
 */
public sealed interface ExpressionPart extends Node {

    /**
     * Call argument. {@code star} is {@code ""}, {@code "*"} or {@code "**"}.
     */
    record Arg(String star,
               ParenthesizableWhitespace whitespaceAfterStar,
               Optional<Expression.Name> keyword,
               Optional<AssignEqual> equal,
               Expression value,
               Optional<Comma> comma,
               ParenthesizableWhitespace whitespaceAfterArg) implements ExpressionPart, CommaSeparated {
        @Override
        public List<Node> children() {
            return Children.of(keyword, value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitArg(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveArg(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken(star);
            whitespaceAfterStar.codegen(state);
            Emit.optional(state, keyword);
            Emit.optional(state, equal);
            value.codegen(state);
            Emit.optional(state, comma);
            whitespaceAfterArg.codegen(state);
        }
    }

    /**
     * Element of a tuple, list or set display.
     */
    sealed interface Element extends ExpressionPart, CommaSeparated {
        Expression value();
    }

    record SimpleElement(Expression value, Optional<Comma> comma) implements Element {
        @Override
        public List<Node> children() {
            return Children.of(value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitSimpleElement(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveSimpleElement(this);
        }

        @Override
        public void codegen(CodegenState state) {
            value.codegen(state);
            Emit.optional(state, comma);
        }
    }

    record StarredElement(ParenthesizableWhitespace whitespaceBeforeValue,
                          Expression value,
                          Optional<Comma> comma) implements Element {
        @Override
        public List<Node> children() {
            return Children.of(value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitStarredElement(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveStarredElement(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("*");
            whitespaceBeforeValue.codegen(state);
            value.codegen(state);
            Emit.optional(state, comma);
        }
    }

    sealed interface DictElement extends ExpressionPart, CommaSeparated {}

    record KeyValue(Expression key,
                    ParenthesizableWhitespace whitespaceBeforeColon,
                    ParenthesizableWhitespace whitespaceAfterColon,
                    Expression value,
                    Optional<Comma> comma) implements DictElement {
        @Override
        public List<Node> children() {
            return Children.of(key, value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitKeyValue(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveKeyValue(this);
        }

        @Override
        public void codegen(CodegenState state) {
            key.codegen(state);
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            whitespaceAfterColon.codegen(state);
            value.codegen(state);
            Emit.optional(state, comma);
        }
    }

    record StarredDictElement(ParenthesizableWhitespace whitespaceBeforeValue,
                              Expression value,
                              Optional<Comma> comma) implements DictElement {
        @Override
        public List<Node> children() {
            return Children.of(value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitStarredDictElement(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveStarredDictElement(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("**");
            whitespaceBeforeValue.codegen(state);
            value.codegen(state);
            Emit.optional(state, comma);
        }
    }

    record SubscriptElement(SliceItem slice, Optional<Comma> comma) implements ExpressionPart, CommaSeparated {
        @Override
        public List<Node> children() {
            return Children.of(slice);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitSubscriptElement(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveSubscriptElement(this);
        }

        @Override
        public void codegen(CodegenState state) {
            slice.codegen(state);
            Emit.optional(state, comma);
        }
    }

    sealed interface SliceItem extends ExpressionPart {}

    /**
     * Plain subscript index; {@code star} is {@code "*"} for an unpacked index.
     */
    record Index(String star,
                 ParenthesizableWhitespace whitespaceAfterStar,
                 Expression value) implements SliceItem {
        @Override
        public List<Node> children() {
            return Children.of(value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitIndex(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveIndex(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken(star);
            whitespaceAfterStar.codegen(state);
            value.codegen(state);
        }
    }

    record Slice(Optional<Expression> lower,
                 Colon firstColon,
                 Optional<Expression> upper,
                 Optional<Colon> secondColon,
                 Optional<Expression> step) implements SliceItem {
        @Override
        public List<Node> children() {
            return Children.of(lower, upper, step);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitSlice(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveSlice(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.optional(state, lower);
            firstColon.codegen(state);
            Emit.optional(state, upper);
            Emit.optional(state, secondColon);
            Emit.optional(state, step);
        }
    }

    /**
     * One {@code for ... in ...} clause of a comprehension, chained through {@link #innerForIn()}.
     */
    record CompFor(ParenthesizableWhitespace whitespaceBefore,
                   Optional<Asynchronous> asynchronous,
                   ParenthesizableWhitespace whitespaceAfterFor,
                   Expression target,
                   ParenthesizableWhitespace whitespaceBeforeIn,
                   ParenthesizableWhitespace whitespaceAfterIn,
                   Expression iter,
                   List<CompIf> ifs,
                   Optional<CompFor> innerForIn) implements ExpressionPart {
        @Override
        public List<Node> children() {
            return Children.of(target, iter, ifs, innerForIn);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitCompFor(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveCompFor(this);
        }

        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            Emit.optional(state, asynchronous);
            state.addToken("for");
            whitespaceAfterFor.codegen(state);
            target.codegen(state);
            whitespaceBeforeIn.codegen(state);
            state.addToken("in");
            whitespaceAfterIn.codegen(state);
            iter.codegen(state);
            Emit.all(state, ifs);
            Emit.optional(state, innerForIn);
        }
    }

    record CompIf(ParenthesizableWhitespace whitespaceBefore,
                  ParenthesizableWhitespace whitespaceBeforeTest,
                  Expression test) implements ExpressionPart {
        @Override
        public List<Node> children() {
            return Children.of(test);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitCompIf(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveCompIf(this);
        }

        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken("if");
            whitespaceBeforeTest.codegen(state);
            test.codegen(state);
        }
    }

    record ComparisonTarget(CompOperator operator, Expression comparator) implements ExpressionPart {
        @Override
        public List<Node> children() {
            return Children.of(comparator);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitComparisonTarget(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveComparisonTarget(this);
        }

        @Override
        public void codegen(CodegenState state) {
            operator.codegen(state);
            comparator.codegen(state);
        }
    }

    /**
     * Parameter list of a function or lambda, in source order including the {@code *} and
     * {@code /} markers.
     */
    record Parameters(List<ParameterItem> params) implements ExpressionPart {
        public static final Parameters EMPTY = new Parameters(List.of());

        @Override
        public List<Node> children() {
            return Children.of(params);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitParameters(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveParameters(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.separated(state, params);
        }
    }

    sealed interface ParameterItem extends ExpressionPart, CommaSeparated {}

    /**
     * A named parameter. {@code star} is {@code ""}, {@code "*"} or {@code "**"}.
     */
    record Param(String star,
                 ParenthesizableWhitespace whitespaceAfterStar,
                 Expression.Name name,
                 Optional<Annotation> annotation,
                 Optional<AssignEqual> equal,
                 Optional<Expression> defaultValue,
                 Optional<Comma> comma,
                 ParenthesizableWhitespace whitespaceAfterParam) implements ParameterItem {
        @Override
        public List<Node> children() {
            return Children.of(name, annotation, defaultValue);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitParam(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveParam(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken(star);
            whitespaceAfterStar.codegen(state);
            name.codegen(state);
            Emit.optional(state, annotation);
            Emit.optional(state, equal);
            Emit.optional(state, defaultValue);
            Emit.optional(state, comma);
            whitespaceAfterParam.codegen(state);
        }
    }

    /**
     * Bare {@code *} separating keyword-only parameters.
     */
    record ParamStar(Optional<Comma> comma) implements ParameterItem {
        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitParamStar(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveParamStar(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("*");
            Emit.optional(state, comma);
        }
    }

    /**
     * Positional-only marker {@code /}.
     */
    record ParamSlash(Optional<Comma> comma, ParenthesizableWhitespace whitespaceAfter) implements ParameterItem {
        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitParamSlash(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveParamSlash(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("/");
            Emit.optional(state, comma);
            whitespaceAfter.codegen(state);
        }
    }

    /**
     * Parameter or return annotation. {@code indicator} is {@code ":"} or {@code "->"}; absent
     * whitespace falls back to the conventional spacing for that indicator.
     */
    record Annotation(String indicator,
                      Optional<ParenthesizableWhitespace> whitespaceBeforeIndicator,
                      Optional<ParenthesizableWhitespace> whitespaceAfterIndicator,
                      Expression annotation) implements ExpressionPart {
        public static final String COLON = ":";
        public static final String ARROW = "->";

        @Override
        public List<Node> children() {
            return Children.of(annotation);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitAnnotation(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveAnnotation(this);
        }

        @Override
        public void codegen(CodegenState state) {
            var defaultBefore = ARROW.equals(indicator)
                                ? SimpleWhitespace.SPACE
                                : SimpleWhitespace.EMPTY;
            whitespaceBeforeIndicator.orElse(defaultBefore)
                                     .codegen(state);
            state.addToken(indicator);
            whitespaceAfterIndicator.orElse(SimpleWhitespace.SPACE)
                                    .codegen(state);
            annotation.codegen(state);
        }
    }
}
