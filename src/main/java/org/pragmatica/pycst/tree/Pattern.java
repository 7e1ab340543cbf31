package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.CodegenState;
import org.pragmatica.pycst.tree.PatternPart.KeywordElement;
import org.pragmatica.pycst.tree.PatternPart.MappingElement;
import org.pragmatica.pycst.tree.PatternPart.OrElement;
import org.pragmatica.pycst.tree.PatternPart.SequenceElement;
import org.pragmatica.pycst.tree.PatternPart.SequenceItem;
import org.pragmatica.pycst.tree.Punctuation.Comma;
import org.pragmatica.pycst.tree.Punctuation.LeftCurlyBrace;
import org.pragmatica.pycst.tree.Punctuation.LeftParen;
import org.pragmatica.pycst.tree.Punctuation.LeftSquareBracket;
import org.pragmatica.pycst.tree.Punctuation.RightCurlyBrace;
import org.pragmatica.pycst.tree.Punctuation.RightParen;
import org.pragmatica.pycst.tree.Punctuation.RightSquareBracket;
import org.pragmatica.pycst.visitor.CstVisitor;
import org.pragmatica.pycst.visitor.VisitResult;

import java.util.List;
import java.util.Optional;

/**
 * Patterns of {@code case} clauses. Like expressions, patterns may be grouped in parentheses.
 */
public sealed interface Pattern extends Node {
    List<LeftParen> lpar();

    List<RightParen> rpar();

    /**
     * Literal or dotted-name value pattern.
     */
    record MatchValue(Expression value, List<LeftParen> lpar, List<RightParen> rpar) implements Pattern {
        @Override
        public List<Node> children() {
            return Children.of(value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitMatchValue(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveMatchValue(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> value.codegen(state));
        }
    }

    /**
     * {@code None}, {@code True} or {@code False}.
     */
    record MatchSingleton(Expression.Name value, List<LeftParen> lpar, List<RightParen> rpar) implements Pattern {
        @Override
        public List<Node> children() {
            return Children.of(value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitMatchSingleton(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveMatchSingleton(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> value.codegen(state));
        }
    }

    record MatchList(LeftSquareBracket lbracket,
                     List<SequenceItem> patterns,
                     RightSquareBracket rbracket,
                     List<LeftParen> lpar,
                     List<RightParen> rpar) implements Pattern {
        @Override
        public List<Node> children() {
            return Children.of(patterns);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitMatchList(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveMatchList(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                lbracket.codegen(state);
                Emit.separated(state, patterns);
                rbracket.codegen(state);
            });
        }
    }

    /**
     * Tuple pattern; its parentheses, when present, are part of {@link #lpar()} and {@link #rpar()}.
     */
    record MatchTuple(List<SequenceItem> patterns,
                      List<LeftParen> lpar,
                      List<RightParen> rpar) implements Pattern {
        @Override
        public List<Node> children() {
            return Children.of(patterns);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitMatchTuple(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveMatchTuple(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                Emit.separated(state, patterns);
                if (patterns.size() == 1 && patterns.get(0).comma().isEmpty()) {
                    state.addToken(",");
                }
            });
        }
    }

    /**
     * Mapping pattern with an optional {@code **rest} capture after the key patterns.
     */
    record MatchMapping(LeftCurlyBrace lbrace,
                        List<MappingElement> elements,
                        ParenthesizableWhitespace whitespaceBeforeRest,
                        Optional<Expression.Name> rest,
                        Optional<Comma> trailingComma,
                        RightCurlyBrace rbrace,
                        List<LeftParen> lpar,
                        List<RightParen> rpar) implements Pattern {
        @Override
        public List<Node> children() {
            return Children.of(elements, rest);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitMatchMapping(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveMatchMapping(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                lbrace.codegen(state);
                Emit.separated(state, elements, rest.isPresent());
                if (rest.isPresent()) {
                    state.addToken("**");
                    whitespaceBeforeRest.codegen(state);
                    rest.get()
                        .codegen(state);
                    Emit.optional(state, trailingComma);
                }
                rbrace.codegen(state);
            });
        }
    }

    record MatchClass(Expression cls,
                      ParenthesizableWhitespace whitespaceAfterCls,
                      ParenthesizableWhitespace whitespaceBeforePatterns,
                      List<SequenceElement> patterns,
                      List<KeywordElement> keywords,
                      ParenthesizableWhitespace whitespaceAfterKeywords,
                      List<LeftParen> lpar,
                      List<RightParen> rpar) implements Pattern {
        @Override
        public List<Node> children() {
            return Children.of(cls, patterns, keywords);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitMatchClass(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveMatchClass(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                cls.codegen(state);
                whitespaceAfterCls.codegen(state);
                state.addToken("(");
                whitespaceBeforePatterns.codegen(state);
                Emit.separated(state, patterns, !keywords.isEmpty());
                Emit.separated(state, keywords);
                whitespaceAfterKeywords.codegen(state);
                state.addToken(")");
            });
        }
    }

    /**
     * Capture ({@code name}), wildcard ({@code _}, no pattern and no name) or
     * {@code pattern as name}.
     */
    record MatchAs(Optional<Pattern> pattern,
                   ParenthesizableWhitespace whitespaceBeforeAs,
                   ParenthesizableWhitespace whitespaceAfterAs,
                   Optional<Expression.Name> name,
                   List<LeftParen> lpar,
                   List<RightParen> rpar) implements Pattern {
        public boolean wildcard() {
            return pattern.isEmpty() && name.isEmpty();
        }

        @Override
        public List<Node> children() {
            return Children.of(pattern, name);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitMatchAs(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveMatchAs(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                if (pattern.isPresent()) {
                    pattern.get()
                           .codegen(state);
                    whitespaceBeforeAs.codegen(state);
                    state.addToken("as");
                    whitespaceAfterAs.codegen(state);
                }
                if (name.isPresent()) {
                    name.get()
                        .codegen(state);
                } else {
                    state.addToken("_");
                }
            });
        }
    }

    record MatchOr(List<OrElement> patterns, List<LeftParen> lpar, List<RightParen> rpar) implements Pattern {
        @Override
        public List<Node> children() {
            return Children.of(patterns);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitMatchOr(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveMatchOr(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                for (int i = 0; i < patterns.size(); i++) {
                    var element = patterns.get(i);
                    element.codegen(state);
                    if (element.separator().isEmpty() && i < patterns.size() - 1) {
                        state.addToken(" | ");
                    }
                }
            });
        }
    }
}
