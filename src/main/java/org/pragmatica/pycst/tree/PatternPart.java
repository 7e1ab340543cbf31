package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.CodegenState;
import org.pragmatica.pycst.tree.Punctuation.BitOr;
import org.pragmatica.pycst.tree.Punctuation.Comma;
import org.pragmatica.pycst.visitor.CstVisitor;
import org.pragmatica.pycst.visitor.VisitResult;

import java.util.List;
import java.util.Optional;

/**
 * Elements of composite match patterns.
 */
public sealed interface PatternPart extends Node {

    sealed interface SequenceItem extends PatternPart, CommaSeparated {}

    record SequenceElement(Pattern pattern, Optional<Comma> comma) implements SequenceItem {
        @Override
        public List<Node> children() {
            return Children.of(pattern);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitSequenceElement(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveSequenceElement(this);
        }

        @Override
        public void codegen(CodegenState state) {
            pattern.codegen(state);
            Emit.optional(state, comma);
        }
    }

    /**
     * {@code *name} or {@code *_} inside a sequence pattern.
     */
    record MatchStar(ParenthesizableWhitespace whitespaceBeforeName,
                     Optional<Expression.Name> name,
                     Optional<Comma> comma) implements SequenceItem {
        @Override
        public List<Node> children() {
            return Children.of(name);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitMatchStar(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveMatchStar(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("*");
            whitespaceBeforeName.codegen(state);
            if (name.isPresent()) {
                name.get()
                    .codegen(state);
            } else {
                state.addToken("_");
            }
            Emit.optional(state, comma);
        }
    }

    record MappingElement(Expression key,
                          ParenthesizableWhitespace whitespaceBeforeColon,
                          ParenthesizableWhitespace whitespaceAfterColon,
                          Pattern pattern,
                          Optional<Comma> comma) implements PatternPart, CommaSeparated {
        @Override
        public List<Node> children() {
            return Children.of(key, pattern);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitMappingElement(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveMappingElement(this);
        }

        @Override
        public void codegen(CodegenState state) {
            key.codegen(state);
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            whitespaceAfterColon.codegen(state);
            pattern.codegen(state);
            Emit.optional(state, comma);
        }
    }

    record KeywordElement(Expression.Name key,
                          ParenthesizableWhitespace whitespaceBeforeEqual,
                          ParenthesizableWhitespace whitespaceAfterEqual,
                          Pattern pattern,
                          Optional<Comma> comma) implements PatternPart, CommaSeparated {
        @Override
        public List<Node> children() {
            return Children.of(key, pattern);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitKeywordElement(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveKeywordElement(this);
        }

        @Override
        public void codegen(CodegenState state) {
            key.codegen(state);
            whitespaceBeforeEqual.codegen(state);
            state.addToken("=");
            whitespaceAfterEqual.codegen(state);
            pattern.codegen(state);
            Emit.optional(state, comma);
        }
    }

    record OrElement(Pattern pattern, Optional<BitOr> separator) implements PatternPart {
        @Override
        public List<Node> children() {
            return Children.of(pattern);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitOrElement(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveOrElement(this);
        }

        @Override
        public void codegen(CodegenState state) {
            pattern.codegen(state);
            Emit.optional(state, separator);
        }
    }
}
