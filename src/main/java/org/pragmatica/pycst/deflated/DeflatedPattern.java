package org.pragmatica.pycst.deflated;

import org.pragmatica.pycst.inflate.InflateCtx;
import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tree.Expression;
import org.pragmatica.pycst.tree.Pattern;
import org.pragmatica.pycst.tree.PatternPart;
import org.pragmatica.pycst.tree.Punctuation.BitOr;
import org.pragmatica.pycst.tree.Punctuation.LeftCurlyBrace;
import org.pragmatica.pycst.tree.Punctuation.LeftSquareBracket;
import org.pragmatica.pycst.tree.Punctuation.RightCurlyBrace;
import org.pragmatica.pycst.tree.Punctuation.RightSquareBracket;
import org.pragmatica.pycst.tree.SimpleWhitespace;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Patterns of {@code case} clauses as produced by the parser.
 */
public sealed interface DeflatedPattern extends Inflatable<Pattern> {
    String WILDCARD = "_";

    Parens parens();

    private static Optional<Expression.Name> capture(InflateCtx ctx, Token name) {
        return WILDCARD.equals(name.text())
               ? Optional.empty()
               : Optional.of(Claims.name(ctx, name));
    }

    record MatchValue(DeflatedExpression value, Parens parens) implements DeflatedPattern {
        @Override
        public Pattern inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var inflated = value.inflate(ctx);
            return new Pattern.MatchValue(inflated, lpar, parens.inflateRight(ctx));
        }
    }

    record MatchSingleton(Token value, Parens parens) implements DeflatedPattern {
        @Override
        public Pattern inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var inflated = Claims.name(ctx, value);
            return new Pattern.MatchSingleton(inflated, lpar, parens.inflateRight(ctx));
        }
    }

    record MatchList(Token lbracket, List<SequenceItem> patterns, Token rbracket, Parens parens)
        implements DeflatedPattern {
        @Override
        public Pattern inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var open = new LeftSquareBracket(ctx.parenthesizable(lbracket.whitespaceAfter()));
            var items = Claims.all(ctx, patterns);
            var close = new RightSquareBracket(ctx.parenthesizable(rbracket.whitespaceBefore()));
            return new Pattern.MatchList(open, items, close, lpar, parens.inflateRight(ctx));
        }
    }

    record MatchTuple(List<SequenceItem> patterns, Parens parens) implements DeflatedPattern {
        @Override
        public Pattern inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var items = Claims.all(ctx, patterns);
            return new Pattern.MatchTuple(items, lpar, parens.inflateRight(ctx));
        }
    }

    /**
     * @param stars {@code **} token of the rest capture
     * @param trailingComma comma after the rest capture
     */
    record MatchMapping(Token lbrace,
                        List<MappingElement> elements,
                        Optional<Token> stars,
                        Optional<Token> rest,
                        Optional<Token> trailingComma,
                        Token rbrace,
                        Parens parens) implements DeflatedPattern {
        @Override
        public Pattern inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var open = new LeftCurlyBrace(ctx.parenthesizable(lbrace.whitespaceAfter()));
            var inflatedElements = Claims.all(ctx, elements);
            var beforeRest = stars.isPresent()
                             ? ctx.parenthesizable(stars.get()
                                                        .whitespaceAfter())
                             : SimpleWhitespace.EMPTY;
            var inflatedRest = rest.map(token -> Claims.name(ctx, token));
            var comma = Claims.comma(ctx, trailingComma);
            var close = new RightCurlyBrace(ctx.parenthesizable(rbrace.whitespaceBefore()));
            return new Pattern.MatchMapping(open, inflatedElements, beforeRest, inflatedRest, comma, close, lpar,
                                            parens.inflateRight(ctx));
        }
    }

    record MatchClass(DeflatedExpression cls,
                      Token lpar,
                      List<SequenceElement> patterns,
                      List<KeywordElement> keywords,
                      Token rpar,
                      Parens parens) implements DeflatedPattern {
        @Override
        public Pattern inflate(InflateCtx ctx) {
            var outer = parens.inflateLeft(ctx);
            var inflatedCls = cls.inflate(ctx);
            var afterCls = ctx.parenthesizable(lpar.whitespaceBefore());
            var beforePatterns = ctx.parenthesizable(lpar.whitespaceAfter());
            var inflatedPatterns = new ArrayList<PatternPart.SequenceElement>(patterns.size());
            for (var pattern : patterns) {
                inflatedPatterns.add(pattern.inflate(ctx));
            }
            var inflatedKeywords = Claims.all(ctx, keywords);
            var afterKeywords = ctx.parenthesizable(rpar.whitespaceBefore());
            return new Pattern.MatchClass(inflatedCls, afterCls, beforePatterns, List.copyOf(inflatedPatterns),
                                          inflatedKeywords, afterKeywords, outer, parens.inflateRight(ctx));
        }
    }

    /**
     * Capture pattern, wildcard, or {@code pattern as name} when {@code pattern} is present.
     */
    record MatchAs(Optional<DeflatedPattern> pattern, Optional<Token> as, Token name, Parens parens)
        implements DeflatedPattern {
        @Override
        public Pattern inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var inflatedPattern = pattern.map(inner -> inner.inflate(ctx));
            var beforeAs = as.isPresent()
                           ? ctx.parenthesizable(as.get()
                                                   .whitespaceBefore())
                           : SimpleWhitespace.EMPTY;
            var afterAs = as.isPresent()
                          ? ctx.parenthesizable(as.get()
                                                  .whitespaceAfter())
                          : SimpleWhitespace.EMPTY;
            var inflatedName = capture(ctx, name);
            return new Pattern.MatchAs(inflatedPattern, beforeAs, afterAs, inflatedName, lpar,
                                       parens.inflateRight(ctx));
        }
    }

    /**
     * @param bars the {@code |} separators, one fewer than {@code patterns}
     */
    record MatchOr(List<DeflatedPattern> patterns, List<Token> bars, Parens parens) implements DeflatedPattern {
        @Override
        public Pattern inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var elements = new ArrayList<PatternPart.OrElement>(patterns.size());
            for (int i = 0; i < patterns.size(); i++) {
                var inflated = patterns.get(i)
                                       .inflate(ctx);
                var separator = i < bars.size()
                                ? Optional.of(Claims.bitOr(ctx, bars.get(i)))
                                : Optional.<BitOr>empty();
                elements.add(new PatternPart.OrElement(inflated, separator));
            }
            return new Pattern.MatchOr(List.copyOf(elements), lpar, parens.inflateRight(ctx));
        }
    }

    sealed interface SequenceItem extends Inflatable<PatternPart.SequenceItem> {
        Optional<Token> comma();
    }

    record SequenceElement(DeflatedPattern pattern, Optional<Token> comma) implements SequenceItem {
        @Override
        public PatternPart.SequenceElement inflate(InflateCtx ctx) {
            var inflated = pattern.inflate(ctx);
            return new PatternPart.SequenceElement(inflated, Claims.comma(ctx, comma));
        }
    }

    record MatchStar(Token star, Token name, Optional<Token> comma) implements SequenceItem {
        @Override
        public PatternPart.SequenceItem inflate(InflateCtx ctx) {
            var beforeName = ctx.parenthesizable(star.whitespaceAfter());
            var inflatedName = capture(ctx, name);
            return new PatternPart.MatchStar(beforeName, inflatedName, Claims.comma(ctx, comma));
        }
    }

    record MappingElement(DeflatedExpression key, Token colon, DeflatedPattern pattern, Optional<Token> comma)
        implements Inflatable<PatternPart.MappingElement> {
        @Override
        public PatternPart.MappingElement inflate(InflateCtx ctx) {
            var inflatedKey = key.inflate(ctx);
            var beforeColon = ctx.parenthesizable(colon.whitespaceBefore());
            var afterColon = ctx.parenthesizable(colon.whitespaceAfter());
            var inflatedPattern = pattern.inflate(ctx);
            return new PatternPart.MappingElement(inflatedKey, beforeColon, afterColon, inflatedPattern,
                                                  Claims.comma(ctx, comma));
        }
    }

    record KeywordElement(Token key, Token equal, DeflatedPattern pattern, Optional<Token> comma)
        implements Inflatable<PatternPart.KeywordElement> {
        @Override
        public PatternPart.KeywordElement inflate(InflateCtx ctx) {
            var inflatedKey = Claims.name(ctx, key);
            var beforeEqual = ctx.parenthesizable(equal.whitespaceBefore());
            var afterEqual = ctx.parenthesizable(equal.whitespaceAfter());
            var inflatedPattern = pattern.inflate(ctx);
            return new PatternPart.KeywordElement(inflatedKey, beforeEqual, afterEqual, inflatedPattern,
                                                  Claims.comma(ctx, comma));
        }
    }
}
