package org.pragmatica.pycst.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.pycst.tree.ExpressionPart.Annotation;
import org.pragmatica.pycst.tree.ExpressionPart.Element;
import org.pragmatica.pycst.tree.ExpressionPart.Parameters;
import org.pragmatica.pycst.tree.ExpressionPart.SimpleElement;
import org.pragmatica.pycst.tree.Punctuation.LeftSquareBracket;
import org.pragmatica.pycst.tree.Punctuation.RightSquareBracket;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CodegenDefaultsTest {

    private static final SimpleWhitespace NONE = SimpleWhitespace.EMPTY;

    private static Statement.FunctionDef function(Optional<Annotation> returns, Suite body) {
        return new Statement.FunctionDef(List.of(), List.of(), List.of(), Optional.empty(), SimpleWhitespace.SPACE,
                                         Expression.Name.of("f"), NONE, Optional.empty(), NONE, NONE,
                                         Parameters.EMPTY, returns, NONE, body, Optional.empty());
    }

    private static Suite.IndentedBlock emptyBlock() {
        return new Suite.IndentedBlock(TrailingWhitespace.DEFAULT, Optional.empty(), List.of(), List.of());
    }

    @Test
    void indentedBlock_withoutStatements_emitsPass() {
        assertThat(function(Optional.empty(), emptyBlock()).code()).isEqualTo("def f():\n    pass\n");
    }

    @Test
    void indentedBlock_withRecordedIndent_usesItForPass() {
        var block = new Suite.IndentedBlock(TrailingWhitespace.DEFAULT, Optional.of("\t"), List.of(), List.of());

        assertThat(function(Optional.empty(), block).code()).isEqualTo("def f():\n\tpass\n");
    }

    @Test
    void listElements_withoutCommas_getDefaultSeparator() {
        List<Element> elements = List.of(new SimpleElement(Expression.Name.of("a"), Optional.empty()),
                                         new SimpleElement(Expression.Name.of("b"), Optional.empty()),
                                         new SimpleElement(Expression.Name.of("c"), Optional.empty()));
        var list = new Expression.ListDisplay(new LeftSquareBracket(NONE), elements, new RightSquareBracket(NONE),
                                              List.of(), List.of());

        assertThat(list.code()).isEqualTo("[a, b, c]");
    }

    @Test
    void returnAnnotation_withoutWhitespace_getsSpacesAroundArrow() {
        var returns = new Annotation(Annotation.ARROW, Optional.empty(), Optional.empty(), Expression.Name.of("int"));

        assertThat(returns.code()).isEqualTo(" -> int");
        assertThat(function(Optional.of(returns), emptyBlock()).code()).isEqualTo("def f() -> int:\n    pass\n");
    }

    @Test
    void parameterAnnotation_withoutWhitespace_getsSpaceAfterColon() {
        var annotation = new Annotation(Annotation.COLON, Optional.empty(), Optional.empty(), Expression.Name.of("str"));

        assertThat(annotation.code()).isEqualTo(": str");
    }

    @Test
    void recordedAnnotationWhitespace_isKept() {
        var annotation = new Annotation(Annotation.ARROW, Optional.of(NONE), Optional.of(NONE),
                                        Expression.Name.of("int"));

        assertThat(annotation.code()).isEqualTo("->int");
    }

    @Test
    void smallStatements_withoutSemicolons_getDefaultSeparator() {
        var pass = new SmallStatement.Pass(Optional.empty(), Optional.empty());
        var suite = new Suite.SimpleStatementSuite(SimpleWhitespace.SPACE, List.of(pass, pass),
                                                   TrailingWhitespace.DEFAULT);

        assertThat(suite.code()).isEqualTo(" pass; pass\n");
    }

    @Test
    void simpleSuite_withoutStatements_emitsPass() {
        var suite = new Suite.SimpleStatementSuite(SimpleWhitespace.SPACE, List.of(), TrailingWhitespace.DEFAULT);

        assertThat(suite.code()).isEqualTo(" pass\n");
    }
}
