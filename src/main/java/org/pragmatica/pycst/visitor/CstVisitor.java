package org.pragmatica.pycst.visitor;

import org.pragmatica.pycst.tree.Expression;
import org.pragmatica.pycst.tree.ExpressionPart;
import org.pragmatica.pycst.tree.Module;
import org.pragmatica.pycst.tree.Pattern;
import org.pragmatica.pycst.tree.PatternPart;
import org.pragmatica.pycst.tree.SmallStatement;
import org.pragmatica.pycst.tree.Statement;
import org.pragmatica.pycst.tree.StatementPart;
import org.pragmatica.pycst.tree.Suite;

/**
 * Hooks called by {@link CstWalker} for every node kind. {@code visitX} runs before the children
 * of a node and decides whether to descend; {@code leaveX} runs after them. All hooks default to
 * continuing without doing anything, so implementations override only what they need.
 */
public interface CstVisitor {
    // === Module ===

    default VisitResult visitModule(Module node) {
        return VisitResult.CONTINUE;
    }

    default void leaveModule(Module node) {}

    // === Statement ===

    default VisitResult visitSimpleStatementLine(Statement.SimpleStatementLine node) {
        return VisitResult.CONTINUE;
    }

    default void leaveSimpleStatementLine(Statement.SimpleStatementLine node) {}

    default VisitResult visitFunctionDef(Statement.FunctionDef node) {
        return VisitResult.CONTINUE;
    }

    default void leaveFunctionDef(Statement.FunctionDef node) {}

    default VisitResult visitClassDef(Statement.ClassDef node) {
        return VisitResult.CONTINUE;
    }

    default void leaveClassDef(Statement.ClassDef node) {}

    default VisitResult visitIf(Statement.If node) {
        return VisitResult.CONTINUE;
    }

    default void leaveIf(Statement.If node) {}

    default VisitResult visitFor(Statement.For node) {
        return VisitResult.CONTINUE;
    }

    default void leaveFor(Statement.For node) {}

    default VisitResult visitWhile(Statement.While node) {
        return VisitResult.CONTINUE;
    }

    default void leaveWhile(Statement.While node) {}

    default VisitResult visitTry(Statement.Try node) {
        return VisitResult.CONTINUE;
    }

    default void leaveTry(Statement.Try node) {}

    default VisitResult visitTryStar(Statement.TryStar node) {
        return VisitResult.CONTINUE;
    }

    default void leaveTryStar(Statement.TryStar node) {}

    default VisitResult visitWith(Statement.With node) {
        return VisitResult.CONTINUE;
    }

    default void leaveWith(Statement.With node) {}

    default VisitResult visitMatch(Statement.Match node) {
        return VisitResult.CONTINUE;
    }

    default void leaveMatch(Statement.Match node) {}

    // === Suite ===

    default VisitResult visitIndentedBlock(Suite.IndentedBlock node) {
        return VisitResult.CONTINUE;
    }

    default void leaveIndentedBlock(Suite.IndentedBlock node) {}

    default VisitResult visitSimpleStatementSuite(Suite.SimpleStatementSuite node) {
        return VisitResult.CONTINUE;
    }

    default void leaveSimpleStatementSuite(Suite.SimpleStatementSuite node) {}

    // === SmallStatement ===

    default VisitResult visitPass(SmallStatement.Pass node) {
        return VisitResult.CONTINUE;
    }

    default void leavePass(SmallStatement.Pass node) {}

    default VisitResult visitBreak(SmallStatement.Break node) {
        return VisitResult.CONTINUE;
    }

    default void leaveBreak(SmallStatement.Break node) {}

    default VisitResult visitContinue(SmallStatement.Continue node) {
        return VisitResult.CONTINUE;
    }

    default void leaveContinue(SmallStatement.Continue node) {}

    default VisitResult visitExpr(SmallStatement.Expr node) {
        return VisitResult.CONTINUE;
    }

    default void leaveExpr(SmallStatement.Expr node) {}

    default VisitResult visitReturn(SmallStatement.Return node) {
        return VisitResult.CONTINUE;
    }

    default void leaveReturn(SmallStatement.Return node) {}

    default VisitResult visitAssert(SmallStatement.Assert node) {
        return VisitResult.CONTINUE;
    }

    default void leaveAssert(SmallStatement.Assert node) {}

    default VisitResult visitImport(SmallStatement.Import node) {
        return VisitResult.CONTINUE;
    }

    default void leaveImport(SmallStatement.Import node) {}

    default VisitResult visitImportFrom(SmallStatement.ImportFrom node) {
        return VisitResult.CONTINUE;
    }

    default void leaveImportFrom(SmallStatement.ImportFrom node) {}

    default VisitResult visitAssign(SmallStatement.Assign node) {
        return VisitResult.CONTINUE;
    }

    default void leaveAssign(SmallStatement.Assign node) {}

    default VisitResult visitAnnAssign(SmallStatement.AnnAssign node) {
        return VisitResult.CONTINUE;
    }

    default void leaveAnnAssign(SmallStatement.AnnAssign node) {}

    default VisitResult visitAugAssign(SmallStatement.AugAssign node) {
        return VisitResult.CONTINUE;
    }

    default void leaveAugAssign(SmallStatement.AugAssign node) {}

    default VisitResult visitDel(SmallStatement.Del node) {
        return VisitResult.CONTINUE;
    }

    default void leaveDel(SmallStatement.Del node) {}

    default VisitResult visitGlobal(SmallStatement.Global node) {
        return VisitResult.CONTINUE;
    }

    default void leaveGlobal(SmallStatement.Global node) {}

    default VisitResult visitNonlocal(SmallStatement.Nonlocal node) {
        return VisitResult.CONTINUE;
    }

    default void leaveNonlocal(SmallStatement.Nonlocal node) {}

    default VisitResult visitRaise(SmallStatement.Raise node) {
        return VisitResult.CONTINUE;
    }

    default void leaveRaise(SmallStatement.Raise node) {}

    default VisitResult visitTypeAlias(SmallStatement.TypeAlias node) {
        return VisitResult.CONTINUE;
    }

    default void leaveTypeAlias(SmallStatement.TypeAlias node) {}

    // === StatementPart ===

    default VisitResult visitDecorator(StatementPart.Decorator node) {
        return VisitResult.CONTINUE;
    }

    default void leaveDecorator(StatementPart.Decorator node) {}

    default VisitResult visitAsName(StatementPart.AsName node) {
        return VisitResult.CONTINUE;
    }

    default void leaveAsName(StatementPart.AsName node) {}

    default VisitResult visitImportAlias(StatementPart.ImportAlias node) {
        return VisitResult.CONTINUE;
    }

    default void leaveImportAlias(StatementPart.ImportAlias node) {}

    default VisitResult visitNameItem(StatementPart.NameItem node) {
        return VisitResult.CONTINUE;
    }

    default void leaveNameItem(StatementPart.NameItem node) {}

    default VisitResult visitAssignTarget(StatementPart.AssignTarget node) {
        return VisitResult.CONTINUE;
    }

    default void leaveAssignTarget(StatementPart.AssignTarget node) {}

    default VisitResult visitWithItem(StatementPart.WithItem node) {
        return VisitResult.CONTINUE;
    }

    default void leaveWithItem(StatementPart.WithItem node) {}

    default VisitResult visitExceptHandler(StatementPart.ExceptHandler node) {
        return VisitResult.CONTINUE;
    }

    default void leaveExceptHandler(StatementPart.ExceptHandler node) {}

    default VisitResult visitExceptStarHandler(StatementPart.ExceptStarHandler node) {
        return VisitResult.CONTINUE;
    }

    default void leaveExceptStarHandler(StatementPart.ExceptStarHandler node) {}

    default VisitResult visitElse(StatementPart.Else node) {
        return VisitResult.CONTINUE;
    }

    default void leaveElse(StatementPart.Else node) {}

    default VisitResult visitFinally(StatementPart.Finally node) {
        return VisitResult.CONTINUE;
    }

    default void leaveFinally(StatementPart.Finally node) {}

    default VisitResult visitMatchCase(StatementPart.MatchCase node) {
        return VisitResult.CONTINUE;
    }

    default void leaveMatchCase(StatementPart.MatchCase node) {}

    default VisitResult visitTypeParameters(StatementPart.TypeParameters node) {
        return VisitResult.CONTINUE;
    }

    default void leaveTypeParameters(StatementPart.TypeParameters node) {}

    default VisitResult visitTypeParam(StatementPart.TypeParam node) {
        return VisitResult.CONTINUE;
    }

    default void leaveTypeParam(StatementPart.TypeParam node) {}

    default VisitResult visitTypeVar(StatementPart.TypeVar node) {
        return VisitResult.CONTINUE;
    }

    default void leaveTypeVar(StatementPart.TypeVar node) {}

    default VisitResult visitTypeVarTuple(StatementPart.TypeVarTuple node) {
        return VisitResult.CONTINUE;
    }

    default void leaveTypeVarTuple(StatementPart.TypeVarTuple node) {}

    default VisitResult visitParamSpec(StatementPart.ParamSpec node) {
        return VisitResult.CONTINUE;
    }

    default void leaveParamSpec(StatementPart.ParamSpec node) {}

    // === Expression ===

    default VisitResult visitName(Expression.Name node) {
        return VisitResult.CONTINUE;
    }

    default void leaveName(Expression.Name node) {}

    default VisitResult visitNumber(Expression.Number node) {
        return VisitResult.CONTINUE;
    }

    default void leaveNumber(Expression.Number node) {}

    default VisitResult visitSimpleString(Expression.SimpleString node) {
        return VisitResult.CONTINUE;
    }

    default void leaveSimpleString(Expression.SimpleString node) {}

    default VisitResult visitConcatenatedString(Expression.ConcatenatedString node) {
        return VisitResult.CONTINUE;
    }

    default void leaveConcatenatedString(Expression.ConcatenatedString node) {}

    default VisitResult visitEllipsis(Expression.Ellipsis node) {
        return VisitResult.CONTINUE;
    }

    default void leaveEllipsis(Expression.Ellipsis node) {}

    default VisitResult visitAttribute(Expression.Attribute node) {
        return VisitResult.CONTINUE;
    }

    default void leaveAttribute(Expression.Attribute node) {}

    default VisitResult visitCall(Expression.Call node) {
        return VisitResult.CONTINUE;
    }

    default void leaveCall(Expression.Call node) {}

    default VisitResult visitSubscript(Expression.Subscript node) {
        return VisitResult.CONTINUE;
    }

    default void leaveSubscript(Expression.Subscript node) {}

    default VisitResult visitUnaryOperation(Expression.UnaryOperation node) {
        return VisitResult.CONTINUE;
    }

    default void leaveUnaryOperation(Expression.UnaryOperation node) {}

    default VisitResult visitBinaryOperation(Expression.BinaryOperation node) {
        return VisitResult.CONTINUE;
    }

    default void leaveBinaryOperation(Expression.BinaryOperation node) {}

    default VisitResult visitBooleanOperation(Expression.BooleanOperation node) {
        return VisitResult.CONTINUE;
    }

    default void leaveBooleanOperation(Expression.BooleanOperation node) {}

    default VisitResult visitComparison(Expression.Comparison node) {
        return VisitResult.CONTINUE;
    }

    default void leaveComparison(Expression.Comparison node) {}

    default VisitResult visitIfExp(Expression.IfExp node) {
        return VisitResult.CONTINUE;
    }

    default void leaveIfExp(Expression.IfExp node) {}

    default VisitResult visitLambda(Expression.Lambda node) {
        return VisitResult.CONTINUE;
    }

    default void leaveLambda(Expression.Lambda node) {}

    default VisitResult visitYield(Expression.Yield node) {
        return VisitResult.CONTINUE;
    }

    default void leaveYield(Expression.Yield node) {}

    default VisitResult visitAwait(Expression.Await node) {
        return VisitResult.CONTINUE;
    }

    default void leaveAwait(Expression.Await node) {}

    default VisitResult visitNamedExpr(Expression.NamedExpr node) {
        return VisitResult.CONTINUE;
    }

    default void leaveNamedExpr(Expression.NamedExpr node) {}

    default VisitResult visitTuple(Expression.Tuple node) {
        return VisitResult.CONTINUE;
    }

    default void leaveTuple(Expression.Tuple node) {}

    default VisitResult visitListDisplay(Expression.ListDisplay node) {
        return VisitResult.CONTINUE;
    }

    default void leaveListDisplay(Expression.ListDisplay node) {}

    default VisitResult visitSetDisplay(Expression.SetDisplay node) {
        return VisitResult.CONTINUE;
    }

    default void leaveSetDisplay(Expression.SetDisplay node) {}

    default VisitResult visitDictDisplay(Expression.DictDisplay node) {
        return VisitResult.CONTINUE;
    }

    default void leaveDictDisplay(Expression.DictDisplay node) {}

    default VisitResult visitGeneratorExp(Expression.GeneratorExp node) {
        return VisitResult.CONTINUE;
    }

    default void leaveGeneratorExp(Expression.GeneratorExp node) {}

    default VisitResult visitListComp(Expression.ListComp node) {
        return VisitResult.CONTINUE;
    }

    default void leaveListComp(Expression.ListComp node) {}

    default VisitResult visitSetComp(Expression.SetComp node) {
        return VisitResult.CONTINUE;
    }

    default void leaveSetComp(Expression.SetComp node) {}

    default VisitResult visitDictComp(Expression.DictComp node) {
        return VisitResult.CONTINUE;
    }

    default void leaveDictComp(Expression.DictComp node) {}

    // === ExpressionPart ===

    default VisitResult visitArg(ExpressionPart.Arg node) {
        return VisitResult.CONTINUE;
    }

    default void leaveArg(ExpressionPart.Arg node) {}

    default VisitResult visitSimpleElement(ExpressionPart.SimpleElement node) {
        return VisitResult.CONTINUE;
    }

    default void leaveSimpleElement(ExpressionPart.SimpleElement node) {}

    default VisitResult visitStarredElement(ExpressionPart.StarredElement node) {
        return VisitResult.CONTINUE;
    }

    default void leaveStarredElement(ExpressionPart.StarredElement node) {}

    default VisitResult visitKeyValue(ExpressionPart.KeyValue node) {
        return VisitResult.CONTINUE;
    }

    default void leaveKeyValue(ExpressionPart.KeyValue node) {}

    default VisitResult visitStarredDictElement(ExpressionPart.StarredDictElement node) {
        return VisitResult.CONTINUE;
    }

    default void leaveStarredDictElement(ExpressionPart.StarredDictElement node) {}

    default VisitResult visitSubscriptElement(ExpressionPart.SubscriptElement node) {
        return VisitResult.CONTINUE;
    }

    default void leaveSubscriptElement(ExpressionPart.SubscriptElement node) {}

    default VisitResult visitIndex(ExpressionPart.Index node) {
        return VisitResult.CONTINUE;
    }

    default void leaveIndex(ExpressionPart.Index node) {}

    default VisitResult visitSlice(ExpressionPart.Slice node) {
        return VisitResult.CONTINUE;
    }

    default void leaveSlice(ExpressionPart.Slice node) {}

    default VisitResult visitCompFor(ExpressionPart.CompFor node) {
        return VisitResult.CONTINUE;
    }

    default void leaveCompFor(ExpressionPart.CompFor node) {}

    default VisitResult visitCompIf(ExpressionPart.CompIf node) {
        return VisitResult.CONTINUE;
    }

    default void leaveCompIf(ExpressionPart.CompIf node) {}

    default VisitResult visitComparisonTarget(ExpressionPart.ComparisonTarget node) {
        return VisitResult.CONTINUE;
    }

    default void leaveComparisonTarget(ExpressionPart.ComparisonTarget node) {}

    default VisitResult visitParameters(ExpressionPart.Parameters node) {
        return VisitResult.CONTINUE;
    }

    default void leaveParameters(ExpressionPart.Parameters node) {}

    default VisitResult visitParam(ExpressionPart.Param node) {
        return VisitResult.CONTINUE;
    }

    default void leaveParam(ExpressionPart.Param node) {}

    default VisitResult visitParamStar(ExpressionPart.ParamStar node) {
        return VisitResult.CONTINUE;
    }

    default void leaveParamStar(ExpressionPart.ParamStar node) {}

    default VisitResult visitParamSlash(ExpressionPart.ParamSlash node) {
        return VisitResult.CONTINUE;
    }

    default void leaveParamSlash(ExpressionPart.ParamSlash node) {}

    default VisitResult visitAnnotation(ExpressionPart.Annotation node) {
        return VisitResult.CONTINUE;
    }

    default void leaveAnnotation(ExpressionPart.Annotation node) {}

    // === Pattern ===

    default VisitResult visitMatchValue(Pattern.MatchValue node) {
        return VisitResult.CONTINUE;
    }

    default void leaveMatchValue(Pattern.MatchValue node) {}

    default VisitResult visitMatchSingleton(Pattern.MatchSingleton node) {
        return VisitResult.CONTINUE;
    }

    default void leaveMatchSingleton(Pattern.MatchSingleton node) {}

    default VisitResult visitMatchList(Pattern.MatchList node) {
        return VisitResult.CONTINUE;
    }

    default void leaveMatchList(Pattern.MatchList node) {}

    default VisitResult visitMatchTuple(Pattern.MatchTuple node) {
        return VisitResult.CONTINUE;
    }

    default void leaveMatchTuple(Pattern.MatchTuple node) {}

    default VisitResult visitMatchMapping(Pattern.MatchMapping node) {
        return VisitResult.CONTINUE;
    }

    default void leaveMatchMapping(Pattern.MatchMapping node) {}

    default VisitResult visitMatchClass(Pattern.MatchClass node) {
        return VisitResult.CONTINUE;
    }

    default void leaveMatchClass(Pattern.MatchClass node) {}

    default VisitResult visitMatchAs(Pattern.MatchAs node) {
        return VisitResult.CONTINUE;
    }

    default void leaveMatchAs(Pattern.MatchAs node) {}

    default VisitResult visitMatchOr(Pattern.MatchOr node) {
        return VisitResult.CONTINUE;
    }

    default void leaveMatchOr(Pattern.MatchOr node) {}

    // === PatternPart ===

    default VisitResult visitSequenceElement(PatternPart.SequenceElement node) {
        return VisitResult.CONTINUE;
    }

    default void leaveSequenceElement(PatternPart.SequenceElement node) {}

    default VisitResult visitMatchStar(PatternPart.MatchStar node) {
        return VisitResult.CONTINUE;
    }

    default void leaveMatchStar(PatternPart.MatchStar node) {}

    default VisitResult visitMappingElement(PatternPart.MappingElement node) {
        return VisitResult.CONTINUE;
    }

    default void leaveMappingElement(PatternPart.MappingElement node) {}

    default VisitResult visitKeywordElement(PatternPart.KeywordElement node) {
        return VisitResult.CONTINUE;
    }

    default void leaveKeywordElement(PatternPart.KeywordElement node) {}

    default VisitResult visitOrElement(PatternPart.OrElement node) {
        return VisitResult.CONTINUE;
    }

    default void leaveOrElement(PatternPart.OrElement node) {}
}
