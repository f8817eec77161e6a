package com.onthegomap.zen.expression;

/**
 * A traversal over expression nodes that handles every {@link NodeKind}.
 * <p>
 * Nodes call back into the one method for their kind from {@link Zen#accept(ZenExprVisitor, Object)}. Every method is
 * abstract so that adding a node kind is a compile error in each visitor until it handles the new kind.
 *
 * @param <P> auxiliary parameter threaded through the traversal
 * @param <R> result of visiting a node
 */
public interface ZenExprVisitor<P, R> {

  <T> R visitConstant(ConstantExpr<T> expression, P parameter);

  <T> R visitArbitrary(ArbitraryExpr<T> expression, P parameter);

  <T> R visitParameter(ParameterExpr<T> expression, P parameter);

  R visitLogicalBinop(LogicalBinopExpr expression, P parameter);

  R visitNot(NotExpr expression, P parameter);

  <T> R visitIf(IfExpr<T> expression, P parameter);

  <T> R visitArithBinop(ArithBinopExpr<T> expression, P parameter);

  <T> R visitArithComparison(ArithComparisonExpr<T> expression, P parameter);

  <T> R visitBitwiseNot(BitwiseNotExpr<T> expression, P parameter);

  <T> R visitBitwiseBinop(BitwiseBinopExpr<T> expression, P parameter);

  <T> R visitEquality(EqualityExpr<T> expression, P parameter);

  <S, T> R visitCast(CastExpr<S, T> expression, P parameter);

  <F> R visitGetField(GetFieldExpr<F> expression, P parameter);

  <F> R visitWithField(WithFieldExpr<F> expression, P parameter);

  R visitCreateObject(CreateObjectExpr expression, P parameter);

  <T> R visitSeqUnit(SeqUnitExpr<T> expression, P parameter);

  <T> R visitSeqConcat(SeqConcatExpr<T> expression, P parameter);

  <T> R visitSeqLength(SeqLengthExpr<T> expression, P parameter);

  <T> R visitSeqAt(SeqAtExpr<T> expression, P parameter);

  <T> R visitSeqNth(SeqNthExpr<T> expression, P parameter);

  <T> R visitSeqContains(SeqContainsExpr<T> expression, P parameter);

  <T> R visitSeqIndexOf(SeqIndexOfExpr<T> expression, P parameter);

  <T> R visitSeqSlice(SeqSliceExpr<T> expression, P parameter);

  <T> R visitSeqReplaceFirst(SeqReplaceFirstExpr<T> expression, P parameter);

  <K, V> R visitDictSet(DictSetExpr<K, V> expression, P parameter);

  <K, V> R visitDictDelete(DictDeleteExpr<K, V> expression, P parameter);

  <K, V> R visitDictGet(DictGetExpr<K, V> expression, P parameter);

  <K> R visitDictCombine(DictCombineExpr<K> expression, P parameter);

  <K, V> R visitCMapSet(CMapSetExpr<K, V> expression, P parameter);

  <K, V> R visitCMapGet(CMapGetExpr<K, V> expression, P parameter);

  <T> R visitFSeqAddFront(FSeqAddFrontExpr<T> expression, P parameter);

  <T, U> R visitFSeqCase(FSeqCaseExpr<T, U> expression, P parameter);

  <A, B> R visitApply(ApplyExpr<A, B> expression, P parameter);
}
