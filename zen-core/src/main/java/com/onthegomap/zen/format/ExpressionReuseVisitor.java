package com.onthegomap.zen.format;

import com.carrotsearch.hppc.LongHashSet;
import com.onthegomap.zen.collection.Hppc;
import com.onthegomap.zen.expression.ApplyExpr;
import com.onthegomap.zen.expression.ArbitraryExpr;
import com.onthegomap.zen.expression.ArithBinopExpr;
import com.onthegomap.zen.expression.ArithComparisonExpr;
import com.onthegomap.zen.expression.BitwiseBinopExpr;
import com.onthegomap.zen.expression.BitwiseNotExpr;
import com.onthegomap.zen.expression.CMapGetExpr;
import com.onthegomap.zen.expression.CMapSetExpr;
import com.onthegomap.zen.expression.CastExpr;
import com.onthegomap.zen.expression.ConstantExpr;
import com.onthegomap.zen.expression.CreateObjectExpr;
import com.onthegomap.zen.expression.DictCombineExpr;
import com.onthegomap.zen.expression.DictDeleteExpr;
import com.onthegomap.zen.expression.DictGetExpr;
import com.onthegomap.zen.expression.DictSetExpr;
import com.onthegomap.zen.expression.EqualityExpr;
import com.onthegomap.zen.expression.FSeqAddFrontExpr;
import com.onthegomap.zen.expression.FSeqCaseExpr;
import com.onthegomap.zen.expression.GetFieldExpr;
import com.onthegomap.zen.expression.IfExpr;
import com.onthegomap.zen.expression.LogicalBinopExpr;
import com.onthegomap.zen.expression.NotExpr;
import com.onthegomap.zen.expression.ParameterExpr;
import com.onthegomap.zen.expression.SeqAtExpr;
import com.onthegomap.zen.expression.SeqConcatExpr;
import com.onthegomap.zen.expression.SeqContainsExpr;
import com.onthegomap.zen.expression.SeqIndexOfExpr;
import com.onthegomap.zen.expression.SeqLengthExpr;
import com.onthegomap.zen.expression.SeqNthExpr;
import com.onthegomap.zen.expression.SeqReplaceFirstExpr;
import com.onthegomap.zen.expression.SeqSliceExpr;
import com.onthegomap.zen.expression.SeqUnitExpr;
import com.onthegomap.zen.expression.WithFieldExpr;
import com.onthegomap.zen.expression.Zen;
import com.onthegomap.zen.expression.ZenExprVisitor;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Finds the subexpressions of an expression graph that are reachable along more than one path.
 * <p>
 * Each distinct node is expanded once: the second time a node is reached it is recorded as reused and its children are
 * not visited again, so the traversal is linear in the number of distinct nodes.
 */
@NotThreadSafe
public class ExpressionReuseVisitor implements ZenExprVisitor<Void, Void> {

  private final LongHashSet seen = Hppc.newLongHashSet();
  private final LongHashSet reused = Hppc.newLongHashSet();

  /** Returns the {@link Zen#id() ids} of nodes in {@code expression} that are reached along more than one path. */
  public LongHashSet getReusedSubExpressions(Zen<?> expression) {
    seen.clear();
    reused.clear();
    visit(expression);
    return new LongHashSet(reused);
  }

  void visit(Zen<?> expression) {
    if (!seen.add(expression.id())) {
      reused.add(expression.id());
      return;
    }
    expression.accept(this, null);
  }

  @Override
  public <T> Void visitConstant(ConstantExpr<T> expression, Void parameter) {
    return null;
  }

  @Override
  public <T> Void visitArbitrary(ArbitraryExpr<T> expression, Void parameter) {
    return null;
  }

  @Override
  public <T> Void visitParameter(ParameterExpr<T> expression, Void parameter) {
    return null;
  }

  @Override
  public Void visitLogicalBinop(LogicalBinopExpr expression, Void parameter) {
    visit(expression.expr1());
    visit(expression.expr2());
    return null;
  }

  @Override
  public Void visitNot(NotExpr expression, Void parameter) {
    visit(expression.expr());
    return null;
  }

  @Override
  public <T> Void visitIf(IfExpr<T> expression, Void parameter) {
    visit(expression.guard());
    visit(expression.thenExpr());
    visit(expression.elseExpr());
    return null;
  }

  @Override
  public <T> Void visitArithBinop(ArithBinopExpr<T> expression, Void parameter) {
    visit(expression.expr1());
    visit(expression.expr2());
    return null;
  }

  @Override
  public <T> Void visitArithComparison(ArithComparisonExpr<T> expression, Void parameter) {
    visit(expression.expr1());
    visit(expression.expr2());
    return null;
  }

  @Override
  public <T> Void visitBitwiseNot(BitwiseNotExpr<T> expression, Void parameter) {
    visit(expression.expr());
    return null;
  }

  @Override
  public <T> Void visitBitwiseBinop(BitwiseBinopExpr<T> expression, Void parameter) {
    visit(expression.expr1());
    visit(expression.expr2());
    return null;
  }

  @Override
  public <T> Void visitEquality(EqualityExpr<T> expression, Void parameter) {
    visit(expression.expr1());
    visit(expression.expr2());
    return null;
  }

  @Override
  public <S, T> Void visitCast(CastExpr<S, T> expression, Void parameter) {
    visit(expression.expr());
    return null;
  }

  @Override
  public <F> Void visitGetField(GetFieldExpr<F> expression, Void parameter) {
    visit(expression.expr());
    return null;
  }

  @Override
  public <F> Void visitWithField(WithFieldExpr<F> expression, Void parameter) {
    visit(expression.expr());
    visit(expression.value());
    return null;
  }

  @Override
  public Void visitCreateObject(CreateObjectExpr expression, Void parameter) {
    for (Zen<?> value : expression.fields().values()) {
      visit(value);
    }
    return null;
  }

  @Override
  public <T> Void visitSeqUnit(SeqUnitExpr<T> expression, Void parameter) {
    visit(expression.value());
    return null;
  }

  @Override
  public <T> Void visitSeqConcat(SeqConcatExpr<T> expression, Void parameter) {
    visit(expression.seq1());
    visit(expression.seq2());
    return null;
  }

  @Override
  public <T> Void visitSeqLength(SeqLengthExpr<T> expression, Void parameter) {
    visit(expression.seq());
    return null;
  }

  @Override
  public <T> Void visitSeqAt(SeqAtExpr<T> expression, Void parameter) {
    visit(expression.seq());
    visit(expression.index());
    return null;
  }

  @Override
  public <T> Void visitSeqNth(SeqNthExpr<T> expression, Void parameter) {
    visit(expression.seq());
    visit(expression.index());
    return null;
  }

  @Override
  public <T> Void visitSeqContains(SeqContainsExpr<T> expression, Void parameter) {
    visit(expression.seq());
    visit(expression.subseq());
    return null;
  }

  @Override
  public <T> Void visitSeqIndexOf(SeqIndexOfExpr<T> expression, Void parameter) {
    visit(expression.seq());
    visit(expression.subseq());
    visit(expression.offset());
    return null;
  }

  @Override
  public <T> Void visitSeqSlice(SeqSliceExpr<T> expression, Void parameter) {
    visit(expression.seq());
    visit(expression.offset());
    visit(expression.length());
    return null;
  }

  @Override
  public <T> Void visitSeqReplaceFirst(SeqReplaceFirstExpr<T> expression, Void parameter) {
    visit(expression.seq());
    visit(expression.match());
    visit(expression.replacement());
    return null;
  }

  @Override
  public <K, V> Void visitDictSet(DictSetExpr<K, V> expression, Void parameter) {
    visit(expression.dict());
    visit(expression.key());
    visit(expression.value());
    return null;
  }

  @Override
  public <K, V> Void visitDictDelete(DictDeleteExpr<K, V> expression, Void parameter) {
    visit(expression.dict());
    visit(expression.key());
    return null;
  }

  @Override
  public <K, V> Void visitDictGet(DictGetExpr<K, V> expression, Void parameter) {
    visit(expression.dict());
    visit(expression.key());
    return null;
  }

  @Override
  public <K> Void visitDictCombine(DictCombineExpr<K> expression, Void parameter) {
    visit(expression.set1());
    visit(expression.set2());
    return null;
  }

  @Override
  public <K, V> Void visitCMapSet(CMapSetExpr<K, V> expression, Void parameter) {
    visit(expression.map());
    visit(expression.value());
    return null;
  }

  @Override
  public <K, V> Void visitCMapGet(CMapGetExpr<K, V> expression, Void parameter) {
    visit(expression.map());
    return null;
  }

  @Override
  public <T> Void visitFSeqAddFront(FSeqAddFrontExpr<T> expression, Void parameter) {
    visit(expression.list());
    visit(expression.element());
    return null;
  }

  @Override
  public <T, U> Void visitFSeqCase(FSeqCaseExpr<T, U> expression, Void parameter) {
    visit(expression.list());
    visit(expression.emptyCase());
    return null;
  }

  @Override
  public <A, B> Void visitApply(ApplyExpr<A, B> expression, Void parameter) {
    visit(expression.lambda().body());
    visit(expression.argument());
    return null;
  }
}
