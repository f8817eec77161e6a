package com.onthegomap.zen.symbolic;

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
import java.util.ArrayList;
import java.util.List;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates the execution paths through an expression as the {@link PathConstraint} that selects each one.
 * <p>
 * Every {@code If} forks on its guard. {@code And(a, b)} is explored as
 * {@code if !a then false else if !b then false else true} and {@code Or(a, b)} as
 * {@code if a then true else if b then true else false}, so short circuiting also splits paths. Other nodes combine the
 * paths of their operands, left to right. The number of paths can grow exponentially with the number of branches.
 */
@NotThreadSafe
public final class PathExplorer implements ZenExprVisitor<PathConstraint, List<PathConstraint>> {

  private static final Logger LOGGER = LoggerFactory.getLogger(PathExplorer.class);

  /** Returns the constraint of every path through {@code expression}. */
  public static List<PathConstraint> explore(Zen<?> expression) {
    List<PathConstraint> paths = new PathExplorer().explore(expression, PathConstraint.empty());
    LOGGER.debug("Found {} paths through expression {}", paths.size(), expression.id());
    return paths;
  }

  private List<PathConstraint> explore(Zen<?> expression, PathConstraint constraint) {
    return expression.accept(this, constraint);
  }

  private static List<PathConstraint> leaf(PathConstraint constraint) {
    return List.of(constraint);
  }

  /** Extends each path in {@code paths} with the paths through {@code next}. */
  private List<PathConstraint> compose(List<PathConstraint> paths, Zen<?> next, PathConstraint constraint) {
    List<PathConstraint> result = new ArrayList<>();
    for (PathConstraint path : paths) {
      result.addAll(explore(next, constraint.union(path)));
    }
    return result;
  }

  private List<PathConstraint> composeAll(PathConstraint constraint, Zen<?>... operands) {
    List<PathConstraint> paths = explore(operands[0], constraint);
    for (int i = 1; i < operands.length; i++) {
      paths = compose(paths, operands[i], constraint);
    }
    return paths;
  }

  private List<PathConstraint> fork(Zen<Boolean> guard, Zen<?> trueExpr, Zen<?> falseExpr,
    PathConstraint constraint) {
    List<PathConstraint> guardPaths = explore(guard, constraint);
    List<PathConstraint> result = new ArrayList<>();
    result.addAll(compose(guardPaths, trueExpr, constraint.add(guard)));
    result.addAll(compose(guardPaths, falseExpr, constraint.add(Zen.not(guard))));
    return result;
  }

  /** Explores {@code if guard1 then case1 else if guard2 then case2 else case3}. */
  private List<PathConstraint> fork2(Zen<Boolean> guard1, Zen<Boolean> guard2, Zen<Boolean> case1,
    Zen<Boolean> case2, Zen<Boolean> case3, PathConstraint constraint) {
    PathConstraint case1Constraint = constraint.add(guard1);
    PathConstraint not1Constraint = constraint.add(Zen.not(guard1));
    PathConstraint case2Constraint = not1Constraint.add(guard2);
    PathConstraint case3Constraint = not1Constraint.add(Zen.not(guard2));

    List<PathConstraint> guard1Paths = explore(guard1, constraint);
    List<PathConstraint> result = new ArrayList<>(compose(guard1Paths, case1, case1Constraint));
    List<PathConstraint> guard2Paths = compose(guard1Paths, guard2, not1Constraint);
    result.addAll(compose(guard2Paths, case2, case2Constraint));
    result.addAll(compose(guard2Paths, case3, case3Constraint));
    return result;
  }

  @Override
  public <T> List<PathConstraint> visitConstant(ConstantExpr<T> expression, PathConstraint parameter) {
    return leaf(parameter);
  }

  @Override
  public <T> List<PathConstraint> visitArbitrary(ArbitraryExpr<T> expression, PathConstraint parameter) {
    return leaf(parameter);
  }

  @Override
  public <T> List<PathConstraint> visitParameter(ParameterExpr<T> expression, PathConstraint parameter) {
    return leaf(parameter);
  }

  @Override
  public List<PathConstraint> visitLogicalBinop(LogicalBinopExpr expression, PathConstraint parameter) {
    var expr1 = expression.expr1();
    var expr2 = expression.expr2();
    return switch (expression.op()) {
      case AND -> fork2(Zen.not(expr1), Zen.not(expr2), Zen.falseExpr(), Zen.falseExpr(), Zen.trueExpr(), parameter);
      case OR -> fork2(expr1, expr2, Zen.trueExpr(), Zen.trueExpr(), Zen.falseExpr(), parameter);
    };
  }

  @Override
  public List<PathConstraint> visitNot(NotExpr expression, PathConstraint parameter) {
    return explore(expression.expr(), parameter);
  }

  @Override
  public <T> List<PathConstraint> visitIf(IfExpr<T> expression, PathConstraint parameter) {
    return fork(expression.guard(), expression.thenExpr(), expression.elseExpr(), parameter);
  }

  @Override
  public <T> List<PathConstraint> visitArithBinop(ArithBinopExpr<T> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.expr1(), expression.expr2());
  }

  @Override
  public <T> List<PathConstraint> visitArithComparison(ArithComparisonExpr<T> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.expr1(), expression.expr2());
  }

  @Override
  public <T> List<PathConstraint> visitBitwiseNot(BitwiseNotExpr<T> expression, PathConstraint parameter) {
    return explore(expression.expr(), parameter);
  }

  @Override
  public <T> List<PathConstraint> visitBitwiseBinop(BitwiseBinopExpr<T> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.expr1(), expression.expr2());
  }

  @Override
  public <T> List<PathConstraint> visitEquality(EqualityExpr<T> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.expr1(), expression.expr2());
  }

  @Override
  public <S, T> List<PathConstraint> visitCast(CastExpr<S, T> expression, PathConstraint parameter) {
    return explore(expression.expr(), parameter);
  }

  @Override
  public <F> List<PathConstraint> visitGetField(GetFieldExpr<F> expression, PathConstraint parameter) {
    return explore(expression.expr(), parameter);
  }

  @Override
  public <F> List<PathConstraint> visitWithField(WithFieldExpr<F> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.expr(), expression.value());
  }

  @Override
  public List<PathConstraint> visitCreateObject(CreateObjectExpr expression, PathConstraint parameter) {
    if (expression.fields().isEmpty()) {
      return leaf(parameter);
    }
    return composeAll(parameter, expression.fields().values().toArray(Zen<?>[]::new));
  }

  @Override
  public <T> List<PathConstraint> visitSeqUnit(SeqUnitExpr<T> expression, PathConstraint parameter) {
    return explore(expression.value(), parameter);
  }

  @Override
  public <T> List<PathConstraint> visitSeqConcat(SeqConcatExpr<T> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.seq1(), expression.seq2());
  }

  @Override
  public <T> List<PathConstraint> visitSeqLength(SeqLengthExpr<T> expression, PathConstraint parameter) {
    return explore(expression.seq(), parameter);
  }

  @Override
  public <T> List<PathConstraint> visitSeqAt(SeqAtExpr<T> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.seq(), expression.index());
  }

  @Override
  public <T> List<PathConstraint> visitSeqNth(SeqNthExpr<T> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.seq(), expression.index());
  }

  @Override
  public <T> List<PathConstraint> visitSeqContains(SeqContainsExpr<T> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.seq(), expression.subseq());
  }

  @Override
  public <T> List<PathConstraint> visitSeqIndexOf(SeqIndexOfExpr<T> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.seq(), expression.subseq(), expression.offset());
  }

  @Override
  public <T> List<PathConstraint> visitSeqSlice(SeqSliceExpr<T> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.seq(), expression.offset(), expression.length());
  }

  @Override
  public <T> List<PathConstraint> visitSeqReplaceFirst(SeqReplaceFirstExpr<T> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.seq(), expression.match(), expression.replacement());
  }

  @Override
  public <K, V> List<PathConstraint> visitDictSet(DictSetExpr<K, V> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.dict(), expression.key(), expression.value());
  }

  @Override
  public <K, V> List<PathConstraint> visitDictDelete(DictDeleteExpr<K, V> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.dict(), expression.key());
  }

  @Override
  public <K, V> List<PathConstraint> visitDictGet(DictGetExpr<K, V> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.dict(), expression.key());
  }

  @Override
  public <K> List<PathConstraint> visitDictCombine(DictCombineExpr<K> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.set1(), expression.set2());
  }

  @Override
  public <K, V> List<PathConstraint> visitCMapSet(CMapSetExpr<K, V> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.map(), expression.value());
  }

  @Override
  public <K, V> List<PathConstraint> visitCMapGet(CMapGetExpr<K, V> expression, PathConstraint parameter) {
    return explore(expression.map(), parameter);
  }

  @Override
  public <T> List<PathConstraint> visitFSeqAddFront(FSeqAddFrontExpr<T> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.list(), expression.element());
  }

  @Override
  public <T, U> List<PathConstraint> visitFSeqCase(FSeqCaseExpr<T, U> expression, PathConstraint parameter) {
    return composeAll(parameter, expression.list(), expression.emptyCase());
  }

  @Override
  public <A, B> List<PathConstraint> visitApply(ApplyExpr<A, B> expression, PathConstraint parameter) {
    return explore(expression.argument(), parameter);
  }
}
