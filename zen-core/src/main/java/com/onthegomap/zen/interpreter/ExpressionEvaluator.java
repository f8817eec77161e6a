package com.onthegomap.zen.interpreter;

import com.carrotsearch.hppc.LongObjectHashMap;
import com.onthegomap.zen.collection.Hppc;
import com.onthegomap.zen.datatype.Arithmetic;
import com.onthegomap.zen.datatype.CMap;
import com.onthegomap.zen.datatype.Dict;
import com.onthegomap.zen.datatype.FSeq;
import com.onthegomap.zen.datatype.Option;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.datatype.SeqType;
import com.onthegomap.zen.datatype.SetUnit;
import com.onthegomap.zen.datatype.ZenRecord;
import com.onthegomap.zen.datatype.ZenType;
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
import com.onthegomap.zen.symbolic.PathConstraint;
import com.onthegomap.zen.util.ZenException;
import java.math.BigInteger;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Computes the concrete value of an expression under an {@link Environment}.
 * <p>
 * Each node is evaluated at most once per evaluator, so a shared subexpression costs the same as an unshared one.
 * Lambda bodies and list case branches are evaluated by a child evaluator over the environment extended with their
 * parameters. When branch tracking is on, every {@code If} taken records its guard, or the negation of its guard, in
 * {@link #pathConstraint()}. Guards inside lambda bodies and case branches are not recorded.
 */
@NotThreadSafe
public final class ExpressionEvaluator implements ZenExprVisitor<Void, Object> {

  private final Environment environment;
  private final boolean trackBranches;
  private final LongObjectHashMap<Object> cache = Hppc.newLongObjectHashMap();
  private PathConstraint pathConstraint = PathConstraint.empty();

  public ExpressionEvaluator(Environment environment, boolean trackBranches) {
    this.environment = environment;
    this.trackBranches = trackBranches;
  }

  public ExpressionEvaluator(Environment environment) {
    this(environment, false);
  }

  /** Returns the value of {@code expression} with the free variables in {@code environment}. */
  public static <T> T evaluate(Zen<T> expression, Environment environment) {
    return new ExpressionEvaluator(environment).evaluate(expression);
  }

  /** Returns the value of {@code expression}, reusing values already computed by this evaluator. */
  @SuppressWarnings("unchecked")
  public <T> T evaluate(Zen<T> expression) {
    Object result = cache.get(expression.id());
    if (result == null) {
      result = expression.accept(this, null);
      cache.put(expression.id(), result);
    }
    return (T) result;
  }

  /** Returns the conditions of the branches taken so far, empty unless tracking branches. */
  public PathConstraint pathConstraint() {
    return pathConstraint;
  }

  private ExpressionEvaluator child(Environment childEnvironment) {
    return new ExpressionEvaluator(childEnvironment, false);
  }

  @Override
  public <T> Object visitConstant(ConstantExpr<T> expression, Void parameter) {
    return expression.value();
  }

  @Override
  public <T> Object visitArbitrary(ArbitraryExpr<T> expression, Void parameter) {
    return environment.valueOf(expression);
  }

  @Override
  public <T> Object visitParameter(ParameterExpr<T> expression, Void parameter) {
    T value = environment.valueOf(expression);
    if (value == null) {
      throw new ZenException("Parameter " + expression.name() + " is not bound");
    }
    return value;
  }

  @Override
  public Object visitLogicalBinop(LogicalBinopExpr expression, Void parameter) {
    boolean first = evaluate(expression.expr1());
    return switch (expression.op()) {
      case AND -> first && evaluate(expression.expr2());
      case OR -> first || evaluate(expression.expr2());
    };
  }

  @Override
  public Object visitNot(NotExpr expression, Void parameter) {
    boolean value = evaluate(expression.expr());
    return !value;
  }

  @Override
  public <T> Object visitIf(IfExpr<T> expression, Void parameter) {
    boolean guard = evaluate(expression.guard());
    if (trackBranches) {
      pathConstraint = pathConstraint.add(guard ? expression.guard() : Zen.not(expression.guard()));
    }
    return guard ? evaluate(expression.thenExpr()) : evaluate(expression.elseExpr());
  }

  @Override
  public <T> Object visitArithBinop(ArithBinopExpr<T> expression, Void parameter) {
    ZenType<T> type = expression.type();
    T value1 = evaluate(expression.expr1());
    T value2 = evaluate(expression.expr2());
    return switch (expression.op()) {
      case ADD -> Arithmetic.add(type, value1, value2);
      case SUBTRACT -> Arithmetic.subtract(type, value1, value2);
      case MULTIPLY -> Arithmetic.multiply(type, value1, value2);
    };
  }

  @Override
  public <T> Object visitArithComparison(ArithComparisonExpr<T> expression, Void parameter) {
    T value1 = evaluate(expression.expr1());
    T value2 = evaluate(expression.expr2());
    return expression.op().test(Arithmetic.compare(expression.expr1().type(), value1, value2));
  }

  @Override
  public <T> Object visitBitwiseNot(BitwiseNotExpr<T> expression, Void parameter) {
    return Arithmetic.bitNot(expression.type(), evaluate(expression.expr()));
  }

  @Override
  public <T> Object visitBitwiseBinop(BitwiseBinopExpr<T> expression, Void parameter) {
    ZenType<T> type = expression.type();
    T value1 = evaluate(expression.expr1());
    T value2 = evaluate(expression.expr2());
    return switch (expression.op()) {
      case AND -> Arithmetic.bitAnd(type, value1, value2);
      case OR -> Arithmetic.bitOr(type, value1, value2);
      case XOR -> Arithmetic.bitXor(type, value1, value2);
    };
  }

  @Override
  public <T> Object visitEquality(EqualityExpr<T> expression, Void parameter) {
    T value1 = evaluate(expression.expr1());
    T value2 = evaluate(expression.expr2());
    return value1.equals(value2);
  }

  @Override
  public <S, T> Object visitCast(CastExpr<S, T> expression, Void parameter) {
    return CastExpr.convert(expression.expr().type(), expression.type(), evaluate(expression.expr()));
  }

  @Override
  public <F> Object visitGetField(GetFieldExpr<F> expression, Void parameter) {
    ZenRecord record = evaluate(expression.expr());
    return record.get(expression.field());
  }

  @Override
  public <F> Object visitWithField(WithFieldExpr<F> expression, Void parameter) {
    ZenRecord record = evaluate(expression.expr());
    return record.with(expression.field(), evaluate(expression.value()));
  }

  @Override
  public Object visitCreateObject(CreateObjectExpr expression, Void parameter) {
    Map<String, Object> values = new TreeMap<>();
    for (Map.Entry<String, Zen<?>> field : expression.fields().entrySet()) {
      values.put(field.getKey(), evaluate(field.getValue()));
    }
    return ZenRecord.of(expression.recordType(), values);
  }

  @Override
  public <T> Object visitSeqUnit(SeqUnitExpr<T> expression, Void parameter) {
    return Seq.of(evaluate(expression.value()));
  }

  @Override
  public <T> Object visitSeqConcat(SeqConcatExpr<T> expression, Void parameter) {
    Seq<T> seq1 = evaluate(expression.seq1());
    return seq1.concat(evaluate(expression.seq2()));
  }

  @Override
  public <T> Object visitSeqLength(SeqLengthExpr<T> expression, Void parameter) {
    Seq<T> seq = evaluate(expression.seq());
    return BigInteger.valueOf(seq.length());
  }

  @Override
  public <T> Object visitSeqAt(SeqAtExpr<T> expression, Void parameter) {
    Seq<T> seq = evaluate(expression.seq());
    return seq.at(index(expression.index()));
  }

  @Override
  public <T> Object visitSeqNth(SeqNthExpr<T> expression, Void parameter) {
    Seq<T> seq = evaluate(expression.seq());
    ZenType<T> elementType = ((SeqType<T>) expression.seq().type()).elementType();
    return seq.nth(index(expression.index())).orElse(elementType.defaultValue());
  }

  @Override
  public <T> Object visitSeqContains(SeqContainsExpr<T> expression, Void parameter) {
    Seq<T> seq = evaluate(expression.seq());
    return expression.containment().test(seq, evaluate(expression.subseq()));
  }

  @Override
  public <T> Object visitSeqIndexOf(SeqIndexOfExpr<T> expression, Void parameter) {
    Seq<T> seq = evaluate(expression.seq());
    Seq<T> subseq = evaluate(expression.subseq());
    return BigInteger.valueOf(seq.indexOf(subseq, index(expression.offset())));
  }

  @Override
  public <T> Object visitSeqSlice(SeqSliceExpr<T> expression, Void parameter) {
    Seq<T> seq = evaluate(expression.seq());
    return seq.slice(index(expression.offset()), index(expression.length()));
  }

  @Override
  public <T> Object visitSeqReplaceFirst(SeqReplaceFirstExpr<T> expression, Void parameter) {
    Seq<T> seq = evaluate(expression.seq());
    Seq<T> match = evaluate(expression.match());
    return seq.replaceFirst(match, evaluate(expression.replacement()));
  }

  private int index(Zen<BigInteger> index) {
    return Arithmetic.clampToInt(evaluate(index));
  }

  @Override
  public <K, V> Object visitDictSet(DictSetExpr<K, V> expression, Void parameter) {
    Dict<K, V> dict = evaluate(expression.dict());
    K key = evaluate(expression.key());
    return dict.set(key, evaluate(expression.value()));
  }

  @Override
  public <K, V> Object visitDictDelete(DictDeleteExpr<K, V> expression, Void parameter) {
    Dict<K, V> dict = evaluate(expression.dict());
    return dict.delete(evaluate(expression.key()));
  }

  @Override
  public <K, V> Object visitDictGet(DictGetExpr<K, V> expression, Void parameter) {
    Dict<K, V> dict = evaluate(expression.dict());
    K key = evaluate(expression.key());
    ZenType<V> valueType = Option.valueType(expression.type());
    return dict.get(key).map(value -> Option.some(valueType, value)).orElseGet(() -> Option.none(valueType));
  }

  @Override
  public <K> Object visitDictCombine(DictCombineExpr<K> expression, Void parameter) {
    Dict<K, SetUnit> set1 = evaluate(expression.set1());
    Dict<K, SetUnit> set2 = evaluate(expression.set2());
    return expression.op().apply(set1, set2);
  }

  @Override
  public <K, V> Object visitCMapSet(CMapSetExpr<K, V> expression, Void parameter) {
    CMap<K, V> map = evaluate(expression.map());
    return map.set(expression.key(), evaluate(expression.value()));
  }

  @Override
  public <K, V> Object visitCMapGet(CMapGetExpr<K, V> expression, Void parameter) {
    CMap<K, V> map = evaluate(expression.map());
    return map.get(expression.key());
  }

  @Override
  public <T> Object visitFSeqAddFront(FSeqAddFrontExpr<T> expression, Void parameter) {
    FSeq<T> list = evaluate(expression.list());
    return list.addFront(evaluate(expression.element()));
  }

  @Override
  public <T, U> Object visitFSeqCase(FSeqCaseExpr<T, U> expression, Void parameter) {
    FSeq<T> list = evaluate(expression.list());
    if (list.isEmpty()) {
      return evaluate(expression.emptyCase());
    }
    Environment bound = environment
      .bind(expression.head(), list.head())
      .bind(expression.tail(), list.tail());
    return child(bound).evaluate(expression.consCase());
  }

  @Override
  public <A, B> Object visitApply(ApplyExpr<A, B> expression, Void parameter) {
    A argument = evaluate(expression.argument());
    var lambda = expression.lambda();
    return child(environment.bind(lambda.parameter(), argument)).evaluate(lambda.body());
  }

  @Override
  public String toString() {
    return "ExpressionEvaluator[environment=" + environment.size() + " values, cached=" + cache.size() + "]";
  }
}
