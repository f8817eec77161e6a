package com.onthegomap.zen.expression;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import com.onthegomap.zen.datatype.CMap;
import com.onthegomap.zen.datatype.CMapType;
import com.onthegomap.zen.datatype.Dict;
import com.onthegomap.zen.datatype.DictType;
import com.onthegomap.zen.datatype.FSeq;
import com.onthegomap.zen.datatype.FSeqType;
import com.onthegomap.zen.datatype.Field;
import com.onthegomap.zen.datatype.Option;
import com.onthegomap.zen.datatype.Pair;
import com.onthegomap.zen.datatype.Real;
import com.onthegomap.zen.datatype.RecordType;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.datatype.SeqType;
import com.onthegomap.zen.datatype.SetUnit;
import com.onthegomap.zen.datatype.ZenRecord;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.format.ZenFormatVisitor;
import com.onthegomap.zen.util.Contract;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * An immutable node in a hash-consed expression graph that evaluates to a value of type {@code T}.
 * <p>
 * Nodes are only built through the static factories on this class (or the {@code create} method of each node kind),
 * which simplify the requested expression and intern the result in the {@link ZenContext#current() current context}.
 * Two requests for the same expression in one context return the same instance, so nodes compare by identity and
 * expose {@link #id()} as a cheap key for downstream caches.
 * <p>
 * The set of node kinds is closed: consumers traverse nodes with a {@link ZenExprVisitor} that must handle every
 * {@link NodeKind}.
 *
 * @param <T> the Java class of values this expression evaluates to
 */
public abstract sealed class Zen<T> permits ConstantExpr, ArbitraryExpr, ParameterExpr, LogicalBinopExpr, NotExpr,
  IfExpr, ArithBinopExpr, ArithComparisonExpr, BitwiseNotExpr, BitwiseBinopExpr, EqualityExpr, CastExpr, GetFieldExpr,
  WithFieldExpr, CreateObjectExpr, SeqUnitExpr, SeqConcatExpr, SeqLengthExpr, SeqAtExpr, SeqNthExpr, SeqContainsExpr,
  SeqIndexOfExpr, SeqSliceExpr, SeqReplaceFirstExpr, DictSetExpr, DictDeleteExpr, DictGetExpr, DictCombineExpr,
  CMapSetExpr, CMapGetExpr, FSeqAddFrontExpr, FSeqCaseExpr, ApplyExpr {

  private static final AtomicLong NEXT_ID = new AtomicLong();

  private final long id;
  private final ZenType<T> type;

  Zen(ZenType<T> type) {
    this.id = NEXT_ID.incrementAndGet();
    this.type = Contract.assertNotNull(type);
  }

  /** Returns the process-wide unique identity of this node, assigned once at construction. */
  public final long id() {
    return id;
  }

  /** Returns the type of value this expression evaluates to. */
  public final ZenType<T> type() {
    return type;
  }

  public abstract NodeKind kind();

  /** Dispatches to the {@code visitor} method for this node's kind. */
  public abstract <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter);

  /** Returns this expression pretty-printed with shared subexpressions bound to {@code let} variables. */
  public String format() {
    return new ZenFormatVisitor().format(this);
  }

  @Override
  public String toString() {
    return format();
  }

  @Override
  public final boolean equals(Object obj) {
    return this == obj;
  }

  @Override
  public final int hashCode() {
    return Long.hashCode(id);
  }

  /* Constants and variables */

  public static Zen<Boolean> trueExpr() {
    return ConstantExpr.TRUE;
  }

  public static Zen<Boolean> falseExpr() {
    return ConstantExpr.FALSE;
  }

  public static Zen<Boolean> constant(boolean value) {
    return value ? ConstantExpr.TRUE : ConstantExpr.FALSE;
  }

  public static Zen<Byte> constant(byte value) {
    return ConstantExpr.create(ZenType.BYTE, value);
  }

  public static Zen<Short> constant(short value) {
    return ConstantExpr.create(ZenType.SHORT, value);
  }

  public static Zen<Integer> constant(int value) {
    return ConstantExpr.create(ZenType.INT, value);
  }

  public static Zen<Long> constant(long value) {
    return ConstantExpr.create(ZenType.LONG, value);
  }

  public static Zen<Character> constant(char value) {
    return ConstantExpr.create(ZenType.CHAR, value);
  }

  public static Zen<UnsignedInteger> constant(UnsignedInteger value) {
    return ConstantExpr.create(ZenType.UINT, value);
  }

  public static Zen<UnsignedLong> constant(UnsignedLong value) {
    return ConstantExpr.create(ZenType.ULONG, value);
  }

  public static Zen<BigInteger> constant(BigInteger value) {
    return ConstantExpr.create(ZenType.BIGINT, value);
  }

  public static Zen<Real> constant(Real value) {
    return ConstantExpr.create(ZenType.REAL, value);
  }

  public static Zen<String> constant(String value) {
    return ConstantExpr.create(ZenType.STRING, value);
  }

  public static <T> Zen<T> constant(ZenType<T> type, T value) {
    return ConstantExpr.create(type, value);
  }

  /** Returns a new free symbolic variable of {@code type} named {@code name}. */
  public static <T> Zen<T> arbitrary(ZenType<T> type, String name) {
    return ArbitraryExpr.create(type, name);
  }

  /** Returns a new free symbolic variable of {@code type} with a generated name. */
  public static <T> Zen<T> arbitrary(ZenType<T> type) {
    return ArbitraryExpr.create(type);
  }

  /* Boolean logic */

  public static Zen<Boolean> and(Zen<Boolean> expr1, Zen<Boolean> expr2) {
    return LogicalBinopExpr.create(expr1, expr2, LogicalBinopExpr.Op.AND);
  }

  @SafeVarargs
  public static Zen<Boolean> and(Zen<Boolean>... exprs) {
    return and(List.of(exprs));
  }

  /** Returns the conjunction of {@code exprs}, or {@code true} if empty. */
  public static Zen<Boolean> and(List<Zen<Boolean>> exprs) {
    Zen<Boolean> result = trueExpr();
    for (int i = exprs.size() - 1; i >= 0; i--) {
      result = and(exprs.get(i), result);
    }
    return result;
  }

  public static Zen<Boolean> or(Zen<Boolean> expr1, Zen<Boolean> expr2) {
    return LogicalBinopExpr.create(expr1, expr2, LogicalBinopExpr.Op.OR);
  }

  @SafeVarargs
  public static Zen<Boolean> or(Zen<Boolean>... exprs) {
    return or(List.of(exprs));
  }

  /** Returns the disjunction of {@code exprs}, or {@code false} if empty. */
  public static Zen<Boolean> or(List<Zen<Boolean>> exprs) {
    Zen<Boolean> result = falseExpr();
    for (int i = exprs.size() - 1; i >= 0; i--) {
      result = or(exprs.get(i), result);
    }
    return result;
  }

  public static Zen<Boolean> not(Zen<Boolean> expr) {
    return NotExpr.create(expr);
  }

  public static Zen<Boolean> implies(Zen<Boolean> expr1, Zen<Boolean> expr2) {
    return or(not(expr1), expr2);
  }

  public static <T> Zen<T> ifThenElse(Zen<Boolean> guard, Zen<T> trueExpr, Zen<T> falseExpr) {
    return IfExpr.create(guard, trueExpr, falseExpr);
  }

  /* Arithmetic, comparison and bitwise operations */

  public static <T> Zen<T> plus(Zen<T> expr1, Zen<T> expr2) {
    return ArithBinopExpr.create(expr1, expr2, ArithBinopExpr.Op.ADD);
  }

  public static <T> Zen<T> minus(Zen<T> expr1, Zen<T> expr2) {
    return ArithBinopExpr.create(expr1, expr2, ArithBinopExpr.Op.SUBTRACT);
  }

  public static <T> Zen<T> multiply(Zen<T> expr1, Zen<T> expr2) {
    return ArithBinopExpr.create(expr1, expr2, ArithBinopExpr.Op.MULTIPLY);
  }

  public static <T> Zen<Boolean> geq(Zen<T> expr1, Zen<T> expr2) {
    return ArithComparisonExpr.create(expr1, expr2, ArithComparisonExpr.Op.GEQ);
  }

  public static <T> Zen<Boolean> leq(Zen<T> expr1, Zen<T> expr2) {
    return ArithComparisonExpr.create(expr1, expr2, ArithComparisonExpr.Op.LEQ);
  }

  public static <T> Zen<Boolean> gt(Zen<T> expr1, Zen<T> expr2) {
    return ArithComparisonExpr.create(expr1, expr2, ArithComparisonExpr.Op.GT);
  }

  public static <T> Zen<Boolean> lt(Zen<T> expr1, Zen<T> expr2) {
    return ArithComparisonExpr.create(expr1, expr2, ArithComparisonExpr.Op.LT);
  }

  public static <T> Zen<T> max(Zen<T> expr1, Zen<T> expr2) {
    return ifThenElse(geq(expr1, expr2), expr1, expr2);
  }

  public static <T> Zen<T> min(Zen<T> expr1, Zen<T> expr2) {
    return ifThenElse(leq(expr1, expr2), expr1, expr2);
  }

  public static <T> Zen<T> bitNot(Zen<T> expr) {
    return BitwiseNotExpr.create(expr);
  }

  public static <T> Zen<T> bitAnd(Zen<T> expr1, Zen<T> expr2) {
    return BitwiseBinopExpr.create(expr1, expr2, BitwiseBinopExpr.Op.AND);
  }

  public static <T> Zen<T> bitOr(Zen<T> expr1, Zen<T> expr2) {
    return BitwiseBinopExpr.create(expr1, expr2, BitwiseBinopExpr.Op.OR);
  }

  public static <T> Zen<T> bitXor(Zen<T> expr1, Zen<T> expr2) {
    return BitwiseBinopExpr.create(expr1, expr2, BitwiseBinopExpr.Op.XOR);
  }

  public static <T> Zen<Boolean> eq(Zen<T> expr1, Zen<T> expr2) {
    return EqualityExpr.create(expr1, expr2);
  }

  public static <T> Zen<Boolean> neq(Zen<T> expr1, Zen<T> expr2) {
    return not(eq(expr1, expr2));
  }

  public static <S, T> Zen<T> cast(Zen<S> expr, ZenType<T> targetType) {
    return CastExpr.create(expr, targetType);
  }

  /* Records */

  public static <F> Zen<F> getField(Zen<ZenRecord> expr, Field<F> field) {
    return GetFieldExpr.create(expr, field);
  }

  public static <F> Zen<ZenRecord> withField(Zen<ZenRecord> expr, Field<F> field, Zen<F> value) {
    return WithFieldExpr.create(expr, field, value);
  }

  /** Returns a new record of {@code type} whose fields are initialized from {@code fields}. */
  public static Zen<ZenRecord> create(RecordType type, Map<String, ? extends Zen<?>> fields) {
    return CreateObjectExpr.create(type, fields);
  }

  public static <T> Zen<ZenRecord> some(Zen<T> value) {
    return create(Option.type(value.type()), Map.of(Option.HAS_VALUE, trueExpr(), Option.VALUE, value));
  }

  public static <T> Zen<ZenRecord> none(ZenType<T> valueType) {
    return create(Option.type(valueType),
      Map.of(Option.HAS_VALUE, falseExpr(), Option.VALUE, constant(valueType, valueType.defaultValue())));
  }

  public static Zen<Boolean> hasValue(Zen<ZenRecord> option) {
    assertOption(option);
    return getField(option, Option.HAS_VALUE_FIELD);
  }

  public static <T> Zen<T> optionValue(Zen<ZenRecord> option, ZenType<T> valueType) {
    assertOption(option);
    return getField(option, Option.valueField(valueType));
  }

  private static void assertOption(Zen<ZenRecord> option) {
    Contract.assertTrue(Option.isOptionType(option.type()), "Type %s is not an option", option.type());
  }

  /** Returns the value held by {@code option}, or {@code defaultValue} if it is empty. */
  public static <T> Zen<T> valueOrDefault(Zen<ZenRecord> option, Zen<T> defaultValue) {
    return ifThenElse(hasValue(option), optionValue(option, defaultValue.type()), defaultValue);
  }

  public static <A, B> Zen<ZenRecord> pair(Zen<A> item1, Zen<B> item2) {
    return create(Pair.type(item1.type(), item2.type()), Map.of(Pair.ITEM1, item1, Pair.ITEM2, item2));
  }

  /* Sequences */

  public static <T> Zen<Seq<T>> seqEmpty(ZenType<T> elementType) {
    return constant(ZenType.seq(elementType), Seq.empty());
  }

  public static <T> Zen<Seq<T>> seqUnit(Zen<T> value) {
    return SeqUnitExpr.create(value);
  }

  public static <T> Zen<Seq<T>> concat(Zen<Seq<T>> seq1, Zen<Seq<T>> seq2) {
    return SeqConcatExpr.create(seq1, seq2);
  }

  public static <T> Zen<Seq<T>> seqAdd(Zen<Seq<T>> seq, Zen<T> value) {
    return concat(seq, seqUnit(value));
  }

  public static <T> Zen<BigInteger> length(Zen<Seq<T>> seq) {
    return SeqLengthExpr.create(seq);
  }

  public static <T> Zen<Boolean> isEmpty(Zen<Seq<T>> seq) {
    return eq(length(seq), constant(BigInteger.ZERO));
  }

  public static <T> Zen<Seq<T>> at(Zen<Seq<T>> seq, Zen<BigInteger> index) {
    return SeqAtExpr.create(seq, index);
  }

  public static <T> Zen<T> nth(Zen<Seq<T>> seq, Zen<BigInteger> index) {
    return SeqNthExpr.create(seq, index);
  }

  public static <T> Zen<Boolean> contains(Zen<Seq<T>> seq, Zen<Seq<T>> subseq) {
    return SeqContainsExpr.create(seq, subseq, SeqContainsExpr.Containment.CONTAINS);
  }

  public static <T> Zen<Boolean> startsWith(Zen<Seq<T>> seq, Zen<Seq<T>> prefix) {
    return SeqContainsExpr.create(seq, prefix, SeqContainsExpr.Containment.HAS_PREFIX);
  }

  public static <T> Zen<Boolean> endsWith(Zen<Seq<T>> seq, Zen<Seq<T>> suffix) {
    return SeqContainsExpr.create(seq, suffix, SeqContainsExpr.Containment.HAS_SUFFIX);
  }

  public static <T> Zen<BigInteger> indexOf(Zen<Seq<T>> seq, Zen<Seq<T>> subseq) {
    return indexOf(seq, subseq, constant(BigInteger.ZERO));
  }

  public static <T> Zen<BigInteger> indexOf(Zen<Seq<T>> seq, Zen<Seq<T>> subseq, Zen<BigInteger> offset) {
    return SeqIndexOfExpr.create(seq, subseq, offset);
  }

  public static <T> Zen<Seq<T>> slice(Zen<Seq<T>> seq, Zen<BigInteger> offset, Zen<BigInteger> length) {
    return SeqSliceExpr.create(seq, offset, length);
  }

  public static <T> Zen<Seq<T>> replaceFirst(Zen<Seq<T>> seq, Zen<Seq<T>> match, Zen<Seq<T>> replacement) {
    return SeqReplaceFirstExpr.create(seq, match, replacement);
  }

  /* Dictionaries and sets */

  public static <K, V> Zen<Dict<K, V>> dictEmpty(DictType<K, V> type) {
    return constant(type, Dict.empty());
  }

  public static <K, V> Zen<Dict<K, V>> dictSet(Zen<Dict<K, V>> dict, Zen<K> key, Zen<V> value) {
    return DictSetExpr.create(dict, key, value);
  }

  public static <K, V> Zen<Dict<K, V>> dictDelete(Zen<Dict<K, V>> dict, Zen<K> key) {
    return DictDeleteExpr.create(dict, key);
  }

  /** Returns an {@link Option} of the value for {@code key}. */
  public static <K, V> Zen<ZenRecord> dictGet(Zen<Dict<K, V>> dict, Zen<K> key) {
    return DictGetExpr.create(dict, key);
  }

  public static <K> Zen<Dict<K, SetUnit>> setEmpty(ZenType<K> keyType) {
    return dictEmpty(ZenType.set(keyType));
  }

  public static <K> Zen<Dict<K, SetUnit>> setAdd(Zen<Dict<K, SetUnit>> set, Zen<K> key) {
    return dictSet(set, key, constant(ZenType.UNIT, SetUnit.UNIT));
  }

  public static <K> Zen<Boolean> setContains(Zen<Dict<K, SetUnit>> set, Zen<K> key) {
    return hasValue(dictGet(set, key));
  }

  public static <K> Zen<Dict<K, SetUnit>> union(Zen<Dict<K, SetUnit>> set1, Zen<Dict<K, SetUnit>> set2) {
    return DictCombineExpr.create(set1, set2, DictCombineExpr.Op.UNION);
  }

  public static <K> Zen<Dict<K, SetUnit>> intersect(Zen<Dict<K, SetUnit>> set1, Zen<Dict<K, SetUnit>> set2) {
    return DictCombineExpr.create(set1, set2, DictCombineExpr.Op.INTERSECT);
  }

  public static <K> Zen<Dict<K, SetUnit>> difference(Zen<Dict<K, SetUnit>> set1, Zen<Dict<K, SetUnit>> set2) {
    return DictCombineExpr.create(set1, set2, DictCombineExpr.Op.DIFFERENCE);
  }

  /* Constant-keyed maps */

  public static <K, V> Zen<CMap<K, V>> cmapEmpty(CMapType<K, V> type) {
    return constant(type, type.defaultValue());
  }

  public static <K, V> Zen<CMap<K, V>> cmapSet(Zen<CMap<K, V>> map, K key, Zen<V> value) {
    return CMapSetExpr.create(map, key, value);
  }

  public static <K, V> Zen<V> cmapGet(Zen<CMap<K, V>> map, K key) {
    return CMapGetExpr.create(map, key);
  }

  /* Front-built lists */

  public static <T> Zen<FSeq<T>> fseqEmpty(ZenType<T> elementType) {
    return constant(ZenType.fseq(elementType), FSeq.empty());
  }

  public static <T> Zen<FSeq<T>> addFront(Zen<FSeq<T>> list, Zen<T> element) {
    return FSeqAddFrontExpr.create(list, element);
  }

  /**
   * Returns {@code empty} if {@code list} is empty, otherwise {@code cons} applied to the head and tail of
   * {@code list}.
   */
  public static <T, R> Zen<R> caseOf(Zen<FSeq<T>> list, Zen<R> empty,
    BiFunction<Zen<T>, Zen<FSeq<T>>, Zen<R>> cons) {
    return FSeqCaseExpr.create(list, empty, cons);
  }

  /* Functions */

  public static <A, R> ZenLambda<A, R> lambda(ZenType<A> argumentType, Function<Zen<A>, Zen<R>> function) {
    return ZenLambda.of(argumentType, function);
  }

  public static <A, R> Zen<R> apply(ZenLambda<A, R> lambda, Zen<A> argument) {
    return ApplyExpr.create(lambda, argument);
  }

  static <T> SeqType<T> seqType(Zen<Seq<T>> seq) {
    return (SeqType<T>) seq.type();
  }

  static <T> FSeqType<T> fseqType(Zen<FSeq<T>> list) {
    return (FSeqType<T>) list.type();
  }

  static <K, V> DictType<K, V> dictType(Zen<Dict<K, V>> dict) {
    return (DictType<K, V>) dict.type();
  }

  static <K, V> CMapType<K, V> cmapType(Zen<CMap<K, V>> map) {
    return (CMapType<K, V>) map.type();
  }
}
