package com.onthegomap.zen.format;

import com.carrotsearch.hppc.LongHashSet;
import com.carrotsearch.hppc.LongObjectHashMap;
import com.onthegomap.zen.collection.Hppc;
import com.onthegomap.zen.config.ZenConfig;
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
import com.onthegomap.zen.expression.ZenContext;
import com.onthegomap.zen.expression.ZenExprVisitor;
import com.onthegomap.zen.util.Format;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pretty-prints an expression graph as nested function calls, binding shared subexpressions to {@code let} variables
 * so the output stays proportional to the number of distinct nodes.
 * <p>
 * The output lists one {@code let name: type} line for each free variable sorted by name, then one
 * {@code let e!N = ...} line for each bound subexpression in the order they were bound, then the root expression. A
 * node reached along more than one path is bound the first time it is printed, and any node nested deeper than
 * {@link ZenConfig#formatLetDepth()} is bound to keep lines short. Constants and free variables are always printed in
 * place.
 * <p>
 * A call {@code Name(arg, ...)} is printed on one line when all of its arguments were and it fits within
 * {@link ZenConfig#formatInlineCutoff()} columns, otherwise each argument starts a new line indented one level deeper.
 * Chains of the same associative operator print as a single call.
 */
@NotThreadSafe
public final class ZenFormatVisitor implements ZenExprVisitor<Integer, ZenFormatVisitor.Rendering> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ZenFormatVisitor.class);

  /** Printed form of a subexpression and whether it fits on one line. */
  public record Rendering(String text, boolean inline) {}

  private final int inlineCutoff;
  private final int letDepth;
  private final SortedMap<String, ZenType<?>> variableTypes = new TreeMap<>();
  private final List<String> letDefinitions = new ArrayList<>();
  private final LongObjectHashMap<String> letNames = Hppc.newLongObjectHashMap();
  private LongHashSet reused = Hppc.newLongHashSet();
  private long nextId = 0;

  public ZenFormatVisitor() {
    this(ZenContext.current().config());
  }

  public ZenFormatVisitor(ZenConfig config) {
    this.inlineCutoff = config.formatInlineCutoff();
    this.letDepth = config.formatLetDepth();
  }

  /** Returns {@code expression} pretty-printed. */
  public String format(Zen<?> expression) {
    variableTypes.clear();
    letDefinitions.clear();
    letNames.clear();
    nextId = 0;
    reused = new ExpressionReuseVisitor().getReusedSubExpressions(expression);

    Rendering root = format(expression, 0);
    List<String> lines = new ArrayList<>(variableTypes.size() + letDefinitions.size() + 1);
    variableTypes.forEach((name, type) -> lines.add("let " + name + ": " + type.name()));
    lines.addAll(letDefinitions);
    lines.add(root.text());
    if (LOGGER.isDebugEnabled() && !letDefinitions.isEmpty()) {
      LOGGER.debug("Formatted expression {} with {} shared nodes, {} let bindings and {} free variables",
        expression.id(), reused.size(), letDefinitions.size(), variableTypes.size());
    }
    return String.join("\n", lines);
  }

  private Rendering format(Zen<?> expression, int level) {
    if (reused.contains(expression.id())) {
      String binding = letNames.get(expression.id());
      if (binding != null) {
        return new Rendering(binding, true);
      }
      if (!isBasic(expression)) {
        String variable = createLetBinding(expression);
        letNames.put(expression.id(), variable);
        return new Rendering(variable, true);
      }
    }
    if (level >= letDepth && !isBasic(expression)) {
      return new Rendering(createLetBinding(expression), true);
    }
    return expression.accept(this, level);
  }

  private String createLetBinding(Zen<?> expression) {
    Rendering rendering = expression.accept(this, 0);
    String variable = "e!" + nextId++;
    letDefinitions.add("let " + variable + " = " + rendering.text());
    return variable;
  }

  private static boolean isBasic(Zen<?> expression) {
    return expression instanceof ConstantExpr<?> || expression instanceof ArbitraryExpr<?>;
  }

  private Rendering formatFunction(int level, String name, Rendering... arguments) {
    return formatFunction(level, name, List.of(arguments));
  }

  private Rendering formatFunction(int level, String name, List<Rendering> arguments) {
    String indent = Format.indent(level + 1);
    boolean canInline = true;
    int totalSize = indent.length() + name.length();
    for (Rendering argument : arguments) {
      totalSize += argument.text().length();
      canInline &= argument.inline();
    }
    boolean inline = canInline && totalSize < inlineCutoff;

    StringBuilder result = new StringBuilder(name).append('(');
    for (int i = 0; i < arguments.size(); i++) {
      if (!inline) {
        result.append('\n').append(indent);
      }
      result.append(arguments.get(i).text());
      if (i + 1 < arguments.size()) {
        result.append(inline ? ", " : ",");
      }
    }
    return new Rendering(result.append(')').toString(), inline);
  }

  private Rendering formatChildren(int level, String name, Zen<?>... children) {
    List<Rendering> arguments = new ArrayList<>(children.length);
    for (Zen<?> child : children) {
      arguments.add(format(child, level + 1));
    }
    return formatFunction(level, name, arguments);
  }

  private static Rendering literal(String text) {
    return new Rendering(text, true);
  }

  /**
   * Collects the operands of a chain of nested binary nodes that all match {@code sameOp}: left operands in
   * breadth-first order followed by right operands, innermost first. Shared nodes end the chain so they can be printed
   * as their {@code let} variable.
   */
  private <E extends Zen<?>> List<Zen<?>> flatten(E root, Predicate<Zen<?>> sameOp,
    Function<E, Zen<?>> left, Function<E, Zen<?>> right, Class<E> nodeClass) {
    List<Zen<?>> operands = new ArrayList<>();
    Deque<Zen<?>> rightOperands = new ArrayDeque<>();
    Deque<E> queue = new ArrayDeque<>();
    queue.add(root);
    while (!queue.isEmpty()) {
      E current = queue.poll();
      Zen<?> expr1 = left.apply(current);
      Zen<?> expr2 = right.apply(current);
      if (sameOp.test(expr1) && !reused.contains(expr1.id())) {
        queue.add(nodeClass.cast(expr1));
      } else {
        operands.add(expr1);
      }
      if (sameOp.test(expr2) && !reused.contains(expr2.id())) {
        queue.add(nodeClass.cast(expr2));
      } else {
        rightOperands.push(expr2);
      }
    }
    operands.addAll(rightOperands);
    return operands;
  }

  private Rendering formatAll(int level, String name, List<Zen<?>> operands) {
    return formatChildren(level, name, operands.toArray(Zen<?>[]::new));
  }

  @Override
  public <T> Rendering visitConstant(ConstantExpr<T> expression, Integer level) {
    T value = expression.value();
    if (value instanceof String string) {
      return literal(Format.quote(string));
    } else if (value instanceof Character c) {
      return literal(Format.quote(c.charValue()));
    }
    return literal(value.toString());
  }

  @Override
  public <T> Rendering visitArbitrary(ArbitraryExpr<T> expression, Integer level) {
    variableTypes.put(expression.name(), expression.type());
    return literal(expression.name());
  }

  @Override
  public <T> Rendering visitParameter(ParameterExpr<T> expression, Integer level) {
    return literal("Parameter(" + expression.name() + ")");
  }

  @Override
  public Rendering visitLogicalBinop(LogicalBinopExpr expression, Integer level) {
    var op = expression.op();
    return formatAll(level, op.displayName(), flatten(expression,
      e -> e instanceof LogicalBinopExpr other && other.op() == op,
      LogicalBinopExpr::expr1, LogicalBinopExpr::expr2, LogicalBinopExpr.class));
  }

  @Override
  public Rendering visitNot(NotExpr expression, Integer level) {
    return formatChildren(level, "Not", expression.expr());
  }

  @Override
  public <T> Rendering visitIf(IfExpr<T> expression, Integer level) {
    return formatChildren(level, "If", expression.guard(), expression.thenExpr(), expression.elseExpr());
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> Rendering visitArithBinop(ArithBinopExpr<T> expression, Integer level) {
    var op = expression.op();
    if (!op.isAssociative()) {
      return formatChildren(level, op.displayName(), expression.expr1(), expression.expr2());
    }
    return formatAll(level, op.displayName(), flatten(expression,
      e -> e instanceof ArithBinopExpr<?> other && other.op() == op,
      ArithBinopExpr::expr1, ArithBinopExpr::expr2, (Class<ArithBinopExpr<T>>) (Class<?>) ArithBinopExpr.class));
  }

  @Override
  public <T> Rendering visitArithComparison(ArithComparisonExpr<T> expression, Integer level) {
    return formatChildren(level, expression.op().displayName(), expression.expr1(), expression.expr2());
  }

  @Override
  public <T> Rendering visitBitwiseNot(BitwiseNotExpr<T> expression, Integer level) {
    return formatChildren(level, "BitwiseNot", expression.expr());
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> Rendering visitBitwiseBinop(BitwiseBinopExpr<T> expression, Integer level) {
    var op = expression.op();
    return formatAll(level, op.displayName(), flatten(expression,
      e -> e instanceof BitwiseBinopExpr<?> other && other.op() == op,
      BitwiseBinopExpr::expr1, BitwiseBinopExpr::expr2,
      (Class<BitwiseBinopExpr<T>>) (Class<?>) BitwiseBinopExpr.class));
  }

  @Override
  public <T> Rendering visitEquality(EqualityExpr<T> expression, Integer level) {
    return formatChildren(level, "Equals", expression.expr1(), expression.expr2());
  }

  @Override
  public <S, T> Rendering visitCast(CastExpr<S, T> expression, Integer level) {
    return formatFunction(level, "Cast", format(expression.expr(), level + 1), literal(expression.type().name()));
  }

  @Override
  public <F> Rendering visitGetField(GetFieldExpr<F> expression, Integer level) {
    return formatFunction(level, "GetField", format(expression.expr(), level + 1),
      literal(expression.field().name()));
  }

  @Override
  public <F> Rendering visitWithField(WithFieldExpr<F> expression, Integer level) {
    return formatFunction(level, "WithField", format(expression.expr(), level + 1),
      literal(expression.field().name()), format(expression.value(), level + 1));
  }

  @Override
  public Rendering visitCreateObject(CreateObjectExpr expression, Integer level) {
    List<Rendering> fields = new ArrayList<>();
    for (Map.Entry<String, Zen<?>> field : expression.fields().entrySet()) {
      Rendering value = format(field.getValue(), level + 1);
      fields.add(new Rendering(field.getKey() + "=" + value.text(), value.inline()));
    }
    return formatFunction(level, "new " + expression.type().name(), fields);
  }

  @Override
  public <T> Rendering visitSeqUnit(SeqUnitExpr<T> expression, Integer level) {
    return formatChildren(level, "Unit", expression.value());
  }

  @Override
  public <T> Rendering visitSeqConcat(SeqConcatExpr<T> expression, Integer level) {
    return formatChildren(level, "Concat", expression.seq1(), expression.seq2());
  }

  @Override
  public <T> Rendering visitSeqLength(SeqLengthExpr<T> expression, Integer level) {
    return formatChildren(level, "Length", expression.seq());
  }

  @Override
  public <T> Rendering visitSeqAt(SeqAtExpr<T> expression, Integer level) {
    return formatChildren(level, "At", expression.seq(), expression.index());
  }

  @Override
  public <T> Rendering visitSeqNth(SeqNthExpr<T> expression, Integer level) {
    return formatChildren(level, "Nth", expression.seq(), expression.index());
  }

  @Override
  public <T> Rendering visitSeqContains(SeqContainsExpr<T> expression, Integer level) {
    return formatChildren(level, expression.containment().displayName(), expression.seq(), expression.subseq());
  }

  @Override
  public <T> Rendering visitSeqIndexOf(SeqIndexOfExpr<T> expression, Integer level) {
    return formatChildren(level, "IndexOf", expression.seq(), expression.subseq(), expression.offset());
  }

  @Override
  public <T> Rendering visitSeqSlice(SeqSliceExpr<T> expression, Integer level) {
    return formatChildren(level, "Slice", expression.seq(), expression.offset(), expression.length());
  }

  @Override
  public <T> Rendering visitSeqReplaceFirst(SeqReplaceFirstExpr<T> expression, Integer level) {
    return formatChildren(level, "ReplaceFirst", expression.seq(), expression.match(), expression.replacement());
  }

  @Override
  public <K, V> Rendering visitDictSet(DictSetExpr<K, V> expression, Integer level) {
    return formatChildren(level, "Set", expression.dict(), expression.key(), expression.value());
  }

  @Override
  public <K, V> Rendering visitDictDelete(DictDeleteExpr<K, V> expression, Integer level) {
    return formatChildren(level, "Delete", expression.dict(), expression.key());
  }

  @Override
  public <K, V> Rendering visitDictGet(DictGetExpr<K, V> expression, Integer level) {
    return formatChildren(level, "Get", expression.dict(), expression.key());
  }

  @Override
  public <K> Rendering visitDictCombine(DictCombineExpr<K> expression, Integer level) {
    return formatChildren(level, expression.op().displayName(), expression.set1(), expression.set2());
  }

  @Override
  public <K, V> Rendering visitCMapSet(CMapSetExpr<K, V> expression, Integer level) {
    return formatFunction(level, "CMapSet", format(expression.map(), level + 1), literal(keyLiteral(expression.key())),
      format(expression.value(), level + 1));
  }

  @Override
  public <K, V> Rendering visitCMapGet(CMapGetExpr<K, V> expression, Integer level) {
    return formatFunction(level, "CMapGet", format(expression.map(), level + 1),
      literal(keyLiteral(expression.key())));
  }

  private static String keyLiteral(Object key) {
    return key instanceof String ? Format.quote(key) : String.valueOf(key);
  }

  @Override
  public <T> Rendering visitFSeqAddFront(FSeqAddFrontExpr<T> expression, Integer level) {
    return formatChildren(level, "Cons", expression.element(), expression.list());
  }

  @Override
  public <T, U> Rendering visitFSeqCase(FSeqCaseExpr<T, U> expression, Integer level) {
    return formatFunction(level, "Case", format(expression.list(), level + 1),
      format(expression.emptyCase(), level + 1), literal("<lambda>"));
  }

  @Override
  public <A, B> Rendering visitApply(ApplyExpr<A, B> expression, Integer level) {
    var lambda = expression.lambda();
    Rendering function = formatFunction(level + 1, "Lambda", literal(lambda.parameter().name()),
      format(lambda.body(), level + 2));
    return formatFunction(level, "Apply", function, format(expression.argument(), level + 1));
  }
}
