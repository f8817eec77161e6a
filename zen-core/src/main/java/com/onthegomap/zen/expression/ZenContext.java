package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.config.Arguments;
import com.onthegomap.zen.config.ZenConfig;
import com.onthegomap.zen.util.Contract;
import com.onthegomap.zen.util.LogUtil;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the intern tables that make expression construction canonical, one table per {@link NodeKind}, and the
 * {@link ZenConfig} that construction and formatting read.
 * <p>
 * Factories build into {@link #current()}: the process-wide {@link #global()} context unless the calling thread is
 * inside {@link #call(Supplier)} or {@link #run(Runnable)} of another context. A scoped context and every node built in
 * it can be dropped once the caller is done with it. Nodes from different contexts must not be combined into one
 * expression since equal nodes are only guaranteed to be the same instance within one context.
 */
@ThreadSafe
public final class ZenContext {

  private static final Logger LOGGER = LoggerFactory.getLogger(ZenContext.class);
  private static final ThreadLocal<ZenContext> CURRENT = new ThreadLocal<>();
  private static final ZenContext GLOBAL =
    new ZenContext("global", ZenConfig.from(Arguments.fromJvmPropertiesOrEnvironment()));

  private final String name;
  private final ZenConfig config;
  private final Map<NodeKind, Flyweight<?, ?>> tables = new EnumMap<>(NodeKind.class);

  private ZenContext(String name, ZenConfig config) {
    this.name = name;
    this.config = config;
    for (NodeKind kind : NodeKind.values()) {
      tables.put(kind, new Flyweight<>());
    }
    ConstantExpr.seed(table(NodeKind.CONSTANT));
    LOGGER.debug("Created context {} preserveBranches={} inlineCutoff={} letDepth={}", name,
      config.preserveBranches(), config.formatInlineCutoff(), config.formatLetDepth());
  }

  /** Returns a new context with its own empty intern tables. */
  public static ZenContext create(String name, ZenConfig config) {
    return new ZenContext(Contract.assertNotNull(name), Contract.assertNotNull(config));
  }

  public static ZenContext create(String name) {
    return create(name, ZenConfig.defaults());
  }

  /** Returns the process-wide context, configured from {@code zen.*} JVM properties or {@code ZEN_*} variables. */
  public static ZenContext global() {
    return GLOBAL;
  }

  /** Returns the context that expression factories on this thread build into. */
  public static ZenContext current() {
    ZenContext context = CURRENT.get();
    return context == null ? GLOBAL : context;
  }

  /** Runs {@code supplier} with this as the {@link #current()} context of the calling thread and returns its result. */
  public <T> T call(Supplier<T> supplier) {
    ZenContext previous = CURRENT.get();
    String previousLogContext = LogUtil.getContext();
    CURRENT.set(this);
    LogUtil.setContext(name);
    try {
      return supplier.get();
    } finally {
      if (previous == null) {
        CURRENT.remove();
      } else {
        CURRENT.set(previous);
      }
      LogUtil.restoreContext(previousLogContext);
    }
  }

  /** Runs {@code runnable} with this as the {@link #current()} context of the calling thread. */
  public void run(Runnable runnable) {
    call(() -> {
      runnable.run();
      return null;
    });
  }

  public String name() {
    return name;
  }

  public ZenConfig config() {
    return config;
  }

  @SuppressWarnings("unchecked")
  <K, V> Flyweight<K, V> table(NodeKind kind) {
    return (Flyweight<K, V>) tables.get(kind);
  }

  /** Returns the number of entries interned for {@code kind}. */
  public int tableSize(NodeKind kind) {
    return tables.get(kind).size();
  }

  public Map<NodeKind, Integer> tableSizes() {
    Map<NodeKind, Integer> result = new EnumMap<>(NodeKind.class);
    tables.forEach((kind, table) -> result.put(kind, table.size()));
    return result;
  }

  /** Returns the total number of entries across every intern table. */
  public long size() {
    long total = 0;
    for (var table : tables.values()) {
      total += table.size();
    }
    return total;
  }

  public void logStats() {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Context {} interned {} entries", name, size());
      tableSizes().forEach((kind, size) -> {
        if (size > 0) {
          LOGGER.debug("  {}: {}", kind, size);
        }
      });
    }
  }

  @Override
  public String toString() {
    return "ZenContext[" + name + "]";
  }
}
