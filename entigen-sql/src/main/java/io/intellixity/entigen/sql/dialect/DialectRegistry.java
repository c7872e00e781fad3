package io.intellixity.entigen.sql.dialect;

import io.intellixity.entigen.schema.DialectKind;
import io.intellixity.entigen.util.EntigenFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Dialects keyed by {@link DialectKind}; the first registration of a kind wins. */
public final class DialectRegistry {
  private static final Logger log = LoggerFactory.getLogger(DialectRegistry.class);

  private final Map<DialectKind, Dialect> byKind = new EnumMap<>(DialectKind.class);

  public DialectRegistry(List<Dialect> dialects) {
    for (Dialect d : dialects) {
      Dialect prev = byKind.putIfAbsent(d.kind(), d);
      if (prev != null && prev.getClass() != d.getClass()) {
        log.warn("Ignoring dialect {} for {}: {} already registered", d.getClass().getName(), d.kind(), prev.getClass().getName());
      }
    }
  }

  /** Loads every dialect listed in {@code META-INF/entigen.factories}. */
  public static DialectRegistry discover() {
    List<Dialect> found = EntigenFactoriesLoader.load(Dialect.class);
    log.debug("Discovered dialects: {}", found.stream().map(Dialect::id).toList());
    return new DialectRegistry(found);
  }

  public Dialect forKind(DialectKind kind) {
    Dialect d = byKind.get(kind);
    if (d == null) {
      throw new IllegalArgumentException("No dialect registered for " + kind.id()
          + "; is its module (e.g. entigen-" + kind.id() + ") on the classpath?");
    }
    return d;
  }

  public boolean has(DialectKind kind) {
    return byKind.containsKey(kind);
  }
}
