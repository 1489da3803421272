package io.b2mash.b2b.schemarouter.multitenancy;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.MDC;

/**
 * Active schema for the current unit of work. Each thread owns its own stack of bindings: nested
 * operations push, leaving pops back to the parent. Nothing here is shared between threads, so a
 * binding made by one request is never visible to another.
 *
 * <p>Work handed to another thread does not inherit the binding; use {@link #wrap(Callable)} to
 * carry it across explicitly.
 */
public final class SchemaContext {

  static final String MDC_SCHEMA = "schema";

  private static final ThreadLocal<Deque<String>> BINDINGS = new ThreadLocal<>();

  private SchemaContext() {}

  public static Optional<String> current() {
    Deque<String> stack = BINDINGS.get();
    return stack == null || stack.isEmpty() ? Optional.empty() : Optional.of(stack.peek());
  }

  /** Returns the active schema. Throws if nothing is bound. */
  public static String require() {
    return current()
        .orElseThrow(
            () -> new IllegalStateException("Schema context not available: nothing bound"));
  }

  public static int depth() {
    Deque<String> stack = BINDINGS.get();
    return stack == null ? 0 : stack.size();
  }

  public static void push(String schemaName) {
    SchemaNames.requireSafe(schemaName);
    Deque<String> stack = BINDINGS.get();
    if (stack == null) {
      stack = new ArrayDeque<>();
      BINDINGS.set(stack);
    }
    stack.push(schemaName);
    MDC.put(MDC_SCHEMA, schemaName);
  }

  /** Removes the innermost binding and returns it; the parent binding becomes active again. */
  public static String pop() {
    Deque<String> stack = BINDINGS.get();
    if (stack == null || stack.isEmpty()) {
      throw new IllegalStateException("SchemaContext.pop() without matching push()");
    }
    String popped = stack.pop();
    if (stack.isEmpty()) {
      BINDINGS.remove();
      MDC.remove(MDC_SCHEMA);
    } else {
      MDC.put(MDC_SCHEMA, stack.peek());
    }
    return popped;
  }

  public static <T> T callInSchema(String schemaName, Callable<T> body) throws Exception {
    push(schemaName);
    try {
      return body.call();
    } finally {
      pop();
    }
  }

  public static void runInSchema(String schemaName, Runnable body) {
    push(schemaName);
    try {
      body.run();
    } finally {
      pop();
    }
  }

  /**
   * Captures the caller's active schema (if any) so the returned task runs under the same binding
   * on whichever thread executes it.
   */
  public static <T> Callable<T> wrap(Callable<T> task) {
    Optional<String> captured = current();
    if (captured.isEmpty()) {
      return task;
    }
    String schema = captured.get();
    return () -> callInSchema(schema, task);
  }
}
