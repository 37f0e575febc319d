package io.tradedesk.opsengine.multitenancy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Immutable set of {@link RequestScope} bindings. Bindings are applied on entry to {@link #run} /
 * {@link #call} and the previous values are restored on every exit path, so nested carriers shadow
 * outer ones.
 */
public final class ScopeCarrier {

  private final List<Binding<?>> bindings;

  private ScopeCarrier(List<Binding<?>> bindings) {
    this.bindings = List.copyOf(bindings);
  }

  static <T> ScopeCarrier of(RequestScope<T> scope, T value) {
    return new ScopeCarrier(List.of(new Binding<>(scope, value)));
  }

  public <T> ScopeCarrier where(RequestScope<T> scope, T value) {
    var next = new ArrayList<Binding<?>>(bindings);
    next.add(new Binding<>(scope, value));
    return new ScopeCarrier(next);
  }

  public void run(Runnable action) {
    List<Object> previous = bindAll();
    try {
      action.run();
    } finally {
      restoreAll(previous);
    }
  }

  public <R> R call(Callable<R> action) throws Exception {
    List<Object> previous = bindAll();
    try {
      return action.call();
    } finally {
      restoreAll(previous);
    }
  }

  private List<Object> bindAll() {
    var previous = new ArrayList<Object>(bindings.size());
    for (Binding<?> binding : bindings) {
      previous.add(binding.bind());
    }
    return previous;
  }

  private void restoreAll(List<Object> previous) {
    for (int i = bindings.size() - 1; i >= 0; i--) {
      bindings.get(i).restore(previous.get(i));
    }
  }

  private record Binding<T>(RequestScope<T> scope, T value) {

    Object bind() {
      return scope.swap(value);
    }

    @SuppressWarnings("unchecked")
    void restore(Object previous) {
      scope.swap((T) previous);
    }
  }
}
