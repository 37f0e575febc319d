package io.tradedesk.opsengine.multitenancy;

import java.util.NoSuchElementException;

/**
 * A single request-scoped value. Bound for the duration of a {@link ScopeCarrier#run} or {@link
 * ScopeCarrier#call} and restored to its previous binding when that call exits.
 *
 * @param <T> the bound value type
 */
public final class RequestScope<T> {

  private final String name;
  private final ThreadLocal<T> current = new ThreadLocal<>();

  RequestScope(String name) {
    this.name = name;
  }

  public boolean isBound() {
    return current.get() != null;
  }

  /** Returns the bound value. Throws {@link NoSuchElementException} when unbound. */
  public T get() {
    T value = current.get();
    if (value == null) {
      throw new NoSuchElementException(name + " not bound");
    }
    return value;
  }

  T swap(T value) {
    T previous = current.get();
    if (value == null) {
      current.remove();
    } else {
      current.set(value);
    }
    return previous;
  }

  @Override
  public String toString() {
    return name;
  }
}
