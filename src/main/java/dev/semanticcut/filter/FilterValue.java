package dev.semanticcut.filter;

import java.util.List;

/**
 * Value side of a filter clause entry. The variant decides how a {@code must} clause combines
 * several values; {@code should} and {@code must_not} treat every value as its own condition.
 *
 * <ul>
 *   <li>{@link Exact} - a single value
 *   <li>{@link AnyOf} - at least one of the values
 *   <li>{@link AllOf} - every one of the values
 * </ul>
 */
public interface FilterValue {

  /** The values carried by this entry, in wire order. */
  List<String> values();

  /** Value to emit when the clause is serialised back to its wire form. */
  Object toWire();

  /** A single scalar value. */
  record Exact(String value) implements FilterValue {

    @Override
    public List<String> values() {
      return List.of(value);
    }

    @Override
    public Object toWire() {
      return value;
    }
  }

  /** A list where one match is enough. */
  record AnyOf(List<String> values) implements FilterValue {

    public AnyOf {
      values = List.copyOf(values);
    }

    @Override
    public Object toWire() {
      return values;
    }
  }

  /** A list where every value must match. */
  record AllOf(List<String> values) implements FilterValue {

    public AllOf {
      values = List.copyOf(values);
    }

    @Override
    public Object toWire() {
      return values;
    }
  }
}
