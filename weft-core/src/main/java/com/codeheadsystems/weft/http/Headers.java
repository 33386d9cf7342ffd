package com.codeheadsystems.weft.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Case-insensitive, multi-valued header map. Insertion order of values is preserved per name.
 */
public class Headers {

  private final TreeMap<String, List<String>> values = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

  /**
   * Returns the first value for the header.
   *
   * @param name the header name
   * @return the first value, or empty
   */
  public Optional<String> first(String name) {
    List<String> list = values.get(name);
    if (list == null || list.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(list.get(0));
  }

  /**
   * All values for the header, possibly empty.
   *
   * @param name the header name
   * @return the values
   */
  public List<String> all(String name) {
    List<String> list = values.get(name);
    return list == null ? List.of() : Collections.unmodifiableList(list);
  }

  /**
   * Appends a value.
   *
   * @param name  the name
   * @param value the value
   * @return this
   */
  public Headers add(String name, String value) {
    values.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
    return this;
  }

  /**
   * Replaces every value of the header with a single value.
   *
   * @param name  the name
   * @param value the value
   * @return this
   */
  public Headers set(String name, String value) {
    List<String> list = new ArrayList<>();
    list.add(value);
    values.put(name, list);
    return this;
  }

  /**
   * Removes the header.
   *
   * @param name the name
   */
  public void remove(String name) {
    values.remove(name);
  }

  public boolean contains(String name) {
    return values.containsKey(name);
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(values.keySet());
  }

  /**
   * Read-only view of every header.
   *
   * @return the map
   */
  public Map<String, List<String>> asMap() {
    return Collections.unmodifiableMap(values);
  }
}
