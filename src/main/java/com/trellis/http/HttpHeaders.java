package com.trellis.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, case-insensitive, multi-valued header collection.
 *
 * <p>Header names keep the spelling they were first added with. Instances are mutable; use {@link
 * #copy()} and {@link #unmodifiable()} to hand out snapshots.
 */
public class HttpHeaders {
  private final Map<String, Entry> entries;
  private final boolean readOnly;

  /** Creates an empty header collection. */
  public HttpHeaders() {
    this(new LinkedHashMap<>(), false);
  }

  private HttpHeaders(Map<String, Entry> entries, boolean readOnly) {
    this.entries = entries;
    this.readOnly = readOnly;
  }

  /**
   * Replaces all values of a header with a single value.
   *
   * @param name the header name
   * @param value the header value
   * @return this collection for method chaining
   */
  public HttpHeaders set(String name, String value) {
    checkWritable();
    Entry entry = new Entry(name);
    entry.values.add(value);
    entries.put(key(name), entry);
    return this;
  }

  /**
   * Appends a value to a header, keeping existing values.
   *
   * @param name the header name
   * @param value the header value
   * @return this collection for method chaining
   */
  public HttpHeaders add(String name, String value) {
    checkWritable();
    entries.computeIfAbsent(key(name), k -> new Entry(name)).values.add(value);
    return this;
  }

  /**
   * Removes a header.
   *
   * @param name the header name
   * @return this collection for method chaining
   */
  public HttpHeaders remove(String name) {
    checkWritable();
    entries.remove(key(name));
    return this;
  }

  /**
   * Gets the first value of a header.
   *
   * @param name the header name
   * @return the first value or null if absent
   */
  public String getFirst(String name) {
    Entry entry = entries.get(key(name));
    return entry == null || entry.values.isEmpty() ? null : entry.values.get(0);
  }

  /**
   * Gets all values of a header.
   *
   * @param name the header name
   * @return the values, empty if absent
   */
  public List<String> getAll(String name) {
    Entry entry = entries.get(key(name));
    return entry == null
        ? Collections.emptyList()
        : Collections.unmodifiableList(entry.values);
  }

  /**
   * Checks whether a header is present.
   *
   * @param name the header name
   * @return true if the header has at least one value
   */
  public boolean contains(String name) {
    Entry entry = entries.get(key(name));
    return entry != null && !entry.values.isEmpty();
  }

  /**
   * Gets the header names in insertion order.
   *
   * @return the names
   */
  public Set<String> names() {
    Set<String> names = new LinkedHashSet<>();
    for (Entry entry : entries.values()) {
      names.add(entry.name);
    }
    return names;
  }

  /**
   * Converts the headers to a map of name to values.
   *
   * @return an unmodifiable map
   */
  public Map<String, List<String>> toMap() {
    Map<String, List<String>> map = new LinkedHashMap<>();
    for (Entry entry : entries.values()) {
      map.put(entry.name, Collections.unmodifiableList(new ArrayList<>(entry.values)));
    }
    return Collections.unmodifiableMap(map);
  }

  /**
   * Gets the number of distinct header names.
   *
   * @return the size
   */
  public int size() {
    return entries.size();
  }

  /**
   * Creates a mutable deep copy.
   *
   * @return the copy
   */
  public HttpHeaders copy() {
    Map<String, Entry> copied = new LinkedHashMap<>();
    for (Map.Entry<String, Entry> e : entries.entrySet()) {
      Entry entry = new Entry(e.getValue().name);
      entry.values.addAll(e.getValue().values);
      copied.put(e.getKey(), entry);
    }
    return new HttpHeaders(copied, false);
  }

  /**
   * Creates a read-only deep copy.
   *
   * @return the read-only copy
   */
  public HttpHeaders unmodifiable() {
    return new HttpHeaders(copy().entries, true);
  }

  private void checkWritable() {
    if (readOnly) {
      throw new UnsupportedOperationException("Headers are read-only");
    }
  }

  private static String key(String name) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Header name must not be empty");
    }
    return name.toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return toMap().toString();
  }

  private static final class Entry {
    private final String name;
    private final List<String> values = new ArrayList<>(1);

    private Entry(String name) {
      this.name = name;
    }
  }
}
