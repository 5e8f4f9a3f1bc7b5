/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.collection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * A {@link Collected} decorated with a lookup table from a derived key to the items carrying that
 * key. Items keep their original order within each key, and the keys keep the order in which they
 * were first seen.
 *
 * @param <K> the type of the keys
 * @param <T> the type of the items
 */
public final class Indexed<K, T> {
  private final Collected<T> source;
  private final Map<K, Collected<T>> index;

  private Indexed(final Collected<T> source, final Map<K, Collected<T>> index) {
    this.source = source;
    this.index = index;
  }

  static <K, T> Indexed<K, T> build(
      final Collected<T> source, final Function<? super T, ? extends K> keyFn) {
    final Map<K, List<T>> groups = new LinkedHashMap<>();
    for (final T t : source) {
      groups.computeIfAbsent(keyFn.apply(t), k -> new ArrayList<>()).add(t);
    }
    final Map<K, Collected<T>> index = new LinkedHashMap<>();
    groups.forEach((k, items) -> index.put(k, Collected.collect(items)));
    return new Indexed<>(source, Collections.unmodifiableMap(index));
  }

  /** @return the undecorated collection, unchanged */
  public Collected<T> source() {
    return this.source;
  }

  /** @return the items with the given key, empty if there are none */
  public Collected<T> get(final K key) {
    final Collected<T> items = this.index.get(key);
    return items == null ? Collected.empty() : items;
  }

  /** @return the first item with the given key */
  public Optional<T> first(final K key) {
    return get(key).first();
  }

  public boolean containsKey(final K key) {
    return this.index.containsKey(key);
  }

  public Set<K> keys() {
    return this.index.keySet();
  }

  public Map<K, Collected<T>> asMap() {
    return this.index;
  }

  @Override
  public String toString() {
    return "Indexed" + this.index;
  }
}
