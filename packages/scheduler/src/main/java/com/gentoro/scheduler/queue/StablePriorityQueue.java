package com.gentoro.scheduler.queue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered container backed by a sorted list. Insertion is a binary search followed by a list
 * insert, front and back access are constant time. Elements that compare as equal keep their
 * insertion order, so two invocations due at the same moment are handed out first-in first-out.
 *
 * <p>Intended for small queues (tens of elements). Not thread-safe.
 *
 * @param <T> element type
 */
public final class StablePriorityQueue<T> implements Iterable<T> {
  private final Comparator<? super T> comparator;
  private final List<T> values;

  public StablePriorityQueue(Comparator<? super T> comparator) {
    this.comparator = Objects.requireNonNull(comparator, "comparator");
    this.values = new ArrayList<>();
  }

  private StablePriorityQueue(Comparator<? super T> comparator, List<T> sortedValues) {
    this.comparator = comparator;
    this.values = sortedValues;
  }

  /**
   * Creates a queue from existing values. The values are sorted once, rather than inserted one at
   * a time; {@link List#sort} is stable so equal elements keep their collection order.
   */
  public static <T> StablePriorityQueue<T> fromCollection(
      Collection<? extends T> values, Comparator<? super T> comparator) {
    Objects.requireNonNull(comparator, "comparator");
    List<T> sorted = new ArrayList<>(values);
    sorted.sort(comparator);
    return new StablePriorityQueue<>(comparator, sorted);
  }

  /** Inserts {@code value} after every element that does not sort after it. */
  public void push(T value) {
    int low = 0;
    int high = values.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (comparator.compare(values.get(mid), value) <= 0) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    values.add(low, value);
  }

  /** The smallest element, or empty when the queue has no elements. */
  public Optional<T> front() {
    return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
  }

  /** The largest element, or empty when the queue has no elements. */
  public Optional<T> back() {
    return values.isEmpty() ? Optional.empty() : Optional.of(values.get(values.size() - 1));
  }

  /** Removes the front element. Does nothing when the queue is empty. */
  public void pop() {
    if (!values.isEmpty()) {
      values.remove(0);
    }
  }

  public void clear() {
    values.clear();
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** Snapshot of the elements in priority order. */
  public List<T> toList() {
    return List.copyOf(values);
  }

  /** Iterates in priority order. The iterator does not support removal. */
  @Override
  public Iterator<T> iterator() {
    return Collections.unmodifiableList(values).iterator();
  }
}
