/*
 * Copyright Travolo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.travolo.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Queue;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Utility methods for finding the top N things from a stream. Selection is stable: of two items with
 * equal value, the one that appeared first in the stream ranks higher.
 */
public final class TopN {

  private TopN() {
  }

  /**
   * @param values stream of values from which to choose; {@code null} and non-finite values are skipped
   * @param n how many top values to choose
   * @return the top N values (at most), ordered by value descending, ties in stream order
   */
  public static <T extends ScoredItem> List<T> selectTopN(Iterator<? extends T> values, int n) {
    Preconditions.checkArgument(n > 0, "n must be positive: %s", n);
    Queue<Entry<T>> topN = new PriorityQueue<Entry<T>>(n + 2, WORST_FIRST);
    int position = 0;
    while (values.hasNext()) {
      T value = values.next();
      if (value == null || !LangUtils.isFinite(value.getValue())) {
        continue;
      }
      Entry<T> entry = new Entry<T>(value, position++);
      if (topN.size() < n) {
        topN.add(entry);
      } else if (WORST_FIRST.compare(entry, topN.peek()) > 0) {
        topN.poll();
        topN.add(entry);
      }
    }
    if (topN.isEmpty()) {
      return Collections.emptyList();
    }
    List<Entry<T>> sorted = new ArrayList<Entry<T>>(topN);
    Collections.sort(sorted, Collections.reverseOrder(WORST_FIRST));
    List<T> result = Lists.newArrayListWithCapacity(sorted.size());
    for (Entry<T> entry : sorted) {
      result.add(entry.item);
    }
    return result;
  }

  /**
   * @see #selectTopN(Iterator, int)
   */
  public static <T extends ScoredItem> List<T> selectTopN(Iterable<? extends T> values, int n) {
    return selectTopN(values.iterator(), n);
  }

  /**
   * Orders lower values first, and among equal values, later stream positions first.
   */
  private static final Comparator<Entry<?>> WORST_FIRST = new Comparator<Entry<?>>() {
    @Override
    public int compare(Entry<?> a, Entry<?> b) {
      int byValue = Double.compare(a.item.getValue(), b.item.getValue());
      if (byValue != 0) {
        return byValue;
      }
      return a.position < b.position ? 1 : (a.position > b.position ? -1 : 0);
    }
  };

  private static final class Entry<T extends ScoredItem> {
    private final T item;
    private final int position;
    private Entry(T item, int position) {
      this.item = item;
      this.position = position;
    }
  }

}
