/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.imports;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable source of plan-wide unique operator ids. Each allocation returns the ids together with
 * the allocator to use for the next step, so ids stay unique as long as the returned allocator is
 * threaded through.
 */
public final class OperatorIdAllocator {

  private final int next;

  private OperatorIdAllocator(int next) {
    this.next = next;
  }

  public static OperatorIdAllocator fromZero() {
    return startingAt(0);
  }

  public static OperatorIdAllocator startingAt(int first) {
    Preconditions.checkArgument(first >= 0, "First operator id must be >= 0 but was %s", first);
    return new OperatorIdAllocator(first);
  }

  /** Id the next allocation starts with. */
  public int peek() {
    return next;
  }

  /**
   * Allocates consecutive ids.
   *
   * @param count number of ids, at least 1
   * @return allocated ids in increasing order and the allocator that follows them
   */
  public Allocation allocate(int count) {
    Preconditions.checkArgument(count > 0, "Must allocate at least one id but asked for %s", count);
    int end = Math.addExact(next, count);
    List<Integer> ids = new ArrayList<>(count);
    for (int id = next; id < end; id++) {
      ids.add(id);
    }
    return new Allocation(Collections.unmodifiableList(ids), new OperatorIdAllocator(end));
  }

  @Override
  public String toString() {
    return "OperatorIdAllocator{next=" + next + '}';
  }

  /**
   * Result of {@link #allocate(int)}.
   *
   * @param ids allocated ids
   * @param next allocator for the following step
   */
  public record Allocation(List<Integer> ids, OperatorIdAllocator next) {

    public int get(int position) {
      return ids.get(position);
    }
  }
}
