/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.combine;

import java.util.Iterator;
import java.util.NoSuchElementException;
import org.opensearch.blockagg.aggregation.GroupKey;
import org.opensearch.blockagg.page.Page;

/**
 * Splits a page sorted by its grouping columns into runs of equal keys. The iterator reads one row
 * ahead: a run is closed when the look-ahead row has a different key or the page is exhausted.
 *
 * <pre>
 *   AWAITING_ROW --row--> ACCUMULATING_RUN --same key--> ACCUMULATING_RUN
 *        ^                       |
 *        +---- key changed ------+
 *   AWAITING_ROW --no more rows--> EXHAUSTED
 * </pre>
 */
public class GroupRunIterator implements Iterator<GroupRun> {

  enum State {
    AWAITING_ROW,
    ACCUMULATING_RUN,
    EXHAUSTED
  }

  private final Page page;
  private final int[] keyChannels;

  private State state = State.AWAITING_ROW;
  private int position;
  private int runStart;
  private GroupKey runKey;
  private GroupRun pending;

  public GroupRunIterator(Page page, int[] keyChannels) {
    this.page = page;
    this.keyChannels = keyChannels.clone();
  }

  @Override
  public boolean hasNext() {
    while (pending == null && state != State.EXHAUSTED) {
      step();
    }
    return pending != null;
  }

  @Override
  public GroupRun next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more group runs");
    }
    GroupRun run = pending;
    pending = null;
    return run;
  }

  State getState() {
    return state;
  }

  private void step() {
    switch (state) {
      case AWAITING_ROW:
        if (position >= page.getPositionCount()) {
          state = State.EXHAUSTED;
        } else {
          runStart = position;
          runKey = GroupKey.fromRow(page, position, keyChannels);
          position++;
          state = State.ACCUMULATING_RUN;
        }
        break;
      case ACCUMULATING_RUN:
        if (position < page.getPositionCount() && runKey.matches(page, position, keyChannels)) {
          position++;
        } else {
          pending = new GroupRun(runKey, runStart, position);
          runKey = null;
          state = State.AWAITING_ROW;
        }
        break;
      default:
        throw new IllegalStateException("Unexpected state " + state);
    }
  }
}
