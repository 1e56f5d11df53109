/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.page;

import java.util.Arrays;

/** {@link Block} over an object array. Regions share the array. */
public class ArrayBlock implements Block {

  private final Object[] values;
  private final int offset;
  private final int length;

  public ArrayBlock(Object[] values) {
    this(values, 0, values.length);
  }

  private ArrayBlock(Object[] values, int offset, int length) {
    this.values = values;
    this.offset = offset;
    this.length = length;
  }

  @Override
  public int getPositionCount() {
    return length;
  }

  @Override
  public Object getValue(int position) {
    if (position < 0 || position >= length) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + length + ")");
    }
    return values[offset + position];
  }

  @Override
  public Block getRegion(int positionOffset, int length) {
    if (positionOffset < 0 || length < 0 || positionOffset + length > this.length) {
      throw new IndexOutOfBoundsException(
          "Region ["
              + positionOffset
              + ", "
              + (positionOffset + length)
              + ") out of range [0, "
              + this.length
              + ")");
    }
    return new ArrayBlock(values, offset + positionOffset, length);
  }

  @Override
  public Object[] toArray() {
    return Arrays.copyOfRange(values, offset, offset + length);
  }
}
