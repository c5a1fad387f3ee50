package Coxeter.Model;

import java.util.Arrays;

/**
 * Immutable set of root indices, stored as a bitset of fixed length (numBits).
 * Used as the label of a DFA state, so equality and hashing are by value.
 */
public final class RootSet {
  private final long[] bits; // Array of longs holding the bits
  private final int numBits;

  private RootSet(final long[] bits, final int numBits) {
    this.bits = bits;
    this.numBits = numBits;
  }

  private static long[] allocate(final int numBits) {
    if (numBits < 0) {
      throw new IllegalArgumentException("numBits < 0: " + numBits);
    }
    return new long[numBits == 0 ? 1 : ((numBits - 1) >> 6) + 1];
  }

  /**
   * The empty set over root indices [0, numBits).
   */
  public static RootSet empty(final int numBits) {
    return new RootSet(allocate(numBits), numBits);
  }

  public static RootSet of(final int numBits, final int... roots) {
    final Builder builder = builder(numBits);
    for (int root : roots) {
      builder.set(root);
    }
    return builder.build();
  }

  public static Builder builder(final int numBits) {
    return new Builder(numBits);
  }

  public int numBits() {
    return numBits;
  }

  public boolean get(final int index) {
    if (index < 0 || index >= numBits) {
      return false;
    }
    final int wordNum = index >> 6; // div 64
    final long bitmask = 1L << (index & 63);
    return (bits[wordNum] & bitmask) != 0;
  }

  public boolean isEmpty() {
    for (long word : bits) {
      if (word != 0) {
        return false;
      }
    }
    return true;
  }

  public int cardinality() {
    int count = 0;
    for (long word : bits) {
      count += Long.bitCount(word);
    }
    return count;
  }

  /**
   * Returns the first set bit at or after index, or -1 if there is none.
   */
  public int nextSetBit(final int index) {
    if (index < 0) {
      throw new IndexOutOfBoundsException("index < 0: " + index);
    }
    int i = index >> 6;
    if (i >= bits.length) {
      return -1;
    }

    // discard the bits below index in the first word
    long word = bits[i] & (-1L << (index & 63));
    while (true) {
      if (word != 0) {
        return (i << 6) + Long.numberOfTrailingZeros(word);
      }
      if (++i == bits.length) {
        return -1;
      }
      word = bits[i];
    }
  }

  public int[] toArray() {
    final int[] result = new int[cardinality()];
    int pos = 0;
    for (int i = nextSetBit(0); i >= 0; i = nextSetBit(i + 1)) {
      result[pos++] = i;
    }
    return result;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RootSet)) {
      return false;
    }
    final RootSet other = (RootSet) o;
    return numBits == other.numBits && Arrays.equals(bits, other.bits);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(bits) + numBits;
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder("{");
    for (int i = nextSetBit(0); i >= 0; i = nextSetBit(i + 1)) {
      if (sb.length() > 1) {
        sb.append(", ");
      }
      sb.append(i);
    }
    return sb.append('}').toString();
  }

  /**
   * Mutable accumulator for a single successor label. {@link #build()} hands out an independent copy.
   */
  public static final class Builder {
    private final long[] bits;
    private final int numBits;

    private Builder(final int numBits) {
      this.bits = allocate(numBits);
      this.numBits = numBits;
    }

    public Builder set(final int index) {
      if (index < 0 || index >= numBits) {
        throw new IndexOutOfBoundsException("root " + index + " outside [0, " + numBits + ")");
      }
      bits[index >> 6] |= 1L << (index & 63);
      return this;
    }

    public RootSet build() {
      return new RootSet(bits.clone(), numBits);
    }
  }
}
