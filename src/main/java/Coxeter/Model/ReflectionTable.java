package Coxeter.Model;

import java.util.Arrays;

/**
 * Action of the simple reflections on a finite set of roots.
 * Rows are roots, columns are generators; roots {@code 0..rank-1} are the simple roots.
 * {@code reflect(j, i)} is the index of s_i(root j) when that image is again in the set, otherwise {@link #NO_ROOT}.
 */
public final class ReflectionTable {
    public static final int NO_ROOT = -1;

    private final int rank;
    private final int numRoots;
    private final int[] data; // data[root * rank + generator]

    private ReflectionTable(int rank, int numRoots, int[] data) {
        this.rank = rank;
        this.numRoots = numRoots;
        this.data = data;
    }

    /**
     * Validates and copies a root transition table.
     *
     * @param table
     *         one row per root, {@code rank} entries per row; {@code null} entries are undefined images
     * @param rank
     *         number of generators
     * @return the immutable table
     * @throws CoxeterConfigurationException
     *         if the table is not a rectangle of width {@code rank} holding at least the simple roots,
     *         or refers to a root outside the table
     */
    public static ReflectionTable of(Integer[][] table, int rank) {
        if (rank < 1) {
            throw new CoxeterConfigurationException("rank must be positive, got " + rank);
        }
        if (table == null) {
            throw new CoxeterConfigurationException("reflection table is missing");
        }
        final int numRoots = table.length;
        if (numRoots < rank) {
            throw new CoxeterConfigurationException(
                "reflection table has " + numRoots + " roots, fewer than the " + rank + " simple roots");
        }

        final int[] data = new int[numRoots * rank];
        for (int j = 0; j < numRoots; j++) {
            final Integer[] row = table[j];
            if (row == null || row.length != rank) {
                throw new CoxeterConfigurationException("row " + j + " of the reflection table has "
                    + (row == null ? "no" : String.valueOf(row.length)) + " entries, expected " + rank);
            }
            for (int i = 0; i < rank; i++) {
                final Integer k = row[i];
                if (k == null) {
                    data[j * rank + i] = NO_ROOT;
                } else if (k < 0 || k >= numRoots) {
                    throw new CoxeterConfigurationException(
                        "entry [" + j + "][" + i + "] = " + k + " is not a root index in [0, " + numRoots + ")");
                } else {
                    data[j * rank + i] = k;
                }
            }
        }
        return new ReflectionTable(rank, numRoots, data);
    }

    public int rank() {
        return rank;
    }

    public int numRoots() {
        return numRoots;
    }

    public int reflect(int root, int generator) {
        if (root < 0 || root >= numRoots || generator < 0 || generator >= rank) {
            throw new IndexOutOfBoundsException("(" + root + ", " + generator + ") outside "
                + numRoots + "x" + rank + " table");
        }
        return data[root * rank + generator];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReflectionTable)) {
            return false;
        }
        final ReflectionTable other = (ReflectionTable) o;
        return rank == other.rank && numRoots == other.numRoots && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rank + numRoots) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        for (int j = 0; j < numRoots; j++) {
            sb.append(j).append(':');
            for (int i = 0; i < rank; i++) {
                final int k = data[j * rank + i];
                sb.append(' ').append(k == NO_ROOT ? "-" : String.valueOf(k));
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }
}
