package Coxeter.Roots;

import java.util.ArrayList;
import java.util.List;

import Coxeter.Model.ReflectionTable;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * The minimal roots of a Coxeter group and the action of the simple reflections on them.
 * <p>
 * Roots are coefficient vectors over the simple roots, and roots {@code 0..rank-1} are the simple roots. A finite
 * group has every positive root minimal; any Coxeter group has finitely many minimal roots (Brink-Howlett).
 */
public final class MinimalRoots {
    private static final double EPSILON = 1e-9;
    private static final double KEY_SCALE = 1e6;
    private static final double KEY_TOLERANCE = 1e-6;
    static final int MISSING_ROOT = -1;

    private final CoxeterMatrix matrix;
    private final List<double[]> roots;
    private final ReflectionTable table;

    private MinimalRoots(CoxeterMatrix matrix, List<double[]> roots, ReflectionTable table) {
        this.matrix = matrix;
        this.roots = roots;
        this.table = table;
    }

    /**
     * Breadth-first search from the simple roots. For a minimal root beta and c = B(beta, alpha_i):
     * <ul>
     *     <li>beta = alpha_i is sent to a negative root,</li>
     *     <li>c &lt;= -1 sends beta to a root dominating alpha_i, which is not minimal,</li>
     *     <li>c = 0 fixes beta,</li>
     *     <li>otherwise s_i(beta) = beta - 2c alpha_i is minimal.</li>
     * </ul>
     */
    public static MinimalRoots compute(CoxeterMatrix matrix) {
        final int rank = matrix.rank();
        final List<double[]> roots = new ArrayList<>();
        final Object2IntMap<LongArrayList> index = new Object2IntOpenHashMap<>();
        index.defaultReturnValue(MISSING_ROOT);

        for (int i = 0; i < rank; i++) {
            final double[] simple = new double[rank];
            simple[i] = 1.0;
            addRoot(roots, index, simple);
        }

        final List<Integer[]> rows = new ArrayList<>();
        for (int k = 0; k < roots.size(); k++) { // roots grows while we scan it
            final double[] beta = roots.get(k);
            final Integer[] row = new Integer[rank];
            for (int i = 0; i < rank; i++) {
                if (k == i) {
                    continue; // s_i(alpha_i) = -alpha_i
                }
                final double c = innerProductWithSimple(matrix, beta, i);
                if (c <= -1.0 + EPSILON) {
                    continue;
                }
                if (Math.abs(c) < EPSILON) {
                    row[i] = k;
                    continue;
                }
                final double[] image = beta.clone();
                image[i] -= 2.0 * c;
                int target = lookup(roots, index, image);
                if (target == MISSING_ROOT) {
                    target = addRoot(roots, index, image);
                }
                row[i] = target;
            }
            rows.add(row);
        }

        final ReflectionTable table = ReflectionTable.of(rows.toArray(new Integer[0][]), rank);
        return new MinimalRoots(matrix, roots, table);
    }

    /**
     * Index of the known root equal to {@code root} up to rounding, or {@link #MISSING_ROOT}.
     * Keys of equal roots may straddle a rounding boundary, so a missed key falls back to comparing coefficients,
     * and the new key is remembered for the root found.
     */
    static int lookup(List<double[]> roots, Object2IntMap<LongArrayList> index, double[] root) {
        final LongArrayList key = key(root);
        final int found = index.getInt(key);
        if (found != MISSING_ROOT) {
            return found;
        }
        for (int k = 0; k < roots.size(); k++) {
            if (close(roots.get(k), root)) {
                index.put(key, k);
                return k;
            }
        }
        return MISSING_ROOT;
    }

    private static boolean close(double[] a, double[] b) {
        for (int j = 0; j < a.length; j++) {
            if (Math.abs(a[j] - b[j]) > KEY_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    static int addRoot(List<double[]> roots, Object2IntMap<LongArrayList> index, double[] root) {
        final int id = roots.size();
        roots.add(root);
        index.put(key(root), id);
        return id;
    }

    /**
     * Coefficients rounded to a fixed precision, so images computed along different paths meet.
     */
    private static LongArrayList key(double[] root) {
        final LongArrayList key = new LongArrayList(root.length);
        for (double x : root) {
            key.add(Math.round(x * KEY_SCALE));
        }
        return key;
    }

    private static double innerProductWithSimple(CoxeterMatrix matrix, double[] beta, int i) {
        double sum = 0.0;
        for (int j = 0; j < beta.length; j++) {
            if (beta[j] != 0.0) {
                sum += beta[j] * matrix.bilinearForm(j, i);
            }
        }
        return sum;
    }

    public CoxeterMatrix getMatrix() {
        return matrix;
    }

    public int rank() {
        return matrix.rank();
    }

    public int size() {
        return roots.size();
    }

    /**
     * Coefficients of a root over the simple roots.
     */
    public double[] root(int index) {
        return roots.get(index).clone();
    }

    public ReflectionTable reflectionTable() {
        return table;
    }
}
