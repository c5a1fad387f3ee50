package Coxeter.Roots;

import java.util.Arrays;

import Coxeter.Model.CoxeterConfigurationException;

/**
 * Symmetric matrix of the orders m_ij of the products s_i s_j of simple reflections.
 * The diagonal is 1; {@link #INFINITY} marks pairs whose product has infinite order.
 */
public final class CoxeterMatrix {
    public static final int INFINITY = -1;

    private final int[][] matrix;

    private CoxeterMatrix(int[][] matrix) {
        this.matrix = matrix;
    }

    public static CoxeterMatrix of(int[][] matrix) {
        if (matrix == null || matrix.length == 0) {
            throw new CoxeterConfigurationException("Coxeter matrix is empty");
        }
        final int rank = matrix.length;
        final int[][] copy = new int[rank][];
        for (int i = 0; i < rank; i++) {
            if (matrix[i] == null || matrix[i].length != rank) {
                throw new CoxeterConfigurationException("Coxeter matrix is not square: row " + i + " has "
                    + (matrix[i] == null ? "no" : String.valueOf(matrix[i].length)) + " entries, expected " + rank);
            }
            copy[i] = matrix[i].clone();
        }
        for (int i = 0; i < rank; i++) {
            if (copy[i][i] != 1) {
                throw new CoxeterConfigurationException("diagonal entry " + i + " is " + copy[i][i] + ", expected 1");
            }
            for (int j = i + 1; j < rank; j++) {
                if (copy[i][j] != copy[j][i]) {
                    throw new CoxeterConfigurationException("Coxeter matrix is not symmetric at (" + i + ", " + j + ")");
                }
                checkOrder(copy[i][j], i, j);
            }
        }
        return new CoxeterMatrix(copy);
    }

    /**
     * Fill the upper triangle of a Coxeter matrix, row by row.
     * E.g. (3, 2, 3) is the rank 3 matrix of the symmetric group S4, six entries give a rank 4 matrix.
     * @param upperTriangle - m_01, m_02, ..., m_12, ... ; no entries means rank 1
     */
    public static CoxeterMatrix fromDiagram(int... upperTriangle) {
        final int entries = upperTriangle.length;
        int rank = 1;
        while (rank * (rank - 1) / 2 < entries) {
            rank++;
        }
        if (rank * (rank - 1) / 2 != entries) {
            throw new CoxeterConfigurationException(
                entries + " diagram entries do not fill the upper triangle of a square matrix");
        }

        final int[][] matrix = new int[rank][rank];
        int k = 0;
        for (int i = 0; i < rank; i++) {
            matrix[i][i] = 1;
            for (int j = i + 1; j < rank; j++) {
                matrix[i][j] = upperTriangle[k];
                matrix[j][i] = upperTriangle[k];
                k++;
            }
        }
        return of(matrix);
    }

    private static void checkOrder(int m, int i, int j) {
        if (m != INFINITY && m < 2) {
            throw new CoxeterConfigurationException(
                "order of s" + i + "s" + j + " is " + m + ", expected an integer >= 2 or infinity");
        }
    }

    public int rank() {
        return matrix.length;
    }

    public int get(int i, int j) {
        return matrix[i][j];
    }

    /**
     * B(alpha_i, alpha_j) = -cos(pi / m_ij), which is 1 on the diagonal and -1 for infinite order.
     */
    public double bilinearForm(int i, int j) {
        if (i == j) {
            return 1.0;
        }
        final int m = matrix[i][j];
        if (m == INFINITY) {
            return -1.0;
        }
        if (m == 2) {
            return 0.0; // commuting mirrors are orthogonal, avoid cos rounding
        }
        return -Math.cos(Math.PI / m);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CoxeterMatrix && Arrays.deepEquals(matrix, ((CoxeterMatrix) o).matrix);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(matrix);
    }

    @Override
    public String toString() {
        return Arrays.deepToString(matrix);
    }
}
