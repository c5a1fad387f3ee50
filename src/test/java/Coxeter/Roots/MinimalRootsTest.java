package Coxeter.Roots;

import Coxeter.Model.CoxeterConfigurationException;
import Coxeter.Model.ReflectionTable;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

class MinimalRootsTest {

  @Test
  void testCoxeterMatrixFromDiagram() {
    CoxeterMatrix a3 = CoxeterMatrix.fromDiagram(3, 2, 3);
    Assertions.assertEquals(3, a3.rank());
    Assertions.assertEquals(3, a3.get(0, 1));
    Assertions.assertEquals(2, a3.get(2, 0));
    Assertions.assertEquals(1, a3.get(1, 1));
    Assertions.assertEquals(a3, CoxeterMatrix.of(new int[][]{{1, 3, 2}, {3, 1, 3}, {2, 3, 1}}));

    Assertions.assertEquals(4, CoxeterMatrix.fromDiagram(3, 2, 2, 3, 2, 3).rank());
    Assertions.assertEquals(1, CoxeterMatrix.fromDiagram().rank());

    Assertions.assertEquals(1.0, a3.bilinearForm(0, 0));
    Assertions.assertEquals(-0.5, a3.bilinearForm(0, 1), 1e-12);
    Assertions.assertEquals(0.0, a3.bilinearForm(0, 2));
    Assertions.assertEquals(-1.0, CoxeterMatrix.fromDiagram(CoxeterMatrix.INFINITY).bilinearForm(0, 1));
  }

  @Test
  void testMalformedCoxeterMatrices() {
    assertThrows(CoxeterConfigurationException.class, () -> CoxeterMatrix.fromDiagram(3, 2));
    assertThrows(CoxeterConfigurationException.class, () -> CoxeterMatrix.fromDiagram(1));
    assertThrows(CoxeterConfigurationException.class, () -> CoxeterMatrix.fromDiagram(0, 2, 3));
    assertThrows(CoxeterConfigurationException.class, () -> CoxeterMatrix.of(new int[0][]));
    assertThrows(CoxeterConfigurationException.class, () -> CoxeterMatrix.of(new int[][]{{1, 3}, {3}}));
    assertThrows(CoxeterConfigurationException.class, () -> CoxeterMatrix.of(new int[][]{{1, 3}, {4, 1}}));
    assertThrows(CoxeterConfigurationException.class, () -> CoxeterMatrix.of(new int[][]{{2, 3}, {3, 1}}));
  }

  @Test
  @DisplayName("A2 produces the three positive roots and the expected reflection table")
  void testA2Table() {
    MinimalRoots roots = MinimalRoots.compute(CoxeterMatrix.fromDiagram(3));
    Assertions.assertEquals(3, roots.size());
    Assertions.assertArrayEquals(new double[]{1.0, 1.0}, roots.root(2), 1e-12);

    Integer[][] expected = {
        {null, 2},
        {2, null},
        {1, 0},
    };
    Assertions.assertEquals(ReflectionTable.of(expected, 2), roots.reflectionTable());
  }

  @Test
  void testCommutingGenerators() {
    // A1 x A1: each reflection fixes the other simple root
    MinimalRoots roots = MinimalRoots.compute(CoxeterMatrix.fromDiagram(2));
    Assertions.assertEquals(2, roots.size());
    ReflectionTable table = roots.reflectionTable();
    Assertions.assertEquals(0, table.reflect(0, 1));
    Assertions.assertEquals(1, table.reflect(1, 0));
    Assertions.assertEquals(ReflectionTable.NO_ROOT, table.reflect(0, 0));
  }

  @Test
  @DisplayName("finite groups have all positive roots minimal")
  void testFiniteGroups() {
    Assertions.assertEquals(1, MinimalRoots.compute(CoxeterMatrix.fromDiagram()).size());
    Assertions.assertEquals(6, MinimalRoots.compute(CoxeterMatrix.fromDiagram(3, 2, 3)).size()); // A3
    Assertions.assertEquals(9, MinimalRoots.compute(CoxeterMatrix.fromDiagram(4, 2, 3)).size()); // B3
    Assertions.assertEquals(15, MinimalRoots.compute(CoxeterMatrix.fromDiagram(5, 2, 3)).size()); // H3
    Assertions.assertEquals(10, MinimalRoots.compute(CoxeterMatrix.fromDiagram(3, 2, 2, 3, 2, 3)).size()); // A4
    Assertions.assertEquals(8, MinimalRoots.compute(CoxeterMatrix.fromDiagram(8)).size()); // I2(8)
  }

  @Test
  @DisplayName("infinite groups keep only the minimal roots")
  void testInfiniteGroups() {
    // infinite dihedral group: s_1(alpha_0) = alpha_0 + 2 alpha_1 dominates alpha_1
    MinimalRoots dihedral = MinimalRoots.compute(CoxeterMatrix.fromDiagram(CoxeterMatrix.INFINITY));
    Assertions.assertEquals(2, dihedral.size());
    Assertions.assertEquals(ReflectionTable.NO_ROOT, dihedral.reflectionTable().reflect(0, 1));
    Assertions.assertEquals(ReflectionTable.NO_ROOT, dihedral.reflectionTable().reflect(1, 0));

    // affine A2: simple roots and the three sums of two of them
    Assertions.assertEquals(6, MinimalRoots.compute(CoxeterMatrix.fromDiagram(3, 3, 3)).size());
  }

  @Test
  void testRootsHaveUnitLength() {
    CoxeterMatrix h3 = CoxeterMatrix.fromDiagram(5, 2, 3);
    MinimalRoots roots = MinimalRoots.compute(h3);
    for (int k = 0; k < roots.size(); k++) {
      double[] beta = roots.root(k);
      double norm = 0.0;
      for (int i = 0; i < beta.length; i++) {
        for (int j = 0; j < beta.length; j++) {
          norm += beta[i] * beta[j] * h3.bilinearForm(i, j);
        }
        Assertions.assertTrue(beta[i] > -1e-9, "root " + k + " is not positive");
      }
      Assertions.assertEquals(1.0, norm, 1e-9, "root " + k);
    }
  }

  @Test
  @DisplayName("roots whose rounded keys differ are still found")
  void testLookupAcrossRoundingBoundary() {
    List<double[]> roots = new ArrayList<>();
    Object2IntMap<LongArrayList> index = new Object2IntOpenHashMap<>();
    index.defaultReturnValue(MinimalRoots.MISSING_ROOT);

    // 0.4999999 and 0.5000001 round to different keys at the 1e-6 grid
    double[] below = {1.0, 0.5e-6 - 1e-13};
    double[] above = {1.0, 0.5e-6 + 1e-13};
    int id = MinimalRoots.addRoot(roots, index, below);
    Assertions.assertEquals(id, MinimalRoots.lookup(roots, index, above));
    Assertions.assertEquals(1, roots.size());
    Assertions.assertEquals(MinimalRoots.MISSING_ROOT, MinimalRoots.lookup(roots, index, new double[]{1.0, 1.0}));
  }

  @Test
  void testUniversalGroupHasOnlySimpleRoots() {
    int inf = CoxeterMatrix.INFINITY;
    MinimalRoots roots = MinimalRoots.compute(CoxeterMatrix.fromDiagram(inf, inf, inf));
    Assertions.assertEquals(3, roots.size());
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        Assertions.assertEquals(ReflectionTable.NO_ROOT, roots.reflectionTable().reflect(i, j));
      }
    }
  }
}
