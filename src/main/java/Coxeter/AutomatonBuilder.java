package Coxeter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import Coxeter.Model.BuildRecord;
import Coxeter.Model.CoxeterConfigurationException;
import Coxeter.Model.Mode;
import Coxeter.Model.ReflectionTable;
import Coxeter.Model.RootSet;
import Coxeter.Registry.HashRegistry;
import Coxeter.Registry.Registry;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Builds the automaton recognizing reduced words or shortlex normal forms of a Coxeter group.
 * <p>
 * States are subsets of the roots in the reflection table. Reading generator i from a state labelled S is
 * allowed only if alpha_i is not in S, and leads to
 * <pre>
 *     {alpha_i} ∪ (s_i(S) ∩ Σ)                              for reduced words,
 *     {alpha_i} ∪ ((s_i(S) ∪ {s_i(alpha_j) : j &lt; i}) ∩ Σ)   for shortlex normal forms,
 * </pre>
 * where Σ is the set of roots in the table. Every state is accepting.
 */
public class AutomatonBuilder {
    public static boolean DEBUG = false;
    private static final long STATES_EXPLORED_PERIOD = 1000L;

    private AutomatonBuilder() {}

    public static CoxeterDFA build(Integer[][] table, int rank, Mode mode) {
        checkMode(mode);
        return build(ReflectionTable.of(table, rank), mode);
    }

    public static CoxeterDFA build(ReflectionTable table, Mode mode) {
        return build(table, mode, new HashRegistry());
    }

    /**
     * Build the (generally non-minimal) automaton by a breadth-first search over root set labels.
     * @param table - action of the simple reflections on the roots
     * @param mode - reduced words or shortlex normal forms
     * @param registry - empty registry used to deduplicate labels
     * @return - the automaton, with every state labelled by its root set
     */
    public static CoxeterDFA build(ReflectionTable table, Mode mode, Registry registry) {
        checkMode(mode);
        if (table == null) {
            throw new CoxeterConfigurationException("reflection table is missing");
        }
        if (registry.size() != 0) {
            throw new IllegalArgumentException("registry already holds " + registry.size() + " labels");
        }

        final int rank = table.rank();
        final Alphabet<Integer> alphabet = Alphabets.integers(0, rank - 1);
        final CompactDFA<Integer> out = new CompactDFA<>(alphabet);
        final List<RootSet> labels = new ArrayList<>();
        final Deque<BuildRecord> queue = new ArrayDeque<>();

        final RootSet init = RootSet.empty(table.numRoots());
        final int initOut = out.addInitialState(true);
        registry.put(init, initOut);
        labels.add(init);
        queue.add(new BuildRecord(init, initOut));

        long statesExplored = 0;
        while (!queue.isEmpty()) {
            final BuildRecord curr = queue.poll();
            final RootSet label = curr.label();
            final int outState = curr.outputAddress();

            for (int i = 0; i < rank; i++) {
                if (out.getSuccessor(outState, i) >= 0) {
                    continue; // transition already known
                }
                final RootSet succ = successorLabel(table, label, i, mode);
                if (succ == null) {
                    continue; // continuation is not canonical
                }
                int outSucc = registry.get(succ);
                if (outSucc == Registry.MISSING_ELEMENT) {
                    // new label: add state to DFA and to queue
                    outSucc = out.addState(true);
                    registry.put(succ, outSucc);
                    labels.add(succ);
                    queue.add(new BuildRecord(succ, outSucc));
                }
                CoxeterDFA.setTransitionOnce(out, outState, i, outSucc);
            }
            statesExplored++;

            if (DEBUG && statesExplored % STATES_EXPLORED_PERIOD == 0) {
                System.out.println("DEBUG: Explored " + statesExplored + " states - "
                    + queue.size() + " states left in queue - " + out.size() + " states added");
            }
        }
        if (DEBUG) {
            System.out.println("DEBUG: " + mode.getName() + " automaton has " + out.size() + " states");
        }

        return CoxeterDFA.construct(out, labels);
    }

    /**
     * Build, then minimize.
     */
    public static CoxeterDFA buildMinimal(ReflectionTable table, Mode mode) {
        return build(table, mode).minimize();
    }

    /**
     * Label reached from {@code label} by reading {@code generator}.
     * @return - the successor label, or null if {@code generator} is in {@code label}
     */
    static RootSet successorLabel(ReflectionTable table, RootSet label, int generator, Mode mode) {
        if (label.get(generator)) {
            return null;
        }

        final RootSet.Builder result = RootSet.builder(table.numRoots()).set(generator);
        for (int j = label.nextSetBit(0); j >= 0; j = label.nextSetBit(j + 1)) {
            final int k = table.reflect(j, generator);
            if (k != ReflectionTable.NO_ROOT) {
                result.set(k);
            }
        }

        if (mode.addsLowerSimpleRoots()) {
            for (int j = 0; j < generator; j++) {
                final int k = table.reflect(j, generator);
                if (k != ReflectionTable.NO_ROOT) {
                    result.set(k);
                }
            }
        }
        return result.build();
    }

    private static void checkMode(Mode mode) {
        if (mode == null) {
            throw new CoxeterConfigurationException("automaton type is missing, must be 'reduced' or 'shortlex'");
        }
    }
}
