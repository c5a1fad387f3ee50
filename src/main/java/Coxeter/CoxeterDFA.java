package Coxeter;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import Coxeter.Model.RootSet;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Deterministic automaton over generator indices {@code 0..rank-1}.
 * <p>
 * States are numbered {@code 0..size()-1} in depth-first visitation order from the initial state, which is always
 * state 0; only states reachable from it are kept. Transitions may be undefined, and an undefined transition
 * rejects. Instances are never modified after construction.
 */
public final class CoxeterDFA {
    public static final int NO_TRANSITION = -1;

    private final CompactDFA<Integer> dfa;
    private final RootSet[] labels; // null if the states carry no root set labels

    private CoxeterDFA(CompactDFA<Integer> dfa, RootSet[] labels) {
        this.dfa = dfa;
        this.labels = labels;
    }

    /**
     * Indexes the states of {@code source} reachable from its initial state.
     * @param source - automaton with a single initial state; it is not modified
     * @return - the indexed automaton, without state labels
     */
    public static CoxeterDFA construct(CompactDFA<Integer> source) {
        return construct(source, null);
    }

    /**
     * Indexes the states of {@code source} reachable from its initial state.
     * @param source - automaton with a single initial state; it is not modified
     * @param sourceLabels - label of each source state, by source state ID, or null
     * @return - the indexed automaton
     */
    static CoxeterDFA construct(CompactDFA<Integer> source, List<RootSet> sourceLabels) {
        final int start = source.getIntInitialState();
        if (start < 0) {
            throw new IllegalArgumentException("automaton has no initial state");
        }
        final Alphabet<Integer> alphabet = source.getInputAlphabet();
        final int numInputs = alphabet.size();

        // iterative preorder: a state gets its ID when popped, successors are pushed in reverse symbol order
        final int[] newId = new int[source.size()];
        final BitSet visited = new BitSet(source.size());
        final int[] order = new int[source.size()];
        int numReachable = 0;

        final Deque<Integer> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            final int curr = stack.pop();
            if (visited.get(curr)) {
                continue; // shared target or cycle, already indexed
            }
            visited.set(curr);
            newId[curr] = numReachable;
            order[numReachable++] = curr;

            for (int j = numInputs - 1; j >= 0; j--) {
                final int succ = source.getSuccessor(curr, j);
                if (succ >= 0 && !visited.get(succ)) {
                    stack.push(succ);
                }
            }
        }

        final CompactDFA<Integer> out = new CompactDFA<>(alphabet, numReachable);
        final RootSet[] labels = sourceLabels == null ? null : new RootSet[numReachable];
        for (int q = 0; q < numReachable; q++) {
            final int orig = order[q];
            if (q == 0) {
                out.addInitialState(source.isAccepting(orig));
            } else {
                out.addState(source.isAccepting(orig));
            }
            if (labels != null) {
                labels[q] = sourceLabels.get(orig);
            }
        }
        for (int q = 0; q < numReachable; q++) {
            final int orig = order[q];
            for (int j = 0; j < numInputs; j++) {
                final int succ = source.getSuccessor(orig, j);
                if (succ >= 0) {
                    setTransitionOnce(out, q, j, newId[succ]);
                }
            }
        }
        return new CoxeterDFA(out, labels);
    }

    /**
     * Records a transition, refusing to overwrite an existing one.
     * @throws IllegalStateException if (state, symbol) already has a transition
     */
    static void setTransitionOnce(CompactDFA<Integer> out, int state, int symbol, int succ) {
        final int existing = out.getSuccessor(state, symbol);
        if (existing >= 0) {
            throw new IllegalStateException(
                "state " + state + " already has a transition on " + symbol + " (to " + existing + ")");
        }
        out.setTransition(state, symbol, succ);
    }

    public CoxeterDFA minimize() {
        return HopcroftMinimization.minimize(this);
    }

    public Alphabet<Integer> getInputAlphabet() {
        return dfa.getInputAlphabet();
    }

    public int numInputs() {
        return dfa.numInputs();
    }

    public int size() {
        return dfa.size();
    }

    public int getInitialState() {
        return 0;
    }

    public Collection<Integer> getStates() {
        return dfa.getStates();
    }

    public boolean isAccepting(int state) {
        checkState(state);
        return dfa.isAccepting(state);
    }

    /**
     * @return the successor of {@code state} under {@code symbol}, or {@link #NO_TRANSITION}
     */
    public int getSuccessor(int state, int symbol) {
        checkState(state);
        if (symbol < 0 || symbol >= numInputs()) {
            throw new IllegalArgumentException("symbol " + symbol + " outside [0, " + numInputs() + ")");
        }
        final int succ = dfa.getSuccessor(state, symbol);
        return succ < 0 ? NO_TRANSITION : succ;
    }

    /**
     * Root set the state was built for. Empty for automata that were minimized or constructed without labels.
     */
    public Optional<RootSet> getLabel(int state) {
        checkState(state);
        return labels == null ? Optional.empty() : Optional.of(labels[state]);
    }

    public int numTransitions() {
        int count = 0;
        for (int q = 0; q < size(); q++) {
            for (int j = 0; j < numInputs(); j++) {
                if (dfa.getSuccessor(q, j) >= 0) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Whether every state has a transition on every symbol.
     */
    public boolean isComplete() {
        return numTransitions() == size() * numInputs();
    }

    /**
     * Whether the word is accepted. A null or out-of-range symbol rejects the word.
     */
    public boolean accepts(Iterable<Integer> word) {
        int state = getInitialState();
        final Iterator<Integer> it = word.iterator();
        while (it.hasNext()) {
            final Integer next = it.next();
            if (next == null) {
                return false;
            }
            final int symbol = next;
            if (symbol < 0 || symbol >= numInputs()) {
                return false;
            }
            state = dfa.getSuccessor(state, symbol);
            if (state < 0) {
                return false;
            }
        }
        return dfa.isAccepting(state);
    }

    /**
     * Counts accepted words by length.
     * For a shortlex automaton these are the coefficients of the group's growth series.
     * Counts are exact: groups of exponential growth exceed {@code long} around length 60, and then this throws
     * rather than wrapping around.
     * @param maxLength - largest word length to count
     * @return - entry l is the number of accepted words of length l, for l in [0, maxLength]
     * @throws ArithmeticException if a count up to maxLength does not fit in a long
     */
    public long[] growthSeries(int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength < 0: " + maxLength);
        }
        final int n = size();
        final long[] series = new long[maxLength + 1];
        long[] paths = new long[n]; // paths[q]: words of the current length leading to q
        paths[getInitialState()] = 1;

        for (int length = 0; length <= maxLength; length++) {
            long accepted = 0;
            final long[] next = new long[n];
            for (int q = 0; q < n; q++) {
                if (paths[q] == 0) {
                    continue;
                }
                if (dfa.isAccepting(q)) {
                    accepted = Math.addExact(accepted, paths[q]);
                }
                if (length == maxLength) {
                    continue; // longer words are not counted
                }
                for (int j = 0; j < numInputs(); j++) {
                    final int succ = dfa.getSuccessor(q, j);
                    if (succ >= 0) {
                        next[succ] = Math.addExact(next[succ], paths[q]);
                    }
                }
            }
            series[length] = accepted;
            paths = next;
        }
        return series;
    }

    /**
     * An independent AutomataLib copy of this automaton, with the same state IDs.
     */
    public CompactDFA<Integer> toCompactDFA() {
        return new CompactDFA<>(dfa);
    }

    private void checkState(int state) {
        if (state < 0 || state >= size()) {
            throw new IllegalArgumentException("state " + state + " outside [0, " + size() + ")");
        }
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        for (int q = 0; q < size(); q++) {
            sb.append(q);
            if (labels != null) {
                sb.append(' ').append(labels[q]);
            }
            sb.append(dfa.isAccepting(q) ? " (accept)" : " (reject)");
            for (int j = 0; j < numInputs(); j++) {
                final int succ = dfa.getSuccessor(q, j);
                if (succ >= 0) {
                    sb.append(' ').append(j).append("->").append(succ);
                }
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }
}
