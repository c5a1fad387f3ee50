package Coxeter;

import net.automatalib.automaton.fsa.impl.CompactDFA;

import java.util.ArrayList;
import java.util.List;

public class WordUtils {
    // Only for tests, not meant to be performant

    /**
     * All words of the given length, in lexicographic order.
     */
    public static List<List<Integer>> allWords(int numInputs, int length) {
        List<List<Integer>> words = new ArrayList<>();
        words.add(new ArrayList<>());
        for (int l = 0; l < length; l++) {
            List<List<Integer>> longer = new ArrayList<>(words.size() * numInputs);
            for (List<Integer> word : words) {
                for (int a = 0; a < numInputs; a++) {
                    List<Integer> w = new ArrayList<>(word);
                    w.add(a);
                    longer.add(w);
                }
            }
            words = longer;
        }
        return words;
    }

    /**
     * All words of length at most maxLength, shortest first.
     */
    public static List<List<Integer>> wordsUpTo(int numInputs, int maxLength) {
        List<List<Integer>> words = new ArrayList<>();
        for (int l = 0; l <= maxLength; l++) {
            words.addAll(allWords(numInputs, l));
        }
        return words;
    }

    public static boolean accepts(CompactDFA<Integer> dfa, List<Integer> word) {
        int state = dfa.getIntInitialState();
        for (int a : word) {
            state = dfa.getSuccessor(state, a);
            if (state < 0) {
                return false;
            }
        }
        return dfa.isAccepting(state);
    }

    /**
     * Copy of dfa with undefined transitions sent to a rejecting sink.
     */
    public static CompactDFA<Integer> complete(CompactDFA<Integer> dfa) {
        CompactDFA<Integer> out = new CompactDFA<>(dfa);
        int numInputs = out.getInputAlphabet().size();
        int sink = -1;
        int size = out.size();
        for (int q = 0; q < size; q++) {
            for (int a = 0; a < numInputs; a++) {
                if (out.getSuccessor(q, a) < 0) {
                    if (sink < 0) {
                        sink = out.addState(false);
                        for (int b = 0; b < numInputs; b++) {
                            out.setTransition(sink, b, sink);
                        }
                    }
                    out.setTransition(q, a, sink);
                }
            }
        }
        return out;
    }

    /**
     * Whether some word is accepted from exactly one of p and q; a missing state (-1) accepts nothing.
     */
    public static boolean distinguishable(CoxeterDFA dfa, int p, int q) {
        final int n = dfa.size() + 1; // index n - 1 stands for the missing state
        boolean[] seen = new boolean[n * n];
        List<int[]> queue = new ArrayList<>();
        queue.add(new int[]{p, q});
        seen[index(p, n) * n + index(q, n)] = true;
        for (int head = 0; head < queue.size(); head++) {
            int[] pair = queue.get(head);
            if (acc(dfa, pair[0]) != acc(dfa, pair[1])) {
                return true;
            }
            for (int a = 0; a < dfa.numInputs(); a++) {
                int s = pair[0] < 0 ? -1 : dfa.getSuccessor(pair[0], a);
                int t = pair[1] < 0 ? -1 : dfa.getSuccessor(pair[1], a);
                int key = index(s, n) * n + index(t, n);
                if (!seen[key]) {
                    seen[key] = true;
                    queue.add(new int[]{s, t});
                }
            }
        }
        return false;
    }

    private static int index(int state, int n) {
        return state < 0 ? n - 1 : state;
    }

    private static boolean acc(CoxeterDFA dfa, int state) {
        return state >= 0 && dfa.isAccepting(state);
    }
}
