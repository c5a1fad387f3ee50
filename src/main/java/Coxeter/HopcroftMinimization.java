package Coxeter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Minimizes a {@link CoxeterDFA} with Hopcroft's partition refinement, in O(n k log n) for n states and k symbols.
 * <p>
 * Undefined transitions are routed to an artificial, non-accepting sink state while refining. The sink is never
 * materialized: transitions into its block stay undefined in the result.
 */
public class HopcroftMinimization {

    private HopcroftMinimization() {}

    private static void prefixSum(int[] array, int startInclusive, int endExclusive) {
        for (int i = startInclusive + 1; i < endExclusive; i++) {
            array[i] += array[i - 1];
        }
    }

    /**
     * Computes the minimal automaton accepting the same words. The input is not modified.
     * @param dfa - automaton to minimize
     * @return - a new automaton whose states are the Myhill-Nerode classes of the input's states
     */
    public static CoxeterDFA minimize(CoxeterDFA dfa) {
        final int numStates = dfa.size();
        final int numInputs = dfa.numInputs();
        final boolean partial = !dfa.isComplete();
        final int sinkId = numStates;
        final int numStatesWithSink = partial ? numStates + 1 : numStates;

        // succData[j * numStatesWithSink + q] is the successor of q under j
        final int[] succData = new int[numInputs * numStatesWithSink];
        // predecessors of t under j are predData[predOfsData[j * numStatesWithSink + t] .. predOfsData[.. + 1])
        final int[] predOfsData = new int[numInputs * numStatesWithSink + 1];
        final int[] predData = new int[numInputs * numStatesWithSink];

        initTransitions(dfa, numInputs, numStatesWithSink, sinkId, succData, predOfsData, predData);

        final int[] blockOf = new int[numStatesWithSink];
        final List<IntArrayList> blocks = new ArrayList<>();
        final IntArrayList worklist = new IntArrayList();
        final BitSet inWorklist = new BitSet();

        initPartition(dfa, numStates, numStatesWithSink, blockOf, blocks, worklist, inWorklist);

        refine(numInputs, numStatesWithSink, predOfsData, predData, blockOf, blocks, worklist, inWorklist);

        return rebuild(dfa, numInputs, numStatesWithSink, partial ? sinkId : -1, succData, blockOf, blocks);
    }

    private static void initTransitions(CoxeterDFA dfa, int numInputs, int numStatesWithSink, int sinkId,
                                        int[] succData, int[] predOfsData, int[] predData) {
        int base = 0;
        for (int j = 0; j < numInputs; j++) {
            for (int q = 0; q < numStatesWithSink; q++) {
                int succ = q == sinkId ? sinkId : dfa.getSuccessor(q, j);
                if (succ == CoxeterDFA.NO_TRANSITION) {
                    succ = sinkId;
                }
                succData[base + q] = succ;
                predOfsData[base + succ + 1]++; // count, shifted by one bucket
            }
            base += numStatesWithSink;
        }

        // predOfsData[b] now holds the start of bucket b
        prefixSum(predOfsData, 0, predOfsData.length);

        final int[] fill = Arrays.copyOf(predOfsData, predOfsData.length - 1);
        base = 0;
        for (int j = 0; j < numInputs; j++) {
            for (int q = 0; q < numStatesWithSink; q++) {
                predData[fill[base + succData[base + q]]++] = q;
            }
            base += numStatesWithSink;
        }
    }

    private static void initPartition(CoxeterDFA dfa, int numStates, int numStatesWithSink, int[] blockOf,
                                      List<IntArrayList> blocks, IntArrayList worklist, BitSet inWorklist) {
        final IntArrayList accepting = new IntArrayList();
        final IntArrayList rejecting = new IntArrayList(); // includes the sink
        for (int q = 0; q < numStatesWithSink; q++) {
            if (q < numStates && dfa.isAccepting(q)) {
                accepting.add(q);
            } else {
                rejecting.add(q);
            }
        }

        if (accepting.isEmpty() || rejecting.isEmpty()) {
            // all states agree on acceptance: one block, which seeds the worklist
            final int only = addBlock(blocks, blockOf, accepting.isEmpty() ? rejecting : accepting);
            enqueue(worklist, inWorklist, only);
        } else {
            final int acc = addBlock(blocks, blockOf, accepting);
            final int rej = addBlock(blocks, blockOf, rejecting);
            enqueue(worklist, inWorklist, accepting.size() <= rejecting.size() ? acc : rej);
        }
    }

    private static void refine(int numInputs, int numStatesWithSink, int[] predOfsData, int[] predData,
                               int[] blockOf, List<IntArrayList> blocks, IntArrayList worklist, BitSet inWorklist) {
        final BitSet moving = new BitSet(numStatesWithSink);

        while (!worklist.isEmpty()) {
            final int splitterId = worklist.popInt();
            inWorklist.clear(splitterId);
            // the splitter block may itself be split below, so iterate over a copy
            final int[] splitter = blocks.get(splitterId).toIntArray();

            int predBase = 0;
            for (int j = 0; j < numInputs; j++) {
                // for each block holding a j-predecessor of the splitter, the predecessors it holds
                final Int2ObjectMap<IntArrayList> touched = new Int2ObjectLinkedOpenHashMap<>();
                for (int a : splitter) {
                    for (int idx = predOfsData[predBase + a]; idx < predOfsData[predBase + a + 1]; idx++) {
                        final int x = predData[idx];
                        final int y = blockOf[x];
                        IntArrayList y1 = touched.get(y);
                        if (y1 == null) {
                            y1 = new IntArrayList();
                            touched.put(y, y1);
                        }
                        y1.add(x);
                    }
                }

                for (Int2ObjectMap.Entry<IntArrayList> entry : touched.int2ObjectEntrySet()) {
                    final int y = entry.getIntKey();
                    final IntArrayList y1 = entry.getValue();
                    final IntArrayList members = blocks.get(y);
                    if (y1.size() == members.size()) {
                        continue; // whole block moves into the splitter, nothing to split
                    }
                    splitBlock(y, y1, members, blockOf, blocks, worklist, inWorklist, moving);
                }
                predBase += numStatesWithSink;
            }
        }
    }

    /**
     * Replace block y by Y1 (the states in {@code y1}, under a new block ID) and Y2 (the rest, keeping ID y).
     */
    private static void splitBlock(int y, IntArrayList y1, IntArrayList members, int[] blockOf,
                                   List<IntArrayList> blocks, IntArrayList worklist, BitSet inWorklist,
                                   BitSet moving) {
        for (int i = 0; i < y1.size(); i++) {
            moving.set(y1.getInt(i));
        }
        final IntArrayList y2 = new IntArrayList(members.size() - y1.size());
        for (int i = 0; i < members.size(); i++) {
            final int x = members.getInt(i);
            if (!moving.get(x)) {
                y2.add(x);
            }
        }
        moving.clear();

        blocks.set(y, y2);
        final int newId = addBlock(blocks, blockOf, y1);

        if (inWorklist.get(y)) {
            // y stays queued for Y2, Y1 joins it
            enqueue(worklist, inWorklist, newId);
        } else {
            enqueue(worklist, inWorklist, y1.size() <= y2.size() ? newId : y);
        }
    }

    private static CoxeterDFA rebuild(CoxeterDFA dfa, int numInputs, int numStatesWithSink, int sinkId,
                                      int[] succData, int[] blockOf, List<IntArrayList> blocks) {
        final int startBlock = blockOf[dfa.getInitialState()];
        final int sinkBlock = sinkId < 0 ? -1 : blockOf[sinkId];
        final CompactDFA<Integer> out = new CompactDFA<>(dfa.getInputAlphabet(), blocks.size());

        if (startBlock == sinkBlock) {
            // the initial state accepts nothing
            out.addInitialState(false);
            return CoxeterDFA.construct(out);
        }

        final int[] blockToOut = new int[blocks.size()];
        Arrays.fill(blockToOut, -1);
        final Deque<Integer> stack = new ArrayDeque<>();

        blockToOut[startBlock] = out.addInitialState(dfa.isAccepting(representative(blocks, startBlock)));
        stack.push(startBlock);

        while (!stack.isEmpty()) {
            final int block = stack.pop();
            final int rep = representative(blocks, block);
            int base = 0;
            for (int j = 0; j < numInputs; j++) {
                final int targetBlock = blockOf[succData[base + rep]];
                base += numStatesWithSink;
                if (targetBlock == sinkBlock) {
                    continue; // rejects from here on, leave undefined
                }
                if (blockToOut[targetBlock] < 0) {
                    final boolean acc = dfa.isAccepting(representative(blocks, targetBlock));
                    blockToOut[targetBlock] = out.addState(acc);
                    stack.push(targetBlock);
                }
                CoxeterDFA.setTransitionOnce(out, blockToOut[block], j, blockToOut[targetBlock]);
            }
        }

        return CoxeterDFA.construct(out);
    }

    private static int representative(List<IntArrayList> blocks, int block) {
        return blocks.get(block).getInt(0);
    }

    private static int addBlock(List<IntArrayList> blocks, int[] blockOf, IntArrayList members) {
        final int id = blocks.size();
        blocks.add(members);
        for (int i = 0; i < members.size(); i++) {
            blockOf[members.getInt(i)] = id;
        }
        return id;
    }

    private static void enqueue(IntArrayList worklist, BitSet inWorklist, int block) {
        if (!inWorklist.get(block)) {
            inWorklist.set(block);
            worklist.add(block);
        }
    }
}
