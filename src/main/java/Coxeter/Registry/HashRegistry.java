package Coxeter.Registry;

import Coxeter.Model.RootSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

public class HashRegistry implements Registry {
    private final Object2IntMap<RootSet> label2State;

    public HashRegistry() {
        this.label2State = new Object2IntOpenHashMap<>();
        this.label2State.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
    }

    @Override
    public int get(RootSet label) {
        return label2State.getInt(label);
    }

    @Override
    public void put(RootSet label, int stateID) {
        if (stateID < 0) {
            throw new IllegalArgumentException("negative state ID " + stateID + " for " + label);
        }
        int previous = label2State.put(label, stateID);
        if (previous != MISSING_ELEMENT) {
            throw new IllegalStateException("label " + label + " already registered to state " + previous);
        }
    }

    @Override
    public int size() {
        return label2State.size();
    }

    @Override
    public String toString() {
        return "Hash";
    }
}
