package Coxeter.Registry;

import Coxeter.Model.RootSet;

/**
 * Maps state labels to the DFA state created for them, so each distinct label gets exactly one state.
 */
public interface Registry {
    int MISSING_ELEMENT = -1;

    /**
     * Get the state ID registered for a label.
     * @param label root set label
     * @return state ID or MISSING_ELEMENT if the label has not been seen.
     */
    int get(RootSet label);

    /**
     * Register a new label with its (fixed) state ID.
     * @param label root set label, not registered yet
     * @param stateID state ID
     */
    void put(RootSet label, int stateID);

    /**
     * Number of registered labels.
     */
    int size();
}
