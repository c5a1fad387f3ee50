package Coxeter.Model;

/**
 * Pending entry of the breadth-first construction: a root set label and the DFA state allocated for it.
 */
public record BuildRecord(RootSet label, int outputAddress) {

  @Override
  public String toString() {
    return outputAddress + ": " + label;
  }
}
