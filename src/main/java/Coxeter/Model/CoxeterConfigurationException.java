package Coxeter.Model;

/**
 * Raised when the input describing a Coxeter group, or the automaton requested from it, is malformed.
 * Always thrown before any automaton state is created.
 */
public class CoxeterConfigurationException extends IllegalArgumentException {

    public CoxeterConfigurationException(String message) {
        super(message);
    }

    public CoxeterConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
