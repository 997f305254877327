package ossim.exception;

/**
 * Base class for recoverable failures reported by the simulation engines.
 */
public class SimulationException extends Exception {
    public SimulationException(String message) {
        super(message);
    }
}
