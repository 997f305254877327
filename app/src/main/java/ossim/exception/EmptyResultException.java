package ossim.exception;

/**
 * Thrown when statistics are requested before any task has completed.
 */
public class EmptyResultException extends SimulationException {
    public EmptyResultException(String message) {
        super(message);
    }
}
