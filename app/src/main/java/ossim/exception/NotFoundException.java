package ossim.exception;

public class NotFoundException extends SimulationException {
    public NotFoundException(String message) {
        super(message);
    }
}
