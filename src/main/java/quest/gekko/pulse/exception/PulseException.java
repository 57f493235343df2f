package quest.gekko.pulse.exception;

/**
 * Root of the engine's unchecked exceptions.
 */
public class PulseException extends RuntimeException {
    public PulseException(String message) {
        super(message);
    }

    public PulseException(String message, Throwable cause) {
        super(message, cause);
    }
}
