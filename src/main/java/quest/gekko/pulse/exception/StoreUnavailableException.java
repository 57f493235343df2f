package quest.gekko.pulse.exception;

public class StoreUnavailableException extends PulseException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
