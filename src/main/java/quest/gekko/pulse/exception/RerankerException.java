package quest.gekko.pulse.exception;

import lombok.Getter;

/**
 * Failed call to the reranking oracle. {@code status} is 0 when no HTTP response was received.
 */
@Getter
public class RerankerException extends PulseException {
    private final int status;
    private final boolean retryable;

    public RerankerException(int status, boolean retryable, String message) {
        super(message);
        this.status = status;
        this.retryable = retryable;
    }

    public RerankerException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.status = 0;
        this.retryable = retryable;
    }

    public static RerankerException forStatus(int status, String body) {
        boolean retry = status == 429 || status >= 500;
        return new RerankerException(status, retry, "Reranker HTTP " + status + ": " + abbreviate(body));
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
