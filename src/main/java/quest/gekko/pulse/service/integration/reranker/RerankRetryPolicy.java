package quest.gekko.pulse.service.integration.reranker;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import quest.gekko.pulse.exception.RerankerException;

import java.util.random.RandomGenerator;

/**
 * Retry schedule for oracle calls: exponential backoff with additive jitter, only for errors flagged
 * retryable (HTTP 429, 5xx and transient I/O).
 */
public record RerankRetryPolicy(int maxAttempts, long baseDelayMillis, double factor, long maxJitterMillis) {

    public static final RerankRetryPolicy DEFAULT = new RerankRetryPolicy(3, 250, 2.0, 120);

    /** Delay before retry number {@code attempt} (1 based): {@code base * factor^(attempt-1) + jitter}. */
    public long delayMillis(int attempt, RandomGenerator random) {
        long exp = (long) (baseDelayMillis * Math.pow(factor, Math.max(0, attempt - 1)));
        long jitter = maxJitterMillis <= 0 ? 0 : random.nextLong(maxJitterMillis + 1);
        return exp + jitter;
    }

    public boolean shouldRetry(Throwable t) {
        return t instanceof RerankerException re && re.isRetryable();
    }

    public RetryTemplate newTemplate(RandomGenerator random, Sleeper sleeper) {
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(maxAttempts) {
            @Override
            public boolean canRetry(RetryContext context) {
                Throwable last = context.getLastThrowable();
                return (last == null || shouldRetry(last)) && context.getRetryCount() < getMaxAttempts();
            }
        };
        return RetryTemplate.builder()
                .customPolicy(retryPolicy)
                .customBackoff(new JitteredBackOff(random, sleeper))
                .build();
    }

    private record Attempts(RetryContext retryContext) implements BackOffContext {}

    private class JitteredBackOff implements BackOffPolicy {
        private final RandomGenerator random;
        private final Sleeper sleeper;

        JitteredBackOff(RandomGenerator random, Sleeper sleeper) {
            this.random = random;
            this.sleeper = sleeper;
        }

        @Override
        public BackOffContext start(RetryContext context) {
            return new Attempts(context);
        }

        @Override
        public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
            int attempt = ((Attempts) backOffContext).retryContext().getRetryCount();
            try {
                sleeper.sleep(delayMillis(attempt, random));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackOffInterruptedException("Interrupted during reranker backoff", e);
            }
        }
    }
}
