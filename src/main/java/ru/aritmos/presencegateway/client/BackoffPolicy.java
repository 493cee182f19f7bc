package ru.aritmos.presencegateway.client;

import ru.aritmos.presencegateway.config.PresenceClientProperties;

import java.time.Duration;

/**
 * Политика экспоненциальной задержки переподключения.
 * <p>
 * Задержка перед повтором №{@code n} (n ≥ 1): {@code baseDelay * 2^(n-1)}, но не больше {@code maxDelay}.
 * После {@code maxAttempts} неудач подряд попытки считаются исчерпанными.
 */
public record BackoffPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {

    public BackoffPolicy {
        if (baseDelay == null || baseDelay.isZero() || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay должен быть > 0");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            maxDelay = baseDelay;
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts должен быть > 0");
        }
    }

    public static BackoffPolicy from(PresenceClientProperties props) {
        return new BackoffPolicy(props.getBaseDelay(), props.getMaxDelay(), props.getMaxAttempts());
    }

    /**
     * @param retryCount число неудач подряд (после инкремента), от 1
     */
    public Duration delayFor(int retryCount) {
        int shift = Math.min(20, Math.max(0, retryCount - 1));
        long millis = baseDelay.toMillis() * (1L << shift);
        long max = maxDelay.toMillis();
        return Duration.ofMillis(Math.min(millis, max));
    }

    public boolean isExhausted(int retryCount) {
        return retryCount >= maxAttempts;
    }
}
