package ru.aritmos.presencegateway.client;

/**
 * Регистрация подписчика. {@link #close()} снимает подписку, повторный вызов - no-op.
 */
@FunctionalInterface
public interface EventSubscription extends AutoCloseable {

    @Override
    void close();
}
