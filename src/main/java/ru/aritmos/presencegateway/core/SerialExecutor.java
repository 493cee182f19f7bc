package ru.aritmos.presencegateway.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Последовательный исполнитель поверх общего пула.
 * <p>
 * Задачи выполняются строго по одной и в порядке постановки, но без выделения отдельного потока.
 * Ошибка одной задачи логируется и не останавливает очередь.
 */
public final class SerialExecutor implements Executor {

    private static final Logger log = LoggerFactory.getLogger(SerialExecutor.class);

    private final Executor delegate;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean running = new AtomicBoolean();

    public SerialExecutor(Executor delegate) {
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable task) {
        tasks.add(task);
        schedule();
    }

    private void schedule() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            delegate.execute(this::drain);
        } catch (RejectedExecutionException e) {
            running.set(false);
            tasks.clear();
            throw e;
        }
    }

    private void drain() {
        Runnable task;
        while ((task = tasks.poll()) != null) {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("Ошибка задачи последовательной очереди: {}", SensitiveDataSanitizer.sanitizeText(e.getMessage()));
            }
        }
        running.set(false);
        if (!tasks.isEmpty()) {
            schedule();
        }
    }
}
