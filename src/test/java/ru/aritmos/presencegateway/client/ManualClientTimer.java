package ru.aritmos.presencegateway.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Таймер, который срабатывает только по команде теста.
 */
final class ManualClientTimer implements ClientTimer {

    final List<Task> scheduled = new ArrayList<>();

    @Override
    public synchronized Handle schedule(Duration delay, Runnable task) {
        Task t = new Task(delay, task);
        scheduled.add(t);
        return t::cancel;
    }

    synchronized List<Task> pending() {
        return scheduled.stream().filter(Task::isPending).toList();
    }

    /**
     * Последняя ещё не сработавшая задача с указанной задержкой.
     */
    synchronized Task pending(Duration delay) {
        List<Task> matching = pending().stream().filter(t -> t.delay.equals(delay)).toList();
        if (matching.isEmpty()) {
            throw new AssertionError("нет ожидающего таймера на " + delay + ", есть: " + pending());
        }
        return matching.get(matching.size() - 1);
    }

    static final class Task {
        final Duration delay;
        final Runnable action;
        volatile boolean cancelled;
        volatile boolean fired;

        Task(Duration delay, Runnable action) {
            this.delay = delay;
            this.action = action;
        }

        void cancel() {
            cancelled = true;
        }

        boolean isPending() {
            return !cancelled && !fired;
        }

        void fire() {
            if (isPending()) {
                fired = true;
                action.run();
            }
        }

        /**
         * Выполнить задачу даже после отмены: имитирует гонку «таймер уже сработал, отмена опоздала».
         */
        void fireIgnoringCancel() {
            fired = true;
            action.run();
        }

        @Override
        public String toString() {
            return "Task[" + delay + (cancelled ? ", cancelled" : "") + (fired ? ", fired" : "") + "]";
        }
    }
}
