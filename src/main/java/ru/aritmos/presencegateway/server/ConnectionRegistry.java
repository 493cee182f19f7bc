package ru.aritmos.presencegateway.server;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Реестр живых соединений, проиндексированный по userId.
 * <p>
 * Это единственное разделяемое изменяемое состояние серверной части. Все операции выполняются под одним
 * монитором {@code lock}, критические секции короткие и не выполняют I/O. Чтение возвращает снимки,
 * которые безопасно итерировать параллельно с регистрацией/снятием.
 * <p>
 * Инварианты:
 * <ul>
 *   <li>каждое соединение в реестре открыто (закрытое соединение снимается с регистрации своим слушателем закрытия);</li>
 *   <li>соединение зарегистрировано не более чем под одним userId;</li>
 *   <li>пустые множества не хранятся: последний {@link #unregister(PushConnection)} удаляет запись пользователя.</li>
 * </ul>
 */
@Singleton
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Object lock = new Object();
    private final Map<String, Set<PushConnection>> byUser = new HashMap<>();
    private final Map<PushConnection, String> ownerOf = new IdentityHashMap<>();

    /**
     * Зарегистрировать соединение под пользователем. С этого момента соединение получает рассылки.
     * <p>
     * Повторная регистрация под тем же пользователем - no-op.
     *
     * @return false, если соединение уже закрыто (в реестр не попадает)
     * @throws IllegalStateException если соединение уже зарегистрировано под другим пользователем
     */
    public boolean register(String userId, PushConnection connection) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId обязателен");
        }
        if (connection == null) {
            throw new IllegalArgumentException("connection обязателен");
        }

        int total;
        synchronized (lock) {
            if (connection.isClosed()) {
                return false;
            }
            String current = ownerOf.get(connection);
            if (current != null) {
                if (current.equals(userId)) {
                    return true;
                }
                throw new IllegalStateException("Соединение " + connection.id() + " уже зарегистрировано под другим пользователем");
            }
            ownerOf.put(connection, userId);
            Set<PushConnection> set = byUser.computeIfAbsent(userId, k -> new LinkedHashSet<>());
            set.add(connection);
            total = set.size();
        }

        log.info("[PRESENCE][REGISTRY] Соединение зарегистрировано: userId={}, connectionId={}, connectionsOfUser={}",
                userId, connection.id(), total);
        return true;
    }

    /**
     * Снять соединение с регистрации. Идемпотентно.
     *
     * @return true, если соединение было в реестре
     */
    public boolean unregister(PushConnection connection) {
        if (connection == null) {
            return false;
        }

        String userId;
        int remaining;
        synchronized (lock) {
            userId = ownerOf.remove(connection);
            if (userId == null) {
                return false;
            }
            Set<PushConnection> set = byUser.get(userId);
            if (set == null) {
                remaining = 0;
            } else {
                set.remove(connection);
                remaining = set.size();
                if (set.isEmpty()) {
                    byUser.remove(userId);
                }
            }
        }

        log.info("[PRESENCE][REGISTRY] Соединение снято с регистрации: userId={}, connectionId={}, connectionsOfUser={}, cause={}",
                userId, connection.id(), remaining, connection.closeCause());
        return true;
    }

    /**
     * @return снимок живых соединений пользователя (пустой, если соединений нет)
     */
    public Set<PushConnection> connectionsFor(String userId) {
        if (userId == null) {
            return Set.of();
        }
        synchronized (lock) {
            Set<PushConnection> set = byUser.get(userId);
            return (set == null || set.isEmpty()) ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(set));
        }
    }

    /**
     * @return снимок всех зарегистрированных соединений
     */
    public List<PushConnection> allConnections() {
        synchronized (lock) {
            List<PushConnection> out = new ArrayList<>(ownerOf.size());
            for (Set<PushConnection> set : byUser.values()) {
                out.addAll(set);
            }
            return Collections.unmodifiableList(out);
        }
    }

    public Optional<String> ownerOf(PushConnection connection) {
        synchronized (lock) {
            return Optional.ofNullable(ownerOf.get(connection));
        }
    }

    public boolean hasUser(String userId) {
        synchronized (lock) {
            return byUser.containsKey(userId);
        }
    }

    public Set<String> users() {
        synchronized (lock) {
            return Set.copyOf(byUser.keySet());
        }
    }

    public int userCount() {
        synchronized (lock) {
            return byUser.size();
        }
    }

    public int connectionCount() {
        synchronized (lock) {
            return ownerOf.size();
        }
    }

    /**
     * @return userId → число живых соединений (отсортировано по userId)
     */
    public Map<String, Integer> connectionCountsByUser() {
        synchronized (lock) {
            Map<String, Integer> out = new TreeMap<>();
            byUser.forEach((u, set) -> out.put(u, set.size()));
            return Collections.unmodifiableMap(out);
        }
    }
}
