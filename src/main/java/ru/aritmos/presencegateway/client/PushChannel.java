package ru.aritmos.presencegateway.client;

/**
 * Открытый клиентский транспорт push-канала.
 */
public interface PushChannel {

    /**
     * @return false, если кадр не принят транспортом (канал закрыт)
     */
    boolean send(String frame);

    void disconnect();

    boolean isOpen();
}
