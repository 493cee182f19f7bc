package ru.aritmos.presencegateway.server;

import ru.aritmos.presencegateway.model.EventEnvelope;

/**
 * Обработчик команды, присланной клиентом после handshake
 * (например, {@code updateDoctorStatus}, {@code updateAppointment}).
 * <p>
 * Бин регистрируется на один {@link #kind()}. Вызывается на IO-пуле.
 */
public interface ClientCommandHandler {

    String kind();

    void handle(String userId, EventEnvelope command);
}
