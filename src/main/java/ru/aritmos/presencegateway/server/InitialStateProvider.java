package ru.aritmos.presencegateway.server;

import ru.aritmos.presencegateway.model.EventEnvelope;
import ru.aritmos.presencegateway.model.IdentityClaim;

import java.util.List;

/**
 * Источник начального снимка состояния, который отправляется сразу после успешного handshake.
 * <p>
 * Реализуется доменным слоем: пациенту обычно нужен список {@code appointments}, врачу - {@code doctorData}.
 * Метод вызывается на IO-пуле и может обращаться к хранилищу.
 */
public interface InitialStateProvider {

    List<EventEnvelope> initialState(IdentityClaim claim);
}
