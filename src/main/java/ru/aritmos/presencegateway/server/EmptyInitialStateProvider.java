package ru.aritmos.presencegateway.server;

import jakarta.inject.Singleton;
import ru.aritmos.presencegateway.model.EventEnvelope;
import ru.aritmos.presencegateway.model.IdentityClaim;

import java.util.List;

/**
 * Реализация по умолчанию: без начального снимка.
 */
@Singleton
public class EmptyInitialStateProvider implements InitialStateProvider {

    @Override
    public List<EventEnvelope> initialState(IdentityClaim claim) {
        return List.of();
    }
}
