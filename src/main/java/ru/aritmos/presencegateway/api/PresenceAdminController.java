package ru.aritmos.presencegateway.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.micronaut.core.annotation.Introspected;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.security.annotation.Secured;
import io.micronaut.security.rules.SecurityRule;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.presencegateway.server.ConnectionRegistry;
import ru.aritmos.presencegateway.server.NotificationTarget;
import ru.aritmos.presencegateway.server.PresenceNotifier;

import java.util.Map;

/**
 * Admin API: состояние реестра соединений и ручная отправка уведомлений.
 * <p>
 * Требуемая роль задаётся {@code presence.security.admin-role} и проверяется {@code PresenceSecurityRule}.
 */
@Secured(SecurityRule.IS_AUTHENTICATED)
@Controller("/admin/presence")
@Tag(name = "Presence Gateway: Admin API", description = "Диагностика push-канала и ручные уведомления")
public class PresenceAdminController {

    private static final Logger log = LoggerFactory.getLogger(PresenceAdminController.class);

    private final ConnectionRegistry registry;
    private final PresenceNotifier notifier;

    public PresenceAdminController(ConnectionRegistry registry, PresenceNotifier notifier) {
        this.registry = registry;
        this.notifier = notifier;
    }

    @Get(uri = "/connections")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Получить сводку живых соединений")
    @ApiResponse(responseCode = "200", description = "Сводка реестра", content = @Content(schema = @Schema(implementation = ConnectionsResponse.class)))
    public ConnectionsResponse connections() {
        return new ConnectionsResponse(registry.userCount(), registry.connectionCount(), registry.connectionCountsByUser());
    }

    @Post(uri = "/notify")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Отправить уведомление пользователю или всем подключённым")
    @ApiResponse(responseCode = "200", description = "Уведомление поставлено в очереди соединений", content = @Content(schema = @Schema(implementation = NotifyResponse.class)))
    @ApiResponse(responseCode = "400", description = "Не указан target или kind")
    public HttpResponse<NotifyResponse> notify(@Body NotifyRequest request) {
        if (request == null || request.kind() == null || request.kind().isBlank()
                || request.target() == null || request.target().isBlank()) {
            return HttpResponse.badRequest();
        }
        NotificationTarget target = NotificationTarget.parse(request.target());
        int delivered = notifier.notify(target, request.kind(), request.payload());
        log.info("[PRESENCE][ADMIN] Ручное уведомление: target={}, kind={}, delivered={}", request.target(), request.kind(), delivered);
        return HttpResponse.ok(new NotifyResponse(delivered));
    }

    @Introspected
    @Schema(name = "PresenceConnectionsResponse", description = "Сводка реестра соединений")
    public record ConnectionsResponse(
            @Schema(description = "Число пользователей с живыми соединениями") int users,
            @Schema(description = "Общее число зарегистрированных соединений") int connections,
            @Schema(description = "userId → число соединений") Map<String, Integer> byUser
    ) {
    }

    @Introspected
    @Schema(name = "PresenceNotifyRequest", description = "Запрос на отправку уведомления")
    public record NotifyRequest(
            @Schema(description = "\"all\" или userId", requiredMode = Schema.RequiredMode.REQUIRED) String target,
            @Schema(description = "Тип события", requiredMode = Schema.RequiredMode.REQUIRED) String kind,
            @Schema(description = "Полезная нагрузка") JsonNode payload
    ) {
    }

    @Introspected
    @Schema(name = "PresenceNotifyResponse", description = "Результат отправки")
    public record NotifyResponse(
            @Schema(description = "Число соединений, в которые поставлено событие") int delivered
    ) {
    }
}
