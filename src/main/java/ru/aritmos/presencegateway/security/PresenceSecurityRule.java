package ru.aritmos.presencegateway.security;

import io.micronaut.core.async.publisher.Publishers;
import io.micronaut.http.HttpRequest;
import io.micronaut.security.authentication.Authentication;
import io.micronaut.security.rules.SecuredAnnotationRule;
import io.micronaut.security.rules.SecurityRule;
import io.micronaut.security.rules.SecurityRuleResult;
import jakarta.inject.Singleton;
import org.reactivestreams.Publisher;
import ru.aritmos.presencegateway.config.PresenceSecurityProperties;

/**
 * Глобальное правило доступа по {@code presence.security.mode}.
 *
 * <p>Правило применяется до аннотационных правил @Secured: в режиме OPEN разрешает всё,
 * в режиме REQUIRE_AUTH пускает в admin API только пользователя с ролью {@code presence.security.admin-role}.
 */
@Singleton
public class PresenceSecurityRule implements SecurityRule<HttpRequest<?>> {

    private final PresenceSecurityProperties securityProperties;
    private final SecurityModeAccessEvaluator evaluator;

    public PresenceSecurityRule(PresenceSecurityProperties securityProperties,
                                SecurityModeAccessEvaluator evaluator) {
        this.securityProperties = securityProperties;
        this.evaluator = evaluator;
    }

    @Override
    public Publisher<SecurityRuleResult> check(HttpRequest<?> request, Authentication authentication) {
        String path = request == null ? null : request.getPath();
        SecurityModeAccessEvaluator.Decision decision = evaluator.evaluate(path, securityProperties);
        if (decision == SecurityModeAccessEvaluator.Decision.ALLOW) {
            return Publishers.just(SecurityRuleResult.ALLOWED);
        }
        if (authentication == null) {
            return Publishers.just(SecurityRuleResult.REJECTED);
        }
        String adminRole = securityProperties.getAdminRole();
        if (authentication.getRoles() != null && authentication.getRoles().contains(adminRole)) {
            return Publishers.just(SecurityRuleResult.ALLOWED);
        }
        return Publishers.just(SecurityRuleResult.REJECTED);
    }

    @Override
    public int getOrder() {
        return SecuredAnnotationRule.ORDER - 10;
    }
}
