package ru.aritmos.presencegateway.security;

import io.micronaut.http.HttpRequest;
import io.micronaut.security.authentication.Authentication;
import io.micronaut.security.rules.SecurityRuleResult;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import ru.aritmos.presencegateway.config.PresenceSecurityProperties;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PresenceSecurityRuleTest {

    @Test
    void shouldAllowAdminApiInOpenMode() {
        PresenceSecurityRule rule = new PresenceSecurityRule(new PresenceSecurityProperties(), new SecurityModeAccessEvaluator());

        assertEquals(SecurityRuleResult.ALLOWED, single(rule.check(HttpRequest.GET("/admin/presence/connections"), null)));
    }

    @Test
    void shouldRejectAnonymousAdminRequestWhenAuthRequired() {
        PresenceSecurityProperties props = new PresenceSecurityProperties();
        props.setMode(PresenceSecurityProperties.Mode.REQUIRE_AUTH);
        PresenceSecurityRule rule = new PresenceSecurityRule(props, new SecurityModeAccessEvaluator());

        assertEquals(SecurityRuleResult.REJECTED, single(rule.check(HttpRequest.GET("/admin/presence/connections"), null)));
        assertEquals(SecurityRuleResult.ALLOWED, single(rule.check(HttpRequest.GET("/ws"), null)));
    }

    @Test
    void shouldAllowAdminApiOnlyForConfiguredRole() {
        PresenceSecurityProperties props = new PresenceSecurityProperties();
        props.setMode(PresenceSecurityProperties.Mode.REQUIRE_AUTH);
        PresenceSecurityRule rule = new PresenceSecurityRule(props, new SecurityModeAccessEvaluator());

        assertEquals(SecurityRuleResult.ALLOWED, single(rule.check(HttpRequest.GET("/admin/presence/notify"),
                Authentication.build("ops", List.of("PRESENCE_ADMIN")))));
        assertEquals(SecurityRuleResult.REJECTED, single(rule.check(HttpRequest.GET("/admin/presence/notify"),
                Authentication.build("doctor", List.of("DOCTOR")))));
    }

    @Test
    void shouldUseAdminRoleFromConfiguration() {
        PresenceSecurityProperties props = new PresenceSecurityProperties();
        props.setMode(PresenceSecurityProperties.Mode.REQUIRE_AUTH);
        props.setAdminRole(" OPS ");
        PresenceSecurityRule rule = new PresenceSecurityRule(props, new SecurityModeAccessEvaluator());

        assertEquals(SecurityRuleResult.ALLOWED, single(rule.check(HttpRequest.GET("/admin/presence/connections"),
                Authentication.build("ops", List.of("OPS")))));
        assertEquals(SecurityRuleResult.REJECTED, single(rule.check(HttpRequest.GET("/admin/presence/connections"),
                Authentication.build("ops", List.of("PRESENCE_ADMIN")))));
    }

    private SecurityRuleResult single(Publisher<SecurityRuleResult> publisher) {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<SecurityRuleResult> ref = new AtomicReference<>();

        publisher.subscribe(new Subscriber<>() {
            @Override
            public void onSubscribe(Subscription s) {
                s.request(1);
            }

            @Override
            public void onNext(SecurityRuleResult securityRuleResult) {
                ref.set(securityRuleResult);
            }

            @Override
            public void onError(Throwable t) {
                latch.countDown();
            }

            @Override
            public void onComplete() {
                latch.countDown();
            }
        });

        try {
            latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            throw new IllegalStateException("Interrupted while waiting SecurityRule result", e);
        }
        return ref.get();
    }
}
