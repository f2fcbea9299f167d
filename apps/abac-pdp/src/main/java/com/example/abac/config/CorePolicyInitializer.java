package com.example.abac.config;

import com.example.abac.common.util.StringSanitizer;
import com.example.abac.engine.AbacEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Seeds the core policies once the application is ready. Existing policies are left as they are.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "abac.core-policies.initialize-on-startup", havingValue = "true", matchIfMissing = true)
public class CorePolicyInitializer {

    private final AbacEngine engine;
    private final AbacProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void initializeCorePolicies() {
        String actor = properties.getCorePolicies().getSystemActorId();
        engine.initializeCorePolicies(actor)
                .count()
                .subscribe(
                        count -> log.info("Core policies ready ({} present)", count),
                        error -> log.error("Core policy initialization failed: {}",
                                StringSanitizer.forLog(error.getMessage(), 200), error));
    }
}
