package com.modelrouter.config;

import com.modelrouter.service.BackendRegistry;
import com.modelrouter.service.TierPolicyResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RouterProperties.class)
@Slf4j
public class RouterConfig {

    @Bean
    public Clock routerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackendRegistry backendRegistry(RouterProperties properties) {
        BackendRegistry registry = new BackendRegistry(properties.toModelBackends());
        log.info("Registered {} model backends: {}", registry.all().size(), registry.ids());
        return registry;
    }

    @Bean
    public TierPolicyResolver tierPolicyResolver(RouterProperties properties, BackendRegistry backendRegistry) {
        TierPolicyResolver resolver = new TierPolicyResolver(properties.toTierPolicies());
        resolver.underpricedBackends(backendRegistry).forEach((tier, ids) ->
                log.warn("Tier {} price {} is below the cost of backends {}: requests they serve will run at a loss",
                        tier.getCode(), resolver.priceFor(tier), ids));
        return resolver;
    }
}
