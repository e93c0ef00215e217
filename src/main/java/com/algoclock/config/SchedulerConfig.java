package com.algoclock.config;

import com.algoclock.algorithm.SecurityRegistry;
import com.algoclock.calendar.ExchangeCalendarService;
import com.algoclock.domain.model.Security;
import com.algoclock.event.EventPublisherHelper;
import com.algoclock.observability.SchedulerMetrics;
import com.algoclock.scheduling.LiveEventScheduler;
import com.algoclock.scheduling.ScheduleManager;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the live scheduling stack.
 *
 * <p>The {@link LiveEventScheduler} bean is a {@code SmartLifecycle}: Spring starts its sampler
 * once the context is refreshed and stops it on shutdown. Callback failures are published as
 * application events through {@link EventPublisherHelper}.
 */
@Configuration
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecurityRegistry securityRegistry(
            SchedulerProperties schedulerProperties, ExchangeCalendarService exchangeCalendarService) {
        SecurityRegistry securityRegistry = new SecurityRegistry();
        for (Map.Entry<String, String> entry : schedulerProperties.getSecurities().entrySet()) {
            securityRegistry.add(Security.builder()
                    .symbol(entry.getKey())
                    .exchangeHours(exchangeCalendarService.getExchangeHours(entry.getValue()))
                    .build());
        }
        log.info("Registered {} securities at startup", securityRegistry.size());
        return securityRegistry;
    }

    @Bean
    public LiveEventScheduler liveEventScheduler(
            Clock clock,
            SchedulerProperties schedulerProperties,
            EventPublisherHelper eventPublisherHelper,
            SchedulerMetrics schedulerMetrics) {
        LiveEventScheduler liveEventScheduler = new LiveEventScheduler(
                clock,
                schedulerProperties.getLive().getScanInterval(),
                schedulerProperties.getLive().getStopTimeout(),
                eventPublisherHelper,
                schedulerMetrics);
        schedulerMetrics.bindScheduler(liveEventScheduler);
        return liveEventScheduler;
    }

    @Bean
    public ScheduleManager scheduleManager(
            LiveEventScheduler liveEventScheduler,
            SecurityRegistry securityRegistry,
            Clock clock,
            SchedulerProperties schedulerProperties) {
        return new ScheduleManager(
                liveEventScheduler,
                securityRegistry,
                ZoneId.of(schedulerProperties.getTimeZone()),
                clock,
                schedulerProperties);
    }
}
