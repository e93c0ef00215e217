package com.algoclock.event;

import com.algoclock.scheduling.ScheduledEvent;
import com.algoclock.scheduling.ScheduledEventErrorHandler;
import java.time.Instant;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} with typed factory methods for
 * the scheduler's application events.
 *
 * <p>Also serves as the live scheduler's {@link ScheduledEventErrorHandler}: every callback
 * failure becomes a {@link ScheduledEventFailedEvent}.
 */
@Component
public class EventPublisherHelper implements ScheduledEventErrorHandler {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishScheduledEventFailed(Object source, String eventName, Instant utcTime, Throwable error) {
        applicationEventPublisher.publishEvent(new ScheduledEventFailedEvent(source, eventName, utcTime, error));
    }

    @Override
    public void handleError(ScheduledEvent scheduledEvent, Instant utcTime, Throwable error) {
        publishScheduledEventFailed(this, scheduledEvent.getName(), utcTime, error);
    }
}
