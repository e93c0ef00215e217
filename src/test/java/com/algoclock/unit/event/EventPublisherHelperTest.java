package com.algoclock.unit.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.algoclock.event.EventPublisherHelper;
import com.algoclock.event.ScheduledEventFailedEvent;
import com.algoclock.scheduling.ScheduledEvent;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class EventPublisherHelperTest {

    private static final Instant T0 = Instant.parse("2024-06-03T13:30:00Z");

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private EventPublisherHelper eventPublisherHelper;

    @BeforeEach
    void setUp() {
        eventPublisherHelper = new EventPublisherHelper(applicationEventPublisher);
    }

    @Test
    @DisplayName("Callback failure is published as ScheduledEventFailedEvent")
    void handleErrorPublishesEvent() {
        ScheduledEvent scheduledEvent = new ScheduledEvent("Rebalance", T0, (n, t) -> {});

        eventPublisherHelper.handleError(scheduledEvent, T0, new IllegalArgumentException("bad weight"));

        ArgumentCaptor<ScheduledEventFailedEvent> captor = ArgumentCaptor.forClass(ScheduledEventFailedEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        ScheduledEventFailedEvent published = captor.getValue();
        assertThat(published.getEventName()).isEqualTo("Rebalance");
        assertThat(published.getUtcTime()).isEqualTo(T0);
        assertThat(published.getErrorType()).isEqualTo(IllegalArgumentException.class.getName());
        assertThat(published.getErrorMessage()).isEqualTo("bad weight");
        assertThat(published.getSource()).isSameAs(eventPublisherHelper);
    }
}
