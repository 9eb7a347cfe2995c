package me.golemcore.runtime.adapter.inbound.confirmation;

import me.golemcore.runtime.domain.model.ConfirmationCallbackEvent;
import me.golemcore.runtime.domain.model.bus.ToolConfirmationResponse;
import me.golemcore.runtime.infrastructure.event.MessageBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ConfirmationCallbackListenerTest {

    private MessageBus messageBus;
    private ConfirmationCallbackListener listener;

    @BeforeEach
    void setUp() {
        messageBus = mock(MessageBus.class);
        listener = new ConfirmationCallbackListener(messageBus);
    }

    @Test
    void shouldPublishAuthoritativeApproval() {
        listener.onConfirmationCallback(new ConfirmationCallbackEvent("corr-1", true));

        ArgumentCaptor<ToolConfirmationResponse> captor = ArgumentCaptor.forClass(ToolConfirmationResponse.class);
        verify(messageBus).publish(captor.capture());
        assertEquals("corr-1", captor.getValue().getCorrelationId());
        assertTrue(captor.getValue().isConfirmed());
        assertFalse(captor.getValue().isProvisional());
    }

    @Test
    void shouldPublishDenial() {
        listener.onConfirmationCallback(new ConfirmationCallbackEvent("corr-2", false));

        ArgumentCaptor<ToolConfirmationResponse> captor = ArgumentCaptor.forClass(ToolConfirmationResponse.class);
        verify(messageBus).publish(captor.capture());
        assertFalse(captor.getValue().isConfirmed());
    }

    @Test
    void shouldIgnoreCallbackWithoutCorrelationId() {
        listener.onConfirmationCallback(new ConfirmationCallbackEvent(" ", true));
        listener.onConfirmationCallback(new ConfirmationCallbackEvent(null, true));

        verify(messageBus, never()).publish(any());
    }
}
