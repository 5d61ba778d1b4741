package com.freightplatform.loadservice;

import com.freightplatform.loadservice.dto.event.LoadEventEnvelope;
import com.freightplatform.loadservice.service.LoadEventDispatcher;
import com.freightplatform.loadservice.service.LoadEventFactory;
import com.freightplatform.loadservice.service.LoadEventPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionSynchronizationUtils;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LoadEventDispatcherTest {

    private static final String TOPIC = "load.events";

    @Mock
    private LoadEventPublisher publisher;

    private LoadEventDispatcher dispatcher;
    private LoadEventEnvelope envelope;

    @BeforeEach
    void setUp() {
        dispatcher = new LoadEventDispatcher(publisher, TOPIC);
        envelope = new LoadEventFactory("load-service", "1.0").loadDeleted(UUID.randomUUID());
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("Inside a transaction nothing is sent until commit")
    void sendsAfterCommit() {
        when(publisher.publish(TOPIC, envelope)).thenReturn(CompletableFuture.completedFuture(null));
        TransactionSynchronizationManager.initSynchronization();

        dispatcher.dispatchAfterCommit(envelope);
        verifyNoInteractions(publisher);

        TransactionSynchronizationUtils.triggerAfterCommit();
        verify(publisher).publish(TOPIC, envelope);
    }

    @Test
    @DisplayName("A rolled back transaction sends nothing")
    void rollbackSendsNothing() {
        TransactionSynchronizationManager.initSynchronization();

        dispatcher.dispatchAfterCommit(envelope);
        TransactionSynchronizationUtils.triggerAfterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK);

        verifyNoInteractions(publisher);
    }

    @Test
    void sendsImmediatelyWithoutTransaction() {
        when(publisher.publish(TOPIC, envelope)).thenReturn(CompletableFuture.completedFuture(null));

        dispatcher.dispatchAfterCommit(envelope);

        verify(publisher).publish(TOPIC, envelope);
    }

    @Test
    @DisplayName("Publish failures never reach the caller")
    void failuresAreSwallowed() {
        when(publisher.publish(anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")))
                .thenThrow(new IllegalStateException("producer closed"));

        assertThatCode(() -> dispatcher.dispatchAfterCommit(envelope)).doesNotThrowAnyException();
        assertThatCode(() -> dispatcher.dispatchAfterCommit(envelope)).doesNotThrowAnyException();

        verify(publisher, times(2)).publish(TOPIC, envelope);
    }
}
