package com.freightplatform.loadservice.service;

import com.freightplatform.loadservice.dto.event.LoadEventEnvelope;

import java.util.concurrent.CompletableFuture;

public interface LoadEventPublisher {

    CompletableFuture<Void> publish(String topic, LoadEventEnvelope envelope);
}
