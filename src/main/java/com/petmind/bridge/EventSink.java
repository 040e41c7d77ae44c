package com.petmind.bridge;

import com.petmind.shared.model.InboundEvent;

@FunctionalInterface
public interface EventSink {
    void accept(InboundEvent event);
}
