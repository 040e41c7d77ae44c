package com.petmind.bridge;

/** A producer of inbound events: speech recognition, vision snapshots, window polling, a console. */
public interface EventSource {
    String id();
    void start(EventSink sink);
    void stop();
}
