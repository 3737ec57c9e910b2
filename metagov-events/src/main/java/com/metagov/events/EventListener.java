package com.metagov.events;

/** In-process receiver of platform events. Called synchronously on the emitting thread. */
@FunctionalInterface
public interface EventListener {

    void onEvent(PlatformEvent event);
}
