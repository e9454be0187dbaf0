package com.omniva.pglistener.engine.transmission;

/**
 * One unit of work for the dispatch loop
 */
public record DispatchEvent(Kind kind, String payload) {

    public enum Kind {
        /** A notification arrived from the receiver */
        PAYLOAD,
        /** A debounce window closed and its payload is due */
        RELEASE
    }

    public static DispatchEvent payload(String payload) {
        return new DispatchEvent(Kind.PAYLOAD, payload);
    }

    public static DispatchEvent release(String payload) {
        return new DispatchEvent(Kind.RELEASE, payload);
    }
}
