package com.omniva.pglistener.messaging.listener;

import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * Annotation to automatically register channel listeners
 * Combines @Component with channel configuration
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface PgChannelListener {

    /**
     * Channel to LISTEN on (case-sensitive)
     */
    String channel();

    /**
     * Collapse identical payloads arriving within this many milliseconds.
     * 0 disables debouncing.
     */
    long debounceMillis() default 0;

    /**
     * Whether this listener is enabled by default
     */
    boolean enabled() default true;

}
