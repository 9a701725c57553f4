package com.openforge.autopilot.channel;

import com.openforge.autopilot.event.SessionEvent;

/**
 * Ordered outbound sink of one session.
 *
 * Implementations serialize concurrent producers (command loop, step callbacks,
 * telemetry) so that each event reaches the transport whole and in the order
 * {@link #send} was entered. After {@link #close} every send is dropped.
 */
public interface EventChannel {

    /**
     * Delivers one event.
     *
     * @return false when the channel is closed or the transport rejected the frame;
     *         delivery failures are logged, never thrown
     */
    boolean send(SessionEvent event);

    boolean isOpen();

    /** Releases the underlying connection. Idempotent. */
    void close();
}
