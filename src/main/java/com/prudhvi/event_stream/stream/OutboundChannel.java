package com.prudhvi.event_stream.stream;

/**
 * The write side of one client stream.
 *
 * Frames are written in the order {@link #offer} accepted them. Offering never blocks:
 * when the channel cannot take a frame right now it says so and the frame is lost.
 */
public interface OutboundChannel {

    /**
     * @return true if the frame was queued for writing, false if it was dropped
     *         (buffer full, or the channel is closing or closed)
     */
    boolean offer(String frame);

    /** Writes whatever is queued, then ends the stream. Idempotent. */
    void complete();

    /**
     * Ends the stream with one last frame. Frames still queued are discarded and the final frame
     * is written regardless of buffer capacity. Ignored once the channel is closing or closed.
     */
    void completeWith(String finalFrame);

    /** Ends the stream abruptly with a transport error. Queued frames are discarded. Idempotent. */
    void completeWithError(Throwable error);

    boolean isClosed();

    /**
     * Runs the callback once, when the channel closes for any reason. Runs it immediately
     * if the channel is already closed.
     */
    void onClosed(Runnable callback);
}
