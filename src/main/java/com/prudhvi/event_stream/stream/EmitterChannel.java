package com.prudhvi.event_stream.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Outbound channel that writes pre-encoded SSE frames into a Spring MVC {@link ResponseBodyEmitter}.
 *
 * Writers never touch the socket. offer() puts the frame on a bounded queue and, if no drain
 * is running, schedules one on the writer executor. At most one drain runs at a time per
 * channel, so frames reach the socket in queue order and a slow client only ever occupies
 * one writer thread. A full queue rejects the frame instead of waiting.
 *
 * A final frame passed to completeWith() skips the queue: whatever is still queued is
 * discarded and the final frame is the last thing written before the stream ends.
 *
 * Closing converges from three directions (our complete(), our completeWithError(), or the
 * container reporting completion/timeout/error on the emitter); the closed callbacks run once
 * whichever comes first.
 */
public class EmitterChannel implements OutboundChannel {

    private static final Logger log = LoggerFactory.getLogger(EmitterChannel.class);

    static final MediaType EVENT_STREAM_UTF8 = new MediaType("text", "event-stream", StandardCharsets.UTF_8);

    private final ResponseBodyEmitter emitter;
    private final Executor writer;
    private final BlockingQueue<String> queue;

    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean completing = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicReference<String> finalFrame = new AtomicReference<>();
    private final List<Runnable> closeCallbacks = new CopyOnWriteArrayList<>();

    public EmitterChannel(ResponseBodyEmitter emitter, Executor writer, int capacity) {
        this.emitter = emitter;
        this.writer = writer;
        this.queue = new ArrayBlockingQueue<>(capacity);
        emitter.onCompletion(this::markClosed);
        emitter.onTimeout(this::markClosed);
        emitter.onError(e -> {
            log.debug("Emitter reported error: {}", e.getMessage());
            markClosed();
        });
    }

    @Override
    public boolean offer(String frame) {
        if (completing.get() || closed.get()) {
            return false;
        }
        if (!queue.offer(frame)) {
            return false;
        }
        scheduleDrain();
        return true;
    }

    @Override
    public void complete() {
        if (closed.get() || !completing.compareAndSet(false, true)) {
            return;
        }
        scheduleDrain();
    }

    @Override
    public void completeWith(String frame) {
        if (closed.get() || completing.get() || !finalFrame.compareAndSet(null, frame)) {
            return;
        }
        completing.set(true);
        queue.clear();
        scheduleDrain();
    }

    @Override
    public void completeWithError(Throwable error) {
        if (closed.get()) {
            return;
        }
        completing.set(true);
        queue.clear();
        try {
            emitter.completeWithError(error);
        } catch (IllegalStateException e) {
            log.debug("Emitter already completed: {}", e.getMessage());
        }
        markClosed();
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void onClosed(Runnable callback) {
        closeCallbacks.add(callback);
        // Registered after the close already happened: nobody else will run it.
        if (closed.get() && closeCallbacks.remove(callback)) {
            callback.run();
        }
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            writer.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Writer pool rejected drain task, closing stream: {}", e.getMessage());
            completeWithError(e);
        }
    }

    private void drain() {
        try {
            String frame;
            while (!closed.get() && finalFrame.get() == null && (frame = queue.poll()) != null) {
                emitter.send(frame, EVENT_STREAM_UTF8);
            }
            if (completing.get() && !closed.get()) {
                String last = finalFrame.getAndSet(null);
                if (last != null) {
                    queue.clear();
                    emitter.send(last, EVENT_STREAM_UTF8);
                    emitter.complete();
                    markClosed();
                } else if (queue.isEmpty()) {
                    emitter.complete();
                    markClosed();
                }
            }
        } catch (IOException | IllegalStateException e) {
            // The peer went away or the response is already done. The container takes care of
            // releasing the response; we only stop writing.
            log.debug("Stream write failed, closing: {}", e.getMessage());
            queue.clear();
            markClosed();
        } finally {
            draining.set(false);
        }
        // A frame or a completion may have arrived after the loop saw an empty queue.
        if (!closed.get() && (!queue.isEmpty() || completing.get())) {
            scheduleDrain();
        }
    }

    private void markClosed() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        completing.set(true);
        for (Runnable callback : closeCallbacks) {
            if (closeCallbacks.remove(callback)) {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    log.warn("Stream close callback failed: {}", e.getMessage(), e);
                }
            }
        }
    }
}
