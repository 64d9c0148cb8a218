package com.morphine.metacognition.orchestration;

import com.morphine.metacognition.domain.model.StreamingContext;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Sinks;

/**
 * Producer side of a stream's bounded input channel.
 * Safe to share between threads; submissions are serialized.
 */
@Slf4j
public final class ContextSender {

    private final String streamId;
    private final Sinks.Many<StreamingContext> sink;
    private boolean closed;

    ContextSender(String streamId, Sinks.Many<StreamingContext> sink) {
        this.streamId = streamId;
        this.sink = sink;
    }

    /**
     * Submit a context for processing.
     * A context without a stream id is stamped with this stream's id.
     *
     * @return false if the channel is full or closed
     * @throws IllegalArgumentException if the context belongs to another stream
     */
    public synchronized boolean submit(StreamingContext context) {
        if (context == null) {
            throw new IllegalArgumentException("Context is required");
        }
        if (closed) {
            return false;
        }

        StreamingContext stamped = context;
        if (context.getStreamId() == null) {
            stamped = context.toBuilder().streamId(streamId).build();
        } else if (!streamId.equals(context.getStreamId())) {
            throw new IllegalArgumentException(
                    "Context for stream " + context.getStreamId() + " submitted on stream " + streamId);
        }

        Sinks.EmitResult result = sink.tryEmitNext(stamped);
        if (result.isFailure()) {
            log.debug("Context rejected on stream {}: {}", streamId, result);
            return false;
        }
        return true;
    }

    /**
     * Close the channel. Contexts already submitted are still processed.
     */
    public synchronized void close() {
        if (!closed) {
            closed = true;
            sink.tryEmitComplete();
        }
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public String getStreamId() {
        return streamId;
    }
}
