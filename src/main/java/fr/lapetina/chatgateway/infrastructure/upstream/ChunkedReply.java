package fr.lapetina.chatgateway.infrastructure.upstream;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Reply backed by text that is already complete, handed out chunk by chunk.
 */
public final class ChunkedReply implements UpstreamReply {

    private final Iterator<String> chunks;
    private volatile boolean cancelled;

    public ChunkedReply(List<String> chunks) {
        this.chunks = List.copyOf(chunks).iterator();
    }

    public static ChunkedReply ofText(String text) {
        return new ChunkedReply(TextChunker.chunk(text));
    }

    @Override
    public Optional<String> nextDelta() {
        if (cancelled || !chunks.hasNext()) {
            return Optional.empty();
        }
        return Optional.of(chunks.next());
    }

    @Override
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
