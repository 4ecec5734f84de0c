package fr.lapetina.chatgateway.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating ChatRequestEvent instances in the Disruptor ring buffer.
 *
 * The Disruptor pre-allocates events at startup; they are then reused by
 * clearing and re-initializing them.
 */
public final class ChatRequestEventFactory implements EventFactory<ChatRequestEvent> {

    @Override
    public ChatRequestEvent newInstance() {
        return new ChatRequestEvent();
    }
}
