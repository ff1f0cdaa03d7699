package fr.lapetina.llmrouter.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating CompletionRequestEvent instances in the Disruptor ring buffer.
 *
 * The Disruptor pre-allocates events at startup; they are then reused by clearing and
 * re-initializing them.
 */
public final class CompletionRequestEventFactory implements EventFactory<CompletionRequestEvent> {

    @Override
    public CompletionRequestEvent newInstance() {
        return new CompletionRequestEvent();
    }
}
