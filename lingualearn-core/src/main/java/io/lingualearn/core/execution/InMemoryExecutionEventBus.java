package io.lingualearn.core.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;

public final class InMemoryExecutionEventBus implements ExecutionListener {
    private final ConcurrentLinkedQueue<StepEvent> queue = new ConcurrentLinkedQueue<>();

    @Override
    public void onEvent(StepEvent event) {
        queue.offer(event);
    }

    public Optional<StepEvent> poll() {
        return Optional.ofNullable(queue.poll());
    }

    public List<StepEvent> drain() {
        List<StepEvent> events = new ArrayList<>();
        StepEvent event;
        while ((event = queue.poll()) != null) {
            events.add(event);
        }
        return events;
    }
}
