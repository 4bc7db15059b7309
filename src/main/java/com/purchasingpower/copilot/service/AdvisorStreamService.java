package com.purchasingpower.copilot.service;

import com.google.common.base.Preconditions;
import com.purchasingpower.copilot.agent.OrchestrationListener;
import com.purchasingpower.copilot.agent.ToolInvocationResult;
import com.purchasingpower.copilot.agent.ToolOrchestrator;
import com.purchasingpower.copilot.exception.OrchestrationException;
import com.purchasingpower.copilot.model.dto.AdvisorEvent;
import com.purchasingpower.copilot.model.dto.OrchestrationResult;
import com.purchasingpower.copilot.query.QueryCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Streams the progress of one orchestrated query as {@link AdvisorEvent}s.
 *
 * Events are produced by the orchestration itself:
 * - THINKING once the question is categorized
 * - TOOL when each source starts and when it finishes
 * - COMPLETE with the fused answer, or ERROR if the query failed
 *
 * Tool events come from executor threads; delivery to the sink is serialized and numbered
 * so the consumer sees one event at a time, in chunk order. The last event is always final.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdvisorStreamService {

    private final ToolOrchestrator orchestrator;

    /**
     * Run the query and push its events to the sink.
     *
     * @return the result, or empty if the query failed (the sink has then received an ERROR event)
     */
    public Optional<OrchestrationResult> streamQuery(String question, Consumer<AdvisorEvent> sink) {
        Preconditions.checkArgument(question != null && !question.isBlank(), "Question cannot be blank");
        Preconditions.checkNotNull(sink, "Event sink cannot be null");

        log.info("Streaming query");
        try {
            return Optional.of(orchestrator.process(question, new EventRelay(sink)));
        } catch (OrchestrationException e) {
            log.warn("Streamed query failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static final class EventRelay implements OrchestrationListener {

        private final Consumer<AdvisorEvent> sink;
        private int sequence;

        private EventRelay(Consumer<AdvisorEvent> sink) {
            this.sink = sink;
        }

        @Override
        public void onStarted(String question, QueryCategory category) {
            send(AdvisorEvent.thinking("Processing your query (" + category.getValue() + ")..."));
        }

        @Override
        public void onToolStarted(String toolId) {
            send(AdvisorEvent.tool(toolId, "Executing..."));
        }

        @Override
        public void onToolFinished(ToolInvocationResult result) {
            String status;
            if (result.isUsable()) {
                status = "Completed";
            } else if (result.isSucceeded()) {
                status = "No relevant information";
            } else {
                status = "Failed";
            }
            send(AdvisorEvent.tool(result.getToolId(), status));
        }

        @Override
        public void onCompleted(OrchestrationResult result) {
            send(AdvisorEvent.complete(result.getResponseText()));
        }

        @Override
        public void onFailed(RuntimeException failure) {
            send(AdvisorEvent.error("Error: " + failure.getMessage()));
        }

        private synchronized void send(AdvisorEvent event) {
            event.setChunkId(String.valueOf(++sequence));
            try {
                sink.accept(event);
            } catch (RuntimeException e) {
                log.warn("Event sink rejected chunk {} ({}): {}", event.getChunkId(), event.getType(), e.getMessage());
            }
        }
    }
}
