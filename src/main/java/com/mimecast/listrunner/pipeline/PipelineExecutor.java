package com.mimecast.listrunner.pipeline;

import com.mimecast.listrunner.metrics.QueueMetrics;
import com.mimecast.listrunner.queue.MessageMetadata;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;

/**
 * Drives a message through a pipeline.
 *
 * <p>Execution resumes at the persisted {@code pipeline_position}.
 * <p>After every {@link Outcome.Kind#CONTINUE} the advanced position and metadata are persisted,
 * so a crash resumes after the last completed handler.
 */
public class PipelineExecutor {
    private static final Logger log = LogManager.getLogger(PipelineExecutor.class);

    /**
     * Persists metadata after a completed step.
     */
    @FunctionalInterface
    public interface Checkpoint {
        void save(MessageMetadata metadata) throws IOException;
    }

    /**
     * Executes a pipeline.
     *
     * @param pipeline   Pipeline instance.
     * @param context    PipelineContext instance.
     * @param checkpoint Metadata persistence callback.
     * @return First non continue outcome, a discard when the pipeline runs out of handlers.
     * @throws PipelineException Handler failure, wrapped with the handler name.
     * @throws IOException       Unable to persist metadata.
     */
    public Outcome execute(Pipeline pipeline, PipelineContext context, Checkpoint checkpoint) throws PipelineException, IOException {
        MessageMetadata metadata = context.getMetadata();
        List<Handler> handlers = pipeline.getHandlers();
        int position = Math.max(0, metadata.getPipelinePosition());

        while (position < handlers.size()) {
            Handler handler = handlers.get(position);
            Outcome outcome = invoke(handler, context);
            log.trace("Handler done: id={}, pipeline={}, handler={}, outcome={}",
                    context.getId(), pipeline.getName(), handler.getName(), outcome);

            if (outcome.getKind() != Outcome.Kind.CONTINUE) {
                QueueMetrics.incrementOutcome(pipeline.getName(), outcome.getKind().name());
                return outcome;
            }

            position++;
            metadata.setInt(MessageMetadata.PIPELINE_POSITION, position);
            checkpoint.save(metadata);
        }

        log.debug("Pipeline exhausted: id={}, pipeline={}", context.getId(), pipeline.getName());
        Outcome outcome = Outcome.discard("pipeline completed");
        QueueMetrics.incrementOutcome(pipeline.getName(), outcome.getKind().name());
        return outcome;
    }

    private Outcome invoke(Handler handler, PipelineContext context) throws PipelineException {
        Outcome outcome;
        try {
            outcome = handler.process(context);
        } catch (UnrecoverableMessageException e) {
            throw e;
        } catch (PipelineException e) {
            throw new PipelineException("Handler " + handler.getName() + " failed: " + e.getMessage(), e);
        } catch (Exception e) {
            throw new PipelineException("Handler " + handler.getName() + " failed: " + e, e);
        }
        if (outcome == null) {
            throw new PipelineException("Handler " + handler.getName() + " returned no outcome");
        }
        return outcome;
    }
}
