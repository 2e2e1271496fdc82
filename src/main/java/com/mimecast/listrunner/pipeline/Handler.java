package com.mimecast.listrunner.pipeline;

import java.io.IOException;

/**
 * Pipeline step.
 *
 * <p>Handlers are stateless and shared between runners.
 * <p>A handler may be re-run after a crash so its effects must be idempotent or recorded only in metadata.
 */
public interface Handler {

    /**
     * Gets handler name as used in pipeline tables.
     *
     * @return Name.
     */
    String getName();

    /**
     * Processes a message.
     *
     * @param context PipelineContext instance.
     * @return Outcome.
     * @throws PipelineException Handler failure.
     * @throws IOException       On I/O error.
     */
    Outcome process(PipelineContext context) throws PipelineException, IOException;
}
