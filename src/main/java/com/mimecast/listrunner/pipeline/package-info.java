/**
 * Handler pipelines.
 *
 * <p>Each message class runs through a named, ordered list of handlers registered in
 * {@link com.mimecast.listrunner.pipeline.PipelineRegistry}.
 * <br>Hold criteria accumulate every reason before a single hold decision is made.
 * <br>Content shaping handlers only run once the message is accepted and only record decorations in metadata,
 * the payload stays byte identical until delivery renders it.
 *
 * <p>Terminal outcomes are applied by {@link com.mimecast.listrunner.pipeline.Disposition}.
 */
package com.mimecast.listrunner.pipeline;
