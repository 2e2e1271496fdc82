package com.mimecast.listrunner.pipeline;

import com.mimecast.listrunner.pipeline.handlers.ApproveHandler;
import com.mimecast.listrunner.pipeline.handlers.BounceHandler;
import com.mimecast.listrunner.pipeline.handlers.CleanseHandler;
import com.mimecast.listrunner.pipeline.handlers.CommandsHandler;
import com.mimecast.listrunner.pipeline.handlers.CookHeadersHandler;
import com.mimecast.listrunner.pipeline.handlers.DecorateHandler;
import com.mimecast.listrunner.pipeline.handlers.EmergencyHandler;
import com.mimecast.listrunner.pipeline.handlers.HoldCriteriaHandler;
import com.mimecast.listrunner.pipeline.handlers.HoldDecisionHandler;
import com.mimecast.listrunner.pipeline.handlers.ModerateHandler;
import com.mimecast.listrunner.pipeline.handlers.ToArchiveHandler;
import com.mimecast.listrunner.pipeline.handlers.ToDigestHandler;
import com.mimecast.listrunner.pipeline.handlers.ToOutgoingHandler;
import com.mimecast.listrunner.pipeline.handlers.ToOwnersHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named pipelines container.
 *
 * <p>Built once at class load, more pipelines can be registered at runtime.
 */
public class PipelineRegistry {
    private static final Logger log = LogManager.getLogger(PipelineRegistry.class);

    public static final String POST = "post";
    public static final String OWNER = "owner";
    public static final String COMMAND = "command";
    public static final String BOUNCE = "bounce";
    public static final String VIRGIN = "virgin";

    private static final Map<String, Pipeline> pipelines = new ConcurrentHashMap<>();

    static {
        register(new Pipeline(POST, List.of(
                new ApproveHandler(),
                new EmergencyHandler(),
                new ModerateHandler(),
                new HoldCriteriaHandler(),
                new HoldDecisionHandler(),
                new CleanseHandler(),
                new CookHeadersHandler(),
                new DecorateHandler(),
                new ToArchiveHandler(),
                new ToDigestHandler(),
                new ToOutgoingHandler()
        )));
        register(new Pipeline(OWNER, List.of(new ToOwnersHandler())));
        register(new Pipeline(COMMAND, List.of(new CommandsHandler())));
        register(new Pipeline(BOUNCE, List.of(new BounceHandler())));
        register(new Pipeline(VIRGIN, List.of(new CookHeadersHandler(), new ToOutgoingHandler())));
    }

    /**
     * Private constructor.
     */
    private PipelineRegistry() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Registers a pipeline, replacing any pipeline of the same name.
     *
     * @param pipeline Pipeline instance.
     */
    public static void register(Pipeline pipeline) {
        Pipeline previous = pipelines.put(pipeline.getName(), pipeline);
        if (previous != null) {
            log.debug("Pipeline replaced: name={}", pipeline.getName());
        }
    }

    /**
     * Gets pipeline by name.
     *
     * @param name Pipeline name.
     * @return Optional of Pipeline.
     */
    public static Optional<Pipeline> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(pipelines.get(name));
    }

    /**
     * Gets registered pipeline names.
     *
     * @return Set of names.
     */
    public static Set<String> names() {
        return Collections.unmodifiableSet(pipelines.keySet());
    }
}
