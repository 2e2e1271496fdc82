package com.mimecast.listrunner.pipeline;

import java.util.List;

/**
 * Named ordered sequence of handlers.
 */
public class Pipeline {

    private final String name;
    private final List<Handler> handlers;

    /**
     * Constructs a new Pipeline instance.
     *
     * @param name     Pipeline name.
     * @param handlers Handlers in execution order.
     */
    public Pipeline(String name, List<Handler> handlers) {
        this.name = name;
        this.handlers = List.copyOf(handlers);
    }

    public String getName() {
        return name;
    }

    public List<Handler> getHandlers() {
        return handlers;
    }

    public int size() {
        return handlers.size();
    }

    @Override
    public String toString() {
        return name + handlers.stream().map(Handler::getName).toList();
    }
}
