package com.socialfeed.ingest.service;

/**
 * The actor run could not be started, or it ended in a non-successful state.
 */
public class ActorInvocationException extends IngestionException {
    public ActorInvocationException(String m) { super(m); }
    public ActorInvocationException(String m, Throwable c) { super(m, c); }
}
