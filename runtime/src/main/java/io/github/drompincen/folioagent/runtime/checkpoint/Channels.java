package io.github.drompincen.folioagent.runtime.checkpoint;

import java.util.Set;

/**
 * Names of the state channels a pending write may target.
 */
public final class Channels {

    public static final String MESSAGES = "messages";
    public static final String STATUS = "status";
    public static final String ERROR = "error";
    public static final String ITERATIONS = "iterations";

    public static final Set<String> ALL = Set.of(MESSAGES, STATUS, ERROR, ITERATIONS);

    private Channels() {}
}
