package com.parallax.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run is dispatched and merged, consumed by progress and
 * notification subscribers.
 *
 * @param eventType   event type (e.g. "group.ready", "workspace.phase", "merge.failed")
 * @param runId       the run this event belongs to
 * @param groupId     the task group this event relates to (nullable for run-level events)
 * @param workspaceId the workspace this event relates to (nullable)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record ParallaxEvent(
    String eventType,
    String runId,
    String groupId,
    String workspaceId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_STARTED = "run.started";
    public static final String GROUP_READY = "group.ready";
    public static final String WORKSPACE_PHASE = "workspace.phase";
    public static final String WORKSPACE_COMPLETED = "workspace.completed";
    public static final String WORKSPACE_FAILED = "workspace.failed";
    public static final String MERGE_SUCCEEDED = "merge.succeeded";
    public static final String MERGE_FAILED = "merge.failed";
    public static final String RUN_COMPLETED = "run.completed";
    public static final String RUN_STALLED = "run.stalled";

    public static ParallaxEvent of(String eventType, String runId, String groupId, String workspaceId,
                                   Map<String, Object> payload) {
        return new ParallaxEvent(eventType, runId, groupId, workspaceId,
                payload == null ? Map.of() : payload, Instant.now());
    }
}
