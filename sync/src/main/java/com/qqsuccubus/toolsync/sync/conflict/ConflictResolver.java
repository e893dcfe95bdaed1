package com.qqsuccubus.toolsync.sync.conflict;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.toolsync.core.model.ConflictDescriptor;
import com.qqsuccubus.toolsync.core.model.ConflictStrategy;
import com.qqsuccubus.toolsync.core.model.EventData;
import com.qqsuccubus.toolsync.core.model.EventIds;
import com.qqsuccubus.toolsync.core.model.StateSnapshot;
import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import com.qqsuccubus.toolsync.core.model.UpdateType;
import com.qqsuccubus.toolsync.core.state.StateDiff;
import com.qqsuccubus.toolsync.core.state.StateMerge;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a client state against a server snapshot that moved past the client's version.
 * <p>
 * Stateless: a resolution only looks at the current snapshot and the incoming client
 * state, never at earlier resolutions.
 * </p>
 */
public class ConflictResolver {

    /**
     * @param server        current snapshot
     * @param clientState   state the client wants to write
     * @param clientVersion version the client last saw
     * @param strategy      resolution policy
     * @param userId        caller performing the sync
     * @param now           resolution time
     */
    public Resolution resolve(StateSnapshot server,
                              JsonNode clientState,
                              long clientVersion,
                              ConflictStrategy strategy,
                              String userId,
                              Instant now) {
        JsonNode serverState = server.getCurrentState();
        JsonNode resolved = resolvedState(serverState, clientState, strategy);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("conflictResolution", strategy.wire());
        metadata.put("clientVersion", clientVersion);
        metadata.put("serverVersion", server.getVersion());

        UpdateEvent event = UpdateEvent.builder()
            .id(EventIds.conflictResolution(server.getToolId(), now))
            .toolId(server.getToolId())
            .deploymentId(server.getDeploymentId())
            .userId(userId)
            .updateType(UpdateType.CONFIGURATION_CHANGE)
            .eventData(EventData.builder()
                .previousState(serverState)
                .newState(resolved)
                .changedFields(StateDiff.changedFields(serverState, resolved))
                .metadata(metadata)
                .build())
            .timestamp(now)
            .sequenceNumber(server.getVersion() + 1)
            .build();

        return Resolution.builder()
            .strategy(strategy)
            .resolvedState(resolved)
            .conflicts(describe(serverState, clientState, resolved))
            .event(event)
            .build();
    }

    static JsonNode resolvedState(JsonNode serverState, JsonNode clientState, ConflictStrategy strategy) {
        switch (strategy) {
            case CLIENT_WINS:
                return clientState;
            case MERGE:
                return StateMerge.shallow(serverState, clientState);
            case LATEST_WINS:
            default:
                return serverState;
        }
    }

    /**
     * One descriptor per top-level field present on both sides with different values.
     */
    static List<ConflictDescriptor> describe(JsonNode serverState, JsonNode clientState, JsonNode resolved) {
        List<ConflictDescriptor> conflicts = new ArrayList<>();
        if (serverState == null || !serverState.isObject() || clientState == null || !clientState.isObject()) {
            return conflicts;
        }
        Iterator<String> fields = serverState.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            JsonNode serverValue = serverState.get(field);
            JsonNode clientValue = clientState.get(field);
            if (clientValue != null && !clientValue.equals(serverValue)) {
                conflicts.add(ConflictDescriptor.builder()
                    .field(field)
                    .serverValue(serverValue)
                    .clientValue(clientValue)
                    .resolvedValue(resolved != null ? resolved.get(field) : null)
                    .build());
            }
        }
        return conflicts;
    }
}
