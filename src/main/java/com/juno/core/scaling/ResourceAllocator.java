package com.juno.core.scaling;

import com.juno.core.model.AppliedResourceChange;
import com.juno.core.model.ResourceChangeRequest;
import com.juno.core.model.RunMessage;
import com.juno.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The only component that changes team agent counts. Each outstanding
 * {@link ResourceChangeRequest} is applied once and then removed.
 */
@Service
public class ResourceAllocator {

    private static final Logger log = LoggerFactory.getLogger(ResourceAllocator.class);

    private final Clock clock;

    public ResourceAllocator(Clock clock) {
        this.clock = clock;
    }

    public Map<String, Object> applyPendingRequests(RunState state) {
        var requests = state.resourceChangeRequests();
        if (requests.isEmpty()) {
            return Map.of();
        }
        var resources = new HashMap<>(state.teamResources());
        var history = new ArrayList<>(state.resourceChangeHistory());
        var messages = new ArrayList<RunMessage>();

        for (ResourceChangeRequest request : requests) {
            var config = resources.get(request.team());
            if (config == null) {
                log.warn("Dropping resource request for team {} with no resource config", request.team());
                continue;
            }
            var updated = config.withAgents(request.recommendedAgents());
            if (updated.currentAgents() == config.currentAgents()) {
                log.info("Resource request for team {} left agents at {}", request.team(), config.currentAgents());
                continue;
            }
            resources.put(request.team(), updated);
            history.add(new AppliedResourceChange(request.team(), config.currentAgents(),
                    updated.currentAgents(), request.reason(), clock.instant()));
            messages.add(new RunMessage("resource_allocator", "**RESOURCE CHANGE**: Team " + request.team()
                    + " scaled from " + config.currentAgents() + " to " + updated.currentAgents() + " agents."));
            log.info("Team {} scaled from {} to {} agents", request.team(), config.currentAgents(),
                    updated.currentAgents());
        }

        var update = new HashMap<String, Object>();
        update.put("teamResources", Map.copyOf(resources));
        update.put("resourceChangeHistory", List.copyOf(history));
        update.put("resourceChangeRequests", List.of());
        if (!messages.isEmpty()) {
            update.put(RunState.MESSAGES, List.copyOf(messages));
        }
        return update;
    }
}
