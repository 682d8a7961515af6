package com.juno.core.router;

/**
 * A member of a team. Exceptions propagate and fail the team run.
 */
@FunctionalInterface
public interface TeamWorker {
    WorkerResult perform(TeamState state);
}
