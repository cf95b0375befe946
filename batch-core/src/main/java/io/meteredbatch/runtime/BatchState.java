package io.meteredbatch.runtime;

/**
 * Lifecycle of one orchestrator run. The dispatch, await and checkpoint states repeat once per
 * chunk; an empty work list goes from {@code LOADING_ITEMS} straight to {@code DONE}.
 */
public enum BatchState {
    PENDING,
    LOADING_ITEMS,
    CHUNKING,
    DISPATCHING,
    AWAITING_WORKERS,
    CHECKPOINTING,
    DONE,
    ABORTED
}
