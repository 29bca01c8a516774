package com.analysiswatch.core.registry;

import java.util.List;

/**
 * Summary of merging one snapshot into the registry.
 *
 * @param applied  entity ids upserted from the snapshot
 * @param skipped  entity ids skipped because a terminal event arrived while the request was in flight
 * @param pruned   entity ids removed because the fresh snapshot no longer lists them
 * @param accepted false when the window was already closed or the registry torn down
 */
public record MergeResult(
    List<String> applied,
    List<String> skipped,
    List<String> pruned,
    boolean accepted
) {
    static MergeResult rejected() {
        return new MergeResult(List.of(), List.of(), List.of(), false);
    }
}
