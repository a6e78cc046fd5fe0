package tech.tessera.identity.common;

import java.util.List;

/**
 * Outcome of a bulk delete.
 *
 * <p>Three variants, so callers can tell a full success, a full failure and a
 * mixed outcome apart:
 * <ul>
 *   <li>{@link AllSucceeded} - every id was deleted</li>
 *   <li>{@link AllFailed} - no id was deleted</li>
 *   <li>{@link Partial} - some ids were deleted, the rest were not</li>
 * </ul>
 */
public sealed interface BulkDeleteResult permits BulkDeleteResult.AllSucceeded, BulkDeleteResult.AllFailed, BulkDeleteResult.Partial {

    List<String> succeededIds();

    List<String> failedIds();

    record AllSucceeded(List<String> succeededIds) implements BulkDeleteResult {
        public AllSucceeded {
            succeededIds = List.copyOf(succeededIds);
        }

        @Override
        public List<String> failedIds() {
            return List.of();
        }
    }

    record AllFailed(List<String> failedIds) implements BulkDeleteResult {
        public AllFailed {
            failedIds = List.copyOf(failedIds);
        }

        @Override
        public List<String> succeededIds() {
            return List.of();
        }
    }

    record Partial(List<String> succeededIds, List<String> failedIds) implements BulkDeleteResult {
        public Partial {
            succeededIds = List.copyOf(succeededIds);
            failedIds = List.copyOf(failedIds);
        }
    }

    /**
     * Classify the per-id outcomes. An empty request counts as all succeeded.
     */
    static BulkDeleteResult of(List<String> succeeded, List<String> failed) {
        if (failed.isEmpty()) {
            return new AllSucceeded(succeeded);
        }
        if (succeeded.isEmpty()) {
            return new AllFailed(failed);
        }
        return new Partial(succeeded, failed);
    }
}
