package io.fuzzdeck.api.result;

import java.util.List;

/**
 * Results split by outcome, each side in snapshot order.
 */
public record PartitionedResults(List<ResultRecord> succeeded, List<ResultRecord> failed) {

    public PartitionedResults {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
    }

    public int total() {
        return succeeded.size() + failed.size();
    }
}
