package org.reliablemq.broker.publish;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a confirmed batch publish.
 *
 * @param total    number of messages in the batch
 * @param failures entries the broker nacked or returned, by position in the batch
 */
public record BatchPublishResult(int total, List<Failure> failures) {

    public BatchPublishResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static BatchPublishResult success(int total) {
        return new BatchPublishResult(total, List.of());
    }

    public static BatchPublishResult allFailed(int total, String reason) {
        List<Failure> failures = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            failures.add(new Failure(i, reason));
        }
        return new BatchPublishResult(total, failures);
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public List<Integer> failedIndexes() {
        return failures.stream().map(Failure::index).collect(Collectors.toList());
    }

    /**
     * @param index  position of the message in the batch
     * @param reason "nack", or the broker's return reply text
     */
    public record Failure(int index, String reason) {}
}
