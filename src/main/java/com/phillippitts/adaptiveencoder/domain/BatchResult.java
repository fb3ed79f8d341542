package com.phillippitts.adaptiveencoder.domain;

import java.nio.file.Path;
import java.util.List;

/**
 * Per-file outcomes of a batch.
 */
public record BatchResult(List<Item> items) {

    public BatchResult {
        items = List.copyOf(items);
    }

    public long succeeded() {
        return items.stream().filter(Item::succeeded).count();
    }

    public long failed() {
        return items.size() - succeeded();
    }

    /**
     * Outcome for one input.
     *
     * @param input input file
     * @param result encode result, or null on failure
     * @param failureKind failure kind name, or null on success
     * @param failureMessage failure message, or null on success
     */
    public record Item(Path input, EncodeResult result, String failureKind, String failureMessage) {

        public static Item success(Path input, EncodeResult result) {
            return new Item(input, result, null, null);
        }

        public static Item failure(Path input, String kind, String message) {
            return new Item(input, null, kind, message);
        }

        public boolean succeeded() {
            return result != null;
        }
    }
}
