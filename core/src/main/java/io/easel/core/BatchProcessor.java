package io.easel.core;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Downstream call behind a batch group.
 *
 * Contract:
 *  - invoked once per flushed group with the items in submission order,
 *  - the returned list must be positionally aligned: result i answers item i,
 *  - a shorter list fails the unmatched items; a failed stage fails the group.
 */
@FunctionalInterface
public interface BatchProcessor<I, R> {

    CompletionStage<List<R>> process(List<I> items);
}
