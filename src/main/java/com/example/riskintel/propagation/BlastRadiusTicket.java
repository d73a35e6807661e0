package com.example.riskintel.propagation;

import java.util.concurrent.CompletableFuture;

/**
 * Answer to a blast-radius request. {@code immediate} is either the precise result or an
 * approximate estimate; {@code precise} completes once the full traversal has finished.
 */
public record BlastRadiusTicket(PropagationResult immediate, CompletableFuture<PropagationResult> precise) {

    public static BlastRadiusTicket completed(PropagationResult result) {
        return new BlastRadiusTicket(result, CompletableFuture.completedFuture(result));
    }

    public boolean deferred() {
        return !precise.isDone();
    }
}
