package com.raditha.bytelift;

/**
 * Raised at a pass boundary once the caller has requested cancellation. Not an error: the orchestrator
 * turns it into a cancelled result and discards the partially transformed tree.
 */
public class DecompilationCancelledException extends ByteliftException {

    public DecompilationCancelledException() {
        super("Decompilation was cancelled");
    }
}
