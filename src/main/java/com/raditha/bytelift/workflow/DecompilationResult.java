package com.raditha.bytelift.workflow;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of decompiling one requested declaration.
 *
 * @param declaration   what was requested
 * @param status        how far the decompilation got
 * @param members       the decompiled bodies, empty when cancelled
 * @param documentation doc comment of the declaration itself, null when absent or not requested
 * @param fault         what went wrong for a degraded result, null otherwise
 * @param duration      wall clock time spent
 */
public record DecompilationResult(
        DeclarationRef declaration,
        Status status,
        List<DecompiledMember> members,
        String documentation,
        Throwable fault,
        Duration duration) {

    public enum Status {
        /** Every body went through the full pipeline. */
        COMPLETE,
        /** The pipeline stopped at the configured abort point. */
        ABORTED,
        /** A transform failed; the bodies are shown untransformed. */
        DEGRADED,
        CANCELLED
    }

    public DecompilationResult {
        members = members == null ? List.of() : List.copyOf(members);
    }

    public static DecompilationResult cancelled(DeclarationRef declaration, Duration duration) {
        return new DecompilationResult(declaration, Status.CANCELLED, List.of(), null, null, duration);
    }

    public Optional<Throwable> getFault() {
        return Optional.ofNullable(fault);
    }

    public boolean isSuccessful() {
        return status == Status.COMPLETE || status == Status.ABORTED;
    }
}
