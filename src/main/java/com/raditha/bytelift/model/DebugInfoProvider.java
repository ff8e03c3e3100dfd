package com.raditha.bytelift.model;

import java.util.Optional;

/**
 * Optional debug-symbol lookup keyed by IL offset. An absent hint is a valid answer.
 */
@FunctionalInterface
public interface DebugInfoProvider {

    Optional<SourceHint> hintFor(int ilOffset);
}
