package io.github.manjago.arbor.search;

/**
 * Lifecycle of a {@link SearchLoop}.
 *
 * <pre>
 * NEW -&gt; INITIALIZED -&gt; EVALUATED -&gt; (SELECTING -&gt; VARYING -&gt; EVALUATING -&gt; REPLACING)* -&gt; TERMINATED
 * </pre>
 */
public enum SearchState {
    NEW,
    INITIALIZED,
    EVALUATED,
    SELECTING,
    VARYING,
    EVALUATING,
    REPLACING,
    TERMINATED;

    /**
     * @return true if a generation may start from this state
     */
    public boolean canStep() {
        return this == EVALUATED || this == REPLACING;
    }
}
