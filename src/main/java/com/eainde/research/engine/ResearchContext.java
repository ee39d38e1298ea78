package com.eainde.research.engine;

import com.eainde.research.model.ResearchState;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Everything that belongs to one research session and flows through every engine call:
 * the session state, its cancellation token and its progress listeners.
 *
 * <p>Passed explicitly as a parameter; never stored in a static.</p>
 */
@Slf4j
public final class ResearchContext {

    private final ResearchState state;
    private final CancellationToken cancellationToken;
    private final List<ProgressListener> listeners;

    public ResearchContext(ResearchState state, CancellationToken cancellationToken, List<ProgressListener> listeners) {
        this.state = Objects.requireNonNull(state, "state");
        this.cancellationToken = cancellationToken != null ? cancellationToken : CancellationToken.none();
        this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
    }

    public ResearchState state() {
        return state;
    }

    public boolean isCancelled() {
        return cancellationToken.isCancellationRequested();
    }

    /**
     * Formats the message and hands it to every listener. A failing listener is logged and skipped.
     */
    public void report(String format, Object... args) {
        String message = String.format(Locale.ROOT, format, args);
        log.debug("[{}] {}", state.getOriginalQuery(), message);
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(message);
            } catch (RuntimeException e) {
                log.warn("Progress listener {} failed on message '{}'", listener, message, e);
            }
        }
    }
}
