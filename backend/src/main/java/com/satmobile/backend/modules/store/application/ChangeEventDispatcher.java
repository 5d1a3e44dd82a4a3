package com.satmobile.backend.modules.store.application;

import java.util.ArrayList;
import java.util.List;

import com.satmobile.backend.global.common.result.SyncErrorKind;
import com.satmobile.backend.global.common.result.SyncResult;
import com.satmobile.backend.modules.store.domain.DocumentChange;
import com.satmobile.backend.modules.store.infrastructure.DocumentChangeSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Routes change events to every handler whose pattern matches. A failing handler is logged
 * and does not keep the other handlers, or later events, from running.
 */
@Component
public class ChangeEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ChangeEventDispatcher.class);

    private final List<DocumentChangeHandler> handlers;
    private final List<DocumentChangeSource> sources;

    public ChangeEventDispatcher(List<DocumentChangeHandler> handlers, List<DocumentChangeSource> sources) {
        this.handlers = List.copyOf(handlers);
        this.sources = List.copyOf(sources);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        sources.forEach(source -> source.subscribe(this::dispatch));
        log.info("Dispatching document changes to {} handlers", handlers.size());
    }

    public List<HandlerOutcome> dispatch(DocumentChange change) {
        List<HandlerOutcome> outcomes = new ArrayList<>();
        for (DocumentChangeHandler handler : handlers) {
            if (!handler.pattern().matches(change.path())) {
                continue;
            }
            SyncResult result;
            try {
                result = handler.handle(change);
            } catch (RuntimeException ex) {
                log.error("Handler {} threw for {}", handler.name(), change.path(), ex);
                result = SyncResult.failed(SyncErrorKind.TRANSIENT_STORE, 0, ex.getMessage());
            }
            if (result.isFailed()) {
                log.warn("[ALERT][Trigger][{}] path={} type={} kind={} writes={} detail={}",
                        handler.name(),
                        change.path(),
                        change.type(),
                        result.errorKind(),
                        result.writes(),
                        result.detail());
            } else if (log.isDebugEnabled()) {
                log.debug("Handler {} {} {} ({})", handler.name(), result.status(), change.path(), result.detail());
            }
            outcomes.add(new HandlerOutcome(handler.name(), result));
        }
        return outcomes;
    }

    public record HandlerOutcome(String handler, SyncResult result) {
    }
}
