package com.spinrank.tournament.format;

import com.spinrank.tournament.model.TournamentFormat;
import com.spinrank.tournament.web.TournamentEngineException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class TournamentFormatRegistry {

    private final Map<TournamentFormat, TournamentFormatHandler> handlers = new EnumMap<>(TournamentFormat.class);

    public TournamentFormatRegistry(List<TournamentFormatHandler> handlers) {
        for (TournamentFormatHandler handler : handlers) {
            TournamentFormatHandler previous = this.handlers.put(handler.format(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for format " + handler.format());
            }
        }
    }

    public TournamentFormat resolveFormat(String tag) {
        TournamentFormat format = TournamentFormat.fromTag(tag)
                .orElseThrow(() -> TournamentEngineException.unsupportedFormat("Unsupported tournament format: " + tag));
        handlerFor(format);
        return format;
    }

    public TournamentFormatHandler handlerFor(TournamentFormat format) {
        TournamentFormatHandler handler = format == null ? null : handlers.get(format);
        if (handler == null) {
            throw TournamentEngineException.unsupportedFormat("No handler registered for format " + format);
        }
        return handler;
    }

    public Set<TournamentFormat> supportedFormats() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
