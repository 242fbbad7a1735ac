package com.caselink.adapter;

import com.caselink.exception.UnknownSourceException;
import com.caselink.model.CaseSource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Registry of the adapter beans, looked up by source. */
@Component
public class SourceAdapters {

    private final Map<CaseSource, SourceAdapter<?>> bySource = new EnumMap<>(CaseSource.class);

    public SourceAdapters(List<SourceAdapter<?>> adapters) {
        for (SourceAdapter<?> adapter : adapters) {
            SourceAdapter<?> previous = bySource.put(adapter.source(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.source().slug()
                    + ": " + previous.getClass().getSimpleName() + " and " + adapter.getClass().getSimpleName());
            }
        }
    }

    public Optional<SourceAdapter<?>> find(CaseSource source) {
        return Optional.ofNullable(bySource.get(source));
    }

    /**
     * @throws UnknownSourceException if no adapter handles {@code slug}
     */
    public SourceAdapter<?> require(String slug) {
        return CaseSource.fromSlug(slug)
            .flatMap(this::find)
            .orElseThrow(() -> new UnknownSourceException(slug));
    }

    public SourceAdapter<?> require(CaseSource source) {
        return find(source).orElseThrow(() -> new UnknownSourceException(source.slug()));
    }

    public List<SourceAdapter<?>> all() {
        return Collections.unmodifiableList(new ArrayList<>(bySource.values()));
    }

    public List<CaseSource> sources() {
        return List.copyOf(bySource.keySet());
    }
}
