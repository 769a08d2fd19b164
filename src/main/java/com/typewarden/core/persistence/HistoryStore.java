package com.typewarden.core.persistence;

import java.util.List;

/**
 * Storage port behind the append-only histories. Implementations must treat
 * missing or unreadable data as an empty history.
 */
public interface HistoryStore<T> {

    List<T> load();

    void save(List<T> entries);

    /** Store that lives only in memory, for tests and ephemeral runs. */
    static <T> HistoryStore<T> inMemory() {
        return new HistoryStore<>() {
            private List<T> saved = List.of();

            @Override
            public List<T> load() {
                return saved;
            }

            @Override
            public void save(List<T> entries) {
                saved = List.copyOf(entries);
            }
        };
    }
}
