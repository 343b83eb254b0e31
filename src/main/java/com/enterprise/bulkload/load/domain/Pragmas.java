package com.enterprise.bulkload.load.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Connection settings applied right after open, before the pre-run statement.
 *
 * @param wal         switch the journal to write-ahead logging
 * @param synchronous {@code PRAGMA synchronous} level, {@code null} to keep the default
 * @param extra       further statements separated by {@code ;}, run verbatim
 */
public record Pragmas(boolean wal, SynchronousMode synchronous, String extra) {

    public static Pragmas none() {
        return new Pragmas(false, null, null);
    }

    public List<String> statements() {
        List<String> out = new ArrayList<>();
        if (wal) {
            out.add("PRAGMA journal_mode=WAL");
        }
        if (synchronous != null) {
            out.add("PRAGMA synchronous=" + synchronous.name());
        }
        if (extra != null && !extra.isBlank()) {
            Arrays.stream(extra.split(";"))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(out::add);
        }
        return out;
    }
}
