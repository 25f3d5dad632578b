package com.tradingrisk.journal;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

/**
 * Process-local journal store. Entries are lost on restart.
 *
 * <p>Backed by a {@link CopyOnWriteArrayList}: appends are rare compared with reads by the coach,
 * and readers always see a consistent snapshot.
 */
@Repository
public class InMemoryJournalRepository implements JournalRepository {

    private final List<JournalEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public JournalEntry save(JournalEntry journalEntry) {
        entries.add(journalEntry);
        return journalEntry;
    }

    @Override
    public List<JournalEntry> findAll() {
        return entries.stream()
                .sorted(Comparator.comparing(JournalEntry::getTimestamp))
                .collect(Collectors.toList());
    }
}
