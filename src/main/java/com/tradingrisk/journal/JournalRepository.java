package com.tradingrisk.journal;

import java.util.List;

/**
 * Append-only store of journal entries.
 */
public interface JournalRepository {

    JournalEntry save(JournalEntry journalEntry);

    /** All entries, oldest first. */
    List<JournalEntry> findAll();
}
