package com.journalengine.notes;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for journal notes.
 */
@Repository
public interface NoteRepository extends JpaRepository<Note, Long> {

    Optional<Note> findByJournalId(Long journalId);
}
