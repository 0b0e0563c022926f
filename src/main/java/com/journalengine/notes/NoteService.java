package com.journalengine.notes;

import com.journalengine.journals.TransactionJournal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Stores and removes journal notes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NoteService {

    private final NoteRepository noteRepository;

    /**
     * Replaces the note of a journal. A null or empty text removes the note.
     */
    @Transactional
    public void storeNotes(TransactionJournal journal, String text) {
        Optional<Note> existing = noteRepository.findByJournalId(journal.getId());
        if (text == null || text.isEmpty()) {
            existing.ifPresent(note -> {
                noteRepository.delete(note);
                log.debug("Removed note #{} of journal #{}", note.getId(), journal.getId());
            });
            return;
        }
        Note note = existing.orElseGet(() -> new Note(journal, text));
        note.setText(text);
        note.setUpdatedAt(Instant.now());
        noteRepository.save(note);
        log.debug("Stored note #{} for journal #{}", note.getId(), journal.getId());
    }

    @Transactional(readOnly = true)
    public Optional<String> getNotes(Long journalId) {
        return noteRepository.findByJournalId(journalId).map(Note::getText);
    }
}
