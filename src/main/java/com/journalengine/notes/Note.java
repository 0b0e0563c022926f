package com.journalengine.notes;

import com.journalengine.journals.TransactionJournal;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Free text attached to a journal. A journal has at most one note.
 */
@Entity
@Table(name = "notes", uniqueConstraints = {
    @UniqueConstraint(name = "uk_notes_journal", columnNames = "transaction_journal_id")
})
@Data
@NoArgsConstructor
public class Note {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(optional = false)
    @JoinColumn(name = "transaction_journal_id", nullable = false)
    private TransactionJournal journal;

    @Lob
    @Column(name = "text")
    private String text;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Note(TransactionJournal journal, String text) {
        this.journal = journal;
        this.text = text;
        this.updatedAt = Instant.now();
    }
}
