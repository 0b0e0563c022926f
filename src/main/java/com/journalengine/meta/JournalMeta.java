package com.journalengine.meta;

import com.journalengine.journals.TransactionJournal;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A named metadata value on a journal, such as an external id or a due date.
 */
@Entity
@Table(name = "journal_meta", uniqueConstraints = {
    @UniqueConstraint(name = "uk_journal_meta_name", columnNames = {"transaction_journal_id", "name"})
})
@Data
@NoArgsConstructor
public class JournalMeta {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "transaction_journal_id", nullable = false)
    private TransactionJournal journal;

    @NotBlank
    @Column(nullable = false)
    private String name;

    @Column(length = 1024)
    private String data;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public JournalMeta(TransactionJournal journal, String name, String data) {
        this.journal = journal;
        this.name = name;
        this.data = data;
        this.updatedAt = Instant.now();
    }
}
