package com.journalengine.meta;

import com.journalengine.journals.TransactionJournal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Creates, updates and removes journal metadata.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalMetaService {

    private final JournalMetaRepository metaRepository;

    /**
     * Upserts a metadata value. A null or empty value removes the entry.
     */
    @Transactional
    public void updateOrCreate(TransactionJournal journal, String name, String value) {
        Optional<JournalMeta> existing = metaRepository.findByJournalIdAndName(journal.getId(), name);
        if (value == null || value.isEmpty()) {
            existing.ifPresent(meta -> {
                metaRepository.delete(meta);
                log.debug("Removed meta field \"{}\" of journal #{}", name, journal.getId());
            });
            return;
        }
        JournalMeta meta = existing.orElseGet(() -> new JournalMeta(journal, name, value));
        meta.setData(value);
        meta.setUpdatedAt(Instant.now());
        metaRepository.save(meta);
        log.debug("Stored meta field \"{}\" = \"{}\" for journal #{}", name, value, journal.getId());
    }

    @Transactional(readOnly = true)
    public Optional<String> getMetaField(Long journalId, String name) {
        return metaRepository.findByJournalIdAndName(journalId, name).map(JournalMeta::getData);
    }
}
