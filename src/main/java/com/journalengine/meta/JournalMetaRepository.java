package com.journalengine.meta;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for journal metadata.
 */
@Repository
public interface JournalMetaRepository extends JpaRepository<JournalMeta, Long> {

    Optional<JournalMeta> findByJournalIdAndName(Long journalId, String name);
}
