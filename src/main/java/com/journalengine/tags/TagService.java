package com.journalengine.tags;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Finds or creates tags.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TagService {

    private final TagRepository tagRepository;

    @Transactional
    public Tag findOrCreate(String userId, String value) {
        String name = value.trim();
        return tagRepository.findFirstByUserIdAndTagOrderByIdAsc(userId, name)
            .orElseGet(() -> {
                Tag tag = tagRepository.save(new Tag(userId, name));
                log.info("Created tag #{} (\"{}\") for user {}", tag.getId(), name, userId);
                return tag;
            });
    }

    /**
     * Turns a list of tag names into tags. Blank and duplicate names are ignored.
     */
    @Transactional
    public Set<Tag> findOrCreateAll(String userId, Collection<?> values) {
        Set<String> names = new LinkedHashSet<>();
        for (Object value : values) {
            String name = value == null ? "" : value.toString().trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        Set<Tag> tags = new LinkedHashSet<>();
        for (String name : names) {
            tags.add(findOrCreate(userId, name));
        }
        return tags;
    }
}
