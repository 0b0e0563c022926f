package com.journalengine.categories;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Finds or creates categories.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryService {

    private final CategoryRepository categoryRepository;

    /**
     * Finds a category by id, then by name; an unknown name creates the category.
     * Returns empty when neither identifies anything.
     */
    @Transactional
    public Optional<Category> findOrCreate(String userId, Long categoryId, String categoryName) {
        if (categoryId != null && categoryId > 0) {
            Optional<Category> byId = categoryRepository.findByIdAndUserId(categoryId, userId);
            if (byId.isPresent()) {
                return byId;
            }
        }
        if (categoryName == null || categoryName.isBlank()) {
            return Optional.empty();
        }
        String name = categoryName.trim();
        Optional<Category> byName = categoryRepository.findFirstByUserIdAndNameOrderByIdAsc(userId, name);
        if (byName.isPresent()) {
            return byName;
        }
        Category category = categoryRepository.save(new Category(userId, name));
        log.info("Created category #{} (\"{}\") for user {}", category.getId(), name, userId);
        return Optional.of(category);
    }
}
