package com.journalengine.categories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for categories.
 */
@Repository
public interface CategoryRepository extends JpaRepository<Category, Long> {

    Optional<Category> findByIdAndUserId(Long id, String userId);

    Optional<Category> findFirstByUserIdAndNameOrderByIdAsc(String userId, String name);
}
