package com.journalengine.tags;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A free-form label on journals.
 */
@Entity
@Table(name = "tags", indexes = {
    @Index(name = "idx_tags_user_id", columnList = "user_id")
})
@Data
@NoArgsConstructor
public class Tag {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "user_id", nullable = false)
    private String userId;

    @NotBlank
    @Column(nullable = false)
    private String tag;

    public Tag(String userId, String tag) {
        this.userId = userId;
        this.tag = tag;
    }
}
