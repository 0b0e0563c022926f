package com.journalengine.update;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a journal update.
 */
@Value
public class UpdateResult {
    Long journalId;

    /**
     * Whether the compare hash of the journal's group changed.
     */
    boolean changed;

    List<UpdateIssue> issues;

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    public List<UpdateIssue> issuesFor(UpdateStep step) {
        return issues.stream()
            .filter(issue -> issue.getStep() == step)
            .collect(Collectors.toList());
    }
}
