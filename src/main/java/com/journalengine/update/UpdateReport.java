package com.journalengine.update;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the issues of one update call.
 */
@Slf4j
public class UpdateReport {

    private final List<UpdateIssue> issues = new ArrayList<>();

    public void skipped(UpdateStep step, String field, String message) {
        add(new UpdateIssue(step, field, UpdateOutcome.SKIPPED, message));
    }

    public void rejected(UpdateStep step, String field, String message) {
        add(new UpdateIssue(step, field, UpdateOutcome.REJECTED, message));
    }

    public void failed(UpdateStep step, String field, String message) {
        add(new UpdateIssue(step, field, UpdateOutcome.FAILED, message));
    }

    public List<UpdateIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    private void add(UpdateIssue issue) {
        log.warn("{} {} ({}): {}", issue.getStep(), issue.getOutcome(), issue.getField(), issue.getMessage());
        issues.add(issue);
    }
}
