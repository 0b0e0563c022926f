package com.journalengine.update;

import lombok.Value;

/**
 * A requested change that was not applied, and why.
 */
@Value
public class UpdateIssue {
    UpdateStep step;
    String field;
    UpdateOutcome outcome;
    String message;
}
