package com.journalengine.journals;

import lombok.Value;

import java.util.Objects;

/**
 * The two legs of a journal. Holding both legs in one value makes the
 * double-entry structure explicit: there is always exactly one source and
 * one destination.
 */
@Value
public class LegPair {
    Transaction source;
    Transaction destination;

    public LegPair(Transaction source, Transaction destination) {
        this.source = Objects.requireNonNull(source, "source leg");
        this.destination = Objects.requireNonNull(destination, "destination leg");
        if (source == destination) {
            throw new IllegalArgumentException("Source and destination leg must be different legs");
        }
    }
}
