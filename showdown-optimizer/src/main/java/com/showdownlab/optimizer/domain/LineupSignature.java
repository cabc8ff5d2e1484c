package com.showdownlab.optimizer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Canonical identity of a roster: the captain id plus the sorted ids of
 * everyone else. Two lineups with the same players but different captains
 * have different signatures.
 */
@Getter
@EqualsAndHashCode
public final class LineupSignature {

    private final String captainId;
    private final List<String> otherIds;

    public LineupSignature(String captainId, Collection<String> otherIds) {
        List<String> sorted = new ArrayList<>(otherIds);
        Collections.sort(sorted);
        this.captainId = captainId;
        this.otherIds = Collections.unmodifiableList(sorted);
    }

    @Override
    public String toString() {
        return captainId + "|" + String.join(",", otherIds);
    }
}
