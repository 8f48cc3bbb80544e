package com.treasurylens.indexer;

import com.treasurylens.domain.Project;
import com.treasurylens.domain.SuckerGroup;

import java.util.Optional;

/**
 * Project row with its sucker group, when it belongs to one.
 */
public record IndexedProject(Project project, SuckerGroup suckerGroup) {

    public Optional<SuckerGroup> group() {
        return Optional.ofNullable(suckerGroup);
    }
}
