package com.treasurylens.indexer;

import com.treasurylens.domain.Page;
import com.treasurylens.domain.Participant;

/**
 * Participants page plus the indexer's total row count for the filter.
 */
public record ParticipantPage(Page<Participant> page, long totalCount) {
}
