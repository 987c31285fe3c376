package com.example.voter.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One recorded vote, embedded in the owning voter's document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoterHistory {
    private int pollId;
    private int voteId;
    private Instant voteDate;
}
