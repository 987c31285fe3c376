package com.example.voter.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A voter record. Stored as one JSON document, history included.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Voter {
    private int id;
    private String name;
    private String email;
    private List<VoterHistory> voteHistory = new ArrayList<>();
}
