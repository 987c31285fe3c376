package com.example.voter.controller;

import com.example.voter.dto.HealthResponseDTO;
import com.example.voter.model.Voter;
import com.example.voter.model.VoterHistory;
import com.example.voter.service.ApiStats;
import com.example.voter.service.VoterService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/voters")
public class VoterController {

    private final VoterService voterService;
    private final ApiStats apiStats;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<List<Voter>> listAllVoters() {
        return ok(voterService.getAllVoters());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Voter> getVoter(@PathVariable("id") int id) {
        return ok(voterService.getVoter(id));
    }

    @PostMapping
    public ResponseEntity<Voter> addVoter(@RequestBody Voter voter) {
        return ok(voterService.addVoter(voter));
    }

    @PutMapping
    public ResponseEntity<Voter> updateVoter(@RequestBody Voter voter) {
        return ok(voterService.updateVoter(voter));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<String> deleteVoter(@PathVariable("id") int id) {
        voterService.deleteVoter(id);
        return ok("Delete OK");
    }

    @DeleteMapping
    public ResponseEntity<String> deleteAllVoters() {
        long removed = voterService.deleteAll();
        return ok("Delete All OK: " + removed + " voters removed");
    }

    @GetMapping("/{id}/polls")
    public ResponseEntity<List<VoterHistory>> getVoterPolls(@PathVariable("id") int id) {
        return ok(voterService.getVoterHistory(id));
    }

    @GetMapping("/{id}/polls/{pollid}")
    public ResponseEntity<VoterHistory> getVoterPoll(@PathVariable("id") int id,
                                                     @PathVariable("pollid") int pollId) {
        return ok(voterService.getVoterPoll(id, pollId));
    }

    @PostMapping("/{id}/polls/{pollid}")
    public ResponseEntity<VoterHistory> addVoterPoll(@PathVariable("id") int id,
                                                     @PathVariable("pollid") int pollId,
                                                     @RequestBody VoterHistory history) {
        return ok(voterService.addVoterPoll(id, forPoll(history, pollId)));
    }

    @PutMapping("/{id}/polls/{pollid}")
    public ResponseEntity<VoterHistory> updateVoterPoll(@PathVariable("id") int id,
                                                        @PathVariable("pollid") int pollId,
                                                        @RequestBody VoterHistory history) {
        return ok(voterService.updateVoterPoll(id, pollId, forPoll(history, pollId)));
    }

    @DeleteMapping("/{id}/polls/{pollid}")
    public ResponseEntity<String> deleteVoterPoll(@PathVariable("id") int id,
                                                  @PathVariable("pollid") int pollId) {
        voterService.deleteVoterPoll(id, pollId);
        return ok("Voter history deleted successfully");
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponseDTO> health() {
        return ResponseEntity.ok(apiStats.snapshot());
    }

    // the path's poll id wins over the body's
    private VoterHistory forPoll(VoterHistory history, int pollId) {
        history.setPollId(pollId);
        if (history.getVoteDate() == null) {
            history.setVoteDate(clock.instant());
        }
        return history;
    }

    private <T> ResponseEntity<T> ok(T body) {
        apiStats.recordProcessed();
        return ResponseEntity.ok(body);
    }
}
