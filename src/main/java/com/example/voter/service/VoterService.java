package com.example.voter.service;

import com.example.voter.config.VoterConfig;
import com.example.voter.exception.DuplicatePollException;
import com.example.voter.exception.InvalidVoterException;
import com.example.voter.exception.PollNotFoundException;
import com.example.voter.exception.StoreException;
import com.example.voter.exception.VoterAlreadyExistsException;
import com.example.voter.exception.VoterNotFoundException;
import com.example.voter.model.Voter;
import com.example.voter.model.VoterHistory;
import com.example.voter.storage.KVStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Data access for voters. Each voter lives under {@code <prefix><id>} as a single JSON
 * document; history operations rewrite the whole document.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VoterService {
    private final KVStore kvStore;
    private final ObjectMapper objectMapper;
    private final VoterConfig voterConfig;

    public Voter addVoter(Voter voter) {
        validate(voter);
        if (!kvStore.putIfAbsent(keyFor(voter.getId()), toJson(voter))) {
            throw new VoterAlreadyExistsException(voter.getId());
        }
        log.info("Added voter {}", voter.getId());
        return voter;
    }

    public Voter updateVoter(Voter voter) {
        validate(voter);
        if (!kvStore.replace(keyFor(voter.getId()), toJson(voter))) {
            throw new VoterNotFoundException(voter.getId());
        }
        log.info("Updated voter {}", voter.getId());
        return voter;
    }

    public Voter getVoter(int voterId) {
        String document = kvStore.get(keyFor(voterId));
        if (document == null) {
            throw new VoterNotFoundException(voterId);
        }
        return fromJson(document);
    }

    public List<Voter> getAllVoters() {
        List<Voter> voters = new ArrayList<>();
        for (String key : kvStore.keys(voterConfig.getKeyPrefix())) {
            String document = kvStore.get(key);
            if (document == null) {
                // deleted between listing and fetch
                continue;
            }
            voters.add(fromJson(document));
        }
        voters.sort(Comparator.comparingInt(Voter::getId));
        return voters;
    }

    public void deleteVoter(int voterId) {
        if (!kvStore.remove(keyFor(voterId))) {
            throw new VoterNotFoundException(voterId);
        }
        log.info("Deleted voter {}", voterId);
    }

    public long deleteAll() {
        List<String> keys = kvStore.keys(voterConfig.getKeyPrefix());
        long removed = kvStore.removeAll(keys);
        if (removed != keys.size()) {
            throw new StoreException("Deleted " + removed + " of " + keys.size() + " voters");
        }
        log.info("Deleted all {} voters", removed);
        return removed;
    }

    public List<VoterHistory> getVoterHistory(int voterId) {
        return getVoter(voterId).getVoteHistory();
    }

    public VoterHistory getVoterPoll(int voterId, int pollId) {
        List<VoterHistory> history = getVoterHistory(voterId);
        int index = indexOfPoll(history, pollId);
        if (index < 0) {
            throw new PollNotFoundException(voterId, pollId);
        }
        return history.get(index);
    }

    public VoterHistory addVoterPoll(int voterId, VoterHistory entry) {
        VoterHistory added = mutateHistory(voterId, history -> {
            if (indexOfPoll(history, entry.getPollId()) >= 0) {
                throw new DuplicatePollException(voterId, entry.getPollId());
            }
            history.add(entry);
            return entry;
        });
        log.info("Added poll {} to voter {}", entry.getPollId(), voterId);
        return added;
    }

    public VoterHistory updateVoterPoll(int voterId, int pollId, VoterHistory entry) {
        VoterHistory updated = mutateHistory(voterId, history -> {
            int index = indexOfPoll(history, pollId);
            if (index < 0) {
                throw new PollNotFoundException(voterId, pollId);
            }
            history.set(index, entry);
            return entry;
        });
        log.info("Updated poll {} of voter {}", pollId, voterId);
        return updated;
    }

    public void deleteVoterPoll(int voterId, int pollId) {
        mutateHistory(voterId, history -> {
            int index = indexOfPoll(history, pollId);
            if (index < 0) {
                throw new PollNotFoundException(voterId, pollId);
            }
            return history.remove(index);
        });
        log.info("Deleted poll {} of voter {}", pollId, voterId);
    }

    String keyFor(int voterId) {
        return voterConfig.getKeyPrefix() + voterId;
    }

    /**
     * Read-modify-write of a voter's history. The write is a compare-and-set against the
     * document that was read, so a concurrent writer forces a re-read instead of being
     * overwritten. Gives up after {@code voter.store.cas-max-attempts} lost races.
     */
    private <T> T mutateHistory(int voterId, Function<List<VoterHistory>, T> mutation) {
        String key = keyFor(voterId);
        int maxAttempts = Math.max(1, voterConfig.getStore().getCasMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String current = kvStore.get(key);
            if (current == null) {
                throw new VoterNotFoundException(voterId);
            }
            Voter voter = fromJson(current);
            T result = mutation.apply(voter.getVoteHistory());
            if (kvStore.compareAndSet(key, current, toJson(voter))) {
                return result;
            }
            log.warn("Voter {} changed during history update, retrying ({}/{})", voterId, attempt, maxAttempts);
        }
        throw new StoreException("Voter " + voterId + " kept changing, gave up after " + maxAttempts + " attempts");
    }

    private static int indexOfPoll(List<VoterHistory> history, int pollId) {
        for (int i = 0; i < history.size(); i++) {
            if (history.get(i).getPollId() == pollId) {
                return i;
            }
        }
        return -1;
    }

    private static void validate(Voter voter) {
        normalize(voter);
        if (voter.getVoteHistory().contains(null)) {
            throw new InvalidVoterException("Voter " + voter.getId() + " has a null history entry");
        }
    }

    private static void normalize(Voter voter) {
        if (voter.getVoteHistory() == null) {
            voter.setVoteHistory(new ArrayList<>());
        }
    }

    private String toJson(Voter voter) {
        try {
            return objectMapper.writeValueAsString(voter);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize voter " + voter.getId(), e);
        }
    }

    private Voter fromJson(String document) {
        try {
            Voter voter = objectMapper.readValue(document, Voter.class);
            normalize(voter);
            return voter;
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize voter document", e);
        }
    }
}
