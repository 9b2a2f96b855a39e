package com.spinrank.tournament.repository;

import com.spinrank.tournament.model.Tournament;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the published snapshot of every tournament.
 *
 * Snapshots are never mutated after {@link #save(Tournament)}; writers take {@link #lockFor(UUID)},
 * mutate a copy and publish it, so readers always see a whole transition or none of it.
 * A lock exists exactly as long as its tournament: it is created on the first save and dropped on delete.
 */
@Repository
public class InMemoryTournamentRepository {

    private static final Comparator<Tournament> CREATION_ORDER = Comparator
            .comparing(Tournament::getCreatedAt, Comparator.nullsLast(Comparator.<OffsetDateTime>naturalOrder()))
            .thenComparing(Tournament::getTournamentId);

    private final Map<UUID, Tournament> snapshots = new ConcurrentHashMap<>();
    private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

    public Optional<Tournament> findById(UUID tournamentId) {
        if (tournamentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshots.get(tournamentId));
    }

    public List<Tournament> findAll() {
        return snapshots.values().stream()
                .sorted(CREATION_ORDER)
                .toList();
    }

    public List<Tournament> findByParentTournamentId(UUID parentTournamentId) {
        return snapshots.values().stream()
                .filter(tournament -> Objects.equals(parentTournamentId, tournament.getParentTournamentId()))
                .sorted(CREATION_ORDER)
                .toList();
    }

    public Tournament save(Tournament tournament) {
        Objects.requireNonNull(tournament.getTournamentId(), "tournamentId is required");
        locks.computeIfAbsent(tournament.getTournamentId(), ignored -> new ReentrantLock());
        snapshots.put(tournament.getTournamentId(), tournament);
        return tournament;
    }

    public void delete(UUID tournamentId) {
        snapshots.remove(tournamentId);
        locks.remove(tournamentId);
    }

    /**
     * Write lock of a stored tournament. Unknown ids get no lock, so failed lookups leave nothing behind.
     * Holders must re-read the snapshot after locking: the tournament may have been deleted meanwhile.
     */
    public Optional<ReentrantLock> lockFor(UUID tournamentId) {
        if (tournamentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(locks.get(tournamentId));
    }

    public int lockCount() {
        return locks.size();
    }
}
