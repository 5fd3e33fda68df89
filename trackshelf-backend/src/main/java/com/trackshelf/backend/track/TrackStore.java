package com.trackshelf.backend.track;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Metadata store for tracks. Sits on top of {@link TrackRepository} and turns Spring's data access
 * failures into the API's error types: an unreachable database is {@link StoreUnavailableException},
 * everything else is {@link TrackPersistenceException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrackStore {

    private final TrackRepository trackRepository;

    /** Persists a new track and returns it with its id and creation time filled in. */
    public Track insert(Track track) {
        return call("Database error while saving track", () -> trackRepository.saveAndFlush(track));
    }

    /** Newest first. A null or zero limit returns everything. */
    public List<Track> list(Integer limit) {
        if (limit == null || limit == 0) {
            return call("Database error while listing tracks", trackRepository::findAllByOrderByCreatedAtDescIdDesc);
        }
        return call("Database error while listing tracks",
                () -> trackRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, limit)));
    }

    public Track getById(String id) {
        long parsed = parseId(id);
        return call("Database error while loading track", () -> trackRepository.findById(parsed))
                .orElseThrow(() -> new TrackNotFoundException("Track not found"));
    }

    public Optional<Track> findByFilename(String filename) {
        return call("Database error while loading track", () -> trackRepository.findByFilename(filename));
    }

    public long count() {
        return call("Database error while counting tracks", trackRepository::count);
    }

    static long parseId(String id) {
        if (id == null || id.isEmpty() || id.length() > 19 || !id.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new InvalidTrackIdException("Invalid track id");
        }
        try {
            long value = Long.parseLong(id);
            if (value <= 0) throw new InvalidTrackIdException("Invalid track id");
            return value;
        } catch (NumberFormatException e) {
            throw new InvalidTrackIdException("Invalid track id");
        }
    }

    private static <T> T call(String failureMessage, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Database not available", e);
        } catch (DataAccessException | TransactionException e) {
            throw new TrackPersistenceException(failureMessage, e);
        }
    }
}
