package com.trackshelf.backend.track;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TrackRepository extends JpaRepository<Track, Long> {

    // newest first; id breaks ties between rows created in the same instant
    List<Track> findAllByOrderByCreatedAtDescIdDesc();

    List<Track> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);

    Optional<Track> findByFilename(String filename);
}
