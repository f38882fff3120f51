package com.killfeed.engine.domain.repository;

import com.killfeed.engine.domain.model.StoredEventRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface StoredEventRepository extends JpaRepository<StoredEventRecord, String>, StoredEventSearchRepository {

    Optional<StoredEventRecord> findFirstByFingerprintAndTimestampEpochMsBetweenOrderByTimestampEpochMsDesc(
            String fingerprint, long fromEpochMs, long toEpochMs);

    List<StoredEventRecord> findAllByOrderByTimestampEpochMsDesc(Pageable pageable);

    @Query("SELECT e.id FROM StoredEventRecord e ORDER BY e.timestampEpochMs ASC, e.createdAtEpochMs ASC")
    List<String> findOldestIds(Pageable pageable);

    long countByPlayerInvolvedTrue();

    @Query("SELECT e.source, COUNT(e) FROM StoredEventRecord e GROUP BY e.source")
    List<Object[]> countBySource();

    @Query("SELECT MIN(e.timestampEpochMs) FROM StoredEventRecord e")
    Long findOldestTimestamp();

    @Query("SELECT MAX(e.timestampEpochMs) FROM StoredEventRecord e")
    Long findNewestTimestamp();
}
