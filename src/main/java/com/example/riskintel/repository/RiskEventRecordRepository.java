package com.example.riskintel.repository;

import com.example.riskintel.domain.EventStatus;
import com.example.riskintel.domain.RiskEventRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface RiskEventRecordRepository extends JpaRepository<RiskEventRecord, String> {

    List<RiskEventRecord> findByFingerprintOrderByFirstSeenAtDesc(String fingerprint);

    /** Records whose dedup window is still open. */
    List<RiskEventRecord> findByWindowClosesAtAfter(Instant now);

    List<RiskEventRecord> findByStatusNotAndLastSeenAtBefore(EventStatus status, Instant cutoff);

    long countByStatus(EventStatus status);
}
