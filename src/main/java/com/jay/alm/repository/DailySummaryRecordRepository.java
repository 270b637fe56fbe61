package com.jay.alm.repository;

import com.jay.alm.entity.DailySummaryRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DailySummaryRecordRepository extends JpaRepository<DailySummaryRecord, LocalDate> {

    List<DailySummaryRecord> findAllByOrderBySummaryDateAsc();

    Optional<DailySummaryRecord> findTopByOrderBySummaryDateAsc();
}
