package com.jay.alm.repository;

import com.jay.alm.entity.ChronologicalEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ChronologicalEventRepository extends JpaRepository<ChronologicalEvent, Long> {

    List<ChronologicalEvent> findAllByOrderByTimestampAscSourceTransactionIdAsc();

    List<ChronologicalEvent> findByTimestampGreaterThanEqualAndTimestampLessThanOrderByTimestampAscSourceTransactionIdAsc(
        Instant from, Instant to);

    @Query("SELECT e.sourceTransactionId FROM ChronologicalEvent e")
    List<String> findAllSourceTransactionIds();
}
