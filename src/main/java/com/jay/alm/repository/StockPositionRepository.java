package com.jay.alm.repository;

import com.jay.alm.entity.StockPosition;
import com.jay.alm.model.enums.PositionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StockPositionRepository extends JpaRepository<StockPosition, String> {

    List<StockPosition> findByStatusOrderByEntryTimestampAscPositionIdAsc(PositionStatus status);

    List<StockPosition> findAllByOrderByEntryTimestampAscPositionIdAsc();
}
