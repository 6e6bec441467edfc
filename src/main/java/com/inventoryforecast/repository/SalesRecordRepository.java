package com.inventoryforecast.repository;

import com.inventoryforecast.entity.SalesRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface SalesRecordRepository extends JpaRepository<SalesRecordEntity, UUID> {

    List<SalesRecordEntity> findBySessionIdOrderByUploadPositionAsc(String sessionId);

    long countBySessionId(String sessionId);

    @Modifying
    @Query("DELETE FROM SalesRecordEntity r WHERE r.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") String sessionId);
}
