package com.newsdigest.backend.ai.repository;

import com.newsdigest.backend.ai.entity.ApiUsageLog;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ApiUsageLogRepository extends JpaRepository<ApiUsageLog, Long> {

    @Query("SELECT COUNT(a) FROM ApiUsageLog a WHERE a.operation = :operation AND a.usedAt >= :since")
    Long countOperationUsageSince(@Param("operation") String operation, @Param("since") LocalDateTime since);

    @Query("SELECT COUNT(a) FROM ApiUsageLog a WHERE a.operation = :operation AND a.success = false AND a.usedAt >= :since")
    Long countOperationFailuresSince(@Param("operation") String operation, @Param("since") LocalDateTime since);

    @Query("SELECT SUM(a.tokenCount) FROM ApiUsageLog a WHERE a.operation = :operation AND a.usedAt >= :since")
    Long sumTokensByOperationSince(@Param("operation") String operation, @Param("since") LocalDateTime since);

    @Query("SELECT a FROM ApiUsageLog a WHERE a.success = false ORDER BY a.usedAt DESC")
    List<ApiUsageLog> findFailedOperations();

    List<ApiUsageLog> findByItemId(Long itemId);

    @Modifying
    @Query("DELETE FROM ApiUsageLog a WHERE a.usedAt < :cutoff")
    int deleteByUsedAtBefore(@Param("cutoff") LocalDateTime cutoff);
}
