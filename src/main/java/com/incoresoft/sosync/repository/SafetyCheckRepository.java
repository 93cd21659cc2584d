package com.incoresoft.sosync.repository;

import com.incoresoft.sosync.domain.check.dto.SafetyCheckStatus;
import com.incoresoft.sosync.repository.entity.SafetyCheckEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface SafetyCheckRepository extends JpaRepository<SafetyCheckEntity, String> {

    List<SafetyCheckEntity> findByGroupIdOrderByCreatedAtDesc(String groupId);

    /**
     * Moves a pending (or status-less) check to {@code status}. Terminal checks are never matched.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update SafetyCheckEntity c set c.status = :status, c.completedAt = :completedAt "
            + "where c.id = :id and (c.status is null or c.status = com.incoresoft.sosync.domain.check.dto.SafetyCheckStatus.PENDING)")
    int updateStatusIfPending(@Param("id") String id,
                              @Param("status") SafetyCheckStatus status,
                              @Param("completedAt") Instant completedAt);

    @Transactional
    @Modifying
    @Query("delete from SafetyCheckEntity c where c.groupId = :groupId")
    int deleteByGroupId(@Param("groupId") String groupId);
}
