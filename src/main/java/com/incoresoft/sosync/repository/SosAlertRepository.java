package com.incoresoft.sosync.repository;

import com.incoresoft.sosync.repository.entity.SosAlertEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface SosAlertRepository extends JpaRepository<SosAlertEntity, String> {

    List<SosAlertEntity> findByGroupIdOrderByTimestampDesc(String groupId);

    /**
     * Deactivates the alert only while it is still active, so the first resolution sticks.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update SosAlertEntity a set a.active = false, a.resolvedAt = :resolvedAt, a.resolvedReason = :reason "
            + "where a.id = :id and a.active = true")
    int resolveIfActive(@Param("id") String id,
                        @Param("resolvedAt") Instant resolvedAt,
                        @Param("reason") String reason);

    @Transactional
    @Modifying
    @Query("delete from SosAlertEntity a where a.groupId = :groupId")
    int deleteByGroupId(@Param("groupId") String groupId);
}
