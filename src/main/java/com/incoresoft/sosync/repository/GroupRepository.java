package com.incoresoft.sosync.repository;

import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.repository.entity.GroupEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface GroupRepository extends JpaRepository<GroupEntity, String> {

    @Query("select g from GroupEntity g where :userId member of g.members")
    List<GroupEntity> findByMember(@Param("userId") String userId);

    /**
     * Leaf write of the derived group status. Does not touch the version column.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update GroupEntity g set g.currentStatus = :status where g.id = :id")
    int updateStatus(@Param("id") String id, @Param("status") GroupStatus status);

    /**
     * Partial multi-field update; null parameters keep the stored value.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update GroupEntity g set "
            + "g.name = coalesce(:name, g.name), "
            + "g.safetyCheckIntervalMinutes = coalesce(:checkInterval, g.safetyCheckIntervalMinutes), "
            + "g.sosIntervalMinutesPerUser = coalesce(:sosInterval, g.sosIntervalMinutesPerUser), "
            + "g.lastSafetyCheckAt = coalesce(:lastCheckAt, g.lastSafetyCheckAt), "
            + "g.currentStatus = coalesce(:status, g.currentStatus) "
            + "where g.id = :id")
    int patch(@Param("id") String id,
              @Param("name") String name,
              @Param("checkInterval") Integer checkInterval,
              @Param("sosInterval") Integer sosInterval,
              @Param("lastCheckAt") Instant lastCheckAt,
              @Param("status") GroupStatus status);
}
