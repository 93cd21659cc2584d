package com.incoresoft.sosync.repository;

import com.incoresoft.sosync.repository.entity.SosCooldownEntity;
import com.incoresoft.sosync.repository.entity.SosCooldownPK;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface SosCooldownRepository extends JpaRepository<SosCooldownEntity, SosCooldownPK> {

    @Transactional
    @Modifying
    @Query("delete from SosCooldownEntity c where c.groupId = :groupId")
    int deleteByGroupId(@Param("groupId") String groupId);
}
