package com.incoresoft.sosync.repository;

import com.incoresoft.sosync.repository.entity.SafetyResponseEntity;
import com.incoresoft.sosync.repository.entity.SafetyResponsePK;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public interface SafetyResponseRepository extends JpaRepository<SafetyResponseEntity, SafetyResponsePK> {

    List<SafetyResponseEntity> findByCheckId(String checkId);

    List<SafetyResponseEntity> findByCheckIdIn(Collection<String> checkIds);

    @Transactional
    @Modifying
    @Query("delete from SafetyResponseEntity r where r.checkId in :checkIds")
    int deleteByCheckIds(@Param("checkIds") Collection<String> checkIds);
}
