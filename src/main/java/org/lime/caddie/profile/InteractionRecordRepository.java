package org.lime.caddie.profile;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;

public interface InteractionRecordRepository extends JpaRepository<InteractionRecord, Long>,
        JpaSpecificationExecutor<InteractionRecord> {

    List<InteractionRecord> findTop20ByUserIdOrderByRecordedAtDescIdDesc(String userId);

    long deleteByUserId(String userId);
}
