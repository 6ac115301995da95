package com.causalgraph.repository.jpa;

import com.causalgraph.entity.TemporalRelationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TemporalRelationJpaRepository extends JpaRepository<TemporalRelationRecord, String> {}
