package com.causalgraph.repository.jpa;

import com.causalgraph.entity.TemporalPatternRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TemporalPatternJpaRepository extends JpaRepository<TemporalPatternRecord, String> {}
