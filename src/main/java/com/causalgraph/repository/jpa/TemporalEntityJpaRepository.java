package com.causalgraph.repository.jpa;

import com.causalgraph.entity.TemporalEntityRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the temporal_entities archive. Written by GraphArchiveService in batches.
 */
@Repository
public interface TemporalEntityJpaRepository extends JpaRepository<TemporalEntityRecord, String> {}
