package com.causalgraph.repository.jpa;

import com.causalgraph.entity.CausalChainRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CausalChainJpaRepository extends JpaRepository<CausalChainRecord, String> {}
