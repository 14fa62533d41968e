package com.xammer.tagops.repository;

import com.xammer.tagops.domain.Policy;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PolicyRepository extends JpaRepository<Policy, Long> {

    List<Policy> findAllByOrderByIdAsc();

    List<Policy> findAllByActiveTrueOrderByIdAsc();
}
