package com.accessmonitoring.infrastructure.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    List<OutboxEvent> findTop500ByProcessedFalseOrderByIdAsc();

    long countByProcessedFalse();
}
