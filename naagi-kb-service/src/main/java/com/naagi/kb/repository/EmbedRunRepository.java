package com.naagi.kb.repository;

import com.naagi.kb.entity.EmbedRun;
import com.naagi.kb.entity.EmbedRun.Status;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EmbedRunRepository extends JpaRepository<EmbedRun, String> {

    Optional<EmbedRun> findFirstByRunIdOrderByCreatedAtDesc(String runId);

    List<EmbedRun> findByRunIdOrderByCreatedAtDesc(String runId);

    List<EmbedRun> findByStatusOrderByCreatedAtDesc(Status status);
}
