package com.csvquery.repo;

import com.csvquery.entity.QueryLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface QueryLogRepository extends JpaRepository<QueryLog, Long> {
    List<QueryLog> findByDatasetIdAndUserIdOrderByCreatedAtDescIdDesc(String datasetId, String userId);
}
