package com.csvquery.repo;

import com.csvquery.entity.DatasetVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DatasetVersionRepository extends JpaRepository<DatasetVersion, Long> {

    boolean existsByDatasetIdAndVersionIdAndUserId(String datasetId, String versionId, String userId);

    Optional<DatasetVersion> findByDatasetIdAndVersionIdAndUserId(String datasetId, String versionId, String userId);

    Optional<DatasetVersion> findFirstByDatasetIdAndUserIdOrderByCreatedAtDescIdDesc(String datasetId, String userId);

    Optional<DatasetVersion> findFirstByDatasetIdAndUserIdAndStatusOrderByCreatedAtDescIdDesc(
            String datasetId, String userId, DatasetVersion.Status status);

    List<DatasetVersion> findByUserIdOrderByCreatedAtDesc(String userId);

    @Modifying(clearAutomatically = true)
    @Query("update DatasetVersion v set v.status = :status, v.updatedAt = :updatedAt " +
            "where v.datasetId = :datasetId and v.versionId = :versionId and v.userId = :userId")
    int updateStatus(@Param("datasetId") String datasetId,
                     @Param("versionId") String versionId,
                     @Param("userId") String userId,
                     @Param("status") DatasetVersion.Status status,
                     @Param("updatedAt") Instant updatedAt);
}
