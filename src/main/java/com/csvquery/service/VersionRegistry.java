package com.csvquery.service;

import com.csvquery.entity.DatasetVersion;
import com.csvquery.exception.RegistrationConflictException;
import com.csvquery.repo.DatasetVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of registered uploads. A version is registered before its table
 * exists, so callers that need a queryable table must look at {@link DatasetVersion#getStatus()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VersionRegistry {

    private final DatasetVersionRepository versions;

    public static String newVersionId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public DatasetVersion register(String datasetId, String versionId, String userId, String filePath) {
        if (versions.existsByDatasetIdAndVersionIdAndUserId(datasetId, versionId, userId)) {
            throw new RegistrationConflictException(
                    "Version " + versionId + " of dataset " + datasetId + " is already registered for user " + userId);
        }

        DatasetVersion v = new DatasetVersion();
        v.setDatasetId(datasetId);
        v.setVersionId(versionId);
        v.setUserId(userId);
        v.setFilePath(filePath);
        v.setStatus(DatasetVersion.Status.PENDING);
        try {
            DatasetVersion saved = versions.saveAndFlush(v);
            log.info("Registered dataset={} version={} user={} path={}", datasetId, versionId, userId, filePath);
            return saved;
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent registration of the same key
            throw new RegistrationConflictException(
                    "Version " + versionId + " of dataset " + datasetId + " is already registered for user " + userId, e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<String> getLatest(String datasetId, String userId) {
        return findLatest(datasetId, userId).map(DatasetVersion::getVersionId);
    }

    @Transactional(readOnly = true)
    public Optional<DatasetVersion> findLatest(String datasetId, String userId) {
        return versions.findFirstByDatasetIdAndUserIdOrderByCreatedAtDescIdDesc(datasetId, userId);
    }

    /** Newest version whose table finished materializing; dangling and in-flight versions are skipped. */
    @Transactional(readOnly = true)
    public Optional<DatasetVersion> findLatestReady(String datasetId, String userId) {
        return versions.findFirstByDatasetIdAndUserIdAndStatusOrderByCreatedAtDescIdDesc(
                datasetId, userId, DatasetVersion.Status.READY);
    }

    @Transactional(readOnly = true)
    public Optional<DatasetVersion> find(String datasetId, String versionId, String userId) {
        return versions.findByDatasetIdAndVersionIdAndUserId(datasetId, versionId, userId);
    }

    @Transactional
    public void markReady(String datasetId, String versionId, String userId) {
        updateStatus(datasetId, versionId, userId, DatasetVersion.Status.READY);
    }

    @Transactional
    public void markFailed(String datasetId, String versionId, String userId) {
        updateStatus(datasetId, versionId, userId, DatasetVersion.Status.FAILED);
    }

    private void updateStatus(String datasetId, String versionId, String userId, DatasetVersion.Status status) {
        int updated = versions.updateStatus(datasetId, versionId, userId, status, Instant.now());
        if (updated == 0) {
            log.warn("No version record to mark {}: dataset={} version={} user={}", status, datasetId, versionId, userId);
        }
    }
}
