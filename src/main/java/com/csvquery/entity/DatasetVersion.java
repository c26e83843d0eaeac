package com.csvquery.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "dataset_versions",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_dataset_versions_key",
                columnNames = {"dataset_id", "version_id", "user_id"}),
        indexes = @Index(name = "ix_dataset_versions_lookup", columnList = "dataset_id, user_id, created_at"))
@Data
public class DatasetVersion {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dataset_id", nullable = false, length = 128)
    private String datasetId;

    @Column(name = "version_id", nullable = false, length = 128)
    private String versionId;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "file_path", nullable = false, columnDefinition = "TEXT")
    private String filePath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status = Status.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /** PENDING until ingestion finishes; FAILED marks a registered version whose table never materialized. */
    public enum Status { PENDING, READY, FAILED }

    public String tableName() {
        return datasetId + "_v" + versionId;
    }

    @PrePersist void prePersist() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }
    @PreUpdate void preUpdate() { updatedAt = Instant.now(); }
}
