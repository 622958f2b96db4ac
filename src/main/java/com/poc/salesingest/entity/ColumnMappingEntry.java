package com.poc.salesingest.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

@Entity
@Table(name = "column_mappings",
        uniqueConstraints = @UniqueConstraint(name = "uk_column_mappings_user_signature", columnNames = {"user_id", "signature"}))
@Data
@NoArgsConstructor
public class ColumnMappingEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false, length = 64)
    private String signature;

    @Column(name = "header_row", nullable = false)
    private int headerRow;

    @Column(name = "sales_column", nullable = false, length = 1000)
    private String salesColumn;

    @Column(name = "bill_column", nullable = false, length = 1000)
    private String billColumn;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
