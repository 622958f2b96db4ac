package com.poc.salesingest.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "sales_metrics", indexes = @Index(name = "idx_sales_metrics_user_created", columnList = "user_id, created_at"))
@Data
@NoArgsConstructor
public class SalesMetric {

    public static final String SOURCE_FILE = "file";
    public static final String SOURCE_TEXT = "text";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "source_type", nullable = false, length = 16)
    private String sourceType;

    // JSON document
    @Column(nullable = false, length = 65535)
    private String payload;

    @Column(name = "total_sales", precision = 19, scale = 2)
    private BigDecimal totalSales;

    @Column(name = "bill_row_count")
    private Integer billRowCount;

    @Column(name = "unique_bill_count")
    private Integer uniqueBillCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
