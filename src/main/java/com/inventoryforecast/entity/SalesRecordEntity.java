package com.inventoryforecast.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "sales_records",
    indexes = {
        @Index(name = "idx_sales_session",  columnList = "session_id"),
        @Index(name = "idx_sales_position", columnList = "session_id, upload_position"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SalesRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    /** Order within the upload; forward-filling missing dates depends on it. */
    @Column(name = "upload_position", nullable = false)
    private int uploadPosition;

    @Column(name = "sale_date")
    private LocalDate saleDate;

    @Column(name = "product_id", length = 100)
    private String productId;

    private Double quantity;

    @Column(name = "unit_price")
    private Double unitPrice;

    @Column(length = 100)
    private String store;

    @Column(name = "customer_segment", length = 100)
    private String customerSegment;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "request_id", length = 64)
    private String requestId;
}
