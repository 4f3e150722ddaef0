package com.ledgerlens.categorizer.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "transactions", indexes = {
        @Index(name = "idx_transactions_user_categorized", columnList = "user_id, is_categorized"),
        @Index(name = "idx_transactions_user_batch", columnList = "user_id, import_batch")
})
public class TransactionEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "import_batch", length = 100)
    private String importBatch;

    @Column(name = "description", nullable = false, columnDefinition = "text")
    private String description;

    @Column(name = "vendor")
    private String vendor;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "subcategory", length = 100)
    private String subcategory;

    @Column(name = "is_categorized", nullable = false)
    private boolean categorized;

    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Column(name = "categorization_method", length = 20)
    private String categorizationMethod;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    // Default constructor for JPA
    public TransactionEntity() {}

    public TransactionEntity(UUID id, UUID userId, String importBatch, String description, String vendor,
                             BigDecimal amount, Instant occurredAt, String category, String subcategory,
                             boolean categorized, Double confidenceScore, String categorizationMethod,
                             Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.userId = userId;
        this.importBatch = importBatch;
        this.description = description;
        this.vendor = vendor;
        this.amount = amount;
        this.occurredAt = occurredAt;
        this.category = category;
        this.subcategory = subcategory;
        this.categorized = categorized;
        this.confidenceScore = confidenceScore;
        this.categorizationMethod = categorizationMethod;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getUserId() { return userId; }
    public void setUserId(UUID userId) { this.userId = userId; }

    public String getImportBatch() { return importBatch; }
    public void setImportBatch(String importBatch) { this.importBatch = importBatch; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getVendor() { return vendor; }
    public void setVendor(String vendor) { this.vendor = vendor; }

    public BigDecimal getAmount() { return amount; }
    public void setAmount(BigDecimal amount) { this.amount = amount; }

    public Instant getOccurredAt() { return occurredAt; }
    public void setOccurredAt(Instant occurredAt) { this.occurredAt = occurredAt; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public String getSubcategory() { return subcategory; }
    public void setSubcategory(String subcategory) { this.subcategory = subcategory; }

    public boolean isCategorized() { return categorized; }
    public void setCategorized(boolean categorized) { this.categorized = categorized; }

    public Double getConfidenceScore() { return confidenceScore; }
    public void setConfidenceScore(Double confidenceScore) { this.confidenceScore = confidenceScore; }

    public String getCategorizationMethod() { return categorizationMethod; }
    public void setCategorizationMethod(String categorizationMethod) { this.categorizationMethod = categorizationMethod; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
