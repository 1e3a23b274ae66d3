package com.codefarm.shortlink.service.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

/**
 * A persisted short link. Rows are written once and never updated or deleted.
 */
@Entity
@Table(name = "short_links")
public class LinkRecord {

    public static final int MAX_SHORT_ID_LENGTH = 32;
    public static final int MAX_LONG_URL_LENGTH = 2048;

    @Id
    @Column(name = "short_id", nullable = false, updatable = false, length = MAX_SHORT_ID_LENGTH)
    private String shortId;

    @Column(name = "long_url", nullable = false, updatable = false, length = MAX_LONG_URL_LENGTH)
    private String longUrl;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    protected LinkRecord() {
        // JPA only
    }

    public LinkRecord(String shortId, String longUrl, LocalDateTime createdAt) {
        this.shortId = shortId;
        this.longUrl = longUrl;
        this.createdAt = createdAt;
    }

    public String getShortId() {
        return shortId;
    }

    public String getLongUrl() {
        return longUrl;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }
}
