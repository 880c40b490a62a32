package com.conflictdata.model;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Entity
@Table(name = "feedback", indexes = {
    @Index(name = "idx_feedback_country_admin1", columnList = "country, admin1"),
    @Index(name = "idx_feedback_created_at", columnList = "created_at")
})
public class Feedback {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User author;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "conflict_id")
    private ConflictRecord conflictRecord;

    @Column(nullable = false, length = 100)
    private String country;

    @Column(name = "admin1", nullable = false, length = 100)
    private String region;

    @Column(nullable = false, length = 600)
    private String text;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(ZoneOffset.UTC);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public User getAuthor() { return author; }
    public void setAuthor(User author) { this.author = author; }
    public ConflictRecord getConflictRecord() { return conflictRecord; }
    public void setConflictRecord(ConflictRecord conflictRecord) { this.conflictRecord = conflictRecord; }
    public String getCountry() { return country; }
    public void setCountry(String country) { this.country = country; }
    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }
    public String getText() { return text; }
    public void setText(String text) { this.text = text; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
