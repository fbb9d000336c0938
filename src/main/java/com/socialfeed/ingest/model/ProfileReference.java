package com.socialfeed.ingest.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * A handle or page URL a user follows. Managed by the dashboard; read-only to ingestion.
 */
@Setter
@Getter
@Entity
@Table(name = "profile_reference")
public class ProfileReference {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private AppUser user;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 32)
    private ContentSource source;

    @Column(name = "raw_reference", length = 255)
    private String reference;

    public ProfileReference() {
    }

    public ProfileReference(AppUser user, ContentSource source, String reference) {
        this.user = user;
        this.source = source;
        this.reference = reference;
    }
}
