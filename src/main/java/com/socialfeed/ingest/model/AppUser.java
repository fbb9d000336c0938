package com.socialfeed.ingest.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Setter
@Getter
@Entity
@Table(name = "app_user")
public class AppUser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @Column(name = "name")
    private String name;

    /**
     * Output language for tweets, ISO code.
     */
    @Column(name = "preferred_language", length = 10)
    private String preferredLanguage = "en";

    /**
     * Output language for page posts. Falls back to {@link #preferredLanguage} when unset.
     */
    @Column(name = "preferred_language_facebook", length = 10)
    private String preferredLanguageFacebook;

    @Column(name = "scraper_interval")
    private Integer scraperInterval = 60;

    @Column(name = "last_scraped_at")
    private OffsetDateTime lastScrapedAt;

    @OneToMany(mappedBy = "user", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    private List<ProfileReference> profileReferences = new ArrayList<>();

    public AppUser() {
    }

    public AppUser(String email, String name) {
        this.email = email;
        this.name = name;
    }

    /**
     * Returns the raw references the user declared for one content source, in declaration order.
     */
    public List<String> referencesFor(ContentSource source) {
        List<String> refs = new ArrayList<>();
        for (ProfileReference reference : profileReferences) {
            if (reference.getSource() == source && reference.getReference() != null) {
                refs.add(reference.getReference());
            }
        }
        return refs;
    }

    /**
     * Language code used when enriching records of the given source.
     */
    public String languageFor(ContentSource source) {
        if (source == ContentSource.FACEBOOK && hasText(preferredLanguageFacebook)) {
            return preferredLanguageFacebook;
        }
        return hasText(preferredLanguage) ? preferredLanguage : "en";
    }

    /**
     * Name shown in prompts when a record carries no author of its own.
     */
    public String displayName() {
        return hasText(name) ? name : email;
    }

    public void addReference(ContentSource source, String reference) {
        ProfileReference ref = new ProfileReference(this, source, reference);
        profileReferences.add(ref);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
