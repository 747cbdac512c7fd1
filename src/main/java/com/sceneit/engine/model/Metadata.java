package com.sceneit.engine.model;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import lombok.Getter;

/**
 * Revision bookkeeping shared by every content entity.
 *
 * Created with {@code createdAt == updatedAt == now} and {@code version == 1}.
 * {@link #touch()} is the only way the version moves, and it only ever grows.
 */
@Getter
public final class Metadata {
    @Getter(lombok.AccessLevel.NONE)
    private final Clock clock;

    private final Instant createdAt;
    private Instant updatedAt;
    private int version;
    private boolean locked;

    @Getter(lombok.AccessLevel.NONE)
    private final List<RevisionNote> revisionNotes = new ArrayList<>();
    @Getter(lombok.AccessLevel.NONE)
    private final List<String> tags = new ArrayList<>();

    public Metadata() {
        this(Clock.systemUTC());
    }

    public Metadata(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Instant now = clock.instant();
        this.createdAt = now;
        this.updatedAt = now;
        this.version = 1;
    }

    /** Updates the last-modified timestamp and increments the version. */
    public void touch() {
        Instant now = clock.instant();
        // never let updatedAt run backwards on a clock adjustment
        if (now.isAfter(updatedAt))
            updatedAt = now;
        version++;
    }

    public void addRevisionNote(RevisionNote note) {
        revisionNotes.add(Objects.requireNonNull(note, "note"));
    }

    public List<RevisionNote> getRevisionNotes() {
        return Collections.unmodifiableList(revisionNotes);
    }

    /** Adds a free-form tag; blank tags and duplicates are ignored. */
    public void addTag(String tag) {
        if (tag == null || tag.isBlank() || tags.contains(tag.strip()))
            return;
        tags.add(tag.strip());
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public void lock() {
        locked = true;
    }

    public void unlock() {
        locked = false;
    }
}
