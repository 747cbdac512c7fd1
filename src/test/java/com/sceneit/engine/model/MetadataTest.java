package com.sceneit.engine.model;

import org.junit.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.Assert.*;

public class MetadataTest {

    /** Clock the test moves by hand. */
    private static final class ManualClock extends Clock {
        private Instant now;

        ManualClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        void rewind(Duration d) {
            now = now.minus(d);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private static final Instant T0 = Instant.parse("2024-03-01T10:15:30Z");

    @Test
    public void testNewMetadata() {
        Metadata m = new Metadata(new ManualClock(T0));

        assertEquals(T0, m.getCreatedAt());
        assertEquals(T0, m.getUpdatedAt());
        assertEquals(1, m.getVersion());
        assertFalse(m.isLocked());
        assertTrue(m.getTags().isEmpty());
        assertTrue(m.getRevisionNotes().isEmpty());
    }

    @Test
    public void testTouchIncrementsVersionAndTimestamp() {
        ManualClock clock = new ManualClock(T0);
        Metadata m = new Metadata(clock);

        clock.advance(Duration.ofSeconds(5));
        m.touch();
        m.touch();

        assertEquals(3, m.getVersion());
        assertEquals(T0.plusSeconds(5), m.getUpdatedAt());
        assertEquals("createdAt never changes", T0, m.getCreatedAt());
    }

    @Test
    public void testUpdatedAtNeverRunsBackwards() {
        ManualClock clock = new ManualClock(T0);
        Metadata m = new Metadata(clock);

        clock.rewind(Duration.ofMinutes(1));
        m.touch();

        assertEquals(T0, m.getUpdatedAt());
        assertEquals(2, m.getVersion());
        assertFalse(m.getUpdatedAt().isBefore(m.getCreatedAt()));
    }

    @Test
    public void testTags() {
        Metadata m = new Metadata();
        m.addTag(" act-one ");
        m.addTag("act-one");
        m.addTag("   ");
        m.addTag(null);
        m.addTag("flashback");

        assertEquals(java.util.List.of("act-one", "flashback"), m.getTags());
    }

    @Test
    public void testRevisionNotesAndLock() {
        Metadata m = new Metadata();
        m.addRevisionNote(RevisionNote.of("Tightened   the opening"));
        m.lock();

        assertEquals(1, m.getRevisionNotes().size());
        assertEquals("Tightened the opening", m.getRevisionNotes().get(0).value());
        assertTrue(m.isLocked());

        m.unlock();
        assertFalse(m.isLocked());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testRevisionNotesAreReadOnly() {
        new Metadata().getRevisionNotes().add(RevisionNote.of("nope"));
    }
}
