package com.abba.pillnow.device.schedule;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class LocalScheduleTableTest {

    private static final LocalDateTime MORNING = LocalDateTime.parse("2026-10-18T08:30:15");

    private final LocalScheduleTable table = new LocalScheduleTable(3);

    @Test
    void rejectsInvalidEntries() {
        assertThat(table.add(24, 0, 1, MORNING)).isEqualTo(AddResult.INVALID);
        assertThat(table.add(8, 60, 1, MORNING)).isEqualTo(AddResult.INVALID);
        assertThat(table.add(8, 0, 0, MORNING)).isEqualTo(AddResult.INVALID);
        assertThat(table.entries()).isEmpty();
    }

    @Test
    void entryFiresOncePerDay() {
        assertThat(table.add(9, 0, 2, MORNING)).isEqualTo(AddResult.ADDED);

        LocalDateTime due = LocalDateTime.parse("2026-10-18T09:00:00");
        assertThat(table.takeDue(due)).extracting(EmbeddedScheduleEntry::getContainer).containsExactly(2);
        assertThat(table.takeDue(due.plusSeconds(30))).isEmpty();
        assertThat(table.takeDue(due.plusDays(1))).hasSize(1);
    }

    @Test
    void pastEntryWaitsUntilTomorrow() {
        assertThat(table.add(7, 0, 1, MORNING)).isEqualTo(AddResult.ADDED_PREFIRED);

        assertThat(table.takeDue(LocalDateTime.parse("2026-10-18T07:00:00"))).isEmpty();
        assertThat(table.takeDue(LocalDateTime.parse("2026-10-19T07:00:00"))).hasSize(1);
    }

    @Test
    void currentMinuteIsMarkedFiredForCaller() {
        assertThat(table.add(8, 30, 1, MORNING)).isEqualTo(AddResult.FIRE_NOW);

        assertThat(table.takeDue(MORNING.plusSeconds(10))).isEmpty();
    }

    @Test
    void entryWithoutClockIsStoredPlain() {
        assertThat(table.add(7, 0, 1, null)).isEqualTo(AddResult.ADDED);

        assertThat(table.takeDue(LocalDateTime.parse("2026-10-18T07:00:00"))).hasSize(1);
    }

    @Test
    void duplicateEntryReusesItsSlot() {
        table.add(9, 0, 1, MORNING);
        table.add(9, 0, 1, MORNING);
        table.add(9, 0, 2, MORNING);

        assertThat(table.entries()).hasSize(2);
    }

    @Test
    void fullTableRejectsNewEntries() {
        table.add(9, 0, 1, MORNING);
        table.add(10, 0, 1, MORNING);
        table.add(11, 0, 1, MORNING);

        assertThat(table.add(12, 0, 1, MORNING)).isEqualTo(AddResult.FULL);

        table.clear();
        assertThat(table.entries()).isEmpty();
        assertThat(table.add(12, 0, 1, MORNING)).isEqualTo(AddResult.ADDED);
    }
}
