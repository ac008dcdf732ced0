package com.educonnect.tracking;

import com.educonnect.tracking.tracking.LessonFocusStateMachine;
import com.educonnect.tracking.tracking.LessonFocusStateMachine.Transition;
import com.educonnect.tracking.tracking.TrackingModels.TabLessonEntry;
import com.educonnect.tracking.tracking.TrackingModels.UserTrackingRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LessonFocusStateMachineTest {
    private static final Instant T0 = Instant.parse("2025-12-15T10:00:00Z");

    private final LessonFocusStateMachine machine = new LessonFocusStateMachine();

    @Test
    void enteringDistinctTabsCountsEveryTabAndFocusesTheLatest() {
        UserTrackingRecord record = null;
        for (int i = 0; i < 5; i++) {
            record = machine.enter("u1", record, "lesson-" + i, "serie-" + i, "tab-" + i, null, T0.plusSeconds(i));
            assertEquals(i + 1, record.totalActiveTabs());
        }

        assertEquals("tab-4", record.focusedEntry().tabId());
        assertEquals("lesson-4", record.focusedEntry().lessonId());
        assertEquals(T0.plusSeconds(4), record.lastUpdated());
    }

    @Test
    void enteringTheSameTabReplacesItsLesson() {
        UserTrackingRecord first = machine.enter("u1", null, "lessonA", "serieA", "tabX", "A", T0);
        UserTrackingRecord second = machine.enter("u1", first, "lessonB", "serieB", "tabX", "B", T0.plusSeconds(5));

        assertEquals(1, second.totalActiveTabs());
        assertEquals("lessonB", second.activeLessons().get(0).lessonId());
        assertEquals("B", second.focusedEntry().lessonTitle());
        assertEquals(second.activeLessons().get(0), second.focusedEntry());
    }

    @Test
    void enteringAnExistingTabTakesFocusBackFromANewerTab() {
        UserTrackingRecord record = machine.enter("u1", null, "lessonA", "serieA", "tabX", null, T0);
        record = machine.enter("u1", record, "lessonB", "serieB", "tabY", null, T0.plusSeconds(1));
        record = machine.enter("u1", record, "lessonC", "serieC", "tabX", null, T0.plusSeconds(2));

        assertEquals(2, record.totalActiveTabs());
        assertEquals("tabX", record.focusedEntry().tabId());
        assertEquals("lessonC", record.focusedEntry().lessonId());
    }

    @Test
    void enterDoesNotModifyThePreviousRecord() {
        UserTrackingRecord first = machine.enter("u1", null, "lessonA", "serieA", "tabX", null, T0);
        machine.enter("u1", first, "lessonB", "serieB", "tabY", null, T0.plusSeconds(1));

        assertEquals(1, first.totalActiveTabs());
        assertEquals("tabX", first.focusedEntry().tabId());
        assertThrows(UnsupportedOperationException.class, () -> first.activeLessons().clear());
    }

    @Test
    void lastActiveNeverMovesBackwards() {
        Instant later = T0.plusSeconds(60);
        UserTrackingRecord record = machine.enter("u1", null, "lessonA", "serieA", "tabX", null, later);

        UserTrackingRecord reentered = machine.enter("u1", record, "lessonB", "serieB", "tabX", null, T0);
        assertEquals(later, reentered.focusedEntry().lastActive());

        UserTrackingRecord refocused = machine.focus(record, "tabX", T0).orElseThrow();
        assertEquals(later, refocused.focusedEntry().lastActive());
        assertEquals(T0, refocused.lastUpdated());
    }

    @Test
    void exitingTheFocusedTabMovesFocusToTheRemainingTab() {
        UserTrackingRecord record = machine.enter("u1", null, "lessonA", "serieA", "T1", null, T0);
        record = machine.enter("u1", record, "lessonB", "serieB", "T2", null, T0.plusSeconds(10));
        assertEquals("T2", record.focusedEntry().tabId());

        Transition transition = machine.exit(record, "T2", T0.plusSeconds(20));

        assertFalse(transition.deletesRecord());
        assertEquals(1, transition.remainingTabs());
        assertEquals("T1", transition.record().focusedEntry().tabId());
        assertEquals(T0.plusSeconds(20), transition.record().lastUpdated());
    }

    @Test
    void exitingAnUnfocusedTabReelectsTheMostRecentlyActiveTab() {
        UserTrackingRecord record = machine.enter("u1", null, "lessonA", "serieA", "T1", null, T0);
        record = machine.enter("u1", record, "lessonB", "serieB", "T2", null, T0.plusSeconds(1));
        record = machine.enter("u1", record, "lessonC", "serieC", "T3", null, T0.plusSeconds(2));
        record = machine.focus(record, "T1", T0.plusSeconds(3)).orElseThrow();

        Transition transition = machine.exit(record, "T2", T0.plusSeconds(4));

        assertEquals(2, transition.remainingTabs());
        assertEquals("T1", transition.record().focusedEntry().tabId());
        assertEquals(List.of("T1", "T3"), transition.record().activeLessons().stream().map(TabLessonEntry::tabId).toList());
    }

    @Test
    void reelectionIgnoresPreviousFocusWhenItIsNotTheLatestTab() {
        TabLessonEntry older = new TabLessonEntry("lessonA", "serieA", null, "T1", T0);
        TabLessonEntry newer = new TabLessonEntry("lessonB", "serieB", null, "T2", T0.plusSeconds(30));
        TabLessonEntry closing = new TabLessonEntry("lessonC", "serieC", null, "T3", T0.plusSeconds(10));
        UserTrackingRecord record = new UserTrackingRecord("u1", List.of(older, newer, closing), older, T0);

        Transition transition = machine.exit(record, "T3", T0.plusSeconds(40));

        assertEquals("T2", transition.record().focusedEntry().tabId());
    }

    @Test
    void exitingTheLastTabDeletesTheRecord() {
        UserTrackingRecord record = machine.enter("u1", null, "lessonA", "serieA", "T1", null, T0);

        Transition transition = machine.exit(record, "T1", T0.plusSeconds(1));

        assertTrue(transition.deletesRecord());
        assertEquals("u1", transition.userId());
        assertEquals(0, transition.remainingTabs());
    }

    @Test
    void exitingAnUnknownTabKeepsTabsAndStillReelects() {
        TabLessonEntry older = new TabLessonEntry("lessonA", "serieA", null, "T1", T0.plusSeconds(20));
        TabLessonEntry newer = new TabLessonEntry("lessonB", "serieB", null, "T2", T0.plusSeconds(30));
        UserTrackingRecord record = new UserTrackingRecord("u1", List.of(older, newer), older, T0.plusSeconds(20));

        Transition transition = machine.exit(record, "missing", T0.plusSeconds(40));

        assertFalse(transition.deletesRecord());
        assertEquals(List.of(older, newer), transition.record().activeLessons());
        assertEquals("T2", transition.record().focusedEntry().tabId());
        assertEquals(T0.plusSeconds(40), transition.record().lastUpdated());
    }

    @Test
    void focusOnUnknownTabIsRejected() {
        UserTrackingRecord record = machine.enter("u1", null, "lessonA", "serieA", "T1", null, T0);

        assertTrue(machine.focus(record, "missing", T0.plusSeconds(1)).isEmpty());
    }

    @Test
    void electionTiesGoToTheEarliestEntry() {
        TabLessonEntry first = new TabLessonEntry("lessonA", "serieA", null, "T1", T0);
        TabLessonEntry second = new TabLessonEntry("lessonB", "serieB", null, "T2", T0);

        Optional<TabLessonEntry> elected = machine.electFocus(List.of(first, second));

        assertEquals(first, elected.orElseThrow());
        assertTrue(machine.electFocus(List.of()).isEmpty());
    }

    @Test
    void walksThroughTheTwoTabScenario() {
        UserTrackingRecord record = machine.enter("u1", null, "lessonA", "serieA", "tabX", null, T0);
        assertEquals("lessonA", record.focusedEntry().lessonId());
        assertEquals(1, record.totalActiveTabs());

        record = machine.enter("u1", record, "lessonB", "serieB", "tabY", null, T0.plusSeconds(1));
        assertEquals("lessonB", record.focusedEntry().lessonId());
        assertEquals(2, record.totalActiveTabs());

        record = machine.focus(record, "tabX", T0.plusSeconds(2)).orElseThrow();
        assertEquals("lessonA", record.focusedEntry().lessonId());
        assertEquals(2, record.totalActiveTabs());

        Transition afterX = machine.exit(record, "tabX", T0.plusSeconds(3));
        assertEquals("lessonB", afterX.record().focusedEntry().lessonId());
        assertEquals(1, afterX.remainingTabs());

        assertTrue(machine.exit(afterX.record(), "tabY", T0.plusSeconds(4)).deletesRecord());
    }
}
