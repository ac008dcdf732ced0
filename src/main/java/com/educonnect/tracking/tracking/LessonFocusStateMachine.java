package com.educonnect.tracking.tracking;

import com.educonnect.tracking.tracking.TrackingModels.TabLessonEntry;
import com.educonnect.tracking.tracking.TrackingModels.UserTrackingRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
public class LessonFocusStateMachine {

    public UserTrackingRecord enter(String userId,
                                    UserTrackingRecord current,
                                    String lessonId,
                                    String seriesId,
                                    String tabId,
                                    String lessonTitle,
                                    Instant now) {
        List<TabLessonEntry> lessons = new ArrayList<>();
        Instant lastActive = now;
        if (current != null) {
            for (TabLessonEntry entry : current.activeLessons()) {
                if (entry.tabId().equals(tabId)) {
                    lastActive = latest(entry.lastActive(), now);
                } else {
                    lessons.add(entry);
                }
            }
        }

        TabLessonEntry entered = new TabLessonEntry(lessonId, seriesId, lessonTitle, tabId, lastActive);
        lessons.add(entered);
        return new UserTrackingRecord(userId, lessons, entered, now);
    }

    // Re-election runs on every exit, not only when the focused tab closes.
    public Transition exit(UserTrackingRecord current, String tabId, Instant now) {
        List<TabLessonEntry> remaining = current.activeLessons().stream()
                .filter(e -> !e.tabId().equals(tabId))
                .toList();
        if (remaining.isEmpty()) {
            return Transition.delete(current.userId());
        }

        TabLessonEntry focused = electFocus(remaining).orElseThrow();
        return Transition.update(new UserTrackingRecord(current.userId(), remaining, focused, now));
    }

    public Optional<UserTrackingRecord> focus(UserTrackingRecord current, String tabId, Instant now) {
        if (current.findTab(tabId).isEmpty()) {
            return Optional.empty();
        }

        List<TabLessonEntry> lessons = new ArrayList<>(current.activeLessons().size());
        TabLessonEntry focused = null;
        for (TabLessonEntry entry : current.activeLessons()) {
            if (entry.tabId().equals(tabId)) {
                focused = new TabLessonEntry(entry.lessonId(), entry.seriesId(), entry.lessonTitle(),
                        entry.tabId(), latest(entry.lastActive(), now));
                lessons.add(focused);
            } else {
                lessons.add(entry);
            }
        }
        return Optional.of(new UserTrackingRecord(current.userId(), lessons, focused, now));
    }

    // Latest lastActive wins; ties go to the earliest entry.
    public Optional<TabLessonEntry> electFocus(List<TabLessonEntry> lessons) {
        TabLessonEntry best = null;
        for (TabLessonEntry entry : lessons) {
            if (best == null || isAfter(entry.lastActive(), best.lastActive())) {
                best = entry;
            }
        }
        return Optional.ofNullable(best);
    }

    private static Instant latest(Instant previous, Instant now) {
        return previous != null && previous.isAfter(now) ? previous : now;
    }

    private static boolean isAfter(Instant candidate, Instant best) {
        if (candidate == null) return false;
        return best == null || candidate.isAfter(best);
    }

    public record Transition(String userId, UserTrackingRecord record) {
        public static Transition update(UserTrackingRecord record) {
            return new Transition(record.userId(), record);
        }

        public static Transition delete(String userId) {
            return new Transition(userId, null);
        }

        public boolean deletesRecord() {
            return record == null;
        }

        public int remainingTabs() {
            return record == null ? 0 : record.totalActiveTabs();
        }
    }
}
