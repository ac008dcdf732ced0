package com.educonnect.tracking.tracking;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public class TrackingModels {
    public record TabLessonEntry(String lessonId,
                                 String seriesId,
                                 String lessonTitle,
                                 String tabId,
                                 Instant lastActive) {}

    public record UserTrackingRecord(String userId,
                                     List<TabLessonEntry> activeLessons,
                                     TabLessonEntry focusedEntry,
                                     Instant lastUpdated) {
        public UserTrackingRecord {
            activeLessons = activeLessons == null ? List.of() : List.copyOf(activeLessons);
        }

        public Optional<TabLessonEntry> findTab(String tabId) {
            return activeLessons.stream()
                    .filter(e -> e.tabId().equals(tabId))
                    .findFirst();
        }

        public int totalActiveTabs() {
            return activeLessons.size();
        }
    }

    public record LessonContent(String seriesId,
                                String lessonId,
                                String title,
                                String videoUrl,
                                String transcript,
                                Integer durationSeconds) {}

    public record ExitOutcome(int remainingTabs, TabLessonEntry focusedEntry) {}

    public record CurrentLessonView(String userId,
                                    String lessonId,
                                    String seriesId,
                                    String lessonTitle,
                                    String tabId,
                                    Instant lastUpdated,
                                    @JsonProperty("is_in_lesson") boolean inLesson,
                                    List<TabLessonEntry> activeLessons,
                                    int totalActiveTabs,
                                    @JsonInclude(JsonInclude.Include.NON_NULL) LessonContent lessonContent) {

        @JsonProperty("serie_id")
        public String serieId() {
            return seriesId;
        }

        public static CurrentLessonView absent(String userId) {
            return new CurrentLessonView(userId, null, null, null, null, null, false, List.of(), 0, null);
        }

        public static CurrentLessonView of(UserTrackingRecord record, LessonContent lessonContent) {
            TabLessonEntry focused = record.focusedEntry();
            return new CurrentLessonView(record.userId(), focused.lessonId(), focused.seriesId(),
                    focused.lessonTitle(), focused.tabId(), record.lastUpdated(), true,
                    record.activeLessons(), record.totalActiveTabs(), lessonContent);
        }
    }
}
