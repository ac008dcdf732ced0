package com.educonnect.tracking.tracking;

import com.educonnect.tracking.config.TrackingProperties;
import com.educonnect.tracking.repository.LessonContentJdbcRepository;
import com.educonnect.tracking.repository.TrackingJdbcRepository;
import com.educonnect.tracking.repository.TrackingStoreException;
import com.educonnect.tracking.tracking.LessonFocusStateMachine.Transition;
import com.educonnect.tracking.tracking.TrackingModels.*;
import com.educonnect.tracking.tracking.TrackingResult.Failure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class TrackingService {
    private static final Logger log = LoggerFactory.getLogger(TrackingService.class);

    private final TrackingJdbcRepository repository;
    private final LessonContentJdbcRepository lessonContentRepository;
    private final LessonFocusStateMachine stateMachine;
    private final TrackingProperties properties;
    private final Clock clock;

    public TrackingService(TrackingJdbcRepository repository,
                           LessonContentJdbcRepository lessonContentRepository,
                           LessonFocusStateMachine stateMachine,
                           TrackingProperties properties,
                           Clock clock) {
        this.repository = repository;
        this.lessonContentRepository = lessonContentRepository;
        this.stateMachine = stateMachine;
        this.properties = properties;
        this.clock = clock;
    }

    public TrackingResult<TabLessonEntry> enterLesson(String userId, String lessonId, String seriesId,
                                                      String tabId, String lessonTitle) {
        Optional<String> invalid = missingField(List.of("user_id", "lesson_id", "series_id", "tab_id"),
                userId, lessonId, seriesId, tabId);
        if (invalid.isPresent()) {
            return TrackingResult.failed(Failure.VALIDATION, invalid.get() + " is required");
        }

        try {
            UserTrackingRecord current = repository.findByUserId(userId).orElse(null);
            UserTrackingRecord next = stateMachine.enter(userId, current, lessonId, seriesId, tabId,
                    lessonTitle, clock.instant());
            repository.save(next);

            log.info("User {} entered lesson {} in tab {} ({} active tabs)", userId, lessonId, tabId, next.totalActiveTabs());
            return TrackingResult.ok("Current lesson set successfully", next.focusedEntry());
        } catch (DataAccessException | TrackingStoreException e) {
            return storeFailure("set current lesson", userId, e);
        }
    }

    public TrackingResult<ExitOutcome> exitLesson(String userId, String tabId) {
        Optional<String> invalid = missingField(List.of("user_id", "tab_id"), userId, tabId);
        if (invalid.isPresent()) {
            return TrackingResult.failed(Failure.VALIDATION, invalid.get() + " is required");
        }

        try {
            Optional<UserTrackingRecord> current = repository.findByUserId(userId);
            if (current.isEmpty()) {
                log.info("No lesson tracking to clear for user {}", userId);
                return TrackingResult.ok("No current lesson was set", new ExitOutcome(0, null));
            }

            Transition transition = stateMachine.exit(current.get(), tabId, clock.instant());
            apply(transition);

            if (transition.deletesRecord()) {
                log.info("User {} closed tab {}, all lessons cleared", userId, tabId);
                return TrackingResult.ok("All lessons cleared", new ExitOutcome(0, null));
            }
            int remaining = transition.remainingTabs();
            log.info("User {} closed tab {}, {} tabs remain, focus on tab {}", userId, tabId, remaining,
                    transition.record().focusedEntry().tabId());
            return TrackingResult.ok("Lesson cleared, " + remaining + " tabs remain",
                    new ExitOutcome(remaining, transition.record().focusedEntry()));
        } catch (DataAccessException | TrackingStoreException e) {
            return storeFailure("clear current lesson", userId, e);
        }
    }

    public TrackingResult<TabLessonEntry> updateFocus(String userId, String tabId) {
        Optional<String> invalid = missingField(List.of("user_id", "tab_id"), userId, tabId);
        if (invalid.isPresent()) {
            return TrackingResult.failed(Failure.VALIDATION, invalid.get() + " is required");
        }

        try {
            Optional<UserTrackingRecord> current = repository.findByUserId(userId);
            if (current.isEmpty()) {
                return TrackingResult.failed(Failure.NOT_FOUND, "No tracking data for user " + userId);
            }

            Optional<UserTrackingRecord> next = stateMachine.focus(current.get(), tabId, clock.instant());
            if (next.isEmpty()) {
                return TrackingResult.failed(Failure.NOT_FOUND, "Tab " + tabId + " not found for user " + userId);
            }
            repository.save(next.get());

            TabLessonEntry focused = next.get().focusedEntry();
            log.info("User {} focused tab {} (lesson {})", userId, tabId, focused.lessonId());
            return TrackingResult.ok("Focus updated successfully", focused);
        } catch (DataAccessException | TrackingStoreException e) {
            return storeFailure("update focus", userId, e);
        }
    }

    public TrackingResult<CurrentLessonView> currentLesson(String userId) {
        if (userId == null || userId.isBlank()) {
            return TrackingResult.failed(Failure.VALIDATION, "user_id is required");
        }

        Optional<UserTrackingRecord> record;
        try {
            record = repository.findByUserId(userId);
        } catch (DataAccessException | TrackingStoreException e) {
            return storeFailure("get current lesson", userId, e);
        }

        if (record.isEmpty() || record.get().focusedEntry() == null) {
            log.debug("User {} is not in any lesson", userId);
            return TrackingResult.ok("User is not in any lesson", CurrentLessonView.absent(userId));
        }

        LessonContent content = properties.enrichment().enabled() ? lookupContent(record.get().focusedEntry()) : null;
        return TrackingResult.ok("User is in a lesson", CurrentLessonView.of(record.get(), content));
    }

    @Scheduled(fixedDelayString = "${tracking.sweep.fixed-delay-ms:600000}")
    public void scheduledSweep() {
        if (!properties.sweep().enabled()) return;
        try {
            evictStaleTabs(clock.instant());
        } catch (DataAccessException | TrackingStoreException e) {
            log.error("Stale tab sweep failed: {}", e.getMessage());
        }
    }

    public int evictStaleTabs(Instant now) {
        Instant cutoff = now.minus(properties.sweep().maxIdle());
        int removed = 0;
        for (String userId : repository.findAllUserIds()) {
            try {
                removed += evictStaleTabs(userId, cutoff, now);
            } catch (DataAccessException | TrackingStoreException e) {
                log.warn("Skipping stale tab sweep for user {}: {}", userId, e.getMessage());
            }
        }

        if (removed > 0) {
            log.info("Removed {} stale tabs idle since before {}", removed, cutoff);
        }
        return removed;
    }

    // Each user is re-read immediately before its write.
    private int evictStaleTabs(String userId, Instant cutoff, Instant now) {
        Optional<UserTrackingRecord> record = repository.findByUserId(userId);
        if (record.isEmpty()) return 0;

        List<String> staleTabs = record.get().activeLessons().stream()
                .filter(e -> e.lastActive() == null || e.lastActive().isBefore(cutoff))
                .map(TabLessonEntry::tabId)
                .toList();
        if (staleTabs.isEmpty()) return 0;

        Transition transition = Transition.update(record.get());
        for (String tabId : staleTabs) {
            transition = stateMachine.exit(transition.record(), tabId, now);
            if (transition.deletesRecord()) break;
        }
        apply(transition);
        return staleTabs.size();
    }

    private void apply(Transition transition) {
        if (transition.deletesRecord()) {
            repository.deleteByUserId(transition.userId());
        } else {
            repository.save(transition.record());
        }
    }

    private LessonContent lookupContent(TabLessonEntry focused) {
        try {
            return lessonContentRepository.findLesson(focused.seriesId(), focused.lessonId()).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Lesson content unavailable for series {} lesson {}: {}",
                    focused.seriesId(), focused.lessonId(), e.getMessage());
            return null;
        }
    }

    private <T> TrackingResult<T> storeFailure(String action, String userId, RuntimeException e) {
        log.error("Failed to {} for user {}: {}", action, userId, e.getMessage());
        return TrackingResult.failed(Failure.STORE, "Failed to " + action + ": " + e.getMessage());
    }

    private Optional<String> missingField(List<String> names, String... values) {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null || values[i].isBlank()) {
                return Optional.of(names.get(i));
            }
        }
        return Optional.empty();
    }
}
