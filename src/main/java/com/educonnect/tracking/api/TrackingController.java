package com.educonnect.tracking.api;

import com.educonnect.tracking.tracking.TrackingModels;
import com.educonnect.tracking.tracking.TrackingResult;
import com.educonnect.tracking.tracking.TrackingService;
import com.fasterxml.jackson.annotation.JsonAlias;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/tracking")
public class TrackingController {
    private final TrackingService trackingService;

    public TrackingController(TrackingService trackingService) {
        this.trackingService = trackingService;
    }

    @PostMapping("/lesson/enter")
    public ResponseEntity<TrackingResult<TrackingModels.TabLessonEntry>> enter(@RequestBody EnterRequest request) {
        return toResponse(trackingService.enterLesson(
                request.userId(), request.lessonId(), request.seriesId(), request.tabId(), request.lessonTitle()));
    }

    @PostMapping("/lesson/exit")
    public ResponseEntity<TrackingResult<TrackingModels.ExitOutcome>> exit(@RequestBody TabRequest request) {
        return toResponse(trackingService.exitLesson(request.userId(), request.tabId()));
    }

    @PostMapping("/lesson/focus")
    public ResponseEntity<TrackingResult<TrackingModels.TabLessonEntry>> focus(@RequestBody TabRequest request) {
        return toResponse(trackingService.updateFocus(request.userId(), request.tabId()));
    }

    @GetMapping("/user/{userId}/current")
    public ResponseEntity<?> current(@PathVariable String userId) {
        TrackingResult<TrackingModels.CurrentLessonView> result = trackingService.currentLesson(userId);
        if (result.success()) {
            return ResponseEntity.ok(result.data());
        }
        return toResponse(result);
    }

    static <T> ResponseEntity<TrackingResult<T>> toResponse(TrackingResult<T> result) {
        if (result.success()) {
            return ResponseEntity.ok(result);
        }
        HttpStatus status = switch (result.failure()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case STORE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(result);
    }

    public record EnterRequest(String userId,
                               String lessonId,
                               @JsonAlias("serie_id") String seriesId,
                               String tabId,
                               String lessonTitle) {}

    public record TabRequest(String userId, String tabId) {}
}
