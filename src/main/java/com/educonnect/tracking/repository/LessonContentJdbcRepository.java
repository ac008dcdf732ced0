package com.educonnect.tracking.repository;

import com.educonnect.tracking.tracking.TrackingModels.LessonContent;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class LessonContentJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public LessonContentJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<LessonContent> findLesson(String seriesId, String lessonId) {
        List<LessonContent> rows = jdbcTemplate.query(
                "SELECT series_id, lesson_id, title, video_url, transcript, duration_seconds FROM lessons WHERE series_id=? AND lesson_id=?",
                (rs, n) -> new LessonContent(rs.getString(1), rs.getString(2), rs.getString(3),
                        rs.getString(4), rs.getString(5), (Integer) rs.getObject(6)),
                seriesId, lessonId);
        return rows.stream().findFirst();
    }
}
