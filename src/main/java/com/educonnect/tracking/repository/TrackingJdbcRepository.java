package com.educonnect.tracking.repository;

import com.educonnect.tracking.tracking.TrackingModels.TabLessonEntry;
import com.educonnect.tracking.tracking.TrackingModels.UserTrackingRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class TrackingJdbcRepository {
    private static final TypeReference<List<TabLessonEntry>> LESSON_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public TrackingJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public Optional<UserTrackingRecord> findByUserId(String userId) {
        List<UserTrackingRecord> rows = jdbcTemplate.query(
                "SELECT user_id, active_lessons, current_lesson, last_updated FROM current_lesson_tracking WHERE user_id=?",
                recordMapper(),
                userId);
        return rows.stream().findFirst();
    }

    public List<String> findAllUserIds() {
        return jdbcTemplate.queryForList("SELECT user_id FROM current_lesson_tracking", String.class);
    }

    public void save(UserTrackingRecord record) {
        jdbcTemplate.update(
                "MERGE INTO current_lesson_tracking(user_id, active_lessons, current_lesson, last_updated) KEY(user_id) VALUES (?,?,?,?)",
                record.userId(),
                write(record.activeLessons()),
                record.focusedEntry() == null ? null : write(record.focusedEntry()),
                record.lastUpdated().toString());
    }

    public boolean deleteByUserId(String userId) {
        return jdbcTemplate.update("DELETE FROM current_lesson_tracking WHERE user_id=?", userId) > 0;
    }

    private RowMapper<UserTrackingRecord> recordMapper() {
        return (rs, n) -> {
            String currentLesson = rs.getString(3);
            return new UserTrackingRecord(
                    rs.getString(1),
                    read(rs.getString(2), LESSON_LIST),
                    currentLesson == null ? null : read(currentLesson, new TypeReference<TabLessonEntry>() {}),
                    Instant.parse(rs.getString(4)));
        };
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TrackingStoreException("Cannot serialize tracking document", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new TrackingStoreException("Cannot read stored tracking document", e);
        }
    }
}
