package com.replifast.backend.services;

import com.replifast.backend.models.Activity;
import com.replifast.backend.repositories.ActivityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ActivityServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

    @Mock
    private ActivityRepository activityRepository;

    private ActivityService activityService;

    @BeforeEach
    void setUp() {
        activityService = new ActivityService(activityRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void record_ShouldPersistActivityWithTimestamp() {
        // When
        activityService.record(5L, Activity.ActivityType.REPLY_POSTED, "Reply posted", Map.of("reviewId", 1L));

        // Then
        ArgumentCaptor<Activity> captor = ArgumentCaptor.forClass(Activity.class);
        verify(activityRepository).save(captor.capture());
        Activity saved = captor.getValue();
        assertThat(saved.getBusinessId()).isEqualTo(5L);
        assertThat(saved.getType()).isEqualTo(Activity.ActivityType.REPLY_POSTED);
        assertThat(saved.getMetadata()).containsEntry("reviewId", 1L);
        assertThat(saved.getCreatedAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void record_RepositoryFailure_ShouldNotPropagate() {
        // Given
        when(activityRepository.save(any())).thenThrow(new DataAccessResourceFailureException("connection lost"));

        // When / Then
        assertThatCode(() -> activityService.record(5L, Activity.ActivityType.REPLY_POSTED, "Reply posted", Map.of()))
                .doesNotThrowAnyException();
    }
}
