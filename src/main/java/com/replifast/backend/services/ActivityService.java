package com.replifast.backend.services;

import com.replifast.backend.models.Activity;
import com.replifast.backend.repositories.ActivityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Best-effort audit trail. Callers invoke this after their own change is committed;
 * a failed insert is logged and otherwise ignored.
 */
@Service
@Slf4j
public class ActivityService {

    private final ActivityRepository activityRepository;
    private final Clock clock;

    public ActivityService(ActivityRepository activityRepository, Clock clock) {
        this.activityRepository = activityRepository;
        this.clock = clock;
    }

    public void record(Long businessId, Activity.ActivityType type, String description, Map<String, Object> metadata) {
        try {
            Activity activity = Activity.builder()
                    .businessId(businessId)
                    .type(type)
                    .description(description)
                    .metadata(metadata)
                    .createdAt(OffsetDateTime.now(clock))
                    .build();
            activityRepository.save(activity);
        } catch (RuntimeException e) {
            log.warn("Failed to record {} activity for business {}: {}", type, businessId, e.getMessage());
        }
    }
}
