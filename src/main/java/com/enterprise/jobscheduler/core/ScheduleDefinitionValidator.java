package com.enterprise.jobscheduler.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates schedule definitions before they are turned into jobs
 */
public class ScheduleDefinitionValidator {
    
    /**
     * Validate the definition against the current time and return any validation errors
     */
    public List<ValidationError> validate(ScheduleDefinition definition, Instant now) {
        List<ValidationError> errors = new ArrayList<>();
        
        if (isBlank(definition.getJobType())) {
            errors.add(new ValidationError("jobType", "Job type is required"));
        }
        
        if (isBlank(definition.getTargetId())) {
            errors.add(new ValidationError("targetId", "Target id is required"));
        }
        
        if (definition.getRunAt() == null) {
            errors.add(new ValidationError("runAt", "First run time is required"));
        }
        
        if (definition.getMaxRetries() != null && definition.getMaxRetries() < 0) {
            errors.add(new ValidationError("maxRetries", "Maximum retries cannot be negative"));
        }
        
        validateKeys("payload", definition.getPayload(), errors);
        validateKeys("metadata", definition.getMetadata(), errors);
        validateRecurrence(definition, now, errors);
        
        return errors;
    }
    
    private void validateRecurrence(ScheduleDefinition definition, Instant now, List<ValidationError> errors) {
        ScheduleRecurrence recurrence = definition.getRecurrence();
        if (recurrence == null || recurrence.getEndsAt() == null || definition.getRunAt() == null) {
            return;
        }
        
        Instant endsAt = recurrence.getEndsAt();
        if (endsAt.isBefore(now) && definition.getRunAt().isAfter(endsAt)) {
            errors.add(new ValidationError("recurrence.endsAt",
                "Recurrence ended at " + endsAt + ", before the first run at " + definition.getRunAt()));
        }
    }
    
    private void validateKeys(String field, Map<String, Object> values, List<ValidationError> errors) {
        for (String key : values.keySet()) {
            if (isBlank(key)) {
                errors.add(new ValidationError(field, "Keys cannot be blank"));
                return;
            }
        }
    }
    
    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
    
    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;
        
        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }
        
        public String getField() { return field; }
        public String getMessage() { return message; }
        
        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
