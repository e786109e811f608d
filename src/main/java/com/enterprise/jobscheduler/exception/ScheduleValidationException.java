package com.enterprise.jobscheduler.exception;

import com.enterprise.jobscheduler.core.ScheduleDefinitionValidator.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when a schedule definition is rejected.
 * Nothing is persisted for a rejected definition.
 */
public class ScheduleValidationException extends SchedulingException {
    
    private final List<ValidationError> errors;
    
    public ScheduleValidationException(List<ValidationError> errors) {
        super("Invalid schedule definition: " + errors.stream()
            .map(ValidationError::toString)
            .collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }
    
    public List<ValidationError> getErrors() {
        return errors;
    }
}
