package com.example.h3csv;

import lombok.Getter;

/**
 * A {@link JobConfig} option holds a value the job cannot run with.
 */
@Getter
public class InvalidConfigurationException extends JobSetupException {

    private final String option;

    public InvalidConfigurationException(String option, String message) {
        super(option + ": " + message);
        this.option = option;
    }

    public InvalidConfigurationException(String option, String message, Throwable cause) {
        super(option + ": " + message, cause);
        this.option = option;
    }
}
