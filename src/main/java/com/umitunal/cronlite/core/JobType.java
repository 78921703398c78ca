package com.umitunal.cronlite.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of job kinds. Each kind resolves to exactly one handler.
 */
public enum JobType {
    EMAIL_NOTIFICATION("email_notification"),
    DATA_BACKUP("data_backup"),
    REPORT_GENERATION("report_generation"),
    API_CALL("api_call"),
    FILE_CLEANUP("file_cleanup"),
    CUSTOM("custom");

    private final String tag;

    JobType(String tag) {
        this.tag = tag;
    }

    /**
     * Gets the wire tag, e.g. {@code email_notification}.
     */
    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Resolve a wire tag to a job type.
     *
     * @throws ValidationException if the tag is unknown
     */
    @JsonCreator
    public static JobType fromTag(String tag) {
        if (tag == null) {
            throw new ValidationException("job_type is required");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (JobType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        throw new ValidationException("Unknown job_type: " + tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
