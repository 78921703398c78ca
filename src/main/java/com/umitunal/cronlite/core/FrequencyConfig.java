package com.umitunal.cronlite.core;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Trigger parameters. The concrete type determines the frequency kind.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CronFrequency.class, name = "cron"),
        @JsonSubTypes.Type(value = IntervalFrequency.class, name = "interval"),
        @JsonSubTypes.Type(value = DateFrequency.class, name = "date")
})
public interface FrequencyConfig {

    /**
     * Gets the trigger family this config belongs to.
     */
    FrequencyKind kind();
}
