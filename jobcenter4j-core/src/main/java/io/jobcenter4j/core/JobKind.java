package io.jobcenter4j.core;

import java.util.List;
import java.util.Map;

/**
 * Closed set of job types. Every kind is served by exactly one {@link io.jobcenter4j.JobExecutor}.
 */
public enum JobKind {
    HTTP(JobParameters.REQUEST_URL, List.of(JobParameters.REQUEST_URL)),
    EMAIL(JobParameters.MAIL_TO, List.of(JobParameters.MAIL_TO, JobParameters.MAIL_TITLE)),
    MQTT(JobParameters.TOPIC, List.of(JobParameters.TOPIC, JobParameters.PAYLOAD)),
    RABBIT_MQ(JobParameters.RABBIT_QUEUE, List.of(JobParameters.RABBIT_QUEUE, JobParameters.RABBIT_BODY));

    private final String addressParameter;
    private final List<String> requiredParameters;

    JobKind(String addressParameter, List<String> requiredParameters) {
        this.addressParameter = addressParameter;
        this.requiredParameters = requiredParameters;
    }

    /**
     * Parameter shown as the "trigger address" in listings (URL, recipients, topic or queue).
     */
    public String addressParameter() {
        return addressParameter;
    }

    public List<String> requiredParameters() {
        return requiredParameters;
    }

    /**
     * @throws IllegalArgumentException naming the first missing or blank required parameter
     */
    public void requireParameters(Map<String, String> parameters) {
        for (String key : requiredParameters) {
            String value = parameters == null ? null : parameters.get(key);
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name() + " job requires parameter '" + key + "'");
            }
        }
    }
}
