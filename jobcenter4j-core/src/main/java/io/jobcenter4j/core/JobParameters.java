package io.jobcenter4j.core;

/**
 * Well-known keys of the job parameter map, per {@link JobKind}.
 */
public final class JobParameters {
    private JobParameters() {
    }

    // HTTP
    public static final String REQUEST_URL = "requestUrl";
    public static final String REQUEST_METHOD = "requestMethod";
    public static final String HEADERS = "headers";
    public static final String BODY = "body";
    public static final String FAIL_ON_ERROR_STATUS = "failOnErrorStatus";

    // EMAIL
    public static final String MAIL_TO = "mailTo";
    public static final String MAIL_TITLE = "mailTitle";
    public static final String MAIL_CONTENT = "mailContent";

    // MQTT
    public static final String TOPIC = "topic";
    public static final String PAYLOAD = "payload";
    public static final String QOS = "qos";
    public static final String RETAINED = "retained";

    // RABBIT_MQ
    public static final String RABBIT_QUEUE = "rabbitQueue";
    public static final String RABBIT_BODY = "rabbitBody";
}
