package io.jobcenter4j.executor;

import io.jobcenter4j.JobExecutor;
import io.jobcenter4j.core.JobKind;
import io.jobcenter4j.core.JobParameters;
import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Publishes {@code payload} to {@code topic}. {@code qos} defaults to 1, {@code retained} to false.
 * The client is shared and must already be connected (or use automatic reconnect).
 */
public class MqttJobExecutor implements JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(MqttJobExecutor.class);

    static final int DEFAULT_QOS = 1;

    private final IMqttClient client;

    public MqttJobExecutor(IMqttClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public JobKind kind() {
        return JobKind.MQTT;
    }

    @Override
    public void validate(Map<String, String> parameters) {
        JobExecutor.super.validate(parameters);
        qos(parameters);
    }

    @Override
    public void execute(Map<String, String> parameters) throws MqttException {
        String topic = parameters.get(JobParameters.TOPIC);
        int qos = qos(parameters);
        boolean retained = Boolean.parseBoolean(parameters.get(JobParameters.RETAINED));
        client.publish(topic, parameters.get(JobParameters.PAYLOAD).getBytes(StandardCharsets.UTF_8), qos, retained);
        log.debug("jobcenter mqtt published topic={} qos={} retained={}", topic, qos, retained);
    }

    private static int qos(Map<String, String> parameters) {
        String raw = parameters.get(JobParameters.QOS);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_QOS;
        }
        int qos;
        try {
            qos = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("qos must be 0, 1 or 2: " + raw, e);
        }
        if (qos < 0 || qos > 2) {
            throw new IllegalArgumentException("qos must be 0, 1 or 2: " + raw);
        }
        return qos;
    }
}
