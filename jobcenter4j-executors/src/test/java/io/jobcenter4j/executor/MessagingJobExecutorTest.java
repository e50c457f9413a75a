package io.jobcenter4j.executor;

import io.jobcenter4j.core.JobParameters;
import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.AmqpTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class MessagingJobExecutorTest {

    @Test
    void mqttShouldPublishWithRequestedQosAndRetainFlag() throws Exception {
        IMqttClient client = mock(IMqttClient.class);
        MqttJobExecutor executor = new MqttJobExecutor(client);

        executor.execute(Map.of(
                JobParameters.TOPIC, "sensors/reset",
                JobParameters.PAYLOAD, "now",
                JobParameters.QOS, "2",
                JobParameters.RETAINED, "true"));

        verify(client).publish("sensors/reset", "now".getBytes(StandardCharsets.UTF_8), 2, true);
    }

    @Test
    void mqttShouldDefaultToQosOneNotRetained() throws Exception {
        IMqttClient client = mock(IMqttClient.class);

        new MqttJobExecutor(client).execute(Map.of(JobParameters.TOPIC, "t", JobParameters.PAYLOAD, "p"));

        verify(client).publish(eq("t"), any(byte[].class), eq(MqttJobExecutor.DEFAULT_QOS), eq(false));
    }

    @Test
    void mqttPublishFailureShouldPropagate() throws Exception {
        IMqttClient client = mock(IMqttClient.class);
        doThrow(new MqttException(MqttException.REASON_CODE_CLIENT_NOT_CONNECTED))
                .when(client).publish(anyString(), any(byte[].class), anyInt(), anyBoolean());

        assertThatThrownBy(() -> new MqttJobExecutor(client)
                .execute(Map.of(JobParameters.TOPIC, "t", JobParameters.PAYLOAD, "p")))
                .isInstanceOf(MqttException.class);
    }

    @Test
    void mqttValidateShouldRejectQosOutOfRange() {
        MqttJobExecutor executor = new MqttJobExecutor(mock(IMqttClient.class));

        assertThatThrownBy(() -> executor.validate(Map.of(
                JobParameters.TOPIC, "t", JobParameters.PAYLOAD, "p", JobParameters.QOS, "3")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("qos");
    }

    @Test
    void rabbitShouldSendThroughDefaultExchange() {
        AmqpTemplate template = mock(AmqpTemplate.class);

        new RabbitMqJobExecutor(template).execute(Map.of(
                JobParameters.RABBIT_QUEUE, "billing",
                JobParameters.RABBIT_BODY, "{\"run\":1}"));

        verify(template).convertAndSend("", "billing", (Object) "{\"run\":1}");
    }

    @Test
    void rabbitValidateShouldRequireQueueAndBody() {
        RabbitMqJobExecutor executor = new RabbitMqJobExecutor(mock(AmqpTemplate.class));

        assertThatThrownBy(() -> executor.validate(Map.of(JobParameters.RABBIT_QUEUE, "billing")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(JobParameters.RABBIT_BODY);
    }
}
