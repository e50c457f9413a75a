package io.jobcenter4j.executor;

import io.jobcenter4j.JobExecutor;
import io.jobcenter4j.core.JobKind;
import io.jobcenter4j.core.JobParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpTemplate;

import java.util.Map;
import java.util.Objects;

/**
 * Sends {@code rabbitBody} to the queue {@code rabbitQueue} through the default exchange.
 */
public class RabbitMqJobExecutor implements JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(RabbitMqJobExecutor.class);

    private static final String DEFAULT_EXCHANGE = "";

    private final AmqpTemplate amqpTemplate;

    public RabbitMqJobExecutor(AmqpTemplate amqpTemplate) {
        this.amqpTemplate = Objects.requireNonNull(amqpTemplate, "amqpTemplate must not be null");
    }

    @Override
    public JobKind kind() {
        return JobKind.RABBIT_MQ;
    }

    @Override
    public void execute(Map<String, String> parameters) throws AmqpException {
        String queue = parameters.get(JobParameters.RABBIT_QUEUE);
        amqpTemplate.convertAndSend(DEFAULT_EXCHANGE, queue, parameters.get(JobParameters.RABBIT_BODY));
        log.debug("jobcenter rabbitmq sent queue={}", queue);
    }
}
