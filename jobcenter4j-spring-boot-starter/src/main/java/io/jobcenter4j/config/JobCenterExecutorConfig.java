package io.jobcenter4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobcenter4j.ExecutionNotifier;
import io.jobcenter4j.executor.HttpJobExecutor;
import io.jobcenter4j.executor.MailExecutionNotifier;
import io.jobcenter4j.executor.MailJobExecutor;
import io.jobcenter4j.executor.MqttJobExecutor;
import io.jobcenter4j.executor.RabbitMqJobExecutor;
import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.mail.javamail.JavaMailSender;

/**
 * Executor adapters, each registered when its client library is on the classpath and a client bean exists.
 */
@Configuration(proxyBeanMethods = false)
public class JobCenterExecutorConfig {

    @Bean
    @ConditionalOnMissingBean
    public HttpJobExecutor httpJobExecutor(ObjectProvider<ObjectMapper> objectMapper) {
        return new HttpJobExecutor(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JavaMailSender.class)
    static class MailExecutorConfig {

        @Bean
        @ConditionalOnBean(JavaMailSender.class)
        @ConditionalOnMissingBean
        public MailJobExecutor mailJobExecutor(JavaMailSender mailSender, JobCenterNotificationProperties notification) {
            return new MailJobExecutor(mailSender, notification.getMailFrom());
        }

        @Bean
        @ConditionalOnBean(JavaMailSender.class)
        @ConditionalOnMissingBean(ExecutionNotifier.class)
        @ConditionalOnProperty(prefix = "jobcenter.notification", name = "mail-to")
        public MailExecutionNotifier mailExecutionNotifier(JavaMailSender mailSender,
                                                           JobCenterNotificationProperties notification) {
            return new MailExecutionNotifier(mailSender, notification.getMailTo(), notification.getMailFrom());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(IMqttClient.class)
    static class MqttExecutorConfig {

        @Bean
        @ConditionalOnBean(IMqttClient.class)
        @ConditionalOnMissingBean
        public MqttJobExecutor mqttJobExecutor(IMqttClient client) {
            return new MqttJobExecutor(client);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(AmqpTemplate.class)
    static class RabbitMqExecutorConfig {

        @Bean
        @ConditionalOnBean(AmqpTemplate.class)
        @ConditionalOnMissingBean
        public RabbitMqJobExecutor rabbitMqJobExecutor(AmqpTemplate amqpTemplate) {
            return new RabbitMqJobExecutor(amqpTemplate);
        }
    }
}
