package io.jobcenter4j.executor;

import io.jobcenter4j.core.ExecutionOutcome;
import io.jobcenter4j.core.JobDefinition;
import io.jobcenter4j.core.JobKey;
import io.jobcenter4j.core.JobKind;
import io.jobcenter4j.core.JobParameters;
import io.jobcenter4j.core.JobSpec;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class MailJobExecutorTest {

    private final JavaMailSender mailSender = mock(JavaMailSender.class);

    @Test
    void shouldSendToEveryRecipient() {
        MailJobExecutor executor = new MailJobExecutor(mailSender, "jobs@example.com");

        executor.execute(Map.of(
                JobParameters.MAIL_TO, "a@example.com, b@example.com,",
                JobParameters.MAIL_TITLE, "Daily report",
                JobParameters.MAIL_CONTENT, "All good"));

        ArgumentCaptor<SimpleMailMessage> sent = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(sent.capture());
        assertThat(sent.getValue().getTo()).containsExactly("a@example.com", "b@example.com");
        assertThat(sent.getValue().getFrom()).isEqualTo("jobs@example.com");
        assertThat(sent.getValue().getSubject()).isEqualTo("Daily report");
        assertThat(sent.getValue().getText()).isEqualTo("All good");
    }

    @Test
    void sendFailureShouldPropagate() {
        MailJobExecutor executor = new MailJobExecutor(mailSender, null);
        doThrow(new MailSendException("smtp down")).when(mailSender).send(any(SimpleMailMessage.class));

        assertThatThrownBy(() -> executor.execute(Map.of(
                JobParameters.MAIL_TO, "a@example.com",
                JobParameters.MAIL_TITLE, "t")))
                .isInstanceOf(MailSendException.class);
    }

    @Test
    void validateShouldRequireRecipientAndTitle() {
        MailJobExecutor executor = new MailJobExecutor(mailSender, null);

        assertThatThrownBy(() -> executor.validate(Map.of(JobParameters.MAIL_TO, "a@example.com")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(JobParameters.MAIL_TITLE);
        assertThatThrownBy(() -> executor.validate(Map.of(JobParameters.MAIL_TO, " , ", JobParameters.MAIL_TITLE, "t")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("recipient");
    }

    @Test
    void notifierShouldDescribeFailure() {
        MailExecutionNotifier notifier = new MailExecutionNotifier(mailSender, "ops@example.com", null);
        JobDefinition job = JobDefinition.fromSpec(JobSpec.builder(JobKey.of("tenant-a", "ping"), JobKind.HTTP)
                        .parameter(JobParameters.REQUEST_URL, "http://localhost/ping")
                        .build())
                .withExecution("2026-01-01T00:00:00Z FAILURE boom", "boom", 20);

        notifier.onExecuted(job, ExecutionOutcome.fatal("boom"));

        ArgumentCaptor<SimpleMailMessage> sent = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(sent.capture());
        assertThat(sent.getValue().getTo()).containsExactly("ops@example.com");
        assertThat(sent.getValue().getSubject()).contains("tenant-a.ping").contains("failed");
        assertThat(sent.getValue().getText()).contains("Error: boom").contains("ERROR");
    }
}
