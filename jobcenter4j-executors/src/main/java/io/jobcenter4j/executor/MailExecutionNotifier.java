package io.jobcenter4j.executor;

import io.jobcenter4j.ExecutionNotifier;
import io.jobcenter4j.core.ExecutionOutcome;
import io.jobcenter4j.core.JobDefinition;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Objects;

/**
 * Mails execution outcomes to a fixed operator address.
 */
public class MailExecutionNotifier implements ExecutionNotifier {

    private final JavaMailSender mailSender;
    private final String[] to;
    private final String from;

    public MailExecutionNotifier(JavaMailSender mailSender, String mailTo, String from) {
        this.mailSender = Objects.requireNonNull(mailSender, "mailSender must not be null");
        this.to = MailJobExecutor.recipients(mailTo);
        if (to.length == 0) {
            throw new IllegalArgumentException("mailTo must name at least one recipient");
        }
        this.from = from;
    }

    @Override
    public void onExecuted(JobDefinition job, ExecutionOutcome outcome) {
        SimpleMailMessage message = new SimpleMailMessage();
        if (from != null && !from.isBlank()) {
            message.setFrom(from);
        }
        message.setTo(to);
        message.setSubject("[jobcenter] " + job.key() + (outcome.success() ? " succeeded" : " failed"));

        StringBuilder text = new StringBuilder()
                .append("Job: ").append(job.key()).append('\n')
                .append("Kind: ").append(job.kind()).append('\n')
                .append("Run count: ").append(job.runCount()).append('\n');
        if (!outcome.success()) {
            text.append("Error: ").append(outcome.message()).append('\n');
            if (outcome.fatal()) {
                text.append("The trigger was moved to ERROR and will not fire until the job is resumed.\n");
            }
        }
        if (!job.log().isEmpty()) {
            text.append("Last entry: ").append(job.log().get(job.log().size() - 1)).append('\n');
        }
        message.setText(text.toString());
        mailSender.send(message);
    }
}
