package io.jobcenter4j.executor;

import io.jobcenter4j.JobExecutor;
import io.jobcenter4j.core.JobKind;
import io.jobcenter4j.core.JobParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Sends a plain-text mail to {@code mailTo} (comma separated) with subject {@code mailTitle} and body
 * {@code mailContent}.
 */
public class MailJobExecutor implements JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(MailJobExecutor.class);

    private final JavaMailSender mailSender;
    private final String from;

    public MailJobExecutor(JavaMailSender mailSender, String from) {
        this.mailSender = Objects.requireNonNull(mailSender, "mailSender must not be null");
        this.from = from;
    }

    @Override
    public JobKind kind() {
        return JobKind.EMAIL;
    }

    @Override
    public void validate(Map<String, String> parameters) {
        JobExecutor.super.validate(parameters);
        if (recipients(parameters.get(JobParameters.MAIL_TO)).length == 0) {
            throw new IllegalArgumentException("mailTo has no recipient");
        }
    }

    @Override
    public void execute(Map<String, String> parameters) throws MailException {
        String[] to = recipients(parameters.get(JobParameters.MAIL_TO));
        SimpleMailMessage message = new SimpleMailMessage();
        if (from != null && !from.isBlank()) {
            message.setFrom(from);
        }
        message.setTo(to);
        message.setSubject(parameters.get(JobParameters.MAIL_TITLE));
        message.setText(parameters.getOrDefault(JobParameters.MAIL_CONTENT, ""));
        mailSender.send(message);
        log.debug("jobcenter mail sent recipients={} subject={}", to.length, message.getSubject());
    }

    static String[] recipients(String mailTo) {
        if (mailTo == null) {
            return new String[0];
        }
        return Arrays.stream(mailTo.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }
}
