package io.jobcenter4j.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Recipients of execution notification mails ({@code jobcenter.notification.*}).
 */
@ConfigurationProperties(prefix = "jobcenter.notification")
public class JobCenterNotificationProperties {
    private String mailTo; // comma separated
    private String mailFrom;

    public String getMailTo() {
        return mailTo;
    }

    public void setMailTo(String mailTo) {
        this.mailTo = mailTo;
    }

    public String getMailFrom() {
        return mailFrom;
    }

    public void setMailFrom(String mailFrom) {
        this.mailFrom = mailFrom;
    }
}
