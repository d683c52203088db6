package com.abba.pillnow.infrastructure.mail;

import com.abba.pillnow.domain.service.MailGateway;
import com.abba.pillnow.infrastructure.config.NotifyProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class SmtpMailGateway implements MailGateway {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final NotifyProperties notifyProperties;

    @Override
    public void send(String to, String subject, String text) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            throw new IllegalStateException("No mail sender configured (spring.mail.host)");
        }
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(notifyProperties.getFrom());
        message.setTo(to);
        message.setSubject(subject);
        message.setText(text);
        sender.send(message);
        log.debug("SMTP message handed off subject='{}' to={}", subject, to);
    }
}
