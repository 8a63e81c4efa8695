package com.plantwatch.service.notification;

import com.plantwatch.entity.ChannelKind;
import com.plantwatch.exception.DispatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class EmailChannelAdapter implements ChannelAdapter<EmailChannelConfig> {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final String fromAddress;

    public EmailChannelAdapter(ObjectProvider<JavaMailSender> mailSender,
                               @Value("${garden.notifications.mail.from:alerts@smartgarden.local}") String fromAddress) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.EMAIL;
    }

    @Override
    public Class<EmailChannelConfig> configType() {
        return EmailChannelConfig.class;
    }

    @Override
    public void send(OutboundMessage message, EmailChannelConfig config) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            throw new DispatchException("Mail is not configured (spring.mail.host is unset)");
        }
        SimpleMailMessage mail = new SimpleMailMessage();
        mail.setFrom(fromAddress);
        mail.setTo(config.getAddress());
        mail.setSubject(message.getSubject());
        mail.setText(message.getBody());
        try {
            sender.send(mail);
        } catch (MailException e) {
            throw new DispatchException("Email delivery to " + config.getAddress() + " failed: " + e.getMessage(), e);
        }
        log.debug("Email sent to {}", config.getAddress());
    }
}
