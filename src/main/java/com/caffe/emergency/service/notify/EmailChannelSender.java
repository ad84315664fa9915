package com.caffe.emergency.service.notify;

import com.caffe.emergency.exception.DeliveryException;
import com.caffe.emergency.model.NotificationChannel;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailChannelSender implements ChannelSender {

    private final JavaMailSender mailSender;

    @Value("${email.alert.from:noreply@caffe-observers.org}")
    private String fromEmail;

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.EMAIL;
    }

    @Override
    public String send(String address, AlertMessage message) {
        try {
            MimeMessage mimeMessage = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
            helper.setFrom(fromEmail);
            helper.setTo(address);
            helper.setSubject(message.getSubject());
            helper.setText(message.getText(), message.getHtml());

            mailSender.send(mimeMessage);
            return mimeMessage.getMessageID();
        } catch (MessagingException | MailException e) {
            throw new DeliveryException("email to " + address + ": " + e.getMessage(), e);
        }
    }
}
