package com.signalrelay.backend.service.mail;

import com.signalrelay.backend.config.MailboxProperties;
import jakarta.mail.BodyPart;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.search.FlagTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Date;
import java.util.Properties;

/**
 * Polls the alert folder over IMAPS for unseen messages and hands them to
 * {@link EmailAlertProcessor}. Only active with {@code mailbox.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "mailbox", name = "enabled", havingValue = "true")
public class MailboxPoller {

    private static final Logger logger = LoggerFactory.getLogger(MailboxPoller.class);

    private final MailboxProperties mailboxProperties;
    private final EmailAlertProcessor emailAlertProcessor;

    public MailboxPoller(MailboxProperties mailboxProperties, EmailAlertProcessor emailAlertProcessor) {
        this.mailboxProperties = mailboxProperties;
        this.emailAlertProcessor = emailAlertProcessor;
        logger.info("Mailbox poller enabled for {}@{} folder '{}'",
                mailboxProperties.getUser(), mailboxProperties.getHost(), mailboxProperties.getFolder());
    }

    @Scheduled(fixedDelayString = "${mailbox.poll-interval-ms:30000}", initialDelayString = "${mailbox.initial-delay-ms:5000}")
    public void poll() {
        if (!mailboxProperties.hasCredentials()) {
            logger.warn("Mailbox polling skipped: IMAP credentials not configured");
            return;
        }
        try {
            pollOnce();
        } catch (MessagingException e) {
            logger.error("Mailbox poll of {} failed: {}", mailboxProperties.getHost(), e.getMessage(), e);
        }
    }

    void pollOnce() throws MessagingException {
        Session session = Session.getInstance(imapProperties());
        Store store = session.getStore("imaps");
        try {
            store.connect(mailboxProperties.getHost(), mailboxProperties.getPort(),
                    mailboxProperties.getUser(), mailboxProperties.getPassword());
            Folder folder = store.getFolder(mailboxProperties.getFolder());
            folder.open(Folder.READ_WRITE);
            try {
                Message[] unseen = folder.search(new FlagTerm(new Flags(Flags.Flag.SEEN), false));
                if (unseen.length > 0) {
                    logger.info("Found {} unseen alert emails in '{}'", unseen.length, mailboxProperties.getFolder());
                }
                for (Message message : unseen) {
                    handle(store, folder, message);
                }
            } finally {
                folder.close(false);
            }
        } finally {
            store.close();
        }
    }

    private void handle(Store store, Folder folder, Message message) throws MessagingException {
        EmailDisposition disposition;
        try {
            disposition = emailAlertProcessor.process(toInboundEmail(message));
        } catch (IOException | MessagingException e) {
            logger.error("Could not read email #{}: {}", message.getMessageNumber(), e.getMessage());
            disposition = EmailDisposition.RETRY_LATER;
        } catch (RuntimeException e) {
            logger.error("Processing email #{} failed", message.getMessageNumber(), e);
            disposition = EmailDisposition.RETRY_LATER;
        }

        if (disposition.shouldQuarantine()) {
            quarantine(store, folder, message);
        }
        // reading the body sets \Seen on most servers, so it is reset explicitly for retries
        message.setFlag(Flags.Flag.SEEN, disposition.shouldAcknowledge());
    }

    private void quarantine(Store store, Folder source, Message message) {
        try {
            Folder failed = store.getFolder(mailboxProperties.getFailedFolder());
            if (!failed.exists() && !failed.create(Folder.HOLDS_MESSAGES)) {
                logger.warn("Could not create failed folder '{}'", mailboxProperties.getFailedFolder());
                return;
            }
            source.copyMessages(new Message[]{message}, failed);
            logger.info("Copied email #{} to '{}'", message.getMessageNumber(), mailboxProperties.getFailedFolder());
        } catch (MessagingException e) {
            logger.warn("Copying email #{} to '{}' failed: {}",
                    message.getMessageNumber(), mailboxProperties.getFailedFolder(), e.getMessage());
        }
    }

    private static InboundEmail toInboundEmail(Message message) throws MessagingException, IOException {
        String messageId = message instanceof MimeMessage ? ((MimeMessage) message).getMessageID() : null;
        Date sent = message.getSentDate() != null ? message.getSentDate() : message.getReceivedDate();
        return new InboundEmail(
                messageId,
                message.getSubject(),
                textOf(message),
                sent != null ? sent.toInstant() : null);
    }

    /**
     * First text/plain part, else the first other text part.
     */
    static String textOf(Part part) throws MessagingException, IOException {
        if (part.isMimeType("text/plain")) {
            return String.valueOf(part.getContent());
        }
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            String fallback = null;
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart bodyPart = multipart.getBodyPart(i);
                String text = textOf(bodyPart);
                if (text != null && bodyPart.isMimeType("text/plain")) {
                    return text;
                }
                if (text != null && fallback == null) {
                    fallback = text;
                }
            }
            return fallback;
        }
        if (part.isMimeType("text/*")) {
            return String.valueOf(part.getContent());
        }
        return null;
    }

    private Properties imapProperties() {
        String timeout = String.valueOf(mailboxProperties.getConnectTimeout().toMillis());
        Properties properties = new Properties();
        properties.put("mail.store.protocol", "imaps");
        properties.put("mail.imaps.host", mailboxProperties.getHost());
        properties.put("mail.imaps.port", String.valueOf(mailboxProperties.getPort()));
        properties.put("mail.imaps.ssl.enable", "true");
        properties.put("mail.imaps.connectiontimeout", timeout);
        properties.put("mail.imaps.timeout", timeout);
        return properties;
    }
}
