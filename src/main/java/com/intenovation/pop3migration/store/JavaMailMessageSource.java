package com.intenovation.pop3migration.store;

import com.sun.mail.imap.IMAPFolder;
import com.sun.mail.imap.protocol.BODY;
import com.sun.mail.pop3.POP3Folder;
import com.sun.mail.pop3.POP3Message;

import javax.mail.FetchProfile;
import javax.mail.Folder;
import javax.mail.Message;
import javax.mail.MessageRemovedException;
import javax.mail.MessagingException;
import javax.mail.UIDFolder;
import javax.mail.internet.MimeMessage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.logging.Logger;

/**
 * A MessageSource backed by a JavaMail folder.
 * <p>
 * POP3 folders report UIDLs and serve headers with TOP; IMAP folders report
 * UIDs and serve headers with BODY.PEEK[HEADER] so the server's own header
 * section is hashed rather than JavaMail's reconstruction of it. Any other
 * folder falls back to the parsed header lines of the message.
 */
public class JavaMailMessageSource implements MessageSource {
    private static final Logger LOGGER = Logger.getLogger(JavaMailMessageSource.class.getName());

    private final Folder folder;
    private final String name;

    /**
     * Create a message source for a folder. The folder is opened
     * read-only on first use.
     *
     * @param folder   The JavaMail folder
     * @param protocol The protocol prefix of the mailbox name, e.g. "pop3" or "imap"
     */
    public JavaMailMessageSource(Folder folder, String protocol) {
        this.folder = folder;
        this.name = protocol + "/" + folder.getFullName();
    }

    public Folder getFolder() {
        return folder;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public long getUidValidity() throws MessagingException {
        if (folder instanceof POP3Folder || !(folder instanceof UIDFolder)) {
            return 0;
        }
        ensureOpen();
        return ((UIDFolder) folder).getUIDValidity();
    }

    private void ensureOpen() throws MessagingException {
        if (!folder.isOpen()) {
            LOGGER.fine("Opening folder " + name + " READ_ONLY");
            folder.open(Folder.READ_ONLY);
        }
    }

    @Override
    public List<MessageInfo> enumerate(boolean withSizes) throws MessagingException {
        ensureOpen();
        Message[] messages = folder.getMessages();

        FetchProfile profile = new FetchProfile();
        profile.add(UIDFolder.FetchProfileItem.UID);
        if (withSizes) {
            profile.add(FetchProfile.Item.SIZE);
        }
        folder.fetch(messages, profile);

        List<MessageInfo> result = new ArrayList<>(messages.length);
        for (Message message : messages) {
            if (message.isExpunged()) {
                continue;
            }
            try {
                result.add(describe(message, withSizes));
            } catch (MessageRemovedException e) {
                LOGGER.fine("Message " + message.getMessageNumber() + " in " + name +
                        " was expunged while listing");
            }
        }
        return result;
    }

    private MessageInfo describe(Message message, boolean withSizes) throws MessagingException {
        int seq = message.getMessageNumber();
        long size = MessageInfo.UNKNOWN_SIZE;
        if (withSizes) {
            size = message.getSize();
            if (size < 0) {
                throw new MessagingException("Size of message " + seq + " in " + name + " is unknown");
            }
        }

        if (folder instanceof POP3Folder) {
            String uidl = ((POP3Folder) folder).getUID(message);
            return MessageInfo.pop3(seq, uidl == null ? "" : uidl, size);
        }
        long uid = folder instanceof UIDFolder ? ((UIDFolder) folder).getUID(message) : 0;
        return MessageInfo.imap(seq, uid, size);
    }

    @Override
    public InputStream fetchHeader(MessageInfo info) throws MessagingException {
        ensureOpen();
        if (folder instanceof IMAPFolder) {
            return fetchImapSection(info, "HEADER");
        }

        Message message = getMessage(info);
        if (message instanceof POP3Message) {
            return ((POP3Message) message).top(0);
        }
        if (message instanceof MimeMessage) {
            StringBuilder header = new StringBuilder();
            Enumeration<String> lines = ((MimeMessage) message).getAllHeaderLines();
            while (lines.hasMoreElements()) {
                header.append(lines.nextElement()).append("\r\n");
            }
            header.append("\r\n");
            return new ByteArrayInputStream(header.toString().getBytes(StandardCharsets.ISO_8859_1));
        }
        // Nothing better than the full message is available
        return fetchFullMessage(info);
    }

    @Override
    public InputStream fetchFullMessage(MessageInfo info) throws MessagingException {
        ensureOpen();
        if (folder instanceof IMAPFolder) {
            return fetchImapSection(info, "");
        }

        Message message = getMessage(info);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            message.writeTo(out);
        } catch (IOException e) {
            throw new MessagingException("Failed to read message " + info.getSequence() + " in " + name, e);
        }
        return new ByteArrayInputStream(out.toByteArray());
    }

    private Message getMessage(MessageInfo info) throws MessagingException {
        Message message;
        if (folder instanceof UIDFolder && info.getUid() != 0) {
            message = ((UIDFolder) folder).getMessageByUID(info.getUid());
        } else {
            message = folder.getMessage(info.getSequence());
        }
        if (message == null || message.isExpunged()) {
            throw new MessageRemovedException("Message " + info + " no longer exists in " + name);
        }
        return message;
    }

    private InputStream fetchImapSection(MessageInfo info, String section) throws MessagingException {
        IMAPFolder imapFolder = (IMAPFolder) folder;
        Message message = getMessage(info);
        int seq = message.getMessageNumber();

        Object result = imapFolder.doCommand(protocol -> protocol.peekBody(seq, section));
        if (!(result instanceof BODY)) {
            throw new MessageRemovedException("No BODY[" + section + "] returned for " + info + " in " + name);
        }
        ByteArrayInputStream stream = ((BODY) result).getByteArrayInputStream();
        if (stream == null) {
            throw new MessageRemovedException("Empty BODY[" + section + "] returned for " + info + " in " + name);
        }
        return stream;
    }

    @Override
    public void close() throws MessagingException {
        if (folder.isOpen()) {
            folder.close(false);
        }
    }
}
