package com.intenovation.pop3migration.store;

import javax.mail.Folder;
import javax.mail.FolderNotFoundException;
import javax.mail.MessagingException;
import javax.mail.Session;
import javax.mail.Store;
import java.util.logging.Logger;

/**
 * Resolves the legacy mailbox to a folder of a JavaMail POP3 store.
 * The store is connected lazily, so no POP3 connection exists until the
 * first sync actually needs one.
 */
public class JavaMailLegacyMailboxResolver implements LegacyMailboxResolver {
    private static final Logger LOGGER = Logger.getLogger(JavaMailLegacyMailboxResolver.class.getName());

    public static final String PROTOCOL = "pop3";

    private final Store store;
    private final String host;
    private final int port;
    private final String user;
    private final String password;

    /**
     * Create a resolver for an already configured store
     *
     * @param store    The POP3 store
     * @param host     The server host, null to use the session properties
     * @param port     The server port, -1 for the default
     * @param user     The user name, null to use the session properties
     * @param password The password, null to use the session properties
     */
    public JavaMailLegacyMailboxResolver(Store store, String host, int port, String user, String password) {
        this.store = store;
        this.host = host;
        this.port = port;
        this.user = user;
        this.password = password;
    }

    /**
     * Create a resolver using the mail.pop3.* properties of a session
     *
     * @param session The JavaMail session
     * @return The resolver
     * @throws MessagingException If no POP3 provider is available
     */
    public static JavaMailLegacyMailboxResolver fromSession(Session session) throws MessagingException {
        Store store = session.getStore(PROTOCOL);
        int port = -1;
        String portStr = session.getProperty("mail.pop3.port");
        if (portStr != null && !portStr.isEmpty()) {
            try {
                port = Integer.parseInt(portStr);
            } catch (NumberFormatException e) {
                LOGGER.warning("Invalid mail.pop3.port '" + portStr + "', using the default port");
            }
        }
        return new JavaMailLegacyMailboxResolver(store,
                session.getProperty("mail.pop3.host"), port,
                session.getProperty("mail.pop3.user"),
                session.getProperty("mail.pop3.password"));
    }

    @Override
    public MessageSource resolve(String identifier) throws MessagingException {
        if (!store.isConnected()) {
            LOGGER.info("Connecting to POP3 server " + (host != null ? host : "(session default)") +
                    " as " + user);
            store.connect(host, port, user, password);
        }

        Folder folder = store.getFolder(identifier);
        if (!folder.exists()) {
            throw new FolderNotFoundException(folder, "Legacy POP3 mailbox " + identifier + " doesn't exist");
        }
        return new JavaMailMessageSource(folder, PROTOCOL);
    }

    @Override
    public boolean isLegacyMailbox(String mailboxName) {
        return mailboxName.startsWith(PROTOCOL + "/");
    }

    /**
     * Close the POP3 connection
     */
    public void close() throws MessagingException {
        if (store.isConnected()) {
            store.close();
        }
    }
}
