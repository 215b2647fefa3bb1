package com.intenovation.pop3migration;

import com.intenovation.pop3migration.match.MatchTable;
import com.intenovation.pop3migration.store.FileAttributeCache;
import com.intenovation.pop3migration.store.JavaMailLegacyMailboxResolver;
import com.intenovation.pop3migration.store.JavaMailMessageSource;

import javax.mail.Folder;
import javax.mail.MessagingException;
import javax.mail.Session;
import javax.mail.Store;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.Map;
import java.util.Properties;

/**
 * Command line check that syncs the POP3 UIDLs of an IMAP INBOX and
 * prints the result.
 * <p>
 * Usage: {@code Pop3MigrationCheck <properties-file>}. The file holds the
 * JavaMail mail.imap.* / mail.imaps.* and mail.pop3.* connection settings
 * plus the mail.pop3migration.* settings.
 */
public class Pop3MigrationCheck {

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: Pop3MigrationCheck <properties-file>");
            System.exit(2);
        }

        Properties props = new Properties();
        try (FileInputStream fis = new FileInputStream(args[0])) {
            props.load(fis);
        } catch (IOException e) {
            System.err.println("Cannot read " + args[0] + ": " + e.getMessage());
            System.exit(2);
        }

        try {
            System.exit(run(props));
        } catch (MessagingException e) {
            System.err.println("Error: " + e.getMessage());
            if (e.getNextException() != null) {
                System.err.println("Caused by: " + e.getNextException().getMessage());
            }
            System.exit(1);
        }
    }

    static int run(Properties props) throws MessagingException {
        Pop3MigrationSettings settings = Pop3MigrationSettings.fromProperties(props);
        if (!settings.isEnabled()) {
            settings.setMailbox("INBOX");
        }
        File cacheDir = settings.getCacheDirectory() != null ?
                new File(settings.getCacheDirectory()) :
                new File(System.getProperty("user.home"), ".pop3migration");

        Session session = Session.getInstance(props);
        boolean useSSL = props.getProperty("mail.imaps.host") != null;
        String protocol = useSSL ? "imaps" : "imap";
        Store imapStore = session.getStore(protocol);
        imapStore.connect(props.getProperty("mail." + protocol + ".host"),
                props.getProperty("mail." + protocol + ".user"),
                props.getProperty("mail." + protocol + ".password"));

        JavaMailLegacyMailboxResolver resolver = JavaMailLegacyMailboxResolver.fromSession(session);
        try {
            Folder inbox = imapStore.getFolder("INBOX");
            JavaMailMessageSource target = new JavaMailMessageSource(inbox, "imap");
            Pop3MigrationContext context = new Pop3MigrationContext(settings, resolver,
                    new FileAttributeCache(cacheDir));

            System.out.println("Settings: " + settings);
            MailboxUidlSync sync = context.createMailboxSync(target);
            try {
                sync.syncIfNeeded();
            } catch (Pop3MigrationException e) {
                Exception cause = e.getNextException();
                System.out.println("Sync failed: " + (cause != null ? cause.getMessage() : e.getMessage()));
                return 1;
            } finally {
                target.close();
            }

            for (Map.Entry<Long, MatchTable.Match> entry : sync.getMatchTable().asMap().entrySet()) {
                System.out.println(entry.getKey() + " -> " + entry.getValue());
            }
            System.out.println(sync.getMatchTable().size() + " messages matched");
            return 0;
        } finally {
            resolver.close();
            imapStore.close();
        }
    }
}
