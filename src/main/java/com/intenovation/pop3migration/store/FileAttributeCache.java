package com.intenovation.pop3migration.store;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

/**
 * An AttributeCache that keeps one properties file per mailbox under a
 * cache directory. Values are Base64 encoded. Puts only change the loaded
 * properties; {@link #flush()} writes each changed mailbox file once.
 */
public class FileAttributeCache implements AttributeCache {
    private static final Logger LOGGER = Logger.getLogger(FileAttributeCache.class.getName());

    public static final String FILE_SUFFIX = ".attributes.properties";

    private final File cacheDirectory;
    private final Map<String, Properties> loaded = new HashMap<>();
    private final Set<String> dirty = new LinkedHashSet<>();
    private int writeCount;

    /**
     * Create a cache rooted at the given directory. The directory is
     * created on the first write.
     *
     * @param cacheDirectory The directory holding the attribute files
     */
    public FileAttributeCache(File cacheDirectory) {
        this.cacheDirectory = cacheDirectory;
    }

    public File getCacheDirectory() {
        return cacheDirectory;
    }

    @Override
    public synchronized byte[] get(String mailbox, String messageKey, String attribute) throws IOException {
        String value = load(mailbox).getProperty(propertyName(messageKey, attribute));
        if (value == null) {
            return null;
        }
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupted attribute " + attribute + " for " + messageKey +
                    " in " + getFile(mailbox), e);
        }
    }

    @Override
    public synchronized void put(String mailbox, String messageKey, String attribute, byte[] value)
            throws IOException {
        Properties properties = load(mailbox);
        properties.setProperty(propertyName(messageKey, attribute),
                Base64.getEncoder().encodeToString(value));
        dirty.add(mailbox);
    }

    @Override
    public synchronized void flush() throws IOException {
        if (dirty.isEmpty()) {
            return;
        }
        if (!cacheDirectory.exists() && !cacheDirectory.mkdirs()) {
            throw new IOException("Couldn't create cache directory " + cacheDirectory.getAbsolutePath());
        }
        Iterator<String> it = dirty.iterator();
        while (it.hasNext()) {
            String mailbox = it.next();
            File file = getFile(mailbox);
            try (FileOutputStream fos = new FileOutputStream(file)) {
                loaded.get(mailbox).store(fos, "pop3-migration attributes for " + mailbox);
            }
            writeCount++;
            it.remove();
            LOGGER.fine("Wrote " + loaded.get(mailbox).size() + " attributes to " + file.getAbsolutePath());
        }
    }

    /**
     * Get the number of mailbox files written so far
     */
    public synchronized int getWriteCount() {
        return writeCount;
    }

    /**
     * Get the file holding the attributes of a mailbox
     */
    public File getFile(String mailbox) {
        return new File(cacheDirectory, sanitizeMailboxName(mailbox) + FILE_SUFFIX);
    }

    private Properties load(String mailbox) throws IOException {
        Properties properties = loaded.get(mailbox);
        if (properties != null) {
            return properties;
        }

        properties = new Properties();
        File file = getFile(mailbox);
        if (file.exists()) {
            try (FileInputStream fis = new FileInputStream(file)) {
                properties.load(fis);
            }
            LOGGER.fine("Loaded " + properties.size() + " attributes from " + file.getAbsolutePath());
        }
        loaded.put(mailbox, properties);
        return properties;
    }

    private static String propertyName(String messageKey, String attribute) {
        return messageKey + "/" + attribute;
    }

    /**
     * Replace characters that are not allowed in file names
     */
    static String sanitizeMailboxName(String mailbox) {
        return mailbox.replaceAll("[\\\\/:*?\"<>|]", "_");
    }
}
