package tech.btreeidx.util;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.builder.fluent.Configurations;
import org.apache.commons.configuration2.ex.ConfigurationException;

import java.io.File;

public class Common {
    public static final int INT_SIZE = Integer.BYTES;
    public static final int LONG_SIZE = Long.BYTES;

    public static final String CONFIG_KEY_ROW_LIST_PART_SIZE = "index.btree.rowlist.part.size";
    public static final String CONFIG_KEY_COMPRESSION_CODEC = "index.compression.codec";
    public static final String CONFIG_KEY_CACHE_MAX_BYTES = "index.cache.max.bytes";

    public static final int DEFAULT_ROW_LIST_PART_SIZE = 1024 * 1024; //entries, not bytes
    public static final String DEFAULT_COMPRESSION_CODEC = "none";
    public static final long DEFAULT_CACHE_MAX_BYTES = 256L * 1024 * 1024;

    /**
     * load reader options from a properties file
     *
     * @param configFile properties file, e.g. index.properties
     * @return loaded configuration
     */
    public static Configuration loadConfig(File configFile) {
        try {
            return new Configurations().properties(configFile);
        } catch (ConfigurationException e) {
            throw new RuntimeException("fail to load config from " + configFile, e);
        }
    }

    /**
     * number of entries per row id list partition, must be positive
     */
    public static int getRowListPartSize(Configuration config) {
        int size = config.getInt(CONFIG_KEY_ROW_LIST_PART_SIZE, DEFAULT_ROW_LIST_PART_SIZE);
        if (size <= 0) {
            throw new IllegalArgumentException(CONFIG_KEY_ROW_LIST_PART_SIZE + " must be positive, got " + size);
        }
        return size;
    }
}
