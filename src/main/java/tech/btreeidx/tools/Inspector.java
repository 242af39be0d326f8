package tech.btreeidx.tools;

import com.google.common.base.Strings;
import org.apache.commons.cli.*;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.btreeidx.IndexFormatException;
import tech.btreeidx.cache.NoOpSectionCache;
import tech.btreeidx.read.BTreeIndexFileReader;
import tech.btreeidx.read.IndexLayout;
import tech.btreeidx.util.Common;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Prints the section layout of a btree index file.
 */
public class Inspector {
    static Logger logger = LoggerFactory.getLogger(Inspector.class);

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        CommandLine cmd = parseArgs(args);
        if (cmd == null) {
            return 1;
        }
        String indexFile = cmd.getOptionValue("f");
        if (Strings.isNullOrEmpty(indexFile)) {
            logger.error("must specify index file.");
            return 1;
        }

        Configuration config;
        String configFile = cmd.getOptionValue("c");
        if (Strings.isNullOrEmpty(configFile)) {
            config = new BaseConfiguration();
        } else {
            File f = new File(configFile);
            if (!f.isFile()) {
                logger.error("config file not exist:{}", configFile);
                return 1;
            }
            try {
                config = Common.loadConfig(f);
            } catch (RuntimeException e) {
                logger.error("invalid config file {}", configFile, e);
                return 1;
            }
        }

        BTreeIndexFileReader opened;
        try {
            opened = new BTreeIndexFileReader(config, new Path(indexFile), NoOpSectionCache.INSTANCE);
        } catch (IllegalArgumentException | ConversionException e) {
            logger.error("invalid reader config: {}", e.getMessage());
            return 1;
        }

        try (BTreeIndexFileReader reader = opened) {
            int version = reader.readVersionNum();
            reader.checkVersionNum(version);
            IndexLayout layout = reader.layout();
            out.printf("file: %s%n", reader.getFile());
            out.printf("version: %d%n", version);
            out.printf("file length: %d%n", layout.fileLength());
            out.printf("nodes: offset=%d length=%d%n", layout.nodesIndex(), layout.nodesLength());
            out.printf("row id list: offset=%d length=%d%n", layout.rowIdListIndex(), layout.rowIdListLength());
            out.printf("footer: offset=%d length=%d%n", layout.footerIndex(), layout.footerLength());

            int partitions = reader.rowIdListPartitionCount();
            out.printf("row id list partitions: %d (%d entries each)%n", partitions, reader.rowIdListSizePerSection());
            if (cmd.hasOption("p")) {
                long partSize = (long) reader.rowIdListSizePerSection() * Common.INT_SIZE;
                for (int i = 0; i < partitions; i++) {
                    long start = i * partSize;
                    long len = Math.min(partSize, layout.rowIdListLength() - start);
                    out.printf("  partition %d: offset=%d length=%d%n", i, layout.rowIdListIndex() + start, len);
                }
            }
            return 0;
        } catch (IndexFormatException e) {
            logger.error("invalid index file {}: {}", indexFile, e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("fail to read index file {}", indexFile, e);
            return 2;
        }
    }

    private static CommandLine parseArgs(String[] args) {
        Options options = new Options();
        options.addOption("f", "file", true, "Specify index file to inspect");
        options.addOption("c", "config", true, "Specify reader config properties file");
        options.addOption("p", "partitions", false, "Print every row id list partition");

        CommandLineParser parser = new DefaultParser();
        try {
            return parser.parse(options, args);
        } catch (ParseException e) {
            logger.error("Error parsing input args", e);
            return null;
        }
    }
}
