package ingest.datanode.benchmark;

import ingest.datanode.benchmark.jmh.ReplicaContention;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.ParseException;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.concurrent.TimeUnit;

public class Main {
    public static void main(String[] args) throws RunnerException {
        ContentionOptions contentionOptions = parseOptions(args);
        if (contentionOptions == null) {
            return;
        }
        int threads = contentionOptions.getReadThreads() + contentionOptions.getWriteThreads()
                + contentionOptions.getReportThreads();
        if (threads == 0) {
            throw new IllegalArgumentException("at least one read, write or report thread is required");
        }
        Options options = new OptionsBuilder()
                .param("collectionCount", String.valueOf(contentionOptions.getCollectionCount()))
                .param("segmentsPerCollection", String.valueOf(contentionOptions.getSegmentsPerCollection()))
                .param("channelCount", String.valueOf(contentionOptions.getChannelCount()))
                .param("fairLock", String.valueOf(contentionOptions.isFairLock()))
                .shouldFailOnError(true)
                .threadGroups(contentionOptions.getReadThreads(), contentionOptions.getReportThreads(),
                        contentionOptions.getWriteThreads())
                .threads(threads)
                .include(".*" + ReplicaContention.class.getSimpleName() + ".*")
                .forks(1)
                .warmupIterations(contentionOptions.getWarmupIterations())
                .warmupTime(new TimeValue(contentionOptions.getWarmupTimeSeconds(), TimeUnit.SECONDS))
                .measurementIterations(contentionOptions.getMeasurementIterations())
                .measurementTime(new TimeValue(contentionOptions.getMeasurementTimeSeconds(), TimeUnit.SECONDS))
                .mode(Mode.SampleTime)
                .timeUnit(TimeUnit.MICROSECONDS)
                .build();
        new Runner(options).run();
    }

    @Builder
    @Getter
    public static class ContentionOptions {
        public static final int DEFAULT_COLLECTION_COUNT = 16;
        public static final int DEFAULT_SEGMENTS_PER_COLLECTION = 64;
        public static final int DEFAULT_CHANNEL_COUNT = 2;
        public static final int DEFAULT_READ_THREADS = 4;
        public static final int DEFAULT_WRITE_THREADS = 2;
        public static final int DEFAULT_REPORT_THREADS = 1;

        public static final int DEFAULT_WARMUP_ITERATIONS = 1;
        public static final int DEFAULT_WARMUP_TIME_SECONDS = 10;
        public static final int DEFAULT_MEASUREMENT_ITERATIONS = 1;
        public static final int DEFAULT_MEASUREMENT_TIME_SECONDS = 30;

        private int collectionCount;
        private int segmentsPerCollection;
        private int channelCount;
        private boolean fairLock;
        private int readThreads;
        private int writeThreads;
        private int reportThreads;

        private int warmupIterations;
        private int warmupTimeSeconds;
        private int measurementIterations;
        private int measurementTimeSeconds;
    }

    static ContentionOptions parseOptions(String[] args) {
        org.apache.commons.cli.Options options = new org.apache.commons.cli.Options();
        options.addOption("h", "help", false, "print this message");
        options.addOption(Option.builder()
                .longOpt("collection-count")
                .type(Integer.class)
                .hasArg()
                .desc("collection count, default " + ContentionOptions.DEFAULT_COLLECTION_COUNT)
                .build());
        options.addOption(Option.builder()
                .longOpt("segments-per-collection")
                .type(Integer.class)
                .hasArg()
                .desc("segments per collection, default " + ContentionOptions.DEFAULT_SEGMENTS_PER_COLLECTION)
                .build());
        options.addOption(Option.builder()
                .longOpt("channel-count")
                .type(Integer.class)
                .hasArg()
                .desc("message queue channels per segment, default " + ContentionOptions.DEFAULT_CHANNEL_COUNT)
                .build());
        options.addOption(Option.builder()
                .longOpt("fair-lock")
                .desc("use a fair replica lock")
                .build());
        options.addOption(Option.builder("rt")
                .longOpt("read-threads")
                .type(Integer.class)
                .hasArg()
                .desc("reader threads, default " + ContentionOptions.DEFAULT_READ_THREADS)
                .build());
        options.addOption(Option.builder("wrt")
                .longOpt("write-threads")
                .type(Integer.class)
                .hasArg()
                .desc("ingestion threads, default " + ContentionOptions.DEFAULT_WRITE_THREADS)
                .build());
        options.addOption(Option.builder("rpt")
                .longOpt("report-threads")
                .type(Integer.class)
                .hasArg()
                .desc("statistics report threads, default " + ContentionOptions.DEFAULT_REPORT_THREADS)
                .build());
        options.addOption(Option.builder("wi")
                .longOpt("warmup-iterations")
                .type(Integer.class)
                .hasArg()
                .desc("warmup iterations, default " + ContentionOptions.DEFAULT_WARMUP_ITERATIONS)
                .build());
        options.addOption(Option.builder("wt")
                .longOpt("warmup-time")
                .type(Integer.class)
                .hasArg()
                .desc("warmup time in seconds, default " + ContentionOptions.DEFAULT_WARMUP_TIME_SECONDS)
                .build());
        options.addOption(Option.builder("mi")
                .longOpt("measurement-iterations")
                .type(Integer.class)
                .hasArg()
                .desc("measurement iterations, default " + ContentionOptions.DEFAULT_MEASUREMENT_ITERATIONS)
                .build());
        options.addOption(Option.builder("mt")
                .longOpt("measurement-time")
                .type(Integer.class)
                .hasArg()
                .desc("measurement time in seconds, default " + ContentionOptions.DEFAULT_MEASUREMENT_TIME_SECONDS)
                .build());

        CommandLineParser parser = new DefaultParser();
        try {
            CommandLine cmd = parser.parse(options, args);
            if (cmd.hasOption("help")) {
                printHelp(options);
                return null;
            }

            return ContentionOptions.builder()
                    .collectionCount(intValue(cmd, "collection-count", ContentionOptions.DEFAULT_COLLECTION_COUNT))
                    .segmentsPerCollection(intValue(cmd, "segments-per-collection", ContentionOptions.DEFAULT_SEGMENTS_PER_COLLECTION))
                    .channelCount(intValue(cmd, "channel-count", ContentionOptions.DEFAULT_CHANNEL_COUNT))
                    .fairLock(cmd.hasOption("fair-lock"))
                    .readThreads(intValue(cmd, "read-threads", ContentionOptions.DEFAULT_READ_THREADS))
                    .writeThreads(intValue(cmd, "write-threads", ContentionOptions.DEFAULT_WRITE_THREADS))
                    .reportThreads(intValue(cmd, "report-threads", ContentionOptions.DEFAULT_REPORT_THREADS))
                    .warmupIterations(intValue(cmd, "warmup-iterations", ContentionOptions.DEFAULT_WARMUP_ITERATIONS))
                    .warmupTimeSeconds(intValue(cmd, "warmup-time", ContentionOptions.DEFAULT_WARMUP_TIME_SECONDS))
                    .measurementIterations(intValue(cmd, "measurement-iterations", ContentionOptions.DEFAULT_MEASUREMENT_ITERATIONS))
                    .measurementTimeSeconds(intValue(cmd, "measurement-time", ContentionOptions.DEFAULT_MEASUREMENT_TIME_SECONDS))
                    .build();
        } catch (ParseException | NumberFormatException e) {
            System.err.println(e.getMessage());
            printHelp(options);
            return null;
        }
    }

    private static int intValue(CommandLine cmd, String longOpt, int defaultValue) {
        return Integer.parseInt(cmd.getOptionValue(longOpt, String.valueOf(defaultValue)));
    }

    private static void printHelp(org.apache.commons.cli.Options options) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp("replica-benchmark", options);
    }
}
