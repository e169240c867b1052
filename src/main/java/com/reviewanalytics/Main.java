package com.reviewanalytics;

import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Main entry point for the Review Analytics Pipeline.
 *
 * Usage:
 *   java -cp target/classes com.reviewanalytics.Main <input_csv_path> [output_root] [job_id]
 *
 * Example:
 *   java -cp target/classes com.reviewanalytics.Main data/reviews.csv processed/ nightly-2024-01-02
 *
 * Exit status is 0 on success, 1 when the run fails and 2 on bad usage.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 1 || args.length > 3) {
            System.err.println("Usage: Main <input_csv_path> [output_root] [job_id]");
            return EXIT_USAGE;
        }
        String inputPath = args[0];
        String outputRoot = args.length > 1 ? args[1] : "output/";
        String jobId = args.length > 2 ? args[2] : "review-pipeline-" + UUID.randomUUID();

        PipelineConfig config;
        try {
            config = PipelineConfig.load();
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        LOG.info("Initializing Spark session {} on {}", config.getAppName(), config.getMaster());
        SparkSession spark = SparkSession.builder()
            .appName(config.getAppName())
            .master(config.getMaster())
            .config("spark.sql.adaptive.enabled", "true")
            .config("spark.sql.adaptive.coalescePartitions.enabled", "true")
            .getOrCreate();

        try {
            ReviewPipeline pipeline = new ReviewPipeline(spark, config);
            PipelineResult result = pipeline.run(new PipelineRequest(jobId, inputPath, outputRoot));
            if (!result.isSuccess()) {
                System.err.println("Job " + jobId + " failed (" + result.getFailureKind() + "): " + result.getMessage());
                return EXIT_FAILED;
            }
            for (String artifact : result.getArtifacts().values()) {
                System.out.println(artifact);
            }
            return EXIT_OK;
        } finally {
            spark.stop();
        }
    }
}
