package com.reviewanalytics;

import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.spark.sql.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Main pipeline class for review data processing.
 * Ingests a raw review CSV, cleans it, computes the six review reports and
 * publishes the cleaned dataset and every report as Parquet.
 */
public class ReviewPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ReviewPipeline.class);

    private final SparkSession spark;
    private final PipelineConfig config;
    private final ReviewCleaner cleaner;
    private final ReviewAggregations aggregations;

    public ReviewPipeline(SparkSession spark, PipelineConfig config) {
        this.spark = spark;
        this.config = config;
        this.cleaner = new ReviewCleaner(config.getDatePattern());
        this.aggregations = new ReviewAggregations(config.getTopCustomersLimit());
    }

    /**
     * Run the pipeline once. Never throws for source or destination problems;
     * those come back as a failed result with their {@link FailureKind}.
     */
    public PipelineResult run(PipelineRequest request) {
        LOG.info("Starting review pipeline job {} on {}", request.getJobId(), request.getInputPath());
        try {
            PipelineResult result = execute(request);
            LOG.info("Job {} completed: {} raw, {} cleaned, {} artifacts",
                request.getJobId(), result.getRawCount(), result.getCleanedCount(), result.getArtifacts().size());
            return result;
        } catch (PipelineException e) {
            LOG.error("Job {} failed with {}: {}", request.getJobId(), e.getKind(), e.getMessage(), e);
            return PipelineResult.failure(request.getJobId(), e.getKind(), e.getMessage());
        }
    }

    private PipelineResult execute(PipelineRequest request) {
        // Step 1: Ingestion
        Dataset<Row> rawData = ingestData(request.getInputPath());

        // Step 2: Cleaning
        ReviewCleaner.CleaningResult cleaning;
        try {
            cleaning = cleaner.clean(rawData);
        } catch (PipelineException e) {
            throw e;
        } catch (Exception e) {
            throw new PipelineException(FailureKind.SOURCE_UNAVAILABLE,
                "Failed to read " + request.getInputPath(), e);
        }
        LOG.info("Ingested {} rows, {} cleaned", cleaning.getRawCount(), cleaning.getCleanedCount());
        if (cleaning.getRawCount() == 0) {
            LOG.warn("Input {} has no records, publishing empty reports", request.getInputPath());
        }

        // Step 3: Reports and publishing
        try {
            Map<String, String> artifacts = generateAnalyticalDatasets(cleaning.getCleaned(), request.getOutputRoot());
            return PipelineResult.success(request.getJobId(), artifacts, cleaning);
        } finally {
            cleaning.release();
        }
    }

    /**
     * Step 1: Ingestion. Every column is read as a string; typing is the cleaner's job.
     */
    Dataset<Row> ingestData(String inputPath) {
        Path path = new Path(inputPath);
        try {
            FileSystem fs = path.getFileSystem(spark.sparkContext().hadoopConfiguration());
            if (!fs.exists(path)) {
                throw new PipelineException(FailureKind.SOURCE_UNAVAILABLE, "Input does not exist: " + inputPath);
            }
        } catch (IOException e) {
            throw new PipelineException(FailureKind.SOURCE_UNAVAILABLE, "Cannot access input " + inputPath, e);
        }

        try {
            return spark.read()
                .option("header", "true")
                .option("inferSchema", "false")
                .option("mode", "PERMISSIVE")
                .option("sep", config.getDelimiter())
                .option("encoding", StandardCharsets.UTF_8.name())
                .csv(inputPath);
        } catch (Exception e) {
            throw new PipelineException(FailureKind.SOURCE_UNAVAILABLE, "Cannot read input " + inputPath, e);
        }
    }

    /**
     * Compute every report from the cleaned records and publish them together
     * with the cleaned dataset. Returns artifact name to published path.
     */
    public Map<String, String> generateAnalyticalDatasets(Dataset<Row> cleanedData, String outputRoot) {
        String runId = UUID.randomUUID().toString();
        ParquetArtifactWriter writer = new ParquetArtifactWriter(spark, outputRoot, config.getStagingDir(), runId);
        Map<String, String> artifacts = new LinkedHashMap<>();
        try {
            Dataset<Row> cleanedOut = cleanedData.drop(ReviewSchema.SOURCE_ROW);
            artifacts.put(PipelineResult.CLEANED_ARTIFACT, writer.write(config.getCleanedDir(), cleanedOut));

            for (Map.Entry<String, Dataset<Row>> report : aggregations.computeAll(cleanedData).entrySet()) {
                String relativePath = config.getResultsDir() + "/" + report.getKey();
                artifacts.put(report.getKey(), writer.write(relativePath, report.getValue()));
            }
        } finally {
            writer.cleanupStaging();
        }
        return artifacts;
    }
}
