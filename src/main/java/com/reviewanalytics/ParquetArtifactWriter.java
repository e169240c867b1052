package com.reviewanalytics;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SaveMode;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Publishes datasets as Parquet under an output root.
 *
 * Every artifact is first written to {@code <root>/<staging>/<runId>/<name>}
 * and then renamed onto {@code <root>/<name>}, so readers see either the
 * previous artifact or the new one, never a half-written directory. A
 * previous artifact is moved aside before the rename and put back if the
 * rename fails.
 */
public class ParquetArtifactWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ParquetArtifactWriter.class);

    private final Configuration hadoopConf;
    private final Path root;
    private final Path stagingRoot;
    private final Path runStaging;
    private final String runId;

    public ParquetArtifactWriter(SparkSession spark, String outputRoot, String stagingDir, String runId) {
        this.hadoopConf = spark.sparkContext().hadoopConfiguration();
        this.root = new Path(outputRoot);
        this.stagingRoot = new Path(root, stagingDir);
        this.runStaging = new Path(stagingRoot, runId);
        this.runId = runId;
    }

    /**
     * Write {@code data} as a single Parquet file and publish it at
     * {@code relativePath} under the output root, replacing whatever was there.
     *
     * @return the published path
     * @throws PipelineException with {@link FailureKind#WRITE_FAILURE}
     */
    public String write(String relativePath, Dataset<Row> data) {
        Path target = new Path(root, relativePath);
        Path staged = new Path(runStaging, relativePath);

        try {
            data.coalesce(1)
                .write()
                .mode(SaveMode.Overwrite)
                .parquet(staged.toString());
        } catch (Exception e) {
            throw new PipelineException(FailureKind.WRITE_FAILURE,
                "Failed to stage " + relativePath + " at " + staged, e);
        }

        try {
            publish(staged, target);
        } catch (IOException e) {
            throw new PipelineException(FailureKind.WRITE_FAILURE,
                "Failed to publish " + relativePath + " at " + target, e);
        }
        LOG.info("Published {}", target);
        return target.toString();
    }

    private void publish(Path staged, Path target) throws IOException {
        FileSystem fs = target.getFileSystem(hadoopConf);
        Path parent = target.getParent();
        if (parent != null && !fs.exists(parent) && !fs.mkdirs(parent)) {
            throw new IOException("Could not create " + parent);
        }

        Path superseded = null;
        if (fs.exists(target)) {
            superseded = new Path(parent, "_" + target.getName() + ".superseded-" + runId);
            if (!fs.rename(target, superseded)) {
                throw new IOException("Could not move aside existing " + target);
            }
        }

        if (!fs.rename(staged, target)) {
            if (superseded != null && !fs.rename(superseded, target)) {
                LOG.error("Could not restore {} from {}", target, superseded);
            }
            throw new IOException("Could not rename " + staged + " to " + target);
        }

        if (superseded != null && !fs.delete(superseded, true)) {
            LOG.warn("Could not delete superseded artifact {}", superseded);
        }
    }

    /**
     * Remove this run's staging directory, and the staging root once no other
     * run is using it.
     */
    public void cleanupStaging() {
        try {
            FileSystem fs = stagingRoot.getFileSystem(hadoopConf);
            if (fs.exists(runStaging)) {
                fs.delete(runStaging, true);
            }
            if (fs.exists(stagingRoot) && fs.listStatus(stagingRoot).length == 0) {
                fs.delete(stagingRoot, false);
            }
        } catch (IOException e) {
            LOG.warn("Could not clean up staging directory {}", runStaging, e);
        }
    }
}
