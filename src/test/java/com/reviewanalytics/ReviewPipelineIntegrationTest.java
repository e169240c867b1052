package com.reviewanalytics;

import org.apache.spark.sql.*;
import org.junit.jupiter.api.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Date;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the complete ReviewPipeline
 */
public class ReviewPipelineIntegrationTest {

    private static final String HEADER = "customer_id,product_id,product_title,star_rating,review_date\n";

    private static SparkSession spark;
    private ReviewPipeline pipeline;
    private String testDir;
    private String testOutputPath;

    @BeforeAll
    public static void setUpSpark() {
        // Disable security for local testing (avoids Java 17+ Subject.getSubject() issues)
        System.setProperty("java.security.auth.login.config", "NONE");
        System.setProperty("hadoop.security.authentication", "simple");

        spark = SparkSession.builder()
            .appName("ReviewPipelineIntegrationTest")
            .master("local[2]")
            .config("spark.driver.host", "localhost")
            .config("spark.driver.bindAddress", "127.0.0.1")
            .config("spark.hadoop.fs.defaultFS", "file:///")
            .getOrCreate();
    }

    @AfterAll
    public static void tearDownSpark() {
        if (spark != null) {
            spark.stop();
        }
    }

    @BeforeEach
    public void setUp() throws Exception {
        pipeline = new ReviewPipeline(spark, PipelineConfig.fromProperties(new Properties()));
        testDir = "test_pipeline_" + System.nanoTime();
        Files.createDirectories(Paths.get(testDir));
        testOutputPath = testDir + "/processed";
    }

    @AfterEach
    public void tearDown() throws Exception {
        Path dir = Paths.get(testDir);
        if (Files.exists(dir)) {
            try (Stream<Path> paths = Files.walk(dir)) {
                paths.sorted(Comparator.reverseOrder()).map(Path::toFile).forEach(File::delete);
            }
        }
    }

    private String createTestCSV(String name, String content) throws Exception {
        Path path = Paths.get(testDir, name);
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        return path.toString();
    }

    private PipelineResult run(String inputPath, String outputRoot) {
        return pipeline.run(new PipelineRequest("test-job", inputPath, outputRoot));
    }

    private Dataset<Row> readReport(String name) {
        return spark.read().parquet(testOutputPath + "/analytics-results/" + name);
    }

    private static byte[] singleParquetFile(String dir) throws Exception {
        try (Stream<Path> files = Files.list(Paths.get(dir))) {
            List<Path> parts = files.filter(p -> p.getFileName().toString().endsWith(".parquet"))
                .collect(Collectors.toList());
            assertEquals(1, parts.size(), "Expected one part file in " + dir);
            return Files.readAllBytes(parts.get(0));
        }
    }

    @Test
    public void testScenarioA_BadRatingRejectedAndLowRatingCounted() throws Exception {
        String input = createTestCSV("reviews.csv", HEADER
            + "c1,p1,T1,5,2024-01-01\n"
            + "c1,p1,T1,1,2024-01-02\n"
            + "c1,p2,T2,abc,2024-01-03\n");

        PipelineResult result = run(input, testOutputPath);

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(3, result.getRawCount());
        assertEquals(2, result.getCleanedCount());
        assertEquals(1L, result.getRejections().get(RejectionReason.INVALID_RATING));

        Dataset<Row> cleaned = spark.read().parquet(testOutputPath + "/processed-data");
        assertEquals(2, cleaned.count());
        assertFalse(Arrays.asList(cleaned.columns()).contains(ReviewSchema.SOURCE_ROW));

        List<Row> low = readReport(ReviewAggregations.DAILY_LOW_RATING_COUNTS).collectAsList();
        assertEquals(1, low.size());
        assertEquals(Date.valueOf("2024-01-02"), low.get(0).getDate(0));
        assertEquals(1L, low.get(0).getLong(1));
    }

    @Test
    public void testScenarioB_CustomerStatsThreshold() throws Exception {
        String input = createTestCSV("reviews.csv", HEADER
            + "c1,p1,T1,4,2024-01-01\n"
            + "c1,p2,T2,4,2024-01-02\n"
            + "c1,p3,T3,5,2024-01-03\n"
            + "c2,p1,T1,5,2024-01-01\n"
            + "c2,p2,T2,3,2024-01-02\n");

        assertTrue(run(input, testOutputPath).isSuccess());

        List<Row> stats = readReport(ReviewAggregations.CUSTOMER_RATING_STATS).collectAsList();
        assertEquals(1, stats.size());
        assertEquals("c1", stats.get(0).getAs("customer_id"));
        assertEquals(3L, (long) stats.get(0).<Long>getAs("num_reviews"));
        assertEquals(13.0 / 3.0, stats.get(0).<Double>getAs("avg_rating"), 1e-12);
    }

    @Test
    public void testScenarioC_EmptyInputProducesEmptyReports() throws Exception {
        String input = createTestCSV("reviews.csv", HEADER);

        PipelineResult result = run(input, testOutputPath);

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(0, result.getRawCount());
        assertEquals(7, result.getArtifacts().size());
        assertEquals(0, spark.read().parquet(testOutputPath + "/processed-data").count());

        List<Row> distribution = readReport(ReviewAggregations.RATING_DISTRIBUTION).collectAsList();
        assertEquals(5, distribution.size());
        for (int i = 0; i < 5; i++) {
            assertEquals(i + 1, distribution.get(i).getInt(0));
            assertEquals(0L, distribution.get(i).getLong(1));
        }

        for (String report : Arrays.asList(
                ReviewAggregations.DAILY_REVIEW_COUNTS,
                ReviewAggregations.TOP_CUSTOMERS,
                ReviewAggregations.TOP_PRODUCTS,
                ReviewAggregations.DAILY_LOW_RATING_COUNTS,
                ReviewAggregations.CUSTOMER_RATING_STATS)) {
            assertEquals(0, readReport(report).count(), report);
        }
    }

    @Test
    public void testFullPipeline_PublishesAllArtifactsWithoutStagingLeftovers() throws Exception {
        String input = createTestCSV("reviews.csv", HEADER
            + "c1,p1,Lamp,5,2024-01-01\n"
            + "c2,p1,Lamp,4,2024-01-01\n");

        PipelineResult result = run(input, testOutputPath);

        assertTrue(result.isSuccess());
        assertEquals(PipelineResult.CLEANED_ARTIFACT, result.getArtifacts().keySet().iterator().next());
        for (String path : result.getArtifacts().values()) {
            assertTrue(Files.isDirectory(Paths.get(path)), path + " should exist");
        }
        assertTrue(Files.isDirectory(Paths.get(testOutputPath, "analytics-results", "top_10_products")));
        assertFalse(Files.exists(Paths.get(testOutputPath, "_staging")));
    }

    @Test
    public void testRerun_IsIdempotent() throws Exception {
        StringBuilder csv = new StringBuilder(HEADER);
        for (int i = 0; i < 40; i++) {
            csv.append("c").append(i % 7).append(",p").append(i % 4).append(",Title ").append(i % 4)
                .append(',').append(1 + (i * 3) % 5).append(",2024-01-").append(String.format("%02d", 1 + i % 9))
                .append('\n');
        }
        String input = createTestCSV("reviews.csv", csv.toString());

        assertTrue(run(input, testOutputPath).isSuccess());
        byte[][] firstRun = new byte[6][];
        String[] reports = {
            ReviewAggregations.DAILY_REVIEW_COUNTS, ReviewAggregations.TOP_CUSTOMERS,
            ReviewAggregations.RATING_DISTRIBUTION, ReviewAggregations.TOP_PRODUCTS,
            ReviewAggregations.DAILY_LOW_RATING_COUNTS, ReviewAggregations.CUSTOMER_RATING_STATS
        };
        for (int i = 0; i < reports.length; i++) {
            firstRun[i] = singleParquetFile(testOutputPath + "/analytics-results/" + reports[i]);
        }
        byte[] cleanedFirstRun = singleParquetFile(testOutputPath + "/processed-data");

        assertTrue(run(input, testOutputPath).isSuccess());
        for (int i = 0; i < reports.length; i++) {
            assertArrayEquals(firstRun[i], singleParquetFile(testOutputPath + "/analytics-results/" + reports[i]),
                reports[i] + " changed between runs");
        }
        assertArrayEquals(cleanedFirstRun, singleParquetFile(testOutputPath + "/processed-data"),
            "Cleaned dataset changed between runs");
        assertEquals(40, spark.read().parquet(testOutputPath + "/processed-data").count(),
            "Rerun must replace, not append");
    }

    @Test
    public void testMissingInput_IsSourceUnavailable() {
        PipelineResult result = run(testDir + "/does_not_exist.csv", testOutputPath);

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.SOURCE_UNAVAILABLE, result.getFailureKind());
        assertTrue(result.getArtifacts().isEmpty());
        assertFalse(Files.exists(Paths.get(testOutputPath)), "Nothing may be written");
    }

    @Test
    public void testUnwritableOutput_IsWriteFailure() throws Exception {
        String input = createTestCSV("reviews.csv", HEADER + "c1,p1,T1,5,2024-01-01\n");
        String blocked = createTestCSV("blocked", "a file, not a directory");

        PipelineResult result = run(input, blocked);

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.WRITE_FAILURE, result.getFailureKind());
    }

    @Test
    public void testRatingAliasAndPassthroughColumns() throws Exception {
        String input = createTestCSV("reviews.csv",
            "rating,customer_id,product_id,review_id,review_date\n"
            + "4,c1,p1,r1,2024-01-01\n"
            + "7,c1,p1,r2,2024-01-01\n");

        PipelineResult result = run(input, testOutputPath);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getCleanedCount());
        Dataset<Row> cleaned = spark.read().parquet(testOutputPath + "/processed-data");
        List<String> columns = Arrays.asList(cleaned.columns());
        assertTrue(columns.contains("star_rating"));
        assertTrue(columns.contains("review_id"));
        assertEquals("r1", cleaned.collectAsList().get(0).getAs("review_id"));
    }

    @Test
    public void testConfiguredDatePatternAndDelimiter() throws Exception {
        Properties props = new Properties();
        props.setProperty(PipelineConfig.INPUT_DATE_PATTERN, "MM/dd/uuuu");
        props.setProperty(PipelineConfig.INPUT_DELIMITER, "|");
        pipeline = new ReviewPipeline(spark, PipelineConfig.fromProperties(props));

        String input = createTestCSV("reviews.psv",
            "customer_id|product_id|product_title|star_rating|review_date\n"
            + "c1|p1|Lamp, large|2|01/31/2024\n"
            + "c1|p1|Lamp, large|2|2024-01-31\n");

        PipelineResult result = run(input, testOutputPath);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getCleanedCount());
        assertEquals(1L, result.getRejections().get(RejectionReason.INVALID_DATE));
        List<Row> daily = readReport(ReviewAggregations.DAILY_REVIEW_COUNTS).collectAsList();
        assertEquals(Date.valueOf("2024-01-31"), daily.get(0).getDate(0));
    }
}
