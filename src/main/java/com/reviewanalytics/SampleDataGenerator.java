package com.reviewanalytics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.Random;

/**
 * Utility class to generate sample review data for local runs and tests.
 * The output contains the kinds of bad rows the cleaner is meant to drop:
 * non-numeric and out-of-range ratings, unparsable dates, blank identifiers
 * and missing titles.
 */
public class SampleDataGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(SampleDataGenerator.class);

    public static final String HEADER =
        "marketplace,customer_id,review_id,product_id,product_title,star_rating,helpful_votes,review_date";

    private static final String[] TITLES = {
        "Wireless Headphones", "Mechanical Keyboard", "Monitor 27inch", "USB Cable",
        "Webcam HD", "Desk Lamp", "Notebook", "Pen Set", "Docking Station", "Speaker System",
        "Bluetooth Adapter", "Mouse Pad", "Surge Protector", "HDMI Cable", "Microphone"
    };

    private static final String[] BAD_RATINGS = {"abc", "0", "6", "-1", "4.5", ""};
    private static final String[] BAD_DATES = {"invalid-date", "2024-02-30", "01/15/2024", ""};

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    public static void main(String[] args) throws IOException {
        int numRecords = args.length > 0 ? Integer.parseInt(args[0]) : 100000;
        String outputPath = args.length > 1 ? args[1] : "data/reviews_sample.csv";

        LOG.info("Generating {} sample records...", numRecords);
        generateSampleData(numRecords, outputPath);
        LOG.info("Sample data generated at: {}", outputPath);
    }

    /**
     * Generate a review CSV. Fixed seed, so the same arguments give the same file.
     *
     * @return number of rows written that should survive cleaning
     */
    public static long generateSampleData(int numRecords, String outputPath) throws IOException {
        Random random = new Random(42);
        int customers = Math.max(1, numRecords / 20);
        int products = Math.max(1, numRecords / 50);
        long valid = 0;

        Path path = Paths.get(outputPath);
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }

        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.append(HEADER).append('\n');

            for (int i = 1; i <= numRecords; i++) {
                String customerId = "C" + String.format("%06d", random.nextInt(customers));
                int product = random.nextInt(products);
                String productId = "P" + String.format("%05d", product);
                String title = random.nextDouble() < 0.05 ? "" : "\"" + TITLES[product % TITLES.length] + "\"";
                String rating = String.valueOf(random.nextInt(5) + 1);
                String date = START.plusDays(random.nextInt(90)).toString();
                boolean bad = true;

                double roll = random.nextDouble();
                if (roll < 0.04) {
                    rating = BAD_RATINGS[random.nextInt(BAD_RATINGS.length)];
                } else if (roll < 0.07) {
                    date = BAD_DATES[random.nextInt(BAD_DATES.length)];
                } else if (roll < 0.09) {
                    customerId = "  ";
                } else if (roll < 0.10) {
                    productId = "";
                } else {
                    bad = false;
                }
                if (!bad) {
                    valid++;
                }

                writer.append(String.join(",",
                    "US",
                    customerId,
                    "R" + String.format("%08d", i),
                    productId,
                    title,
                    rating,
                    String.valueOf(random.nextInt(20)),
                    date
                ));
                writer.append('\n');

                if (i % 100000 == 0) {
                    LOG.info("Generated {} records...", i);
                }
            }
        }
        return valid;
    }
}
