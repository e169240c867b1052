package com.reviewanalytics;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

import static org.apache.spark.sql.functions.*;

/**
 * Column names and input shape of a review record.
 *
 * Raw input is read with every column as a string; the cleaning stage
 * coerces {@code star_rating} to an integer and {@code review_date} to a date.
 * Columns not listed here are carried through untouched.
 */
public final class ReviewSchema {

    private static final Logger LOG = LoggerFactory.getLogger(ReviewSchema.class);

    public static final String CUSTOMER_ID = "customer_id";
    public static final String PRODUCT_ID = "product_id";
    public static final String PRODUCT_TITLE = "product_title";
    public static final String STAR_RATING = "star_rating";
    public static final String REVIEW_DATE = "review_date";

    /** Older exports name the rating column {@code rating}. */
    public static final String RATING_ALIAS = "rating";

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    // Internal bookkeeping columns, never written out
    public static final String SOURCE_ROW = "_source_row";
    public static final String REJECTION_REASON = "_rejection_reason";

    public static final List<String> REQUIRED_COLUMNS = Arrays.asList(
        CUSTOMER_ID, PRODUCT_ID, PRODUCT_TITLE, STAR_RATING, REVIEW_DATE
    );

    private ReviewSchema() {
    }

    /**
     * Bring a raw frame to the expected column set: apply the {@code rating}
     * alias and add any missing required column as all-null strings, so the
     * rules reading it reject every row instead of failing the run.
     */
    public static Dataset<Row> conform(Dataset<Row> raw) {
        Dataset<Row> conformed = raw;

        if (!hasColumn(conformed, STAR_RATING) && hasColumn(conformed, RATING_ALIAS)) {
            LOG.info("Input has no {} column, using {} instead", STAR_RATING, RATING_ALIAS);
            conformed = conformed.withColumnRenamed(RATING_ALIAS, STAR_RATING);
        }

        for (String column : REQUIRED_COLUMNS) {
            if (!hasColumn(conformed, column)) {
                LOG.warn("Input is missing column {}", column);
                conformed = conformed.withColumn(column, lit(null).cast("string"));
            }
        }
        return conformed;
    }

    public static boolean hasColumn(Dataset<Row> df, String name) {
        return Arrays.asList(df.columns()).contains(name);
    }
}
