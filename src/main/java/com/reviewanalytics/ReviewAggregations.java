package com.reviewanalytics;

import org.apache.spark.sql.*;
import org.apache.spark.sql.types.DataTypes;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.apache.spark.sql.functions.*;

/**
 * The six review reports. Each method is a pure function of the cleaned
 * records and fully orders its output (sort key, then identifier), so two runs
 * over the same input produce the same rows in the same order.
 */
public class ReviewAggregations {

    public static final String DAILY_REVIEW_COUNTS = "daily_review_counts";
    public static final String TOP_CUSTOMERS = "top_customers";
    public static final String RATING_DISTRIBUTION = "rating_distribution";
    public static final String TOP_PRODUCTS = "top_10_products";
    public static final String DAILY_LOW_RATING_COUNTS = "daily_low_rating_counts";
    public static final String CUSTOMER_RATING_STATS = "customer_rating_stats";

    public static final String REVIEW_COUNT = "review_count";
    public static final String RATING_COUNT = "rating_count";
    public static final String LOW_RATING_COUNT = "low_rating_count";
    public static final String NUM_REVIEWS = "num_reviews";
    public static final String AVG_RATING = "avg_rating";

    static final int TOP_PRODUCTS_LIMIT = 10;
    static final int TOP_PRODUCTS_MIN_REVIEWS = 5;
    static final int CUSTOMER_STATS_MIN_REVIEWS = 3;
    static final int LOW_RATING_THRESHOLD = 2;

    private static final String FIRST_TITLE = "_first_title";
    private static final String BUCKET = "_bucket";

    private final int topCustomersLimit;

    /**
     * @param topCustomersLimit rows kept in the top customers report; zero or negative keeps all
     */
    public ReviewAggregations(int topCustomersLimit) {
        this.topCustomersLimit = topCustomersLimit;
    }

    /**
     * All six reports keyed by report name, in a fixed order.
     */
    public Map<String, Dataset<Row>> computeAll(Dataset<Row> cleaned) {
        Map<String, Dataset<Row>> reports = new LinkedHashMap<>();
        reports.put(DAILY_REVIEW_COUNTS, dailyReviewCounts(cleaned));
        reports.put(TOP_CUSTOMERS, topCustomers(cleaned));
        reports.put(RATING_DISTRIBUTION, ratingDistribution(cleaned));
        reports.put(TOP_PRODUCTS, topProducts(cleaned));
        reports.put(DAILY_LOW_RATING_COUNTS, dailyLowRatingCounts(cleaned));
        reports.put(CUSTOMER_RATING_STATS, customerRatingStats(cleaned));
        return reports;
    }

    public Dataset<Row> dailyReviewCounts(Dataset<Row> cleaned) {
        return cleaned
            .groupBy(ReviewSchema.REVIEW_DATE)
            .agg(count(lit(1)).alias(REVIEW_COUNT))
            .orderBy(asc(ReviewSchema.REVIEW_DATE))
            .select(col(ReviewSchema.REVIEW_DATE), col(REVIEW_COUNT));
    }

    public Dataset<Row> topCustomers(Dataset<Row> cleaned) {
        Dataset<Row> ranked = cleaned
            .groupBy(ReviewSchema.CUSTOMER_ID)
            .agg(count(lit(1)).alias(REVIEW_COUNT))
            .orderBy(desc(REVIEW_COUNT), asc(ReviewSchema.CUSTOMER_ID));
        if (topCustomersLimit > 0) {
            ranked = ranked.limit(topCustomersLimit);
        }
        return ranked.select(col(ReviewSchema.CUSTOMER_ID), col(REVIEW_COUNT));
    }

    /**
     * Count per star value; every value from 1 to 5 is present, zero when unused.
     */
    public Dataset<Row> ratingDistribution(Dataset<Row> cleaned) {
        Dataset<Row> buckets = cleaned.sparkSession()
            .range(ReviewSchema.MIN_RATING, ReviewSchema.MAX_RATING + 1)
            .select(col("id").cast(DataTypes.IntegerType).alias(ReviewSchema.STAR_RATING));

        Dataset<Row> counts = cleaned
            .groupBy(col(ReviewSchema.STAR_RATING).alias(BUCKET))
            .agg(count(lit(1)).alias(RATING_COUNT));

        return buckets
            .join(counts, buckets.col(ReviewSchema.STAR_RATING).equalTo(counts.col(BUCKET)), "left_outer")
            .select(
                buckets.col(ReviewSchema.STAR_RATING),
                coalesce(counts.col(RATING_COUNT), lit(0L)).alias(RATING_COUNT)
            )
            .orderBy(asc(ReviewSchema.STAR_RATING));
    }

    /**
     * Top 10 products by average rating among products with at least five
     * reviews. The title is the first non-null one in input order.
     */
    public Dataset<Row> topProducts(Dataset<Row> cleaned) {
        Column titleInInputOrder = when(col(ReviewSchema.PRODUCT_TITLE).isNotNull(),
            struct(col(ReviewSchema.SOURCE_ROW), col(ReviewSchema.PRODUCT_TITLE)));

        return withSourceRow(cleaned)
            .groupBy(ReviewSchema.PRODUCT_ID)
            .agg(
                count(lit(1)).alias(REVIEW_COUNT),
                avg(ReviewSchema.STAR_RATING).alias(AVG_RATING),
                min(titleInInputOrder).alias(FIRST_TITLE)
            )
            .filter(col(REVIEW_COUNT).geq(TOP_PRODUCTS_MIN_REVIEWS))
            .orderBy(desc(AVG_RATING), asc(ReviewSchema.PRODUCT_ID))
            .limit(TOP_PRODUCTS_LIMIT)
            .select(
                col(ReviewSchema.PRODUCT_ID),
                col(FIRST_TITLE).getField(ReviewSchema.PRODUCT_TITLE).alias(ReviewSchema.PRODUCT_TITLE),
                col(REVIEW_COUNT),
                col(AVG_RATING)
            );
    }

    /**
     * Reviews rated 2 or lower per day. Days without any are left out.
     */
    public Dataset<Row> dailyLowRatingCounts(Dataset<Row> cleaned) {
        return cleaned
            .filter(col(ReviewSchema.STAR_RATING).leq(LOW_RATING_THRESHOLD))
            .groupBy(ReviewSchema.REVIEW_DATE)
            .agg(count(lit(1)).alias(LOW_RATING_COUNT))
            .orderBy(asc(ReviewSchema.REVIEW_DATE))
            .select(col(ReviewSchema.REVIEW_DATE), col(LOW_RATING_COUNT));
    }

    public Dataset<Row> customerRatingStats(Dataset<Row> cleaned) {
        return cleaned
            .groupBy(ReviewSchema.CUSTOMER_ID)
            .agg(
                count(lit(1)).alias(NUM_REVIEWS),
                avg(ReviewSchema.STAR_RATING).alias(AVG_RATING)
            )
            .filter(col(NUM_REVIEWS).geq(CUSTOMER_STATS_MIN_REVIEWS))
            .orderBy(desc(AVG_RATING), asc(ReviewSchema.CUSTOMER_ID))
            .select(col(ReviewSchema.CUSTOMER_ID), col(NUM_REVIEWS), col(AVG_RATING));
    }

    // Frames built outside the cleaner (tests, ad-hoc callers) have no row order column yet
    private static Dataset<Row> withSourceRow(Dataset<Row> df) {
        if (ReviewSchema.hasColumn(df, ReviewSchema.SOURCE_ROW)) {
            return df;
        }
        return df.withColumn(ReviewSchema.SOURCE_ROW, monotonically_increasing_id());
    }
}
