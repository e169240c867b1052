package com.reviewanalytics;

import org.apache.spark.sql.*;
import org.apache.spark.sql.api.java.UDF1;
import org.apache.spark.sql.expressions.UserDefinedFunction;
import org.apache.spark.sql.types.DataTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.apache.spark.sql.functions.*;

/**
 * Cleaning stage: coerces the typed review columns and drops every record
 * that fails a rule of the {@link ReviewValidator} chain.
 */
public class ReviewCleaner {

    private static final Logger LOG = LoggerFactory.getLogger(ReviewCleaner.class);

    // Up to nine significant digits always fits an int, so the cast cannot overflow
    private static final String INTEGER_PATTERN = "^[+-]?0*\\d{1,9}$";

    private static final Map<String, DateTimeFormatter> FORMATTERS = new ConcurrentHashMap<>();

    private final String datePattern;
    private final ReviewValidator validator;

    public ReviewCleaner(String datePattern) {
        this.datePattern = datePattern;
        this.validator = new ReviewValidator();
    }

    /**
     * Run the whole stage. The returned cleaned frame is cached; call
     * {@link CleaningResult#release()} once it is no longer needed.
     */
    public CleaningResult clean(Dataset<Row> raw) {
        Dataset<Row> coerced = ReviewSchema.conform(raw)
            .withColumn(ReviewSchema.SOURCE_ROW, monotonically_increasing_id());
        coerced = cleanStarRating(coerced);
        coerced = cleanReviewDate(coerced);
        coerced = cleanIdentifiers(coerced);

        Dataset<Row> tagged = coerced.withColumn(ReviewSchema.REJECTION_REASON, validator.rejectionReason());
        tagged.cache();

        long rawCount = 0;
        long cleanedCount = 0;
        Map<RejectionReason, Long> rejections = new EnumMap<>(RejectionReason.class);
        List<Row> tally = tagged.groupBy(ReviewSchema.REJECTION_REASON).count().collectAsList();
        for (Row row : tally) {
            long n = row.getLong(1);
            rawCount += n;
            if (row.isNullAt(0)) {
                cleanedCount = n;
            } else {
                rejections.put(RejectionReason.valueOf(row.getString(0)), n);
            }
        }

        Dataset<Row> cleaned = tagged
            .filter(col(ReviewSchema.REJECTION_REASON).isNull())
            .drop(ReviewSchema.REJECTION_REASON);

        if (!rejections.isEmpty()) {
            LOG.info("Rejected {} of {} records: {}", rawCount - cleanedCount, rawCount, rejections);
        }
        return new CleaningResult(cleaned, tagged, rawCount, cleanedCount, rejections);
    }

    /**
     * Clean star_rating: integer text becomes an int, anything else null.
     * Range is left to the validator so out-of-range values are reported as such.
     */
    public Dataset<Row> cleanStarRating(Dataset<Row> df) {
        Column trimmed = stripWhitespace(col(ReviewSchema.STAR_RATING));
        return df.withColumn(ReviewSchema.STAR_RATING,
            when(trimmed.rlike(INTEGER_PATTERN), trimmed.cast(DataTypes.IntegerType))
            .otherwise(lit(null).cast(DataTypes.IntegerType))
        );
    }

    /**
     * Clean review_date: strict parse in the configured pattern, null when it does not parse.
     */
    public Dataset<Row> cleanReviewDate(Dataset<Row> df) {
        String pattern = datePattern;
        UserDefinedFunction toDate = udf(
            (UDF1<String, java.sql.Date>) dateStr -> {
                LocalDate date = parseDate(dateStr, pattern);
                return date == null ? null : java.sql.Date.valueOf(date);
            },
            DataTypes.DateType
        );
        return df.withColumn(ReviewSchema.REVIEW_DATE, toDate.apply(col(ReviewSchema.REVIEW_DATE)));
    }

    /**
     * Clean customer_id and product_id: trim surrounding whitespace.
     */
    public Dataset<Row> cleanIdentifiers(Dataset<Row> df) {
        return df
            .withColumn(ReviewSchema.CUSTOMER_ID, stripWhitespace(col(ReviewSchema.CUSTOMER_ID)))
            .withColumn(ReviewSchema.PRODUCT_ID, stripWhitespace(col(ReviewSchema.PRODUCT_ID)));
    }

    // Spark's trim() only removes spaces; tabs and line breaks count as whitespace too
    private static Column stripWhitespace(Column column) {
        return regexp_replace(column, "^\\s+|\\s+$", "");
    }

    /**
     * Formatter that only accepts real calendar dates in {@code pattern}.
     *
     * @throws IllegalArgumentException if the pattern is malformed or cannot
     *         resolve a date strictly (for example {@code yyyy}, which needs an era)
     */
    public static DateTimeFormatter strictFormatter(String pattern) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
        LocalDate sample = LocalDate.of(2024, 1, 31);
        try {
            if (!sample.equals(LocalDate.parse(formatter.format(sample), formatter))) {
                throw new IllegalArgumentException("Date pattern does not round-trip: " + pattern);
            }
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Date pattern cannot be parsed strictly: " + pattern
                + " (use 'u' for the year instead of 'y')", e);
        }
        return formatter;
    }

    static LocalDate parseDate(String dateStr, String pattern) {
        if (dateStr == null || dateStr.trim().isEmpty()) {
            return null;
        }
        DateTimeFormatter formatter = FORMATTERS.computeIfAbsent(pattern, ReviewCleaner::strictFormatter);
        try {
            return LocalDate.parse(dateStr.trim(), formatter);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Output of the cleaning stage.
     */
    public static final class CleaningResult {
        private final Dataset<Row> cleaned;
        private final Dataset<Row> cachedSource;
        private final long rawCount;
        private final long cleanedCount;
        private final Map<RejectionReason, Long> rejections;

        CleaningResult(Dataset<Row> cleaned, Dataset<Row> cachedSource, long rawCount,
                       long cleanedCount, Map<RejectionReason, Long> rejections) {
            this.cleaned = cleaned;
            this.cachedSource = cachedSource;
            this.rawCount = rawCount;
            this.cleanedCount = cleanedCount;
            this.rejections = rejections;
        }

        /** Cleaned records, including the internal {@code _source_row} column. */
        public Dataset<Row> getCleaned() {
            return cleaned;
        }

        public long getRawCount() {
            return rawCount;
        }

        public long getCleanedCount() {
            return cleanedCount;
        }

        public long getRejectedCount() {
            return rawCount - cleanedCount;
        }

        public long getRejectedCount(RejectionReason reason) {
            return rejections.getOrDefault(reason, 0L);
        }

        public Map<RejectionReason, Long> getRejections() {
            return rejections;
        }

        public void release() {
            cachedSource.unpersist();
        }
    }
}
