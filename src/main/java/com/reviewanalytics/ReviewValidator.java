package com.reviewanalytics;

import org.apache.spark.sql.Column;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.apache.spark.sql.functions.*;

/**
 * Ordered chain of record rules. Each rule is a boolean column that is true
 * when the record violates it; {@link #rejectionReason()} folds the chain into
 * a single column holding the first violated rule's reason, or null for a
 * record that passes everything.
 *
 * Rules read the coerced columns produced by {@link ReviewCleaner}: a rating
 * or date that failed coercion is null at this point.
 */
public class ReviewValidator {

    private final List<Rule> rules;

    public ReviewValidator() {
        List<Rule> chain = new ArrayList<>();
        chain.add(new Rule(RejectionReason.INVALID_RATING, invalidRating()));
        chain.add(new Rule(RejectionReason.INVALID_DATE, col(ReviewSchema.REVIEW_DATE).isNull()));
        chain.add(new Rule(RejectionReason.MISSING_IDENTIFIER,
            blank(ReviewSchema.CUSTOMER_ID).or(blank(ReviewSchema.PRODUCT_ID))));
        this.rules = Collections.unmodifiableList(chain);
    }

    public List<Rule> getRules() {
        return rules;
    }

    /**
     * Reason of the first failing rule, as its enum name; null when the record is valid.
     */
    public Column rejectionReason() {
        Column reason = null;
        for (Rule rule : rules) {
            Column tag = lit(rule.getReason().name());
            reason = reason == null
                ? when(rule.getViolation(), tag)
                : reason.when(rule.getViolation(), tag);
        }
        return reason.otherwise(lit(null).cast("string"));
    }

    private static Column invalidRating() {
        Column rating = col(ReviewSchema.STAR_RATING);
        return rating.isNull()
            .or(rating.lt(ReviewSchema.MIN_RATING))
            .or(rating.gt(ReviewSchema.MAX_RATING));
    }

    private static Column blank(String column) {
        return col(column).isNull().or(length(col(column)).equalTo(0));
    }

    /**
     * A single rule: the reason it reports and the condition that violates it.
     */
    public static final class Rule {
        private final RejectionReason reason;
        private final Column violation;

        Rule(RejectionReason reason, Column violation) {
            this.reason = reason;
            this.violation = violation;
        }

        public RejectionReason getReason() {
            return reason;
        }

        public Column getViolation() {
            return violation;
        }
    }
}
