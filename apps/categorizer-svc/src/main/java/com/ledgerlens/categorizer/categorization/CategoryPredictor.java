package com.ledgerlens.categorizer.categorization;

import com.ledgerlens.categorizer.model.Transaction;
import java.util.Optional;

/**
 * Model-backed fallback consulted for transactions no rule matched.
 */
public interface CategoryPredictor {

    Optional<CategoryPrediction> predict(Transaction transaction);

    record CategoryPrediction(String category, String subcategory, double confidence) {
        public CategoryPrediction {
            if (category == null || category.isBlank()) {
                throw new IllegalArgumentException("category must be provided");
            }
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("confidence must be within [0, 1]");
            }
        }
    }
}
