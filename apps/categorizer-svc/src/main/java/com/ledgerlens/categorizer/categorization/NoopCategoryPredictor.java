package com.ledgerlens.categorizer.categorization;

import com.ledgerlens.categorizer.model.Transaction;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Used until a real model is wired in. Never predicts anything.
 */
@Component
public class NoopCategoryPredictor implements CategoryPredictor {

    @Override
    public Optional<CategoryPrediction> predict(Transaction transaction) {
        return Optional.empty();
    }
}
