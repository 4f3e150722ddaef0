package com.ledgerlens.categorizer.common;

import java.util.UUID;

public class RuleNotFoundException extends ResourceNotFoundException {

    public RuleNotFoundException(UUID ruleId) {
        super("Categorization rule not found: " + ruleId);
    }
}
