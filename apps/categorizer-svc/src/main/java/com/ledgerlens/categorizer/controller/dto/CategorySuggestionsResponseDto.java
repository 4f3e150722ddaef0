package com.ledgerlens.categorizer.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

public record CategorySuggestionsResponseDto(String transactionId, List<SuggestionDto> suggestions) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SuggestionDto(String category, String subcategory, double confidence, String method, String ruleId) {
    }
}
