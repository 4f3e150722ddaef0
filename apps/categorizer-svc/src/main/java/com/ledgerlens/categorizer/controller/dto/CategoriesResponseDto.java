package com.ledgerlens.categorizer.controller.dto;

import java.util.List;
import java.util.Map;

public record CategoriesResponseDto(Map<String, List<String>> categories) {
}
