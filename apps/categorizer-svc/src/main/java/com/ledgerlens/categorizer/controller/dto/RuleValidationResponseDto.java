package com.ledgerlens.categorizer.controller.dto;

import com.ledgerlens.categorizer.controller.dto.RuleTestResponseDto.RuleConflictDto;
import java.util.List;

public record RuleValidationResponseDto(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        List<RuleConflictDto> conflicts
) {
}
