package com.ledgerlens.categorizer.controller;

import com.ledgerlens.categorizer.categorization.CategorizationService;
import com.ledgerlens.categorizer.controller.dto.RuleApplicationResponseDto;
import com.ledgerlens.categorizer.controller.dto.RuleApplyRequestDto;
import com.ledgerlens.categorizer.controller.dto.RuleFromCorrectionRequestDto;
import com.ledgerlens.categorizer.controller.dto.RuleRequestDto;
import com.ledgerlens.categorizer.controller.dto.RuleResponseDto;
import com.ledgerlens.categorizer.controller.dto.RuleTestRequestDto;
import com.ledgerlens.categorizer.controller.dto.RuleTestResponseDto;
import com.ledgerlens.categorizer.controller.dto.RuleTestResponseDto.RuleConflictDto;
import com.ledgerlens.categorizer.controller.dto.RuleUpdateRequestDto;
import com.ledgerlens.categorizer.controller.dto.RuleValidationRequestDto;
import com.ledgerlens.categorizer.controller.dto.RuleValidationResponseDto;
import com.ledgerlens.categorizer.controller.dto.RulesListResponseDto;
import com.ledgerlens.categorizer.controller.dto.TransactionResponseDto;
import com.ledgerlens.categorizer.model.PatternType;
import com.ledgerlens.categorizer.rules.CategorizationRuleService;
import com.ledgerlens.categorizer.rules.CategorizationRuleService.RuleChanges;
import com.ledgerlens.categorizer.rules.CategorizationRuleService.RuleConflict;
import com.ledgerlens.categorizer.rules.CategorizationRuleService.RuleDraft;
import com.ledgerlens.categorizer.security.AuthenticatedUserProvider;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rules")
public class CategorizationRulesController {

    private final CategorizationRuleService ruleService;
    private final CategorizationService categorizationService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public CategorizationRulesController(
            CategorizationRuleService ruleService,
            CategorizationService categorizationService,
            AuthenticatedUserProvider authenticatedUserProvider
    ) {
        this.ruleService = ruleService;
        this.categorizationService = categorizationService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @GetMapping
    public ResponseEntity<RulesListResponseDto> listRules(
            @RequestParam(value = "activeOnly", required = false, defaultValue = "false") boolean activeOnly
    ) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        List<RuleResponseDto> rules = ruleService.listRules(userId, activeOnly).stream()
                .map(RuleResponseDto::from)
                .toList();
        return ResponseEntity.ok(new RulesListResponseDto(rules, TransactionsController.currentTraceId()));
    }

    @GetMapping("/{ruleId}")
    public ResponseEntity<RuleResponseDto> getRule(@PathVariable("ruleId") UUID ruleId) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        return ResponseEntity.ok(RuleResponseDto.from(ruleService.getRule(userId, ruleId)));
    }

    @PostMapping
    public ResponseEntity<RuleResponseDto> createRule(@RequestBody @Valid RuleRequestDto request) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        var created = ruleService.createRule(userId, new RuleDraft(
                request.pattern(),
                PatternType.parse(request.patternType()),
                request.category(),
                request.subcategory(),
                request.priority(),
                request.active()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(RuleResponseDto.from(created));
    }

    @PutMapping("/{ruleId}")
    public ResponseEntity<RuleResponseDto> updateRule(
            @PathVariable("ruleId") UUID ruleId,
            @RequestBody @Valid RuleUpdateRequestDto request
    ) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        var updated = ruleService.updateRule(userId, ruleId, new RuleChanges(
                Optional.ofNullable(request.pattern()),
                Optional.ofNullable(request.patternType()).map(PatternType::parse),
                Optional.ofNullable(request.category()),
                Optional.ofNullable(request.subcategory()),
                Optional.ofNullable(request.priority()),
                Optional.ofNullable(request.active())
        ));
        return ResponseEntity.ok(RuleResponseDto.from(updated));
    }

    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> deleteRule(@PathVariable("ruleId") UUID ruleId) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        ruleService.deleteRule(userId, ruleId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{ruleId}/apply")
    public ResponseEntity<RuleApplicationResponseDto> applyRule(
            @PathVariable("ruleId") UUID ruleId,
            @RequestBody(required = false) RuleApplyRequestDto request
    ) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        boolean force = request != null && request.forceRecategorizeFlag();
        var result = categorizationService.applyRuleToExistingTransactions(userId, ruleId, force);
        return ResponseEntity.ok(new RuleApplicationResponseDto(
                result.ruleId().toString(),
                result.pattern(),
                result.categorizedCount(),
                result.totalProcessed()
        ));
    }

    @PostMapping("/test")
    public ResponseEntity<RuleTestResponseDto> testRule(@RequestBody @Valid RuleTestRequestDto request) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        var result = ruleService.testRule(userId, request.pattern(), PatternType.parse(request.patternType()), request.limit());
        return ResponseEntity.ok(new RuleTestResponseDto(
                result.pattern(),
                result.patternType().value(),
                result.matchesFound(),
                result.totalTransactions(),
                result.matchRate(),
                result.sampleMatches().stream().map(TransactionResponseDto::from).toList(),
                map(result.potentialConflicts())
        ));
    }

    @PostMapping("/validate")
    public ResponseEntity<RuleValidationResponseDto> validateRule(@RequestBody RuleValidationRequestDto request) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        var result = ruleService.validateRule(
                userId,
                request.pattern(),
                request.patternType() == null ? null : PatternType.parse(request.patternType()),
                request.category(),
                request.subcategory(),
                request.excludeRuleId()
        );
        return ResponseEntity.ok(new RuleValidationResponseDto(result.valid(), result.errors(), result.warnings(), map(result.conflicts())));
    }

    @PostMapping("/from-correction")
    public ResponseEntity<RuleResponseDto> createFromCorrection(@RequestBody @Valid RuleFromCorrectionRequestDto request) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        var created = categorizationService.createRuleFromCorrection(
                userId,
                request.transactionId(),
                request.category().trim(),
                TransactionsController.blankToNull(request.subcategory())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(RuleResponseDto.from(created));
    }

    private List<RuleConflictDto> map(List<RuleConflict> conflicts) {
        return conflicts.stream()
                .map(conflict -> new RuleConflictDto(conflict.ruleId().toString(), conflict.pattern(), conflict.type().name()))
                .toList();
    }
}
