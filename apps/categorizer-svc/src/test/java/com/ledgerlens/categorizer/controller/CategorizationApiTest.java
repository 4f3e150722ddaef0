package com.ledgerlens.categorizer.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.categorizer.security.CookieBearerTokenFilter;
import jakarta.servlet.http.Cookie;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

@SpringBootTest
@AutoConfigureMockMvc
class CategorizationApiTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Test
    void importThenCorrectPropagatesToSimilarTransactions() throws Exception {
        RequestPostProcessor user = user(UUID.randomUUID());

        mockMvc.perform(post("/rules").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("pattern", "rent", "patternType", "keyword", "category", "Housing", "subcategory", "Rent"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.priority").value(1))
                .andExpect(jsonPath("$.active").value(true));

        MvcResult imported = mockMvc.perform(post("/transactions/import").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("transactions", List.of(
                                row("MONTHLY RENT PAYMENT", null, "-1500.00"),
                                row("AMZN MKTP US*1A2B", "Amazon", "-19.99"),
                                row("AMAZON DIGITAL", "Amazon", "-4.99"),
                                row("SHELL OIL 5521", "Shell", "-45.10")
                        )))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.importedCount").value(4))
                .andExpect(jsonPath("$.categorization.categorizedCount").value(1))
                .andExpect(jsonPath("$.categorization.ruleCategorized").value(1))
                .andReturn();
        assertThat(body(imported).get("batchId").asText()).isNotBlank();

        JsonNode uncategorized = body(mockMvc.perform(get("/transactions").param("uncategorized", "true").with(user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andReturn());
        String amazonId = idOf(uncategorized, "AMZN MKTP US*1A2B");

        mockMvc.perform(patch("/transactions/{id}/category", amazonId).with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("category", "Entertainment", "subcategory", "Digital Media"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated").value(true))
                .andExpect(jsonPath("$.autoCategorizedCount").value(1))
                .andExpect(jsonPath("$.newRuleCreated").value(true));

        mockMvc.perform(get("/transactions").param("uncategorized", "true").with(user))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.transactions[0].description").value("SHELL OIL 5521"));

        mockMvc.perform(get("/rules").with(user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rules[0].pattern").value("Amazon"))
                .andExpect(jsonPath("$.rules[0].patternType").value("vendor"))
                .andExpect(jsonPath("$.rules[0].priority").value(10));

        mockMvc.perform(get("/categories").with(user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories.Entertainment[0]").value("Digital Media"))
                .andExpect(jsonPath("$.categories.Housing[0]").value("Rent"));
    }

    @Test
    void ruleLifecycleAndDryRun() throws Exception {
        RequestPostProcessor user = user(UUID.randomUUID());
        mockMvc.perform(post("/transactions/import").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("transactions", List.of(
                                row("UBER TRIP 1", null, "-12.00"),
                                row("UBER TRIP 2", null, "-9.00"),
                                row("BUS PASS", null, "-50.00")
                        )))))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/rules/test").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("pattern", "uber", "patternType", "keyword"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matchesFound").value(2))
                .andExpect(jsonPath("$.totalTransactions").value(3));

        String ruleId = body(mockMvc.perform(post("/rules").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("pattern", "uber", "patternType", "keyword", "category", "Transport"))))
                .andExpect(status().isCreated())
                .andReturn()).get("id").asText();

        mockMvc.perform(post("/rules/{id}/apply", ruleId).with(user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categorizedCount").value(2))
                .andExpect(jsonPath("$.totalProcessed").value(3));

        mockMvc.perform(put("/rules/{id}", ruleId).with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("category", "Transportation", "priority", 7))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.category").value("Transportation"))
                .andExpect(jsonPath("$.pattern").value("uber"))
                .andExpect(jsonPath("$.priority").value(7));

        mockMvc.perform(post("/rules/validate").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("pattern", "uber", "patternType", "keyword", "category", "Transportation"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.conflicts[0].type").value("DUPLICATE"));

        mockMvc.perform(delete("/rules/{id}", ruleId).with(user))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/rules/{id}", ruleId).with(user))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void rulesFromCorrectionAreNotDeduplicated() throws Exception {
        RequestPostProcessor user = user(UUID.randomUUID());
        JsonNode imported = body(mockMvc.perform(post("/transactions/import").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("transactions", List.of(row("NETFLIX.COM", "Netflix", "-15.49"))))))
                .andExpect(status().isCreated())
                .andReturn());
        assertThat(imported.get("categorization").get("failed").asInt()).isEqualTo(1);
        String txId = idOf(body(mockMvc.perform(get("/transactions").with(user)).andReturn()), "NETFLIX.COM");

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/rules/from-correction").with(user)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(Map.of("transactionId", txId, "category", "Entertainment"))))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.pattern").value("Netflix"))
                    .andExpect(jsonPath("$.priority").value(1));
        }

        mockMvc.perform(get("/rules").with(user))
                .andExpect(jsonPath("$.rules.length()").value(2));

        mockMvc.perform(get("/transactions/{id}/suggestions", txId).with(user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.suggestions.length()").value(2))
                .andExpect(jsonPath("$.suggestions[0].method").value("RULE"));

        mockMvc.perform(post("/transactions/{id}/categorize", txId).with(user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matched").value(true))
                .andExpect(jsonPath("$.transaction.category").value("Entertainment"))
                .andExpect(jsonPath("$.transaction.confidenceScore").value(0.9));

        mockMvc.perform(post("/categorization/run").with(user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalTransactions").value(0));
    }

    @Test
    void transactionsAreScopedToTheirOwner() throws Exception {
        RequestPostProcessor owner = user(UUID.randomUUID());
        RequestPostProcessor stranger = user(UUID.randomUUID());
        mockMvc.perform(post("/transactions/import").with(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("transactions", List.of(row("GYM MEMBERSHIP", null, "-30.00"))))))
                .andExpect(status().isCreated());
        String txId = idOf(body(mockMvc.perform(get("/transactions").with(owner)).andReturn()), "GYM MEMBERSHIP");

        mockMvc.perform(patch("/transactions/{id}/category", txId).with(stranger)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("category", "Health"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
        mockMvc.perform(get("/transactions").with(stranger))
                .andExpect(jsonPath("$.total").value(0));
    }

    @Test
    void invalidRequestsAreRejected() throws Exception {
        RequestPostProcessor user = user(UUID.randomUUID());

        mockMvc.perform(post("/rules").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("pattern", "x", "patternType", "fuzzy", "category", "Misc"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

        mockMvc.perform(post("/rules").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("pattern", "(x", "patternType", "regex", "category", "Misc"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

        mockMvc.perform(patch("/transactions/{id}/category", UUID.randomUUID()).with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("category", ""))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/transactions/import").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("transactions", List.of()))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void importRejectsAmountsOutsideTheLedgerColumn() throws Exception {
        RequestPostProcessor user = user(UUID.randomUUID());

        mockMvc.perform(post("/transactions/import").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("transactions", List.of(row("YACHT", null, "123456789012.00"))))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        mockMvc.perform(post("/transactions/import").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("transactions", List.of(row("FUEL", null, "45.105"))))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(get("/transactions").with(user))
                .andExpect(jsonPath("$.total").value(0));
    }

    @Test
    void selectedRunAndPerformanceReport() throws Exception {
        RequestPostProcessor user = user(UUID.randomUUID());
        mockMvc.perform(post("/transactions/import").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("transactions", List.of(
                                row("UBER TRIP 1", null, "-12.00"),
                                row("UBER TRIP 2", null, "-9.00"),
                                row("BUS PASS", null, "-50.00")
                        )))))
                .andExpect(status().isCreated());
        JsonNode listed = body(mockMvc.perform(get("/transactions").with(user)).andReturn());
        String firstTrip = idOf(listed, "UBER TRIP 1");
        String busPass = idOf(listed, "BUS PASS");
        mockMvc.perform(post("/rules").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("pattern", "uber", "patternType", "keyword", "category", "Transport"))))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/categorization/run-selected").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("transactionIds", List.of(firstTrip, busPass)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalTransactions").value(2))
                .andExpect(jsonPath("$.ruleCategorized").value(1))
                .andExpect(jsonPath("$.failed").value(1));

        mockMvc.perform(get("/categorization/performance").with(user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalTransactions").value(3))
                .andExpect(jsonPath("$.categorizedCount").value(1))
                .andExpect(jsonPath("$.uncategorizedCount").value(2))
                .andExpect(jsonPath("$.methods.RULE").value(1))
                .andExpect(jsonPath("$.confidenceDistribution.high").value(1))
                .andExpect(jsonPath("$.categories.Transport.count").value(1));

        mockMvc.perform(get("/categorization/performance").with(user)
                        .param("from", "2024-02-01T00:00:00Z")
                        .param("to", "2024-01-01T00:00:00Z"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
        mockMvc.perform(post("/categorization/run-selected").with(user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("transactionIds", List.of()))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void unauthenticatedRequestsGetJsonUnauthorized() throws Exception {
        mockMvc.perform(get("/rules"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    void devLoginCookieAuthenticatesRequests() throws Exception {
        UUID userId = UUID.randomUUID();
        MvcResult login = mockMvc.perform(post("/dev/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("userId", userId.toString()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(userId.toString()))
                .andReturn();
        String token = body(login).get("token").asText();
        assertThat(login.getResponse().getHeader("Set-Cookie")).contains(CookieBearerTokenFilter.TOKEN_COOKIE + "=");

        mockMvc.perform(get("/rules").cookie(new Cookie(CookieBearerTokenFilter.TOKEN_COOKIE, token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rules.length()").value(0));
        mockMvc.perform(get("/categories").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk());
    }

    private static RequestPostProcessor user(UUID userId) {
        return jwt().jwt(token -> token.subject(userId.toString()));
    }

    private static Map<String, Object> row(String description, String vendor, String amount) {
        Map<String, Object> row = new HashMap<>();
        row.put("description", description);
        row.put("vendor", vendor);
        row.put("amount", amount);
        return row;
    }

    private String json(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private static String idOf(JsonNode listResponse, String description) {
        for (JsonNode tx : listResponse.get("transactions")) {
            if (description.equals(tx.get("description").asText())) {
                return tx.get("id").asText();
            }
        }
        throw new AssertionError("No transaction with description " + description);
    }
}
