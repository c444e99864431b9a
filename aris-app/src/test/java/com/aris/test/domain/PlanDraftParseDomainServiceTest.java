package com.aris.test.domain;

import com.aris.domain.planning.model.valobj.PlannedAction;
import com.aris.domain.planning.service.PlanDraftParseDomainService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class PlanDraftParseDomainServiceTest {

    private final PlanDraftParseDomainService service = new PlanDraftParseDomainService();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Function<String, Map<String, Object>> strictParser = text -> {
        try {
            return objectMapper.readValue(text, new TypeReference<Map<String, Object>>() {
            });
        } catch (Exception ex) {
            throw new IllegalArgumentException(ex);
        }
    };

    @Test
    public void shouldExtractJsonWrappedInProse() {
        String text = "Here is the plan:\n```json\n{\"actions\":[{\"id\":\"step1\",\"tool_name\":\"send_email\","
                + "\"arguments\":{\"to\":\"bob@example.com\"}}]}\n```\nLet me know.";

        Map<String, Object> draft = service.parseEmbeddedJsonObject(text, strictParser);

        Assertions.assertNotNull(draft);
        List<PlannedAction> actions = service.toPlannedActions(draft);
        Assertions.assertEquals(1, actions.size());
        Assertions.assertEquals("step1", actions.get(0).getId());
        Assertions.assertEquals("send_email", actions.get(0).getToolName());
        Assertions.assertEquals("bob@example.com", actions.get(0).getArguments().get("to"));
    }

    @Test
    public void shouldAcceptCamelCaseFieldNames() {
        Map<String, Object> draft = service.parseEmbeddedJsonObject(
                "{\"actions\":[{\"actionId\":\"a\",\"toolName\":\"generate_pdf\",\"args\":{\"title\":\"Q3\"},"
                        + "\"resultVariableName\":\"pdf1\"}]}", strictParser);

        PlannedAction action = service.toPlannedActions(draft).get(0);

        Assertions.assertEquals("a", action.getId());
        Assertions.assertEquals("generate_pdf", action.getToolName());
        Assertions.assertEquals("Q3", action.getArguments().get("title"));
        Assertions.assertEquals("pdf1", action.getResultVariableName());
    }

    @Test
    public void shouldReturnNothingForUnparseableOutput() {
        Assertions.assertNull(service.parseEmbeddedJsonObject("I cannot help with that.", strictParser));
        Assertions.assertNull(service.parseEmbeddedJsonObject("  ", strictParser));
        Assertions.assertTrue(service.toPlannedActions(Map.of("actions", "not-a-list")).isEmpty());
        Assertions.assertTrue(service.toPlannedActions(null).isEmpty());
    }
}
