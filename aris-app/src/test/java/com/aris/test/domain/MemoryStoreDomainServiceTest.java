package com.aris.test.domain;

import com.aris.domain.memory.model.entity.MemoryEntryEntity;
import com.aris.domain.memory.model.valobj.MemorySearchCriteria;
import com.aris.domain.memory.service.MemoryStoreDomainService;
import com.aris.domain.memory.service.MemoryTagDomainService;
import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.test.support.InMemoryMemoryEntryRepository;
import com.aris.types.enums.ActionStatusEnum;
import com.aris.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MemoryStoreDomainServiceTest {

    private final InMemoryMemoryEntryRepository repository = new InMemoryMemoryEntryRepository();
    private final MemoryStoreDomainService service = new MemoryStoreDomainService(repository, new MemoryTagDomainService());

    @Test
    public void shouldOverwriteValueForSameKey() {
        service.put("chat-1", "report", "v1", Collections.singletonList("file"), "generate_pdf", "a-1");
        service.put("chat-1", "report", "v2", Collections.singletonList("file"), "generate_pdf", "a-2");

        MemoryEntryEntity entry = service.get("chat-1", "report");

        Assertions.assertEquals("v2", entry.getValue());
        Assertions.assertEquals("a-2", entry.getSourceActionId());
        Assertions.assertEquals(1, repository.all().size());
        Assertions.assertEquals(1, entry.getAccessCount());
        Assertions.assertNotNull(entry.getLastAccessedAt());
    }

    @Test
    public void shouldIsolateEntriesByChat() {
        service.put("chat-1", "k", "one", null, null, null);
        service.put("chat-2", "k", "two", null, null, null);

        Assertions.assertEquals("one", service.get("chat-1", "k").getValue());
        Assertions.assertEquals("two", service.get("chat-2", "k").getValue());
        Assertions.assertNull(service.get("chat-3", "k"));
    }

    @Test
    public void shouldReturnMostRecentFirstWhenSearchingByTag() {
        service.put("chat-1", "first", "a", List.of("pdf"), "generate_pdf", "a-1");
        service.put("chat-1", "second", "b", List.of("pdf"), "generate_pdf", "a-2");
        service.put("chat-1", "other", "c", List.of("email"), "send_email", "a-3");

        List<MemoryEntryEntity> found = service.search("chat-1", MemorySearchCriteria.byTag("pdf"));

        Assertions.assertEquals(2, found.size());
        Assertions.assertEquals("second", found.get(0).getKey());
        Assertions.assertEquals("first", found.get(1).getKey());
    }

    @Test
    public void shouldRejectBlankKey() {
        Assertions.assertThrows(AppException.class, () -> service.put("chat-1", " ", "v", null, null, null));
    }

    @Test
    public void shouldStoreNamedResultUnderVariableName() {
        ActionEntity action = completedAction("a-1", "generate_pdf", "pdf1",
                new LinkedHashMap<>(Map.of("file_url", "s3://x.pdf")));

        MemoryEntryEntity entry = service.rememberActionResult("chat-1", action, false);

        Assertions.assertEquals("pdf1", entry.getKey());
        Assertions.assertTrue(entry.hasTag("auto_stored"));
        Assertions.assertTrue(entry.hasTag("pdf"));
        Assertions.assertEquals("generate_pdf", entry.getSourceTool());
    }

    @Test
    public void shouldStoreUnnamedResultOnlyWhenStoreAllEnabled() {
        ActionEntity action = completedAction("a-9", "search", null, new LinkedHashMap<>(Map.of("hits", 3)));

        Assertions.assertNull(service.rememberActionResult("chat-1", action, false));
        MemoryEntryEntity entry = service.rememberActionResult("chat-1", action, true);

        Assertions.assertEquals("tool_result_a-9", entry.getKey());
        Assertions.assertFalse(entry.hasTag("auto_stored"));
    }

    @Test
    public void shouldIgnoreActionsThatDidNotComplete() {
        ActionEntity action = completedAction("a-1", "search", "r", new LinkedHashMap<>());
        action.setStatus(ActionStatusEnum.FAILED);

        Assertions.assertNull(service.rememberActionResult("chat-1", action, true));
        Assertions.assertTrue(repository.all().isEmpty());
    }

    private ActionEntity completedAction(String id, String tool, String resultVariableName, Map<String, Object> result) {
        ActionEntity action = new ActionEntity();
        action.setId(id);
        action.setPlanId("plan-1");
        action.setOrderIndex(0);
        action.setToolName(tool);
        action.setResultVariableName(resultVariableName);
        action.setArguments(new LinkedHashMap<>());
        action.setStatus(ActionStatusEnum.COMPLETED);
        action.setResult(result);
        return action;
    }
}
