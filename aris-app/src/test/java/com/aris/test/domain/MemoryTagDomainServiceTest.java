package com.aris.test.domain;

import com.aris.domain.memory.service.MemoryTagDomainService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MemoryTagDomainServiceTest {

    private final MemoryTagDomainService service = new MemoryTagDomainService();

    @Test
    public void shouldTagPdfProducerWithFileKeywords() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("file_url", "s3://bucket/q3-sales-report.pdf");
        result.put("filename", "Q3 Sales Report.pdf");

        List<String> tags = service.generateTags("generate_pdf", new LinkedHashMap<>(), result, true);

        Assertions.assertTrue(tags.contains("tool_result"));
        Assertions.assertTrue(tags.contains("generate_pdf"));
        Assertions.assertTrue(tags.contains("auto_stored"));
        Assertions.assertTrue(tags.contains("file"));
        Assertions.assertTrue(tags.contains("pdf"));
        Assertions.assertTrue(tags.contains("sales"));
        Assertions.assertTrue(tags.contains("report"));
        Assertions.assertEquals(1, tags.stream().filter("pdf"::equals).count());
    }

    @Test
    public void shouldTagEmailTools() {
        List<String> tags = service.generateTags("send_email", new LinkedHashMap<>(),
                new LinkedHashMap<>(Map.of("status", "sent")), false);

        Assertions.assertTrue(tags.contains("email"));
        Assertions.assertFalse(tags.contains("auto_stored"));
        Assertions.assertFalse(tags.contains("file"));
    }

    @Test
    public void shouldTagGetToolsWithDataNounsAndIdentifyingArguments() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("user_id", "U-42");
        arguments.put("note", "ignored");
        arguments.put("group_name", "Finance");

        List<String> tags = service.generateTags("get_user_profile", arguments,
                new LinkedHashMap<>(Map.of("name", "Ann")), false);

        Assertions.assertTrue(tags.contains("data"));
        Assertions.assertTrue(tags.contains("user"));
        Assertions.assertTrue(tags.contains("profile"));
        Assertions.assertTrue(tags.contains("u-42"));
        Assertions.assertTrue(tags.contains("finance"));
        Assertions.assertFalse(tags.contains("ignored"));
    }
}
