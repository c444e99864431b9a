package com.aris.test.domain;

import com.aris.domain.tool.adapter.gateway.IToolRouter;
import com.aris.domain.tool.model.valobj.ToolCallPolicy;
import com.aris.domain.tool.model.valobj.ToolResultEnvelope;
import com.aris.test.support.NoSleepToolCallDomainService;
import com.aris.test.support.ScriptedToolRouter;
import com.aris.types.enums.ToolErrorKindEnum;
import com.aris.types.exception.ToolInvocationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ToolCallDomainServiceTest {

    private final NoSleepToolCallDomainService service = new NoSleepToolCallDomainService();

    @Test
    public void shouldRetryRetryableFailureWithExponentialBackoff() {
        ScriptedToolRouter router = new ScriptedToolRouter()
                .failing("fetch_weather", ToolErrorKindEnum.TIMEOUT, "no answer within 30s");

        ToolResultEnvelope envelope = service.invoke(router, "fetch_weather", Map.of("city", "Oslo"), policy(2));

        Assertions.assertFalse(envelope.isOk());
        Assertions.assertEquals(ToolErrorKindEnum.TIMEOUT, envelope.getError());
        Assertions.assertEquals(3, envelope.getAttempts());
        Assertions.assertEquals(3, router.calls().size());
        Assertions.assertEquals(Arrays.asList(500L, 1000L), service.sleeps());
        Assertions.assertTrue(envelope.getErrorMessage().startsWith("timeout: "));
    }

    @Test
    public void shouldNotRetryToolError() {
        ScriptedToolRouter router = new ScriptedToolRouter()
                .failing("send_email", ToolErrorKindEnum.TOOL_ERROR, "invalid recipient");

        ToolResultEnvelope envelope = service.invoke(router, "send_email", Map.of(), policy(2));

        Assertions.assertFalse(envelope.isOk());
        Assertions.assertEquals(ToolErrorKindEnum.TOOL_ERROR, envelope.getError());
        Assertions.assertEquals("tool_error: invalid recipient", envelope.getErrorMessage());
        Assertions.assertEquals(1, router.calls().size());
        Assertions.assertTrue(service.sleeps().isEmpty());
    }

    @Test
    public void shouldSucceedAfterTransientFailure() {
        IToolRouter router = mock(IToolRouter.class);
        when(router.invoke(eq("list_files"), anyMap(), any()))
                .thenThrow(new ToolInvocationException(ToolErrorKindEnum.UNREACHABLE, "list_files", "connection refused"))
                .thenReturn(Map.of("files", Arrays.asList("a.txt", "b.txt")));

        ToolResultEnvelope envelope = service.invoke(router, "list_files", Map.of("dir", "/"), policy(2));

        Assertions.assertTrue(envelope.isOk());
        Assertions.assertEquals(2, envelope.getAttempts());
        Assertions.assertEquals(Arrays.asList("a.txt", "b.txt"), envelope.getValue().get("files"));
        verify(router, times(2)).invoke(eq("list_files"), anyMap(), any());
    }

    @Test
    public void shouldTreatUnexpectedExceptionAsToolError() {
        IToolRouter router = mock(IToolRouter.class);
        when(router.invoke(eq("broken"), anyMap(), any())).thenThrow(new IllegalStateException("codec failure"));

        ToolResultEnvelope envelope = service.invoke(router, "broken", Map.of(), policy(2));

        Assertions.assertFalse(envelope.isOk());
        Assertions.assertEquals(ToolErrorKindEnum.TOOL_ERROR, envelope.getError());
        Assertions.assertEquals("codec failure", envelope.getErrorMessage());
        Assertions.assertEquals(1, envelope.getAttempts());
    }

    @Test
    public void shouldCapBackoffAtMaximum() {
        ToolCallPolicy policy = ToolCallPolicy.builder()
                .initialBackoffMs(500).maxBackoffMs(1500).backoffMultiplier(2.0).build();

        Assertions.assertEquals(500L, policy.backoffMillis(1));
        Assertions.assertEquals(1000L, policy.backoffMillis(2));
        Assertions.assertEquals(1500L, policy.backoffMillis(3));
        Assertions.assertEquals(0L, policy.backoffMillis(0));
    }

    private ToolCallPolicy policy(int maxRetries) {
        return ToolCallPolicy.builder()
                .timeout(Duration.ofSeconds(30))
                .maxRetries(maxRetries)
                .initialBackoffMs(500)
                .maxBackoffMs(5000)
                .backoffMultiplier(2.0)
                .build();
    }
}
