package io.specbridge.toolbox.remotehttp;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import io.specbridge.core.errors.ErrorType;
import io.specbridge.core.errors.MissingRequiredParameterError;
import io.specbridge.core.errors.ToolNotFoundError;
import io.specbridge.core.tools.HttpMethod;
import io.specbridge.core.utils.JsonUtils;
import okhttp3.Call;
import okhttp3.EventListener;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link InvocationDispatcher}
 */
@WireMockTest
class InvocationDispatcherTest {

    @Test
    void testPathParameterIsSubstituted(final WireMockRuntimeInfo wiremock) {
        stubFor(get(urlEqualTo("/suppliers/42"))
                        .willReturn(okJson("""
                                                   {"id": 42, "name": "Acme"}
                                                   """)));
        final var result = dispatcher(wiremock).dispatch("get_supplier_detail", Map.of("supplier_id", 42));
        assertTrue(result.isSuccess());
        assertEquals(ErrorType.SUCCESS, result.getErrorType());
        assertEquals(200, result.getStatusCode());
        final var json = result.toJson(JsonUtils.createMapper());
        assertEquals("Acme", json.get("name").asText());
        assertFalse(json.has("success"));
    }

    @Test
    void testQueryParametersAndIgnoredHeaders(final WireMockRuntimeInfo wiremock) {
        stubFor(get(urlPathEqualTo("/suppliers")).willReturn(okJson("[]")));
        final var result = dispatcher(wiremock).dispatch("list_suppliers",
                                                         Map.of("status", "active", "X-Tenant", "acme"));
        assertTrue(result.isSuccess());
        assertTrue(result.getData().isArray());
        verify(getRequestedFor(urlEqualTo("/suppliers?status=active"))
                       .withoutHeader("X-Tenant"));
    }

    @Test
    void testDroppedArgumentsAreLogged(final WireMockRuntimeInfo wiremock) {
        stubFor(get(urlPathEqualTo("/suppliers")).willReturn(okJson("[]")));
        final var logger = (Logger) LoggerFactory.getLogger(InvocationDispatcher.class);
        final var appender = new ListAppender<ILoggingEvent>();
        appender.start();
        logger.addAppender(appender);
        try {
            dispatcher(wiremock).dispatch("list_suppliers",
                                          Map.of("status", "active", "X-Tenant", "acme", "colour", "red"));
        }
        finally {
            logger.detachAppender(appender);
        }
        final var messages = appender.list.stream()
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
        assertTrue(messages.contains("Tool list_suppliers: header parameter X-Tenant is not forwarded"));
        assertTrue(messages.contains("Tool list_suppliers: ignoring undeclared argument colour"));
        assertTrue(messages.stream().noneMatch(message -> message.contains("status")
                && message.contains("ignoring")));
        verify(getRequestedFor(urlEqualTo("/suppliers?status=active")));
    }

    @Test
    void testNullQueryValuesArePruned(final WireMockRuntimeInfo wiremock) {
        stubFor(get(urlPathEqualTo("/suppliers")).willReturn(okJson("[]")));
        final var arguments = new HashMap<String, Object>();
        arguments.put("status", null);
        dispatcher(wiremock).dispatch("list_suppliers", arguments);
        verify(getRequestedFor(urlEqualTo("/suppliers")));
    }

    @Test
    void testListQueryValuesAreRepeated(final WireMockRuntimeInfo wiremock) {
        stubFor(get(urlPathEqualTo("/suppliers")).willReturn(okJson("[]")));
        dispatcher(wiremock).dispatch("list_suppliers", Map.of("status", List.of("active", "blocked")));
        verify(getRequestedFor(urlEqualTo("/suppliers?status=active&status=blocked")));
    }

    @Test
    void testBodyIsBuiltFromDeclaredProperties(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/purchase-orders"))
                        .willReturn(jsonResponse("""
                                                         {"success": true, "data": {"id": "PO-1"}}
                                                         """, 201)));
        final var arguments = new HashMap<String, Object>();
        arguments.put("supplier_name", "Acme");
        arguments.put("items", List.of(Map.of("sku", "A1", "qty", 2)));
        arguments.put("note", null);
        arguments.put("unrelated", "dropped");
        final var result = dispatcher(wiremock).dispatch("create_purchase_order", arguments);
        assertTrue(result.isSuccess());
        assertEquals(201, result.getStatusCode());
        assertEquals("PO-1", result.toJson(JsonUtils.createMapper()).at("/data/id").asText());
        verify(postRequestedFor(urlEqualTo("/purchase-orders"))
                       .withHeader("Content-Type", containing("application/json"))
                       .withRequestBody(equalToJson("""
                                                            {"supplier_name": "Acme", "items": [{"sku": "A1", "qty": 2}]}
                                                            """)));
    }

    @Test
    void testPatch(final WireMockRuntimeInfo wiremock) {
        stubFor(patch(urlEqualTo("/purchase-orders/PO-1/approve")).willReturn(okJson("{\"status\": \"approved\"}")));
        final var result = dispatcher(wiremock).dispatch("approve_purchase_order", Map.of("order_id", "PO-1"));
        assertEquals("approved", result.getData().get("status").asText());
    }

    @Test
    void testDeleteWithoutBody(final WireMockRuntimeInfo wiremock) {
        stubFor(delete(urlEqualTo("/suppliers/7")).willReturn(noContent()));
        final var result = dispatcher(wiremock).dispatch("delete_suppliers_supplier_id", Map.of("supplier_id", "7"));
        assertTrue(result.isSuccess());
        assertEquals(204, result.getStatusCode());
        assertEquals("", result.getData().asText());
        verify(deleteRequestedFor(urlEqualTo("/suppliers/7")));
    }

    @Test
    void testMissingRequiredBodyFieldMakesNoCall(final WireMockRuntimeInfo wiremock) {
        final var dispatcher = dispatcher(wiremock);
        final var arguments = Map.<String, Object>of("items", List.of());
        final var error = assertThrows(MissingRequiredParameterError.class,
                                       () -> dispatcher.dispatch("create_purchase_order", arguments));
        assertEquals("supplier_name", error.getParameterName());
        assertEquals("create_purchase_order", error.getToolName());
        verify(0, anyRequestedFor(anyUrl()));
    }

    @Test
    void testMissingPathParameterMakesNoCall(final WireMockRuntimeInfo wiremock) {
        final var dispatcher = dispatcher(wiremock);
        assertThrows(MissingRequiredParameterError.class, () -> dispatcher.dispatch("get_supplier_detail", null));
        verify(0, anyRequestedFor(anyUrl()));
    }

    @Test
    void testUnknownTool(final WireMockRuntimeInfo wiremock) {
        final var dispatcher = dispatcher(wiremock);
        final var error = assertThrows(ToolNotFoundError.class, () -> dispatcher.dispatch("drop_tables", Map.of()));
        assertEquals(ErrorType.TOOL_NOT_FOUND, error.getErrorType());
        verify(0, anyRequestedFor(anyUrl()));
    }

    @Test
    void testUnreachable() {
        final var dispatcher = dispatcher("http://localhost:1", Duration.ofSeconds(5));
        final var result = dispatcher.dispatch("health", Map.of());
        assertFalse(result.isSuccess());
        assertEquals(ErrorType.CONNECTION_FAILURE, result.getErrorType());
        assertEquals("localhost:1 unreachable", result.getError());
    }

    @Test
    void testHttpStatusFailureCarriesJsonDetail(final WireMockRuntimeInfo wiremock) {
        stubFor(get(urlEqualTo("/suppliers/9"))
                        .willReturn(jsonResponse("""
                                                         {"detail": "Supplier not found"}
                                                         """, 404)));
        final var result = dispatcher(wiremock).dispatch("get_supplier_detail", Map.of("supplier_id", 9));
        assertFalse(result.isSuccess());
        assertEquals(ErrorType.HTTP_STATUS_FAILURE, result.getErrorType());
        assertEquals(404, result.getStatusCode());
        assertEquals("GET /suppliers/9 failed (HTTP 404)", result.getError());
        assertEquals("Supplier not found", result.getDetail().get("detail").asText());
    }

    @Test
    void testHttpStatusFailureCarriesRawDetail(final WireMockRuntimeInfo wiremock) {
        stubFor(get(urlEqualTo("/health")).willReturn(serverError().withBody("upstream exploded")));
        final var result = dispatcher(wiremock).dispatch("health", Map.of());
        assertEquals(500, result.getStatusCode());
        assertEquals("upstream exploded", result.getDetail().asText());
    }

    @Test
    void testTextResponseIsWrapped(final WireMockRuntimeInfo wiremock) {
        stubFor(get(urlEqualTo("/health")).willReturn(ok("OK").withHeader("Content-Type", "text/plain")));
        final var result = dispatcher(wiremock).dispatch("health", null);
        final var json = result.toJson(JsonUtils.createMapper());
        assertTrue(json.get("success").asBoolean());
        assertEquals("OK", json.get("data").asText());
        verify(getRequestedFor(urlEqualTo("/health")));
    }

    @Test
    void testTimeout(final WireMockRuntimeInfo wiremock) {
        stubFor(get(urlEqualTo("/health")).willReturn(ok("late").withFixedDelay(3_000)));
        final var dispatcher = dispatcher(wiremock.getHttpBaseUrl(), Duration.ofMillis(500));
        final var result = dispatcher.dispatch("health", Map.of());
        assertFalse(result.isSuccess());
        assertEquals(ErrorType.UNEXPECTED_FAILURE, result.getErrorType());
        assertNotNull(result.getError());
    }

    @Test
    void testStaticHeadersAreSent(final WireMockRuntimeInfo wiremock) {
        stubFor(get(urlEqualTo("/health")).willReturn(okJson("{}")));
        final var dispatcher = InvocationDispatcher.builder()
                .api("procurement")
                .tools(TestResources.procurementTools())
                .baseUrlResolver(BaseUrlResolver.direct(wiremock.getHttpBaseUrl()))
                .headers(Map.of("Authorization", "Bearer secret"))
                .build();
        dispatcher.dispatch("health", Map.of());
        verify(getRequestedFor(urlEqualTo("/health")).withHeader("Authorization", equalTo("Bearer secret")));
    }

    @Test
    void testResolve(final WireMockRuntimeInfo wiremock) {
        final var spec = dispatcher(wiremock).resolve("get_supplier_detail", Map.of("supplier_id", "a b/c"));
        assertEquals(HttpMethod.GET, spec.getMethod());
        assertEquals("/suppliers/a%20b%2Fc", spec.getPath());
        assertTrue(spec.getQuery().isEmpty());
        assertNull(spec.getBody());
    }

    @Test
    void testAsync(final WireMockRuntimeInfo wiremock) throws Exception {
        stubFor(get(urlEqualTo("/health")).willReturn(okJson("{\"status\": \"up\"}")));
        final var result = dispatcher(wiremock).dispatchAsync("health", Map.of()).get(5, TimeUnit.SECONDS);
        assertEquals("up", result.getData().get("status").asText());
    }

    @Test
    void testAsyncRejection(final WireMockRuntimeInfo wiremock) {
        final var future = dispatcher(wiremock).dispatchAsync("create_purchase_order", Map.of());
        final var error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(MissingRequiredParameterError.class, error.getCause());
        verify(0, anyRequestedFor(anyUrl()));
    }

    @Test
    void testAsyncCancel(final WireMockRuntimeInfo wiremock) throws Exception {
        stubFor(get(urlEqualTo("/health")).willReturn(ok("late").withFixedDelay(5_000)));
        final var failed = new CountDownLatch(1);
        final var canceled = new AtomicBoolean();
        final var client = new OkHttpClient.Builder()
                .eventListener(new EventListener() {
                    @Override
                    public void callFailed(Call call, IOException ioe) {
                        canceled.set(call.isCanceled());
                        failed.countDown();
                    }
                })
                .build();
        final var dispatcher = InvocationDispatcher.builder()
                .api("procurement")
                .tools(TestResources.procurementTools())
                .baseUrlResolver(BaseUrlResolver.direct(wiremock.getHttpBaseUrl()))
                .httpClient(client)
                .build();
        final var future = dispatcher.dispatchAsync("health", Map.of());
        assertTrue(future.cancel(true));
        assertTrue(future.isCancelled());
        assertTrue(failed.await(2, TimeUnit.SECONDS));
        assertTrue(canceled.get());
    }

    private static InvocationDispatcher dispatcher(WireMockRuntimeInfo wiremock) {
        return dispatcher(wiremock.getHttpBaseUrl(), Duration.ofSeconds(5));
    }

    private static InvocationDispatcher dispatcher(String baseUrl, Duration timeout) {
        return InvocationDispatcher.builder()
                .api("procurement")
                .tools(TestResources.procurementTools())
                .baseUrlResolver(BaseUrlResolver.direct(baseUrl))
                .httpClient(new OkHttpClient())
                .mapper(JsonUtils.createMapper())
                .timeout(timeout)
                .build();
    }
}
