package com.sahulatPay.statusProxy.gateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.sahulatPay.statusProxy.gateway.dto.BulkStatusResponse;
import com.sahulatPay.statusProxy.gateway.dto.StatusLookupResponse;
import com.sahulatPay.statusProxy.lookup.exception.InvalidRequestException;
import com.sahulatPay.statusProxy.lookup.model.BulkLookupResult;
import com.sahulatPay.statusProxy.lookup.model.CanonicalStatus;
import com.sahulatPay.statusProxy.lookup.model.LookupOutcome;
import com.sahulatPay.statusProxy.lookup.model.TransactionType;
import com.sahulatPay.statusProxy.lookup.service.BulkLookupService;
import com.sahulatPay.statusProxy.lookup.service.LookupService;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class GatewayServiceTest {

    @Mock
    private LookupService lookupService;

    @Mock
    private BulkLookupService bulkLookupService;

    private GatewayService gatewayService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    public void setup() {
        gatewayService = new GatewayService(lookupService, bulkLookupService, objectMapper,
                Validation.buildDefaultValidatorFactory().getValidator());
    }

    @Test
    public void testLookupStatus_Success() {
        LookupOutcome outcome = LookupOutcome.builder()
                .orderId("42")
                .type(TransactionType.PAYIN)
                .upstreamOk(true)
                .statusCode(200)
                .transactionFound(true)
                .status(CanonicalStatus.COMPLETED)
                .rawStatus("success")
                .txnId(TextNode.valueOf("T-42"))
                .date(TextNode.valueOf("2026-01-20"))
                .currency(TextNode.valueOf("PKR"))
                .data(objectMapper.createObjectNode().put("salt", "***"))
                .build();
        when(lookupService.resolve("42", TransactionType.PAYIN)).thenReturn(outcome);

        StatusLookupResponse response = gatewayService.lookupStatus(" 42 ", "PAYIN");

        assertTrue(response.isOk());
        assertEquals(200, response.getHttpStatus());
        assertEquals(200, response.getStatusCode());
        assertEquals("42", response.getOrderId());
        assertEquals("payin", response.getType());
        assertEquals("COMPLETED", response.getSummary().getStatus());
        assertEquals("T-42", response.getSummary().getTxnId().asText());
        assertNull(response.getSummary().getAmount());
        assertEquals("***", response.getData().get("salt").asText());
        assertNull(response.getError());
    }

    @Test
    public void testLookupStatus_MirrorsUpstreamErrorStatus() {
        LookupOutcome outcome = LookupOutcome.builder()
                .orderId("42")
                .type(TransactionType.PAYOUT)
                .upstreamOk(false)
                .statusCode(404)
                .status(CanonicalStatus.UNKNOWN)
                .build();
        when(lookupService.resolve("42", TransactionType.PAYOUT)).thenReturn(outcome);

        StatusLookupResponse response = gatewayService.lookupStatus("42", null);

        assertFalse(response.isOk());
        assertEquals(404, response.getHttpStatus());
        assertEquals("UNKNOWN", response.getSummary().getStatus());
    }

    @Test
    public void testLookupStatus_Timeout() {
        when(lookupService.resolve("42", TransactionType.PAYOUT))
                .thenReturn(LookupOutcome.timeout("42", TransactionType.PAYOUT));

        StatusLookupResponse response = gatewayService.lookupStatus("42", "payout");

        assertFalse(response.isOk());
        assertEquals(504, response.getHttpStatus());
        assertEquals("TIMEOUT", response.getCode());
        assertEquals("timeout", response.getError());
        assertNull(response.getSummary());
    }

    @Test
    public void testLookupStatus_Error() {
        when(lookupService.resolve("42", TransactionType.PAYOUT))
                .thenReturn(LookupOutcome.error("42", TransactionType.PAYOUT, "Connection refused"));

        StatusLookupResponse response = gatewayService.lookupStatus("42", "payout");

        assertEquals(500, response.getHttpStatus());
        assertEquals("UPSTREAM_ERROR", response.getCode());
        assertEquals("Connection refused", response.getError());
    }

    @Test
    public void testLookupStatus_ValidationBeforeUpstream() {
        InvalidRequestException missing = assertThrows(InvalidRequestException.class,
                () -> gatewayService.lookupStatus("  ", "payout"));
        assertEquals("id is required", missing.getMessage());

        InvalidRequestException badType = assertThrows(InvalidRequestException.class,
                () -> gatewayService.lookupStatus("42", "refund"));
        assertEquals("type must be payout or payin", badType.getMessage());

        verifyNoInteractions(lookupService);
    }

    @Test
    public void testBulkStatus_ArrayOfMixedIds() throws Exception {
        when(bulkLookupService.resolveMany(any(), eq(TransactionType.PAYIN)))
                .thenReturn(BulkLookupResult.builder().type(TransactionType.PAYIN).entries(List.of()).elapsedMs(3).build());

        BulkStatusResponse response = gatewayService.bulkStatus("{\"type\":\"payin\",\"ids\":[\"a\", 87703010204162, null]}");

        assertTrue(response.isOk());
        assertEquals("payin", response.getType());
        assertEquals(0, response.getCount());
        assertEquals(3, response.getElapsedMs());
        verify(bulkLookupService).resolveMany(List.of("a", "87703010204162", ""), TransactionType.PAYIN);
    }

    @Test
    public void testParseIds_SeparatedString() {
        assertEquals(List.of("1", " 2", "3 "), gatewayService.parseIds(TextNode.valueOf("1, 2\n3 ")));
    }

    @Test
    public void testParseIds_BlankSeparatedStringIsEmpty() {
        InvalidRequestException empty = assertThrows(InvalidRequestException.class,
                () -> gatewayService.parseIds(TextNode.valueOf("")));
        assertEquals("ids must be a non-empty list", empty.getMessage());

        assertThrows(InvalidRequestException.class, () -> gatewayService.parseIds(TextNode.valueOf(" , ,")));
        assertThrows(InvalidRequestException.class, () -> gatewayService.parseIds(TextNode.valueOf("\n\r\n")));
    }

    @Test
    public void testBulkStatus_BlankIdStringRejectedBeforeLookup() {
        InvalidRequestException ex = assertThrows(InvalidRequestException.class,
                () -> gatewayService.bulkStatus("{\"type\":\"payout\",\"ids\":\"\"}"));

        assertEquals("ids must be a non-empty list", ex.getMessage());
        verifyNoInteractions(bulkLookupService);
    }

    @Test
    public void testBulkStatus_MissingOrUnreadableBody() {
        InvalidRequestException missing = assertThrows(InvalidRequestException.class,
                () -> gatewayService.bulkStatus(null));
        assertEquals("ids must be a non-empty list", missing.getMessage());

        InvalidRequestException nullIds = assertThrows(InvalidRequestException.class,
                () -> gatewayService.bulkStatus("{\"type\":\"payout\",\"ids\":null}"));
        assertEquals("ids must be a non-empty list", nullIds.getMessage());

        InvalidRequestException notObject = assertThrows(InvalidRequestException.class,
                () -> gatewayService.bulkStatus("[\"1\"]"));
        assertEquals("request body must be a JSON object with type and ids", notObject.getMessage());

        verifyNoInteractions(bulkLookupService);
    }

    @Test
    public void testParseIds_RejectsOtherShapes() throws Exception {
        assertThrows(InvalidRequestException.class, () -> gatewayService.parseIds(null));
        assertThrows(InvalidRequestException.class, () -> gatewayService.parseIds(objectMapper.readTree("{\"a\":1}")));
        assertThrows(InvalidRequestException.class, () -> gatewayService.parseIds(objectMapper.readTree("null")));
    }
}
