package com.sahulatPay.statusProxy.lookup.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FieldPickerTest {

    private static final JsonNode NA = TextNode.valueOf("N/A");
    private static final List<String> KEYS = List.of("a", "b");

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    public void testPick_FirstCandidateWins() throws Exception {
        JsonNode record = objectMapper.readTree("{\"a\":\"first\",\"b\":\"second\"}");

        assertEquals("first", FieldPicker.pick(record, KEYS, NA).asText());
    }

    @Test
    public void testPick_SkipsNullAndEmptyString() throws Exception {
        assertEquals("second", FieldPicker.pick(objectMapper.readTree("{\"a\":null,\"b\":\"second\"}"), KEYS, NA).asText());
        assertEquals("second", FieldPicker.pick(objectMapper.readTree("{\"a\":\"\",\"b\":\"second\"}"), KEYS, NA).asText());
    }

    @Test
    public void testPick_KeepsFalsyNonEmptyValues() throws Exception {
        JsonNode record = objectMapper.readTree("{\"a\":0,\"b\":\"second\"}");

        JsonNode picked = FieldPicker.pick(record, KEYS, NA);

        assertTrue(picked.isNumber());
        assertEquals(0, picked.asInt());
    }

    @Test
    public void testPick_DefaultWhenNoCandidate() throws Exception {
        JsonNode record = objectMapper.readTree("{\"c\":\"other\",\"b\":\"\"}");

        assertSame(NA, FieldPicker.pick(record, KEYS, NA));
        assertNull(FieldPicker.pick(record, KEYS, null));
    }

    @Test
    public void testPick_NonObjectRecordReturnsDefault() throws Exception {
        assertSame(NA, FieldPicker.pick(null, KEYS, NA));
        assertSame(NA, FieldPicker.pick(NullNode.getInstance(), KEYS, NA));
        assertSame(NA, FieldPicker.pick(MissingNode.getInstance(), KEYS, NA));
        assertSame(NA, FieldPicker.pick(TextNode.valueOf("a"), KEYS, NA));
        assertSame(NA, FieldPicker.pick(objectMapper.readTree("[{\"a\":1}]"), KEYS, NA));
    }
}
