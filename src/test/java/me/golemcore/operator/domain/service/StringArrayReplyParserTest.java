package me.golemcore.operator.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StringArrayReplyParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldExtractArrayFromSurroundingProse() throws JsonProcessingException {
        List<String> values = StringArrayReplyParser.parse(objectMapper,
                "Here you go:\n[\" one \", 2, \"\", \"two\"]\nHope that helps.");

        assertEquals(List.of("one", "two"), values);
    }

    @Test
    void shouldReturnEmptyWithoutArray() throws JsonProcessingException {
        assertTrue(StringArrayReplyParser.parse(objectMapper, "nothing to remember").isEmpty());
        assertTrue(StringArrayReplyParser.parse(objectMapper, null).isEmpty());
    }

    @Test
    void shouldFailOnMalformedArray() {
        assertThrows(JsonProcessingException.class,
                () -> StringArrayReplyParser.parse(objectMapper, "[\"unterminated]"));
    }
}
