package dumb.lambdamesh.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import static dumb.lambdamesh.util.Log.error;

public class Json {

    public static final ObjectMapper the = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /** Pretty printer for files and console output; wire messages stay single-line. */
    public static final ObjectWriter pretty = the.writerWithDefaultPrettyPrinter();

    public static String pretty(Object obj) {
        try {
            return pretty.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            error("Error serializing object to JSON: " + e.getMessage());
            return "{}";
        }
    }

    public static JsonNode node(Object obj) {
        try {
            return the.valueToTree(obj);
        } catch (IllegalArgumentException e) {
            error("Error converting object to JsonNode: " + e.getMessage());
            return the.createObjectNode();
        }
    }

    public static <T> T obj(String json, Class<T> valueType) throws JsonProcessingException {
        return the.readValue(json, valueType);
    }
}
