package com.webfront.core.routing;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.webfront.core.exceptions.ConfigException;
import com.webfront.entity.Rule;

/**
 * Decodes the rule file: a JSON array of records with the string fields
 * {@code Host}, {@code Forward} and {@code Serve}. Field names are matched
 * case-insensitively and unknown fields are ignored.
 */
public class RuleFileParser {

    private final JsonMapper mapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    /**
     * Parses rules from the text of a rule file.
     *
     * @param content The file content.
     * @param source Name of the source for error messages.
     * @return The rules in file order.
     * @throws ConfigException if the content is not a JSON array of rule records.
     */
    public List<Rule> parse(String content, String source) {
        if (content == null || content.isBlank()) {
            throw new ConfigException("Rule file " + source + " is empty");
        }

        JsonNode document;
        try {
            document = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid rule file " + source + ": " + e.getOriginalMessage(), e);
        }
        if (document == null || !document.isArray()) {
            throw new ConfigException("Rule file " + source + " must contain an array of rules");
        }

        List<Rule> rules = new ArrayList<>(document.size());
        for (int index = 0; index < document.size(); index++) {
            rules.add(toRule(document.get(index), source, index));
        }
        return rules;
    }

    private Rule toRule(JsonNode element, String source, int index) {
        if (!element.isObject()) {
            throw new ConfigException("Rule #" + index + " in " + source + " is not an object");
        }
        RuleRecord fields;
        try {
            fields = mapper.treeToValue(element, RuleRecord.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Rule #" + index + " in " + source + ": " + e.getOriginalMessage(), e);
        }
        return Rule.of(
                stringValue(fields.host, "Host", source, index),
                stringValue(fields.forward, "Forward", source, index),
                stringValue(fields.serve, "Serve", source, index));
    }

    private static String stringValue(JsonNode value, String field, String source, int index) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        throw new ConfigException("Rule #" + index + " in " + source + ": field " + field
                + " must be a string, got " + value.getNodeType());
    }

    /**
     * Raw record as bound from JSON; values are checked after binding.
     */
    static class RuleRecord {
        private JsonNode host;
        private JsonNode forward;
        private JsonNode serve;

        public void setHost(JsonNode host) {
            this.host = host;
        }

        public void setForward(JsonNode forward) {
            this.forward = forward;
        }

        public void setServe(JsonNode serve) {
            this.serve = serve;
        }
    }
}
