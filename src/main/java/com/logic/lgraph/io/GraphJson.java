package com.logic.lgraph.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logic.lgraph.exception.LogicGraphException;
import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.graph.Graph;

/** JSON text codec for graphs, backed by Jackson. */
public final class GraphJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GraphJson() {
        // Utility class
    }

    public static String toJson(Graph graph) {
        return write(graph.toDefinition());
    }

    /**
     * @throws ValidationException for malformed JSON or invalid content.
     */
    public static Graph fromJson(String json) {
        return Graph.fromDefinition(readDefinition(json));
    }

    public static String write(GraphDefinition definition) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new LogicGraphException("Failed to serialise graph " + definition.getId(), e);
        }
    }

    public static GraphDefinition readDefinition(String json) {
        try {
            return MAPPER.readValue(json, GraphDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed graph JSON: " + e.getOriginalMessage(), e);
        }
    }
}
