package com.stratus.binding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stratus.api.HttpMethod;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a {@link FunctionRequest} into an instance of a function's request
 * type. GET and DELETE bind from route captures and query parameters, the
 * other methods from the JSON body. Both paths go through Jackson so a type
 * binds the same way whichever way it arrives.
 */
public class RequestBinder {
    private final ObjectMapper objectMapper;

    public RequestBinder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Object bind(Type target, HttpMethod method, FunctionRequest request) {
        if (method.bindsFromRoute()) {
            return bindFromValues(target, mergeRouteValues(request.getPathParameters(), request.getQueryParameters()));
        }
        return bindFromBody(target, request.getBody());
    }

    /**
     * Route captures override query parameters of the same name. Keys compare
     * case-insensitively.
     */
    public static Map<String, String> mergeRouteValues(Map<String, String> route, Map<String, String> query) {
        Map<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        merged.putAll(query);
        merged.putAll(route);
        return merged;
    }

    /**
     * @param values case-insensitive map of raw string values
     */
    public Object bindFromValues(Type target, Map<String, String> values) {
        JavaType javaType = objectMapper.constructType(target);
        Map<String, String> lookup = values;
        if (!(values instanceof TreeMap)) {
            lookup = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            lookup.putAll(values);
        }

        ObjectNode node = objectMapper.createObjectNode();
        BeanDescription description = objectMapper.getDeserializationConfig().introspect(javaType);
        for (BeanPropertyDefinition property : description.findProperties()) {
            String value = lookup.get(property.getName());
            if (value != null) {
                node.put(property.getName(), value);
            }
        }
        return read(javaType, node);
    }

    public Object bindFromBody(Type target, String body) {
        JavaType javaType = objectMapper.constructType(target);
        if (body == null || body.isBlank()) {
            return read(javaType, objectMapper.createObjectNode());
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new BindingException(e.getOriginalMessage(), e);
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new BindingException("Invalid request body");
        }
        return read(javaType, node);
    }

    private Object read(JavaType javaType, JsonNode node) {
        try {
            return objectMapper.readerFor(javaType).readValue(node);
        } catch (JsonProcessingException e) {
            throw new BindingException(e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new BindingException(e.getMessage(), e);
        }
    }
}
