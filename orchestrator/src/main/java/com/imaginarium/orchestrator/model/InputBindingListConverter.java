package com.imaginarium.orchestrator.model;

import com.imaginarium.orchestrator.graph.InputBinding;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/** JSON array column holding the connections that feed a task's input handles. */
@Converter
public class InputBindingListConverter implements AttributeConverter<List<InputBinding>, String> {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<ArrayList<InputBinding>> LIST_TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<InputBinding> attribute) {
        try {
            return JSON.writeValueAsString(attribute == null ? List.of() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize input bindings: " + e.getMessage(), e);
        }
    }

    @Override
    public List<InputBinding> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return new ArrayList<>();
        try {
            return JSON.readValue(dbData, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot deserialize input bindings: " + e.getMessage(), e);
        }
    }
}
