package com.xammer.tagops.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;

import javax.persistence.Converter;
import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class TagMapConverter extends JsonAttributeConverter<Map<String, String>> {

    public TagMapConverter() {
        super(new TypeReference<Map<String, String>>() {
        });
    }

    @Override
    protected Map<String, String> emptyValue() {
        return new LinkedHashMap<>();
    }
}
