package com.xammer.tagops.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;

import javax.persistence.Converter;
import java.util.List;

/**
 * NULL and [] are kept distinct; both mean "no restriction" when used as a policy scope.
 */
@Converter
public class StringListConverter extends JsonAttributeConverter<List<String>> {

    public StringListConverter() {
        super(new TypeReference<List<String>>() {
        });
    }
}
