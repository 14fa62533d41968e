package com.xammer.tagops.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.xammer.tagops.domain.TagRule;

import javax.persistence.Converter;
import java.util.ArrayList;
import java.util.List;

@Converter
public class TagRuleListConverter extends JsonAttributeConverter<List<TagRule>> {

    public TagRuleListConverter() {
        super(new TypeReference<List<TagRule>>() {
        });
    }

    @Override
    protected List<TagRule> emptyValue() {
        return new ArrayList<>();
    }
}
