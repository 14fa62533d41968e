package com.xammer.tagops.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.xammer.tagops.domain.ComplianceIssues;

import javax.persistence.Converter;

@Converter
public class ComplianceIssuesConverter extends JsonAttributeConverter<ComplianceIssues> {

    public ComplianceIssuesConverter() {
        super(new TypeReference<ComplianceIssues>() {
        });
    }
}
