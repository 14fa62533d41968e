package com.xammer.tagops.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.xammer.tagops.domain.WorkflowDetails;

import javax.persistence.Converter;

@Converter
public class WorkflowDetailsConverter extends JsonAttributeConverter<WorkflowDetails> {

    public WorkflowDetailsConverter() {
        super(new TypeReference<WorkflowDetails>() {
        });
    }

    @Override
    protected WorkflowDetails emptyValue() {
        return new WorkflowDetails();
    }
}
