package com.xammer.tagops.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.xammer.tagops.domain.CloudProvider;

import javax.persistence.Converter;
import java.util.List;

@Converter
public class CloudProviderListConverter extends JsonAttributeConverter<List<CloudProvider>> {

    public CloudProviderListConverter() {
        super(new TypeReference<List<CloudProvider>>() {
        });
    }
}
