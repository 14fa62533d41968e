package com.xammer.tagops.dto;

import com.xammer.tagops.domain.WorkflowStatus;
import com.xammer.tagops.domain.WorkflowType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowFilter {
    private WorkflowStatus status;
    private WorkflowType workflowType;
    private String resourceId;
    private int skip = 0;
    private int limit = 100;
}
