package com.ogt.buildings.queue;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobMessage {

    private String taskId;
    private JobType type;
    private UUID runId;
}
