package io.github.drompincen.bandwidth.protocol.api;

import java.util.List;

public record UnplacedTaskDto(
        String taskId,
        String title,
        List<String> reasons
) {}
