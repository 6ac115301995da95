package com.causalgraph.exception;

import com.causalgraph.domain.enums.AnalyticsKind;
import java.util.Map;

public class AnalyticsInProgressException extends BaseException {

    public AnalyticsInProgressException(AnalyticsKind kind) {
        super(
                ErrorCode.ANALYTICS_IN_PROGRESS,
                String.format("A %s run is already in progress", kind),
                Map.of("analytics", kind.name()));
    }
}
