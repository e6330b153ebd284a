package com.delta.siteaudit.audit.model;

import java.util.Collection;

public enum PageStatus {
    SUCCESS,
    PARTIAL,
    FAILED;

    public static PageStatus derive(Collection<CheckOutcome> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) {
            return FAILED;
        }
        long succeeded = outcomes.stream().filter(CheckOutcome::isSuccess).count();
        if (succeeded == outcomes.size()) {
            return SUCCESS;
        }
        return succeeded == 0 ? FAILED : PARTIAL;
    }
}
