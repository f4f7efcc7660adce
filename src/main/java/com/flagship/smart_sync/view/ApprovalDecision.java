package com.flagship.smart_sync.view;

public enum ApprovalDecision {
    APPROVED,
    REJECTED
}
