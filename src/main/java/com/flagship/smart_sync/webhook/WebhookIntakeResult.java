package com.flagship.smart_sync.webhook;

import lombok.Value;

@Value
public class WebhookIntakeResult {
    boolean duplicate;
    int signals;
    int triggered;

    static WebhookIntakeResult duplicate(int signals) {
        return new WebhookIntakeResult(true, signals, 0);
    }
}
