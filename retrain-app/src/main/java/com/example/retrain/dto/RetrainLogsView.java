package com.example.retrain.dto;

import com.example.retrain.store.RetrainEvent;

import java.util.List;

public record RetrainLogsView(List<RetrainEvent> logs, int count) {

    public static RetrainLogsView of(List<RetrainEvent> logs) {
        return new RetrainLogsView(logs, logs.size());
    }
}
