package com.journeytide.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CallbackBatchResult {

    private int processed;
    private int skipped;
    private int failed;

    @Builder.Default
    private List<EngineIssue> issues = new ArrayList<>();

    public void merge(CallbackBatchResult other) {
        processed += other.processed;
        skipped += other.skipped;
        failed += other.failed;
        issues.addAll(other.issues);
    }
}
