package com.dbmaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookConfig {
    private String url;

    @Builder.Default
    private String method = "POST";

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    private boolean includeResults;
}
