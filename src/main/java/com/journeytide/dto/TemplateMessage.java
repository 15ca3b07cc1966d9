package com.journeytide.dto;

import lombok.*;

import java.util.List;
import java.util.Map;

/**
 * An already-resolved WhatsApp template send.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TemplateMessage {

    private String templateName;
    private String language;
    private List<Map<String, Object>> components;
}
