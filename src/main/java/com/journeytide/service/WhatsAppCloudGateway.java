package com.journeytide.service;

import com.journeytide.config.JourneyEngineProperties;
import com.journeytide.dto.TemplateMessage;
import com.journeytide.dto.WhatsAppSendResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Sends template messages through the WhatsApp Cloud API.
 *
 *   POST {base-url}/{phone-number-id}/messages
 *   Authorization: Bearer {access-token}
 *   {
 *     "messaging_product": "whatsapp",
 *     "to": "15551234567",
 *     "type": "template",
 *     "template": {"name": "vip_offer", "language": {"code": "en"}, "components": [...]}
 *   }
 *   → {"messages": [{"id": "wamid.HBg..."}]}
 *
 * The RestTemplate carries connect/read timeouts, so a stuck gateway fails
 * the send instead of stalling the sweep.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WhatsAppCloudGateway implements MessagingGateway {

    private final RestTemplate restTemplate;
    private final JourneyEngineProperties properties;

    @Override
    public boolean isConfigured() {
        JourneyEngineProperties.Gateway gateway = properties.getGateway();
        return notBlank(gateway.getBaseUrl())
                && notBlank(gateway.getPhoneNumberId())
                && notBlank(gateway.getAccessToken());
    }

    @Override
    public String send(String phone, TemplateMessage message) {
        if (!isConfigured()) {
            throw new MessagingException("WhatsApp gateway is not configured");
        }
        if (message == null || !notBlank(message.getTemplateName())) {
            throw new MessagingException("Template name is required");
        }

        JourneyEngineProperties.Gateway gateway = properties.getGateway();
        String url = gateway.getBaseUrl() + "/" + gateway.getPhoneNumberId() + "/messages";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(gateway.getAccessToken());

        HttpEntity<Map<String, Object>> request = new HttpEntity<>(buildBody(phone, message), headers);

        try {
            ResponseEntity<WhatsAppSendResponse> response =
                    restTemplate.postForEntity(url, request, WhatsAppSendResponse.class);
            String messageId = response.getBody() != null ? response.getBody().firstMessageId() : null;
            if (messageId == null) {
                throw new MessagingException("Gateway response carried no message id");
            }
            log.info("Sent template {} → phone={}, messageId={}", message.getTemplateName(), phone, messageId);
            return messageId;
        } catch (RestClientException e) {
            log.error("WhatsApp send failed: template={}, phone={}, error={}",
                    message.getTemplateName(), phone, e.getMessage());
            throw new MessagingException("WhatsApp send failed: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> buildBody(String phone, TemplateMessage message) {
        String language = notBlank(message.getLanguage())
                ? message.getLanguage()
                : properties.getGateway().getDefaultLanguage();

        Map<String, Object> template = new HashMap<>();
        template.put("name", message.getTemplateName());
        template.put("language", Map.of("code", language));
        if (message.getComponents() != null && !message.getComponents().isEmpty()) {
            template.put("components", message.getComponents());
        }

        Map<String, Object> body = new HashMap<>();
        body.put("messaging_product", "whatsapp");
        body.put("to", normalizePhone(phone));
        body.put("type", "template");
        body.put("template", template);
        return body;
    }

    /** The Cloud API expects digits only, without the leading plus. */
    static String normalizePhone(String phone) {
        return phone == null ? null : phone.replaceAll("[^0-9]", "");
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
