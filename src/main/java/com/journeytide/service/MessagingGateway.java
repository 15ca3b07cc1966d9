package com.journeytide.service;

import com.journeytide.dto.TemplateMessage;

/**
 * Outbound messaging channel. Delivery and engagement arrive later as
 * callbacks carrying the returned message id.
 */
public interface MessagingGateway {

    /** False when credentials are missing; journeys that send must not run. */
    boolean isConfigured();

    /**
     * @return the provider's message id
     * @throws MessagingException when the send is rejected or the gateway is unreachable
     */
    String send(String phone, TemplateMessage message);
}
