package com.journeytide.dto;

import lombok.*;

/**
 * A button or list reply to a sent message. messageId is the id of the
 * message replied to (context.id in the webhook), not of the reply itself.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class InteractiveReply {

    private String messageId;
    private String from;
    private String buttonId;
    private String buttonText;
}
