package com.journeytide.service;

/**
 * The messaging gateway refused, timed out on, or could not be reached for a send.
 */
public class MessagingException extends RuntimeException {

    public MessagingException(String message) {
        super(message);
    }

    public MessagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
