package com.ryuqq.handover.adapter.mail;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;

/**
 * Hands a built message to the mail system.
 */
@FunctionalInterface
interface MessageTransport {

    void send(Message message) throws MessagingException;
}
