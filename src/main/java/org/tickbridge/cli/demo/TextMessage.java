package org.tickbridge.cli.demo;

/**
 * A plain text message produced outside the world and delivered to it as an event.
 *
 * @param sender who produced the message
 * @param text   the message body
 */
public record TextMessage(String sender, String text) {
}
