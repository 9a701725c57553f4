package com.openforge.autopilot.channel;

/**
 * A parsed client command.
 *
 * @param type    what the client asks for
 * @param message free text; non-blank for {@link Type#CHAT_MESSAGE}, null for {@link Type#STOP_TASK}
 */
public record InboundMessage(Type type, String message) {

    public enum Type {
        CHAT_MESSAGE,
        STOP_TASK
    }

    public static InboundMessage chat(String message) {
        return new InboundMessage(Type.CHAT_MESSAGE, message);
    }

    public static InboundMessage stop() {
        return new InboundMessage(Type.STOP_TASK, null);
    }
}
