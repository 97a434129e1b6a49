package com.apimerge.dto.response;

/**
 * The outcome of a shell command, rendered in green or red depending on {@code success}.
 *
 * @param success Whether the command completed.
 * @param message The text shown to the user.
 */
public record CommandResponse(boolean success, String message) {

    public static CommandResponse ok(String message) {
        return new CommandResponse(true, message);
    }

    public static CommandResponse failed(String message) {
        return new CommandResponse(false, message);
    }

    /**
     * Wraps the message in ANSI color codes for terminal output.
     *
     * @return The colored message, with the color reset at the end.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
