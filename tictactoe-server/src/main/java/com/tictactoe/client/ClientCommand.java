package com.tictactoe.client;

/**
 * A line typed by the user: {@code row,col}, {@code chat <text>} or {@code quit}.
 */
public final class ClientCommand {

    public enum Kind {
        MOVE,
        CHAT,
        QUIT
    }

    private final Kind kind;
    private final int row;
    private final int col;
    private final String text;

    private ClientCommand(Kind kind, int row, int col, String text) {
        this.kind = kind;
        this.row = row;
        this.col = col;
        this.text = text;
    }

    /**
     * Parses user input.
     *
     * @throws IllegalArgumentException with a user-facing message if the input is not a command
     */
    public static ClientCommand parse(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Enter a move as row,col, 'chat <message>' or 'quit'.");
        }
        String trimmed = input.trim();
        String lower = trimmed.toLowerCase();

        if (lower.equals("quit")) {
            return new ClientCommand(Kind.QUIT, -1, -1, null);
        }
        if (lower.equals("chat") || lower.startsWith("chat ")) {
            String text = trimmed.substring(4).trim();
            if (text.isEmpty()) {
                throw new IllegalArgumentException("Chat message must not be empty.");
            }
            return new ClientCommand(Kind.CHAT, -1, -1, text);
        }

        String[] parts = trimmed.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Moves look like row,col, for example 1,2.");
        }
        try {
            int row = Integer.parseInt(parts[0].trim());
            int col = Integer.parseInt(parts[1].trim());
            if (row < 0 || row > 2 || col < 0 || col > 2) {
                throw new IllegalArgumentException("Row and column must be between 0 and 2.");
            }
            return new ClientCommand(Kind.MOVE, row, col, null);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Row and column must be numbers.", e);
        }
    }

    public Kind getKind() {
        return kind;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /** Chat text, or null for other commands. */
    public String getText() {
        return text;
    }
}
