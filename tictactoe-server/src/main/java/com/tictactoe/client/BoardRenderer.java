package com.tictactoe.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Draws a {@code game_state} array as text.
 *
 * <pre>
 *  X | O |
 * ---+---+---
 *    | X |
 * ---+---+---
 *    |   | O
 * </pre>
 */
public final class BoardRenderer {

    private static final String SEPARATOR = "---+---+---";

    private BoardRenderer() {
    }

    public static String render(JsonNode gameState) {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < gameState.size(); row++) {
            JsonNode cells = gameState.get(row);
            for (int col = 0; col < cells.size(); col++) {
                String cell = cells.get(col).asText("");
                sb.append(' ').append(cell.isEmpty() ? " " : cell).append(' ');
                if (col < cells.size() - 1) {
                    sb.append('|');
                }
            }
            sb.append(System.lineSeparator());
            if (row < gameState.size() - 1) {
                sb.append(SEPARATOR).append(System.lineSeparator());
            }
        }
        return sb.toString();
    }
}
