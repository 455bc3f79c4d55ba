package com.fleetdeck.core.work;

import com.fleetdeck.core.model.TerminalSession;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code tmux list-sessions} lines such as
 * {@code dev: 3 windows (created Thu Oct 10 10:00:00 2024) (attached)}.
 */
final class TmuxSessionParser {

    private TmuxSessionParser() {}

    static List<TerminalSession> parse(String nodeId, String output) {
        var sessions = new ArrayList<TerminalSession>();
        if (output == null) {
            return sessions;
        }
        for (String line : output.strip().split("\\R")) {
            int colon = line.indexOf(':');
            if (line.isBlank() || colon <= 0 || !line.contains("window")) {
                continue;
            }
            String name = line.substring(0, colon).trim();
            String rest = line.substring(colon + 1).trim();
            sessions.add(new TerminalSession(nodeId, name, windows(rest), created(rest),
                    rest.contains("(attached)")));
        }
        return sessions;
    }

    private static int windows(String rest) {
        String[] words = rest.split("\\s+");
        for (int i = 1; i < words.length; i++) {
            if (words[i].startsWith("window")) {
                try {
                    return Integer.parseInt(words[i - 1]);
                } catch (NumberFormatException e) {
                    return 1;
                }
            }
        }
        return 1;
    }

    private static String created(String rest) {
        int start = rest.indexOf("(created");
        if (start < 0) {
            return "";
        }
        start += "(created".length();
        int end = rest.indexOf(')', start);
        return end > start ? rest.substring(start, end).trim() : "";
    }
}
