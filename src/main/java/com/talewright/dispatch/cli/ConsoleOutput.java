package com.talewright.dispatch.cli;

import com.talewright.core.events.EventTypes;
import com.talewright.core.events.RunEvent;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Talewright CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TALEWRIGHT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TALEWRIGHT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * One line per streamed run event, with the most useful payload fields pulled forward.
     */
    public static void event(RunEvent event) {
        Map<String, Object> data = event.data();
        String detail = switch (event.type()) {
            case EventTypes.PHASE_START -> data.get("phase") + " (" + data.get("agent") + ")";
            case EventTypes.PHASE_COMPLETE -> data.get("phase") + " in " + formatDuration(data.get("durationMs"));
            case EventTypes.SCENE_DRAFT_COMPLETE, EventTypes.SCENE_EXPANSION_COMPLETE,
                 EventTypes.SCENE_POLISH_COMPLETE, EventTypes.SCENE_FINAL ->
                    "scene " + data.get("sceneNumber") + ", " + data.get("wordCount") + " words";
            case EventTypes.SCENE_CRITIQUE_COMPLETE ->
                    "scene " + data.get("sceneNumber") + (Boolean.TRUE.equals(data.get("approved")) ? " approved" : " needs revision");
            case EventTypes.ERROR -> String.valueOf(data.get("error"));
            default -> data.isEmpty() ? "" : data.toString();
        };
        watchEvent(event.type(), "#" + event.id() + " " + detail);
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case EventTypes.GENERATION_STARTED -> "@|fg(cyan) [STARTED]|@";
            case EventTypes.PHASE_START, EventTypes.PHASE_COMPLETE -> "@|bold,fg(yellow) [PHASE]|@";
            case EventTypes.SCENE_DRAFT_START, EventTypes.SCENE_DRAFT_COMPLETE,
                 EventTypes.SCENE_EXPANSION_COMPLETE -> "@|fg(blue) [WRITER]|@";
            case EventTypes.SCENE_CRITIQUE_START, EventTypes.SCENE_CRITIQUE_COMPLETE -> "@|fg(magenta) [CRITIC]|@";
            case EventTypes.SCENE_REVISION_START, EventTypes.SCENE_REVISION_COMPLETE -> "@|fg(blue) [REVISION]|@";
            case EventTypes.ARCHIVIST_START, EventTypes.ARCHIVIST_COMPLETE -> "@|fg(cyan) [ARCHIVIST]|@";
            case EventTypes.SCENE_POLISH_START, EventTypes.SCENE_POLISH_COMPLETE,
                 EventTypes.SCENE_POLISH_REJECTED, EventTypes.SCENE_FINAL -> "@|fg(green) [SCENE]|@";
            case EventTypes.RUN_PAUSED, EventTypes.RUN_RESUMED, EventTypes.RUN_RESTORED,
                 EventTypes.SHUTDOWN_INITIATED -> "@|fg(yellow) [RUN]|@";
            case EventTypes.RUN_CANCELLED, EventTypes.GENERATION_CANCELLED -> "@|fg(red) [CANCELLED]|@";
            case EventTypes.GENERATION_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            case EventTypes.ERROR -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    private static String formatDuration(Object value) {
        if (!(value instanceof Number n)) {
            return "?";
        }
        long ms = n.longValue();
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
