package dev.shellspec.engine.report;

import java.util.regex.Pattern;

final class AnsiText {
    private static final Pattern ESCAPES = Pattern.compile("\u001B(?:\\[[0-9;?]*[ -/]*[@-~]|\\][^\u0007\u001B]*(?:\u0007|\u001B\\\\)|[@-Z\\\\-_])");

    private AnsiText() {}

    static String strip(String text) {
        if (text == null || text.indexOf('\u001B') < 0) {
            return text == null ? "" : text;
        }
        return ESCAPES.matcher(text).replaceAll("");
    }
}
